package org.bsbi.core.text;

import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Default {@link TextNormalizer}: lower-cases, splits on anything that is not a letter or digit, drops tokens
 * outside the configured length range, strips plural suffixes and removes stop words.
 */
public class SimpleTextNormalizer implements TextNormalizer {
	private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

	private final int minWordLength;
	private final int maxWordLength;
	private final Set<String> stopWords;
	private final boolean stemming;

	public SimpleTextNormalizer(int minWordLength, int maxWordLength, Set<String> stopWords, boolean stemming) {
		if (minWordLength < 1 || maxWordLength < minWordLength) {
			throw new IllegalArgumentException(
					"Invalid word length range: " + minWordLength + ".." + maxWordLength);
		}
		this.minWordLength = minWordLength;
		this.maxWordLength = maxWordLength;
		this.stopWords = Set.copyOf(stopWords);
		this.stemming = stemming;
	}

	@Override
	public Stream<String> normalize(String text) {
		if (text == null || text.isBlank()) {
			return Stream.empty();
		}

		return SEPARATOR.splitAsStream(text.toLowerCase(Locale.ROOT))
				.filter(token -> token.length() >= minWordLength && token.length() <= maxWordLength)
				.filter(token -> !stopWords.contains(token))
				.map(token -> stemming ? stem(token) : token)
				.filter(term -> !term.isEmpty() && !stopWords.contains(term));
	}

	/**
	 * S-stemmer: conflates regular English plurals with their singular.
	 */
	static String stem(String word) {
		int length = word.length();
		if (length > 3 && word.endsWith("ies") && !word.endsWith("eies") && !word.endsWith("aies")) {
			return word.substring(0, length - 3) + "y";
		}
		if (length > 3 && word.endsWith("es") && !word.endsWith("aes") && !word.endsWith("ees")
				&& !word.endsWith("oes")) {
			return word.substring(0, length - 1);
		}
		if (length > 2 && word.endsWith("s") && !word.endsWith("us") && !word.endsWith("ss")) {
			return word.substring(0, length - 1);
		}
		return word;
	}

	/**
	 * Parse stop words from comma-separated string
	 */
	public static Set<String> parseStopWords(String stopWordsStr) {
		if (stopWordsStr == null || stopWordsStr.trim().isEmpty()) {
			return Collections.emptySet();
		}

		String[] words = stopWordsStr.split(",");
		Set<String> stopWords = new HashSet<>();

		for (String word : words) {
			String cleaned = word.trim().toLowerCase(Locale.ROOT);
			if (!cleaned.isEmpty()) {
				stopWords.add(cleaned);
			}
		}

		return stopWords;
	}
}
