package org.bsbi.core.text;

import java.util.stream.Stream;

/**
 * Turns raw document or query text into index terms.
 *
 * <p>Implementations must be deterministic and stateless per call: indexing and retrieval have to produce the same
 * terms for the same text.</p>
 */
@FunctionalInterface
public interface TextNormalizer {
	/**
	 * Lazily produce the normalized terms of {@code text}, in text order
	 */
	Stream<String> normalize(String text);
}
