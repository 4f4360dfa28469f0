package org.bsbi.search.config;

import org.bsbi.core.codec.PostingsCodec;
import org.bsbi.core.codec.PostingsCodecs;
import org.bsbi.core.text.SimpleTextNormalizer;
import org.bsbi.core.text.TextNormalizer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.Set;

/**
 * Typed configuration for retrieval.
 *
 * <p>Loads {@code application.properties}, overlays environment variables, then the given overrides. Missing
 * required keys fail fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    Path indexPath,
    String indexName,
    String codec,
    int defaultK,
    Bm25 bm25,
    Text text
) {
    /** BM25 saturation and length-normalization parameters. */
    public record Bm25(double k1, double b) {}

    /** Settings of the default text normalizer; must match the values the index was built with. */
    public record Text(int minWordLength, int maxWordLength, Set<String> stopWords, boolean stemming) {
        public TextNormalizer normalizer() {
            return new SimpleTextNormalizer(minWordLength, maxWordLength, stopWords, stemming);
        }
    }

    public PostingsCodec postingsCodec() {
        return PostingsCodecs.forName(codec);
    }

    /**
     * Loads configuration from classpath properties, environment variables and {@code overrides}.
     *
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load(Properties overrides) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        properties.putAll(overrides);
        return from(properties);
    }

    private static SearchConfig from(Properties p) {
        return new SearchConfig(
            Paths.get(requireString(p, "index.path")),
            requireString(p, "index.name"),
            requireCodec(p, "index.codec"),
            requireInt(p, "search.default.k"),
            new Bm25(requireDouble(p, "search.bm25.k1"), requireDouble(p, "search.bm25.b")),
            readText(p)
        );
    }

    private static Text readText(Properties p) {
        return new Text(
            requireInt(p, "text.min.word.length"),
            requireInt(p, "text.max.word.length"),
            SimpleTextNormalizer.parseStopWords(p.getProperty("text.stop.words")),
            requireBoolean(p, "text.stemming")
        );
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
        String index = trimToNull(properties.getProperty("INDEX_PATH"));
        if (index != null) {
            properties.setProperty("index.path", index);
        }
    }

    private static String requireCodec(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return PostingsCodecs.forName(value).name();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid codec for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static double requireDouble(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static boolean requireBoolean(Properties properties, String key) {
        String value = requireString(properties, key);
        if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
            throw new IllegalStateException("Invalid boolean for configuration '" + key + "': '" + value + "'");
        }
        return Boolean.parseBoolean(value);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
