package org.bsbi.indexing.config;

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
 * Typed configuration for an indexing run.
 *
 * <p>Loads {@code application.properties}, overlays environment variables, then the given overrides (command-line
 * arguments). {@code COLLECTION_PATH} and {@code INDEX_PATH} environment variables override
 * {@code collection.path} and {@code index.path}. Missing required keys fail fast with
 * {@link IllegalStateException}.</p>
 */
public record IndexingConfig(
    Path collectionPath,
    Path indexPath,
    String indexName,
    String codec,
    boolean keepIntermediate,
    Text text
) {
    /** Settings of the default text normalizer; indexing and search must use the same values. */
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
     * @return a fully-initialized {@link IndexingConfig}
     */
    public static IndexingConfig load(Properties overrides) {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        normalizePaths(properties);
        properties.putAll(overrides);
        return from(properties);
    }

    private static IndexingConfig from(Properties p) {
        return new IndexingConfig(
            Paths.get(requireString(p, "collection.path")),
            Paths.get(requireString(p, "index.path")),
            requireString(p, "index.name"),
            requireCodec(p, "index.codec"),
            requireBoolean(p, "index.keep.intermediate"),
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
        try (InputStream in = IndexingConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
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
    }

    private static void normalizePaths(Properties properties) {
        String collection = trimToNull(properties.getProperty("COLLECTION_PATH"));
        if (collection != null) {
            properties.setProperty("collection.path", collection);
        }
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
