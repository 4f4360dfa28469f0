package org.bsbi.core.dictionary;

import java.nio.file.Path;

/**
 * Locations of the term and document dictionaries next to the index files.
 */
public final class DictionaryFiles {
    public static final String TERMS_DICTIONARY = "terms.dict";
    public static final String DOCS_DICTIONARY = "docs.dict";

    private DictionaryFiles() {}

    public static Path terms(Path indexPath) {
        return indexPath.resolve(TERMS_DICTIONARY);
    }

    public static Path docs(Path indexPath) {
        return indexPath.resolve(DOCS_DICTIONARY);
    }
}
