package org.bsbi.indexing.service;

import org.bsbi.core.dictionary.IdMap;
import org.bsbi.core.text.TextNormalizer;
import org.bsbi.indexing.model.TermDocPair;
import org.bsbi.indexing.storage.CollectionReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns one block of the collection into its (termId, docId) pairs, one pair per term occurrence.
 *
 * <p>Assigns ids through the shared term and document {@link IdMap}s, which outlive the block.</p>
 */
public class BlockParser {
    private static final Logger logger = LoggerFactory.getLogger(BlockParser.class);

    private final CollectionReader collection;
    private final IdMap termIds;
    private final IdMap docIds;
    private final TextNormalizer normalizer;

    public BlockParser(CollectionReader collection, IdMap termIds, IdMap docIds, TextNormalizer normalizer) {
        this.collection = collection;
        this.termIds = termIds;
        this.docIds = docIds;
        this.normalizer = normalizer;
    }

    public List<TermDocPair> parse(String blockName) throws IOException {
        List<Path> documents = collection.listDocuments(blockName);
        List<TermDocPair> pairs = new ArrayList<>();

        for (Path document : documents) {
            String text;
            try {
                text = collection.readDocument(document);
            } catch (IOException e) {
                throw new IOException("Failed to read document " + document + " in block " + blockName, e);
            }

            int docId = docIds.getOrAssign(document.toString());
            normalizer.normalize(text)
                .forEach(term -> pairs.add(new TermDocPair(termIds.getOrAssign(term), docId)));
        }

        logger.info("Parsed block {}: {} documents, {} term occurrences", blockName, documents.size(), pairs.size());
        return pairs;
    }
}
