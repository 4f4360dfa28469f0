package org.bsbi.indexing.service;

import org.bsbi.core.index.InvertedIndexWriter;
import org.bsbi.indexing.model.TermDocPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory inversion of one block: aggregates term occurrences per term and document in hash maps, then writes
 * the terms in ascending id order with ascending document ids.
 */
public class BlockInverter {
    private static final Logger logger = LoggerFactory.getLogger(BlockInverter.class);

    /**
     * @return number of terms appended to {@code writer}
     */
    public int invert(List<TermDocPair> pairs, InvertedIndexWriter writer) throws IOException {
        Map<Integer, Map<Integer, Integer>> termDocs = new HashMap<>();
        for (TermDocPair pair : pairs) {
            termDocs.computeIfAbsent(pair.termId(), termId -> new HashMap<>())
                .merge(pair.docId(), 1, Integer::sum);
        }

        List<Integer> termIds = new ArrayList<>(termDocs.keySet());
        termIds.sort(null);

        for (int termId : termIds) {
            Map<Integer, Integer> docTfs = termDocs.get(termId);
            List<Integer> postings = new ArrayList<>(docTfs.keySet());
            postings.sort(null);

            List<Integer> tfs = new ArrayList<>(postings.size());
            for (int docId : postings) {
                tfs.add(docTfs.get(docId));
            }
            writer.append(termId, postings, tfs);
        }

        logger.debug("Inverted {} pairs into {} terms for {}", pairs.size(), termIds.size(), writer.getIndexName());
        return termIds.size();
    }
}
