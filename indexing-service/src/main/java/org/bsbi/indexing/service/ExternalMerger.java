package org.bsbi.indexing.service;

import org.bsbi.core.index.InvertedIndexReader;
import org.bsbi.core.index.InvertedIndexWriter;
import org.bsbi.core.index.PostingsLists;
import org.bsbi.core.index.TermPostings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * K-way merge of per-block indices into one index.
 *
 * <p>Keeps one cursor per reader in a min-heap keyed by term id (ties go to the earlier reader). Postings of a term
 * that occurs in several blocks are combined before the term is written.</p>
 */
public class ExternalMerger {
    private static final Logger logger = LoggerFactory.getLogger(ExternalMerger.class);

    private static final Comparator<Cursor> BY_TERM_THEN_READER = Comparator
        .comparingInt((Cursor cursor) -> cursor.current.termId())
        .thenComparingInt(cursor -> cursor.position);

    /**
     * @return number of terms written to {@code writer}
     * @throws IllegalArgumentException if {@code readers} is empty
     * @throws IllegalStateException if no reader has a term, or a reader yields term ids out of order
     */
    public int merge(List<InvertedIndexReader> readers, InvertedIndexWriter writer) throws IOException {
        if (readers.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge: no intermediate indices");
        }

        PriorityQueue<Cursor> heap = new PriorityQueue<>(readers.size(), BY_TERM_THEN_READER);
        for (int i = 0; i < readers.size(); i++) {
            Cursor cursor = new Cursor(i, readers.get(i));
            if (cursor.advance()) {
                heap.add(cursor);
            }
        }
        if (heap.isEmpty()) {
            throw new IllegalStateException("Nothing to merge: all " + readers.size() + " intermediate indices are empty");
        }

        Cursor first = heap.poll();
        TermPostings accumulator = first.current;
        if (first.advance()) {
            heap.add(first);
        }

        int written = 0;
        while (!heap.isEmpty()) {
            Cursor cursor = heap.poll();
            TermPostings next = cursor.current;
            if (cursor.advance()) {
                heap.add(cursor);
            }

            if (next.termId() == accumulator.termId()) {
                accumulator = PostingsLists.merge(accumulator, next);
            } else {
                writer.append(accumulator);
                written++;
                accumulator = next;
            }
        }
        writer.append(accumulator);
        written++;

        logger.info("Merged {} indices into {}: {} terms", readers.size(), writer.getIndexName(), written);
        return written;
    }

    private static final class Cursor {
        private final int position;
        private final String indexName;
        private final Iterator<TermPostings> terms;
        private TermPostings current;

        private Cursor(int position, InvertedIndexReader reader) {
            this.position = position;
            this.indexName = reader.getIndexName();
            this.terms = reader.iterator();
        }

        private boolean advance() {
            if (!terms.hasNext()) {
                current = null;
                return false;
            }
            TermPostings next = terms.next();
            if (current != null && next.termId() <= current.termId()) {
                throw new IllegalStateException("Index " + indexName + " yields term ids out of order: "
                    + next.termId() + " after " + current.termId());
            }
            current = next;
            return true;
        }
    }
}
