package org.bsbi.indexing.service;

import org.bsbi.core.codec.VbePostingsCodec;
import org.bsbi.core.index.InvertedIndexReader;
import org.bsbi.core.index.InvertedIndexWriter;
import org.bsbi.core.index.TermPostings;
import org.bsbi.indexing.model.TermDocPair;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BlockInverterTest {

    @TempDir
    Path tempDir;

    @Test
    public void testInvertAggregatesAndSorts() throws Exception {
        List<TermDocPair> pairs = List.of(
            new TermDocPair(5, 3), new TermDocPair(2, 7), new TermDocPair(5, 1),
            new TermDocPair(5, 3), new TermDocPair(2, 3), new TermDocPair(9, 7)
        );

        int terms;
        try (InvertedIndexWriter writer = InvertedIndexWriter.open(tempDir, "block", new VbePostingsCodec())) {
            terms = new BlockInverter().invert(pairs, writer);
        }
        assertEquals(3, terms);

        try (InvertedIndexReader reader = InvertedIndexReader.open(tempDir, "block", new VbePostingsCodec())) {
            List<Integer> termIds = new java.util.ArrayList<>();
            for (TermPostings termPostings : reader) {
                termIds.add(termPostings.termId());
            }
            assertEquals(List.of(2, 5, 9), termIds);

            TermPostings term5 = reader.getPostings(5);
            assertEquals(List.of(1, 3), term5.postings());
            assertEquals(List.of(1, 2), term5.tfs());

            TermPostings term2 = reader.getPostings(2);
            assertEquals(List.of(3, 7), term2.postings());
            assertEquals(List.of(1, 1), term2.tfs());

            assertEquals(Map.of(1, 1, 3, 3, 7, 2), reader.documentLengths());
        }

        System.out.println("✅ Block inversion test passed!");
    }

    @Test
    public void testEmptyBlockWritesEmptyIndex() throws Exception {
        try (InvertedIndexWriter writer = InvertedIndexWriter.open(tempDir, "empty", new VbePostingsCodec())) {
            assertEquals(0, new BlockInverter().invert(List.of(), writer));
        }

        try (InvertedIndexReader reader = InvertedIndexReader.open(tempDir, "empty", new VbePostingsCodec())) {
            assertEquals(0, reader.termCount());
            assertEquals(0, reader.documentCount());
        }
    }
}
