package org.bsbi.search.service;

import org.bsbi.core.codec.VbePostingsCodec;
import org.bsbi.core.dictionary.DictionaryFiles;
import org.bsbi.core.dictionary.IdMap;
import org.bsbi.core.index.InvertedIndexReader;
import org.bsbi.core.index.InvertedIndexWriter;
import org.bsbi.core.text.SimpleTextNormalizer;
import org.bsbi.core.text.TextNormalizer;
import org.bsbi.search.model.ScoredDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two toy documents: A = "cat dog", B = "dog dog fish".
 */
public class RetrievalServiceTest {

    private static final double LOG2 = Math.log10(2);
    private static final double EPSILON = 1e-9;

    private final TextNormalizer normalizer = new SimpleTextNormalizer(1, 50, Set.of(), false);

    @TempDir
    Path tempDir;

    private IdMap termIds;
    private IdMap docIds;
    private RetrievalService service;

    @BeforeEach
    public void setUp() throws Exception {
        termIds = new IdMap();
        docIds = new IdMap();
        int docA = docIds.getOrAssign("collection/0/a.txt");
        int docB = docIds.getOrAssign("collection/0/b.txt");
        int cat = termIds.getOrAssign("cat");
        int dog = termIds.getOrAssign("dog");
        int fish = termIds.getOrAssign("fish");

        try (InvertedIndexWriter writer = InvertedIndexWriter.open(tempDir, "main_index", new VbePostingsCodec())) {
            writer.append(cat, List.of(docA), List.of(1));
            writer.append(dog, List.of(docA, docB), List.of(1, 2));
            writer.append(fish, List.of(docB), List.of(1));
        }

        InvertedIndexReader reader = InvertedIndexReader.open(tempDir, "main_index", new VbePostingsCodec());
        service = new RetrievalService(termIds, docIds, reader, normalizer);
    }

    @AfterEach
    public void tearDown() throws Exception {
        service.close();
    }

    @Test
    public void testTermInEveryDocumentScoresZero() throws Exception {
        List<ScoredDocument> results = service.retrieveTfIdf("dog", 10);

        assertEquals(2, results.size());
        assertEquals(0.0, results.get(0).score(), EPSILON);
        assertEquals(0.0, results.get(1).score(), EPSILON);
        assertEquals("collection/0/a.txt", results.get(0).documentPath());
        assertEquals("collection/0/b.txt", results.get(1).documentPath());

        System.out.println("✅ Zero idf test passed!");
    }

    @Test
    public void testTfIdfRareTerm() throws Exception {
        List<ScoredDocument> results = service.retrieveTfIdf("fish", 10);

        assertEquals(1, results.size());
        assertEquals("collection/0/b.txt", results.get(0).documentPath());
        assertEquals(LOG2, results.get(0).score(), EPSILON);
    }

    @Test
    public void testTiesBrokenByDocumentId() throws Exception {
        List<ScoredDocument> results = service.retrieveTfIdf("fish cat", 10);

        assertEquals(2, results.size());
        assertEquals(results.get(0).score(), results.get(1).score(), EPSILON);
        assertEquals("collection/0/a.txt", results.get(0).documentPath());

        List<ScoredDocument> top1 = service.retrieveTfIdf("fish cat", 1);
        assertEquals(1, top1.size());
        assertEquals("collection/0/a.txt", top1.get(0).documentPath());
    }

    @Test
    public void testOutOfVocabularyTerms() throws Exception {
        assertTrue(service.retrieveTfIdf("xyzzy", 10).isEmpty());
        assertTrue(service.retrieveBm25("xyzzy", 10).isEmpty());

        List<ScoredDocument> withUnknown = service.retrieveTfIdf("fish xyzzy", 10);
        assertEquals(service.retrieveTfIdf("fish", 10), withUnknown);

        assertEquals(3, termIds.size());
    }

    @Test
    public void testEmptyQuery() throws Exception {
        assertTrue(service.retrieveTfIdf("", 10).isEmpty());
        assertTrue(service.retrieveTfIdf("   ", 10).isEmpty());
        assertTrue(service.retrieveBm25("", 10).isEmpty());
        assertTrue(service.retrieveBm25(null, 10).isEmpty());
    }

    @Test
    public void testBm25UsesDocumentLength() throws Exception {
        double k1 = 1.2;
        double b = 0.75;
        double avg = 2.5;

        List<ScoredDocument> results = service.retrieveBm25("cat fish", 10, k1, b);

        double expectedA = LOG2 * (1 * (k1 + 1)) / (1 + k1 * (1 - b + b * (2 / avg)));
        double expectedB = LOG2 * (1 * (k1 + 1)) / (1 + k1 * (1 - b + b * (3 / avg)));
        assertEquals(2, results.size());
        assertEquals("collection/0/a.txt", results.get(0).documentPath());
        assertEquals(expectedA, results.get(0).score(), EPSILON);
        assertEquals(expectedB, results.get(1).score(), EPSILON);
        assertTrue(expectedA > expectedB);

        System.out.println("✅ BM25 length normalization test passed!");
    }

    @Test
    public void testBm25WithoutLengthNormalizationMatchesTfIdfForSingleOccurrence() throws Exception {
        List<ScoredDocument> bm25 = service.retrieveBm25("fish", 10, 1.2, 0.0);
        List<ScoredDocument> tfidf = service.retrieveTfIdf("fish", 10);

        assertEquals(tfidf.get(0).score(), bm25.get(0).score(), EPSILON);
        assertEquals(service.retrieveBm25("fish", 10, RetrievalService.DEFAULT_K1, RetrievalService.DEFAULT_B),
            service.retrieveBm25("fish", 10));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> service.retrieveTfIdf("fish", 0));
        assertThrows(IllegalArgumentException.class, () -> service.retrieveBm25("fish", 10, -1, 0.75));
        assertThrows(IllegalArgumentException.class, () -> service.retrieveBm25("fish", 10, 1.2, 1.5));
    }

    @Test
    public void testOpenFromPersistedDictionaries() throws Exception {
        termIds.save(DictionaryFiles.terms(tempDir));
        docIds.save(DictionaryFiles.docs(tempDir));

        try (RetrievalService loaded = RetrievalService.open(tempDir, "main_index", new VbePostingsCodec(), normalizer)) {
            assertEquals(service.retrieveTfIdf("fish cat dog", 10), loaded.retrieveTfIdf("fish cat dog", 10));

            RetrievalService.SearchStats stats = loaded.getStats();
            assertEquals(2, stats.documents());
            assertEquals(3, stats.indexedTerms());
            assertEquals(3, stats.vocabularySize());
        }
    }
}
