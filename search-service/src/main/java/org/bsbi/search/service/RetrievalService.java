package org.bsbi.search.service;

import org.bsbi.core.codec.PostingsCodec;
import org.bsbi.core.dictionary.DictionaryFiles;
import org.bsbi.core.dictionary.IdMap;
import org.bsbi.core.index.IndexStats;
import org.bsbi.core.index.InvertedIndexReader;
import org.bsbi.core.index.TermPostings;
import org.bsbi.core.text.TextNormalizer;
import org.bsbi.search.model.ScoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Term-at-a-time ranked retrieval over the merged index.
 *
 * <p>Each query term is scored across its whole postings list before the next one is read; scores accumulate per
 * document. Terms outside the vocabulary contribute nothing. Results are ordered by score, then by ascending
 * document id. The service only reads, so one instance can answer concurrent queries.</p>
 */
public class RetrievalService implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(RetrievalService.class);

    public static final double DEFAULT_K1 = 1.2;
    public static final double DEFAULT_B = 0.75;

    private static final Comparator<Map.Entry<Integer, Double>> BY_SCORE_THEN_DOC_ID =
        Comparator.comparing((Map.Entry<Integer, Double> entry) -> entry.getValue()).reversed()
            .thenComparing(Map.Entry::getKey);

    private final IdMap termIds;
    private final IdMap docIds;
    private final InvertedIndexReader index;
    private final TextNormalizer normalizer;

    public RetrievalService(IdMap termIds, IdMap docIds, InvertedIndexReader index, TextNormalizer normalizer) {
        this.termIds = termIds;
        this.docIds = docIds;
        this.index = index;
        this.normalizer = normalizer;
    }

    /**
     * Loads the dictionaries and opens the merged index written by an indexing run into {@code indexPath}.
     */
    public static RetrievalService open(Path indexPath, String indexName, PostingsCodec codec,
                                        TextNormalizer normalizer) throws IOException {
        IdMap termIds = IdMap.load(DictionaryFiles.terms(indexPath));
        IdMap docIds = IdMap.load(DictionaryFiles.docs(indexPath));
        InvertedIndexReader index = InvertedIndexReader.open(indexPath, indexName, codec);
        logger.info("Opened index {} with {} terms and {} documents", indexName, index.termCount(), index.documentCount());
        return new RetrievalService(termIds, docIds, index, normalizer);
    }

    /**
     * TF-IDF: {@code sum over query terms of log10(N/df) * (1 + log10(tf))}.
     *
     * @return at most {@code k} documents, best first; empty when no query term is in the vocabulary
     */
    public List<ScoredDocument> retrieveTfIdf(String query, int k) throws IOException {
        return retrieve(query, k, (tf, docId, idf) -> tf > 0 ? idf * (1 + Math.log10(tf)) : 0.0);
    }

    public List<ScoredDocument> retrieveBm25(String query, int k) throws IOException {
        return retrieveBm25(query, k, DEFAULT_K1, DEFAULT_B);
    }

    /**
     * Okapi BM25 with the same idf as {@link #retrieveTfIdf(String, int)}.
     *
     * @param k1 term-frequency saturation
     * @param b  document length normalization, from 0 (none) to 1 (full)
     */
    public List<ScoredDocument> retrieveBm25(String query, int k, double k1, double b) throws IOException {
        if (k1 < 0) {
            throw new IllegalArgumentException("k1 must not be negative: " + k1);
        }
        if (b < 0 || b > 1) {
            throw new IllegalArgumentException("b must be between 0 and 1: " + b);
        }

        double averageLength = index.averageDocumentLength();
        return retrieve(query, k, (tf, docId, idf) -> {
            double lengthRatio = averageLength > 0 ? index.documentLength(docId) / averageLength : 1.0;
            double norm = tf + k1 * (1 - b + b * lengthRatio);
            return idf * (tf * (k1 + 1)) / norm;
        });
    }

    private List<ScoredDocument> retrieve(String query, int k, TermWeight weight) throws IOException {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        if (query == null || query.isBlank()) {
            return List.of();
        }

        int n = index.documentCount();
        Map<Integer, Double> scores = new HashMap<>();

        for (String term : normalizer.normalize(query).toList()) {
            OptionalInt termId = termIds.find(term);
            if (termId.isEmpty()) {
                logger.debug("Skipping out-of-vocabulary term '{}'", term);
                continue;
            }

            TermPostings termPostings = index.getPostings(termId.getAsInt());
            int df = termPostings.documentFrequency();
            if (df == 0) {
                continue;
            }

            double idf = Math.log10((double) n / df);
            for (int i = 0; i < df; i++) {
                int docId = termPostings.postings().get(i);
                double score = weight.score(termPostings.tfs().get(i), docId, idf);
                scores.merge(docId, score, Double::sum);
            }
        }

        List<ScoredDocument> results = scores.entrySet().stream()
            .sorted(BY_SCORE_THEN_DOC_ID)
            .limit(k)
            .map(entry -> new ScoredDocument(entry.getValue(), docIds.get(entry.getKey())))
            .toList();

        logger.debug("Query '{}' matched {} documents, returning {}", query, scores.size(), results.size());
        return results;
    }

    public SearchStats getStats() {
        IndexStats stats = index.getStats();
        return new SearchStats(stats.documents(), stats.uniqueTerms(), termIds.size(), stats.sizeInMB());
    }

    @Override
    public void close() throws IOException {
        index.close();
    }

    @FunctionalInterface
    private interface TermWeight {
        double score(int tf, int docId, double idf);
    }

    public record SearchStats(int documents, int indexedTerms, int vocabularySize, double sizeInMB) {}
}
