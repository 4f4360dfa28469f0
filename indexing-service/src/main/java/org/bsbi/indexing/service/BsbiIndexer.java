package org.bsbi.indexing.service;

import org.bsbi.core.codec.PostingsCodec;
import org.bsbi.core.dictionary.DictionaryFiles;
import org.bsbi.core.dictionary.IdMap;
import org.bsbi.core.index.IndexStats;
import org.bsbi.core.index.InvertedIndexReader;
import org.bsbi.core.index.InvertedIndexWriter;
import org.bsbi.core.text.TextNormalizer;
import org.bsbi.indexing.model.IndexingReport;
import org.bsbi.indexing.model.TermDocPair;
import org.bsbi.indexing.storage.CollectionReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Blocked sort-based indexing of a whole collection.
 *
 * <p>Every directory directly under the collection root is one block. Each block is parsed and inverted into its
 * own intermediate index; the intermediate indices are then merged into the main index and the term and document
 * dictionaries are saved next to it.</p>
 */
public class BsbiIndexer {
    private static final Logger logger = LoggerFactory.getLogger(BsbiIndexer.class);

    public static final String INTERMEDIATE_PREFIX = "intermediate_index_";

    private final PostingsCodec codec;
    private final TextNormalizer normalizer;
    private final String indexName;
    private final boolean keepIntermediate;
    private final BlockInverter inverter;
    private final ExternalMerger merger;

    public BsbiIndexer(PostingsCodec codec, TextNormalizer normalizer, String indexName, boolean keepIntermediate) {
        this.codec = codec;
        this.normalizer = normalizer;
        this.indexName = indexName;
        this.keepIntermediate = keepIntermediate;
        this.inverter = new BlockInverter();
        this.merger = new ExternalMerger();
    }

    /**
     * Indexes every block under {@code collectionRoot} into {@code outputLocation}.
     *
     * @throws IOException if the collection has no blocks, a document cannot be read or an index file cannot be
     *                     written; the run is aborted and no main index is published
     */
    public IndexingReport runIndexing(Path collectionRoot, Path outputLocation) throws IOException {
        long start = System.currentTimeMillis();
        logger.info("Starting BSBI indexing of {} into {} ({} codec)", collectionRoot, outputLocation, codec.name());

        CollectionReader collection = new CollectionReader(collectionRoot);
        List<String> blocks = collection.listBlocks();
        if (blocks.isEmpty()) {
            throw new IOException("Collection contains no blocks: " + collectionRoot);
        }
        Files.createDirectories(outputLocation);

        IdMap termIds = new IdMap();
        IdMap docIds = new IdMap();
        BlockParser parser = new BlockParser(collection, termIds, docIds, normalizer);

        List<String> intermediateIndices = new ArrayList<>();
        for (String block : blocks) {
            String intermediateName = INTERMEDIATE_PREFIX + block;
            indexBlock(parser, block, intermediateName, outputLocation);
            intermediateIndices.add(intermediateName);
        }

        mergeIntermediateIndices(intermediateIndices, outputLocation);
        // dictionaries must only ever describe a published main index
        termIds.save(DictionaryFiles.terms(outputLocation));
        docIds.save(DictionaryFiles.docs(outputLocation));
        if (!keepIntermediate) {
            deleteIntermediateIndices(intermediateIndices, outputLocation);
        }

        IndexStats stats;
        try (InvertedIndexReader mainIndex = InvertedIndexReader.open(outputLocation, indexName, codec)) {
            stats = mainIndex.getStats();
        }

        IndexingReport report = new IndexingReport(indexName, blocks.size(), stats.documents(), stats.uniqueTerms(),
            stats.totalPostings(), stats.sizeInMB(), System.currentTimeMillis() - start);
        logger.info("Indexing complete: {}", report);
        return report;
    }

    private void indexBlock(BlockParser parser, String block, String intermediateName, Path outputLocation)
        throws IOException {
        List<TermDocPair> pairs = parser.parse(block);
        InvertedIndexWriter writer = InvertedIndexWriter.open(outputLocation, intermediateName, codec);
        try (writer) {
            try {
                inverter.invert(pairs, writer);
            } catch (IOException | RuntimeException e) {
                writer.abort();
                throw e;
            }
        }
    }

    private void mergeIntermediateIndices(List<String> intermediateIndices, Path outputLocation) throws IOException {
        List<InvertedIndexReader> readers = new ArrayList<>(intermediateIndices.size());
        // opening the writer removes the previous main directory
        InvertedIndexWriter writer = InvertedIndexWriter.open(outputLocation, indexName, codec);
        try (writer) {
            try {
                for (String name : intermediateIndices) {
                    readers.add(InvertedIndexReader.open(outputLocation, name, codec));
                }
                merger.merge(readers, writer);
            } catch (UncheckedIOException e) {
                writer.abort();
                throw e.getCause();
            } catch (IOException | RuntimeException e) {
                writer.abort();
                throw e;
            } finally {
                closeAll(readers);
            }
        }
    }

    private static void closeAll(List<InvertedIndexReader> readers) throws IOException {
        IOException failure = null;
        for (InvertedIndexReader reader : readers) {
            try {
                reader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void deleteIntermediateIndices(List<String> intermediateIndices, Path outputLocation) {
        for (String name : intermediateIndices) {
            try {
                Files.deleteIfExists(InvertedIndexWriter.postingsPath(outputLocation, name));
                Files.deleteIfExists(InvertedIndexWriter.directoryPath(outputLocation, name));
            } catch (IOException e) {
                logger.warn("Failed to delete intermediate index {}", name, e);
            }
        }
        logger.debug("Deleted {} intermediate indices", intermediateIndices.size());
    }
}
