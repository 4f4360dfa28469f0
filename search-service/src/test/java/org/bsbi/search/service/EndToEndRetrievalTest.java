package org.bsbi.search.service;

import org.bsbi.core.codec.PostingsCodec;
import org.bsbi.core.codec.StandardPostingsCodec;
import org.bsbi.core.codec.VbePostingsCodec;
import org.bsbi.core.text.SimpleTextNormalizer;
import org.bsbi.core.text.TextNormalizer;
import org.bsbi.indexing.service.BsbiIndexer;
import org.bsbi.search.model.ScoredDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class EndToEndRetrievalTest {

    private final TextNormalizer normalizer = new SimpleTextNormalizer(2, 50, Set.of("the", "and", "of"), true);

    @TempDir
    Path tempDir;

    @Test
    public void testIndexThenSearchWithBothCodecs() throws Exception {
        Path collection = tempDir.resolve("collection");
        Files.createDirectories(collection.resolve("0"));
        Files.createDirectories(collection.resolve("1"));
        Files.createDirectories(collection.resolve("2"));
        Files.writeString(collection.resolve("0/1.txt"), "Cancer treatment and the immune system");
        Files.writeString(collection.resolve("0/2.txt"), "Diet of cats and dogs");
        Files.writeString(collection.resolve("1/3.txt"), "Immune response of dogs to vaccines");
        Files.writeString(collection.resolve("1/4.txt"), "Vaccines, vaccines and more vaccines");
        Files.writeString(collection.resolve("2/5.txt"), "Cats sleep");

        for (PostingsCodec codec : List.of(new VbePostingsCodec(), new StandardPostingsCodec())) {
            Path output = tempDir.resolve("index_" + codec.name());
            new BsbiIndexer(codec, normalizer, "main_index", false).runIndexing(collection, output);

            try (RetrievalService service = RetrievalService.open(output, "main_index", codec, normalizer)) {
                List<ScoredDocument> vaccines = service.retrieveTfIdf("vaccines", 10);
                assertEquals(2, vaccines.size(), codec.name());
                assertTrue(vaccines.get(0).documentPath().endsWith("4.txt"), codec.name());
                assertTrue(vaccines.get(1).documentPath().endsWith("3.txt"), codec.name());
                assertTrue(vaccines.get(0).score() > vaccines.get(1).score(), codec.name());

                List<ScoredDocument> cats = service.retrieveBm25("cat", 10);
                assertEquals(2, cats.size(), codec.name());
                assertTrue(cats.get(0).documentPath().endsWith("5.txt"), codec.name());

                assertTrue(service.retrieveBm25("xyzzy", 10).isEmpty(), codec.name());
                assertEquals(5, service.getStats().documents(), codec.name());
            }
        }

        System.out.println("✅ End-to-end retrieval test passed!");
    }
}
