package org.bsbi.benchmarks;

import org.bsbi.core.codec.PostingsCodecs;
import org.bsbi.core.text.SimpleTextNormalizer;
import org.bsbi.core.text.TextNormalizer;
import org.bsbi.indexing.service.BsbiIndexer;
import org.bsbi.search.service.RetrievalService;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Benchmarks for ranked retrieval over a synthetic collection indexed once per trial
 * Tests: tf-idf and bm25 queries of one and three terms
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class RetrievalBenchmark {

	private static final String BENCHMARK_DIR = "./benchmark-indexes";
	private static final int VOCABULARY = 5000;
	private static final int WORDS_PER_DOCUMENT = 200;
	private static final int DOCUMENTS_PER_BLOCK = 100;

	@Param({"10", "50"})
	private int blocks;

	@Param({"vbe", "standard"})
	private String codecName;

	private RetrievalService service;

	@Setup(Level.Trial)
	public void setup() throws IOException {
		System.out.println("=== Retrieval Benchmark Setup (blocks=" + blocks + ", codec=" + codecName + ") ===");

		Path root = Paths.get(BENCHMARK_DIR, codecName + "_" + blocks);
		Path collection = root.resolve("collection");
		Path index = root.resolve("index");
		writeCollection(collection);

		TextNormalizer normalizer = new SimpleTextNormalizer(1, 50, Set.of(), false);
		new BsbiIndexer(PostingsCodecs.forName(codecName), normalizer, "main_index", false)
				.runIndexing(collection, index);

		service = RetrievalService.open(index, "main_index", PostingsCodecs.forName(codecName), normalizer);
		System.out.println("Index ready: " + service.getStats());
	}

	@TearDown(Level.Trial)
	public void tearDown() throws IOException {
		service.close();

		Path dir = Paths.get(BENCHMARK_DIR);
		if (Files.exists(dir)) {
			try (Stream<Path> paths = Files.walk(dir)) {
				for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
					Files.deleteIfExists(path);
				}
			}
		}
	}

	/**
	 * Benchmark: Frequent single term, tf-idf
	 */
	@Benchmark
	public void tfIdfSingleTerm(Blackhole blackhole) throws IOException {
		blackhole.consume(service.retrieveTfIdf("w1", 10));
	}

	/**
	 * Benchmark: Three terms of different frequency, tf-idf
	 */
	@Benchmark
	public void tfIdfThreeTerms(Blackhole blackhole) throws IOException {
		blackhole.consume(service.retrieveTfIdf("w1 w50 w2000", 10));
	}

	/**
	 * Benchmark: Three terms of different frequency, bm25
	 */
	@Benchmark
	public void bm25ThreeTerms(Blackhole blackhole) throws IOException {
		blackhole.consume(service.retrieveBm25("w1 w50 w2000", 10));
	}

	private void writeCollection(Path collection) throws IOException {
		Random random = new Random(7);
		for (int block = 0; block < blocks; block++) {
			Path blockDir = Files.createDirectories(collection.resolve(String.format("%03d", block)));
			for (int doc = 0; doc < DOCUMENTS_PER_BLOCK; doc++) {
				StringBuilder text = new StringBuilder();
				for (int word = 0; word < WORDS_PER_DOCUMENT; word++) {
					// skewed towards small word numbers, like natural text
					int rank = (int) Math.floor(Math.pow(random.nextDouble(), 3) * VOCABULARY);
					text.append('w').append(rank).append(' ');
				}
				Files.writeString(blockDir.resolve(doc + ".txt"), text);
			}
		}
	}
}
