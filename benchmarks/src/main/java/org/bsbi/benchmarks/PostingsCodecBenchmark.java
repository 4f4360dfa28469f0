package org.bsbi.benchmarks;

import org.bsbi.core.codec.PostingsCodec;
import org.bsbi.core.codec.PostingsCodecs;
import org.bsbi.core.codec.PostingsFormatException;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for the postings codecs
 * Tests: encode postings, decode postings, encode tfs, decode tfs
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class PostingsCodecBenchmark {

	@Param({"standard", "vbe"})
	private String codecName;

	@Param({"100", "10000", "1000000"})
	private int postingsSize;

	private PostingsCodec codec;
	private List<Integer> postings;
	private List<Integer> tfs;
	private byte[] encodedPostings;
	private byte[] encodedTfs;

	@Setup(Level.Trial)
	public void setup() {
		codec = PostingsCodecs.forName(codecName);

		Random random = new Random(42);
		postings = new ArrayList<>(postingsSize);
		tfs = new ArrayList<>(postingsSize);
		int docId = 0;
		for (int i = 0; i < postingsSize; i++) {
			docId += 1 + random.nextInt(200);
			postings.add(docId);
			tfs.add(1 + random.nextInt(20));
		}

		encodedPostings = codec.encodePostings(postings);
		encodedTfs = codec.encodeTf(tfs);

		System.out.println("=== " + codecName + " codec, " + postingsSize + " postings: "
				+ encodedPostings.length + " bytes of postings, " + encodedTfs.length + " bytes of tfs ===");
	}

	/**
	 * Benchmark: Gap + variable-byte (or fixed-width) encode of a postings list
	 */
	@Benchmark
	public void encodePostings(Blackhole blackhole) {
		blackhole.consume(codec.encodePostings(postings));
	}

	/**
	 * Benchmark: Decode a postings list
	 */
	@Benchmark
	public void decodePostings(Blackhole blackhole) throws PostingsFormatException {
		blackhole.consume(codec.decodePostings(encodedPostings));
	}

	/**
	 * Benchmark: Encode term frequencies
	 */
	@Benchmark
	public void encodeTf(Blackhole blackhole) {
		blackhole.consume(codec.encodeTf(tfs));
	}

	/**
	 * Benchmark: Decode term frequencies
	 */
	@Benchmark
	public void decodeTf(Blackhole blackhole) throws PostingsFormatException {
		blackhole.consume(codec.decodeTf(encodedTfs));
	}
}
