package org.bsbi.core.codec;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Variable-byte codec.
 *
 * <p>Postings are first turned into gaps (first id absolute, then differences) so that clustered ids stay small.
 * Every integer is written base-128, most significant group first, one byte per group; the last byte of an
 * integer has its high bit set. Term frequencies are written without the gap step.</p>
 */
public final class VbePostingsCodec implements PostingsCodec {
	public static final String NAME = "vbe";

	private static final int GROUP_BITS = 7;
	private static final int GROUP_MASK = 0x7F;
	private static final int TERMINATOR = 0x80;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public byte[] encodePostings(List<Integer> postings) {
		ByteArrayOutputStream out = new ByteArrayOutputStream(postings.size() * 2);
		int previous = 0;
		for (int i = 0; i < postings.size(); i++) {
			int docId = postings.get(i);
			if (docId < 0) {
				throw new IllegalArgumentException("Cannot encode negative document id: " + docId);
			}
			if (i > 0 && docId <= previous) {
				throw new IllegalArgumentException(
						"Postings must be strictly ascending: " + docId + " follows " + previous);
			}
			writeNumber(out, docId - previous);
			previous = docId;
		}
		return out.toByteArray();
	}

	@Override
	public List<Integer> decodePostings(byte[] encoded) throws PostingsFormatException {
		List<Integer> gaps = decodeNumbers(encoded);
		List<Integer> postings = new ArrayList<>(gaps.size());
		long running = 0;
		for (int gap : gaps) {
			running += gap;
			if (running > Integer.MAX_VALUE) {
				throw new PostingsFormatException("Document id overflows an int after prefix sum");
			}
			postings.add((int) running);
		}
		return postings;
	}

	@Override
	public byte[] encodeTf(List<Integer> tfs) {
		ByteArrayOutputStream out = new ByteArrayOutputStream(tfs.size());
		for (int tf : tfs) {
			if (tf < 0) {
				throw new IllegalArgumentException("Cannot encode negative value: " + tf);
			}
			writeNumber(out, tf);
		}
		return out.toByteArray();
	}

	@Override
	public List<Integer> decodeTf(byte[] encoded) throws PostingsFormatException {
		return decodeNumbers(encoded);
	}

	/**
	 * Number of bytes the variable-byte form of {@code number} takes.
	 */
	public static int encodedWidth(int number) {
		int width = 1;
		while ((number >>>= GROUP_BITS) != 0) {
			width++;
		}
		return width;
	}

	static void writeNumber(ByteArrayOutputStream out, int number) {
		int width = encodedWidth(number);
		for (int group = width - 1; group > 0; group--) {
			out.write((number >>> (group * GROUP_BITS)) & GROUP_MASK);
		}
		out.write((number & GROUP_MASK) | TERMINATOR);
	}

	static List<Integer> decodeNumbers(byte[] encoded) throws PostingsFormatException {
		List<Integer> numbers = new ArrayList<>();
		long n = 0;
		boolean pending = false;
		for (byte b : encoded) {
			int unsigned = b & 0xFF;
			n = (n << GROUP_BITS) | (unsigned & GROUP_MASK);
			if (n > Integer.MAX_VALUE) {
				throw new PostingsFormatException("Variable-byte value overflows an int");
			}
			if (unsigned >= TERMINATOR) {
				numbers.add((int) n);
				n = 0;
				pending = false;
			} else {
				pending = true;
			}
		}
		if (pending) {
			throw new PostingsFormatException("Truncated variable-byte stream: last value has no terminator byte");
		}
		return numbers;
	}
}
