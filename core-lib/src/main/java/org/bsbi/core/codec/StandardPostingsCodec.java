package org.bsbi.core.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Uncompressed codec: every integer is one 4-byte unsigned word in native byte order.
 */
public final class StandardPostingsCodec implements PostingsCodec {
	public static final String NAME = "standard";

	private static final int WORD_BYTES = Integer.BYTES;

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public byte[] encodePostings(List<Integer> postings) {
		return encode(postings);
	}

	@Override
	public List<Integer> decodePostings(byte[] encoded) throws PostingsFormatException {
		return decode(encoded);
	}

	@Override
	public byte[] encodeTf(List<Integer> tfs) {
		return encode(tfs);
	}

	@Override
	public List<Integer> decodeTf(byte[] encoded) throws PostingsFormatException {
		return decode(encoded);
	}

	private static byte[] encode(List<Integer> values) {
		ByteBuffer buffer = ByteBuffer.allocate(values.size() * WORD_BYTES).order(ByteOrder.nativeOrder());
		for (int value : values) {
			if (value < 0) {
				throw new IllegalArgumentException("Cannot encode negative value: " + value);
			}
			buffer.putInt(value);
		}
		return buffer.array();
	}

	private static List<Integer> decode(byte[] encoded) throws PostingsFormatException {
		if (encoded.length % WORD_BYTES != 0) {
			throw new PostingsFormatException(
					"Encoded length " + encoded.length + " is not a multiple of " + WORD_BYTES);
		}

		ByteBuffer buffer = ByteBuffer.wrap(encoded).order(ByteOrder.nativeOrder());
		List<Integer> values = new ArrayList<>(encoded.length / WORD_BYTES);
		while (buffer.hasRemaining()) {
			int value = buffer.getInt();
			if (value < 0) {
				// unsigned word above Integer.MAX_VALUE, never produced by encode
				throw new PostingsFormatException("Decoded value out of range: " + Integer.toUnsignedString(value));
			}
			values.add(value);
		}
		return values;
	}
}
