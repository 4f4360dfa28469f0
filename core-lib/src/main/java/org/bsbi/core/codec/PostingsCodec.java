package org.bsbi.core.codec;

import java.util.List;

/**
 * Byte encoding of one term's postings list and its parallel term-frequency list.
 *
 * <p>The same codec must be used to write and to read an index. Empty lists encode to an empty array.</p>
 */
public interface PostingsCodec {
	/**
	 * Name recorded in the index directory and accepted by {@link PostingsCodecs#forName(String)}
	 */
	String name();

	/**
	 * Encode an ascending list of document ids
	 */
	byte[] encodePostings(List<Integer> postings);

	/**
	 * Decode the output of {@link #encodePostings(List)}
	 */
	List<Integer> decodePostings(byte[] encoded) throws PostingsFormatException;

	/**
	 * Encode a list of term frequencies
	 */
	byte[] encodeTf(List<Integer> tfs);

	/**
	 * Decode the output of {@link #encodeTf(List)}
	 */
	List<Integer> decodeTf(byte[] encoded) throws PostingsFormatException;
}
