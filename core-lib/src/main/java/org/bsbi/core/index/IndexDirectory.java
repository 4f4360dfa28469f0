package org.bsbi.core.index;

import java.util.List;
import java.util.Map;

/**
 * Contents of the {@code .dict} file written next to a postings file.
 *
 * @param codec name of the codec the postings were written with
 * @param terms directory entries in ascending term id order
 * @param documentLengths document id to the sum of its term frequencies
 */
public record IndexDirectory(
		String codec,
		List<TermEntry> terms,
		Map<Integer, Integer> documentLengths
) {}
