package org.bsbi.core.index;

/**
 * Directory entry locating one term's encoded postings and term frequencies inside the postings file.
 *
 * <p>The tf bytes start right after the postings bytes.</p>
 */
public record TermEntry(
		int termId,
		long offset,
		int postingsLength,
		int tfLength,
		int documentFrequency
) {
	public long tfOffset() {
		return offset + postingsLength;
	}

	public int totalLength() {
		return postingsLength + tfLength;
	}
}
