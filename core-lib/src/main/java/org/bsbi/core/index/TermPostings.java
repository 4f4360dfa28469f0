package org.bsbi.core.index;

import java.util.List;

/**
 * One term's postings list with the co-indexed term frequencies.
 */
public record TermPostings(int termId, List<Integer> postings, List<Integer> tfs) {

	public TermPostings {
		if (postings.size() != tfs.size()) {
			throw new IllegalArgumentException("Postings and tf lists differ in length for term " + termId
					+ ": " + postings.size() + " vs " + tfs.size());
		}
		postings = List.copyOf(postings);
		tfs = List.copyOf(tfs);
	}

	public static TermPostings empty(int termId) {
		return new TermPostings(termId, List.of(), List.of());
	}

	public int documentFrequency() {
		return postings.size();
	}

	public boolean isEmpty() {
		return postings.isEmpty();
	}
}
