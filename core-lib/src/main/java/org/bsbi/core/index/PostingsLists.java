package org.bsbi.core.index;

import java.util.ArrayList;
import java.util.List;

public final class PostingsLists {
    private PostingsLists() {}

    /**
     * Two-pointer merge of two postings lists of the same term into one ascending, duplicate-free list.
     *
     * <p>Blocks hold disjoint documents, so a shared document id only shows up in a corrupt or re-indexed
     * collection; its frequencies are summed.</p>
     */
    public static TermPostings merge(TermPostings left, TermPostings right) {
        if (left.termId() != right.termId()) {
            throw new IllegalArgumentException(
                "Cannot merge postings of different terms: " + left.termId() + " and " + right.termId());
        }

        int size = left.documentFrequency() + right.documentFrequency();
        List<Integer> postings = new ArrayList<>(size);
        List<Integer> tfs = new ArrayList<>(size);

        int i = 0;
        int j = 0;
        while (i < left.documentFrequency() && j < right.documentFrequency()) {
            int leftDoc = left.postings().get(i);
            int rightDoc = right.postings().get(j);
            if (leftDoc < rightDoc) {
                postings.add(leftDoc);
                tfs.add(left.tfs().get(i++));
            } else if (rightDoc < leftDoc) {
                postings.add(rightDoc);
                tfs.add(right.tfs().get(j++));
            } else {
                postings.add(leftDoc);
                tfs.add(left.tfs().get(i++) + right.tfs().get(j++));
            }
        }
        for (; i < left.documentFrequency(); i++) {
            postings.add(left.postings().get(i));
            tfs.add(left.tfs().get(i));
        }
        for (; j < right.documentFrequency(); j++) {
            postings.add(right.postings().get(j));
            tfs.add(right.tfs().get(j));
        }

        return new TermPostings(left.termId(), postings, tfs);
    }
}
