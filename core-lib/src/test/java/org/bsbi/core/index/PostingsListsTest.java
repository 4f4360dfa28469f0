package org.bsbi.core.index;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PostingsListsTest {

    @Test
    public void testMergeDisjointLists() {
        TermPostings left = new TermPostings(7, List.of(1, 4, 9), List.of(2, 1, 5));
        TermPostings right = new TermPostings(7, List.of(2, 3, 12), List.of(3, 3, 1));

        TermPostings merged = PostingsLists.merge(left, right);

        assertEquals(List.of(1, 2, 3, 4, 9, 12), merged.postings());
        assertEquals(List.of(2, 3, 3, 1, 5, 1), merged.tfs());
        assertEquals(7, merged.termId());
    }

    @Test
    public void testMergeSumsSharedDocument() {
        TermPostings left = new TermPostings(1, List.of(1, 5), List.of(2, 2));
        TermPostings right = new TermPostings(1, List.of(5), List.of(3));

        TermPostings merged = PostingsLists.merge(left, right);

        assertEquals(List.of(1, 5), merged.postings());
        assertEquals(List.of(2, 5), merged.tfs());
    }

    @Test
    public void testMergeWithEmptySide() {
        TermPostings left = new TermPostings(1, List.of(3, 8), List.of(1, 4));

        assertEquals(left, PostingsLists.merge(left, TermPostings.empty(1)));
        assertEquals(left, PostingsLists.merge(TermPostings.empty(1), left));
    }

    @Test
    public void testMergeRejectsDifferentTerms() {
        assertThrows(IllegalArgumentException.class,
            () -> PostingsLists.merge(TermPostings.empty(1), TermPostings.empty(2)));
    }
}
