package org.bsbi.core.index;

public record IndexStats(int uniqueTerms, long totalPostings, int documents, double sizeInMB) {}
