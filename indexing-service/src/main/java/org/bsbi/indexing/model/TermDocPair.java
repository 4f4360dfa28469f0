package org.bsbi.indexing.model;

/**
 * One occurrence of a term in a document, as produced by block parsing.
 */
public record TermDocPair(int termId, int docId) {}
