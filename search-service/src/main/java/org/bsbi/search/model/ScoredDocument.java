package org.bsbi.search.model;

/**
 * One ranked hit: the relevance score and the path of the document, as recorded in the document dictionary.
 */
public record ScoredDocument(double score, String documentPath) {}
