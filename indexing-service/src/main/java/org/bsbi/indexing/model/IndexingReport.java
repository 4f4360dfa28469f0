package org.bsbi.indexing.model;

public record IndexingReport(
		String indexName,
		int blocks,
		int documents,
		int terms,
		long postings,
		double sizeInMB,
		long elapsedMillis
) {}
