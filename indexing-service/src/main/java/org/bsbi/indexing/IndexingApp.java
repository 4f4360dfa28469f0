package org.bsbi.indexing;

import org.bsbi.indexing.config.IndexingConfig;
import org.bsbi.indexing.model.IndexingReport;
import org.bsbi.indexing.service.BsbiIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

public class IndexingApp {
	private static final Logger logger = LoggerFactory.getLogger(IndexingApp.class);

	public static void main(String[] args) {
		try {
			Properties overrides = parseArguments(args);
			IndexingConfig config = IndexingConfig.load(overrides);

			logger.info("Starting BSBI indexing...");
			logger.info("Configuration:");
			logger.info("  Collection: {}", config.collectionPath());
			logger.info("  Output: {}", config.indexPath());
			logger.info("  Index: {} ({} codec)", config.indexName(), config.codec());
			logger.info("  Text: min length={}, max length={}, stop words={}, stemming={}",
					config.text().minWordLength(), config.text().maxWordLength(),
					config.text().stopWords().size(), config.text().stemming());

			BsbiIndexer indexer = new BsbiIndexer(
					config.postingsCodec(),
					config.text().normalizer(),
					config.indexName(),
					config.keepIntermediate()
			);

			IndexingReport report = indexer.runIndexing(config.collectionPath(), config.indexPath());

			logger.info("Indexed {} documents from {} blocks: {} terms, {} postings, {} MB in {} ms",
					report.documents(), report.blocks(), report.terms(), report.postings(),
					String.format("%.2f", report.sizeInMB()), report.elapsedMillis());

		} catch (Exception e) {
			logger.error("Indexing failed", e);
			printUsage();
			System.exit(1);
		}
	}

	/**
	 * Parse command line arguments into configuration overrides
	 */
	static Properties parseArguments(String[] args) {
		Properties overrides = new Properties();
		for (int i = 0; i < args.length; i++) {
			if (args[i].equals("-h") || args[i].equals("--help")) {
				printUsage();
				System.exit(0);
			} else if (args[i].startsWith("--") && i + 1 < args.length) {
				String key = args[i].substring(2);
				String value = args[i + 1];
				overrides.setProperty(key, value);
				logger.info("Command line argument: {} = {}", key, value);
				i++;
			} else {
				throw new IllegalArgumentException("Unexpected argument: " + args[i]);
			}
		}
		return overrides;
	}

	/**
	 * Print usage information
	 */
	private static void printUsage() {
		System.out.println("\n=== BSBI Indexer Usage ===\n");
		System.out.println("Usage: java -jar indexing-service-1.0.0.jar [options]\n");
		System.out.println("Options:");
		System.out.println("  --collection.path <path>        Collection root, one sub-directory per block (default: collection)");
		System.out.println("  --index.path <path>             Output directory for index files (default: index)");
		System.out.println("  --index.name <name>             Name of the merged index (default: main_index)");
		System.out.println("  --index.codec <codec>           Postings codec (default: vbe)");
		System.out.println("                                  Options: vbe, standard");
		System.out.println("  --index.keep.intermediate <b>   Keep per-block indices after merging (default: false)");
		System.out.println("  --text.stemming <b>             Strip plural suffixes (default: true)");
		System.out.println("  -h, --help                      Show this help message\n");
		System.out.println("Examples:");
		System.out.println("  java -jar indexing-service-1.0.0.jar --collection.path collection --index.path index\n");
		System.out.println("  java -jar indexing-service-1.0.0.jar --index.codec standard --index.keep.intermediate true\n");
	}
}
