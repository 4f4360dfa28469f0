package org.bsbi.search;

import org.bsbi.search.config.SearchConfig;
import org.bsbi.search.model.ScoredDocument;
import org.bsbi.search.service.RetrievalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * Answers one query against a merged index and prints the ranking.
 */
public class SearchApp {
    private static final Logger logger = LoggerFactory.getLogger(SearchApp.class);

    public static void main(String[] args) {
        try {
            Properties overrides = new Properties();
            String query = null;
            String ranking = "bm25";
            for (int i = 0; i < args.length; i++) {
                if (args[i].equals("-h") || args[i].equals("--help")) {
                    printUsage();
                    return;
                } else if (args[i].equals("--query") && i + 1 < args.length) {
                    query = args[++i];
                } else if (args[i].equals("--ranking") && i + 1 < args.length) {
                    ranking = args[++i];
                } else if (args[i].startsWith("--") && i + 1 < args.length) {
                    overrides.setProperty(args[i].substring(2), args[++i]);
                } else {
                    throw new IllegalArgumentException("Unexpected argument: " + args[i]);
                }
            }
            if (query == null) {
                throw new IllegalArgumentException("--query is required");
            }

            SearchConfig config = SearchConfig.load(overrides);
            try (RetrievalService service = RetrievalService.open(config.indexPath(), config.indexName(),
                config.postingsCodec(), config.text().normalizer())) {

                List<ScoredDocument> results = search(service, config, query, ranking);
                logger.info("Query '{}' ({}) returned {} documents", query, ranking, results.size());
                for (ScoredDocument result : results) {
                    System.out.printf("%.3f\t%s%n", result.score(), result.documentPath());
                }
            }

        } catch (Exception e) {
            logger.error("Search failed", e);
            printUsage();
            System.exit(1);
        }
    }

    static List<ScoredDocument> search(RetrievalService service, SearchConfig config, String query, String ranking)
        throws IOException {
        return switch (ranking.toLowerCase(Locale.ROOT)) {
            case "tfidf" -> service.retrieveTfIdf(query, config.defaultK());
            case "bm25" -> service.retrieveBm25(query, config.defaultK(), config.bm25().k1(), config.bm25().b());
            default -> throw new IllegalArgumentException("Unknown ranking: " + ranking + ". Valid options: tfidf, bm25");
        };
    }

    private static void printUsage() {
        System.out.println("\n=== BSBI Search Usage ===\n");
        System.out.println("Usage: java -jar search-service-1.0.0.jar --query <text> [options]\n");
        System.out.println("Options:");
        System.out.println("  --query <text>               Query text (required)");
        System.out.println("  --ranking <name>             Ranking function (default: bm25)");
        System.out.println("                               Options: tfidf, bm25");
        System.out.println("  --index.path <path>          Directory holding the index files (default: index)");
        System.out.println("  --search.default.k <k>       Number of documents to return (default: 10)");
        System.out.println("  --search.bm25.k1 <k1>        BM25 saturation (default: 1.2)");
        System.out.println("  --search.bm25.b <b>          BM25 length normalization (default: 0.75)");
        System.out.println("  -h, --help                   Show this help message\n");
    }
}
