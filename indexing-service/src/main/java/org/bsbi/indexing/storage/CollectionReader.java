package org.bsbi.indexing.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Read access to a document collection laid out as {@code root/<block>/<document>}.
 */
public class CollectionReader {
	private static final Logger logger = LoggerFactory.getLogger(CollectionReader.class);
	private final Path collectionRoot;

	public CollectionReader(Path collectionRoot) {
		this.collectionRoot = collectionRoot;
	}

	/**
	 * Names of the block directories directly under the collection root, sorted
	 */
	public List<String> listBlocks() throws IOException {
		if (!Files.isDirectory(collectionRoot)) {
			throw new IOException("Collection directory not found: " + collectionRoot);
		}

		try (Stream<Path> paths = Files.list(collectionRoot)) {
			List<String> blocks = paths
					.filter(Files::isDirectory)
					.map(path -> path.getFileName().toString())
					.sorted()
					.toList();
			logger.info("Found {} blocks in {}", blocks.size(), collectionRoot);
			return blocks;
		}
	}

	/**
	 * Regular files of one block, sorted by file name
	 */
	public List<Path> listDocuments(String blockName) throws IOException {
		Path blockDir = collectionRoot.resolve(blockName);
		if (!Files.isDirectory(blockDir)) {
			throw new IOException("Block directory not found: " + blockDir);
		}

		try (Stream<Path> paths = Files.list(blockDir)) {
			return paths
					.filter(Files::isRegularFile)
					.sorted()
					.toList();
		}
	}

	/**
	 * Read a document as UTF-8; malformed input is an error
	 */
	public String readDocument(Path document) throws IOException {
		return Files.readString(document, StandardCharsets.UTF_8);
	}
}
