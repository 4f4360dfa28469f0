package org.bsbi.core.index;

import com.google.gson.Gson;
import org.bsbi.core.codec.PostingsCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes one inverted index: a postings file ({@code <name>.index}) holding each term's encoded postings followed by
 * its encoded term frequencies, and a JSON directory ({@code <name>.dict}) with the term entries and the
 * document-length table.
 *
 * <p>Terms must be appended in strictly ascending id order. The directory is only published, by an atomic rename,
 * when the writer is closed without a prior write failure.</p>
 */
public class InvertedIndexWriter implements Closeable {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndexWriter.class);
	private static final Gson gson = new Gson();

	public static final String POSTINGS_SUFFIX = ".index";
	public static final String DIRECTORY_SUFFIX = ".dict";

	private final String indexName;
	private final Path postingsPath;
	private final Path directoryPath;
	private final PostingsCodec codec;
	private final FileChannel channel;
	private final List<TermEntry> terms;
	private final Map<Integer, Integer> documentLengths;
	private long position;
	private int lastTermId;
	private boolean failed;
	private boolean closed;

	private InvertedIndexWriter(Path directory, String indexName, PostingsCodec codec) throws IOException {
		this.indexName = indexName;
		this.postingsPath = postingsPath(directory, indexName);
		this.directoryPath = directoryPath(directory, indexName);
		this.codec = codec;
		this.terms = new ArrayList<>();
		this.documentLengths = new TreeMap<>();
		this.position = 0L;
		this.lastTermId = -1;

		Files.createDirectories(directory);
		Files.deleteIfExists(directoryPath);
		this.channel = FileChannel.open(postingsPath,
				StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
	}

	/**
	 * Creates (or truncates) the files of index {@code indexName} under {@code directory}.
	 */
	public static InvertedIndexWriter open(Path directory, String indexName, PostingsCodec codec) throws IOException {
		InvertedIndexWriter writer = new InvertedIndexWriter(directory, indexName, codec);
		logger.debug("Opened index writer {} ({} codec) in {}", indexName, codec.name(), directory);
		return writer;
	}

	public static Path postingsPath(Path directory, String indexName) {
		return directory.resolve(indexName + POSTINGS_SUFFIX);
	}

	public static Path directoryPath(Path directory, String indexName) {
		return directory.resolve(indexName + DIRECTORY_SUFFIX);
	}

	/**
	 * Appends the postings of one term.
	 *
	 * @param termId strictly greater than every term id appended before
	 * @param postings ascending document ids, non-empty
	 * @param tfs term frequencies co-indexed with {@code postings}
	 */
	public void append(int termId, List<Integer> postings, List<Integer> tfs) throws IOException {
		ensureOpen();
		if (termId <= lastTermId) {
			throw new IllegalArgumentException("Term ids must be appended in ascending order: "
					+ termId + " after " + lastTermId + " in index " + indexName);
		}
		if (postings.isEmpty()) {
			throw new IllegalArgumentException("Empty postings list for term " + termId);
		}
		if (postings.size() != tfs.size()) {
			throw new IllegalArgumentException("Postings and tf lists differ in length for term " + termId
					+ ": " + postings.size() + " vs " + tfs.size());
		}

		byte[] encodedPostings = codec.encodePostings(postings);
		byte[] encodedTfs = codec.encodeTf(tfs);

		try {
			write(encodedPostings);
			write(encodedTfs);
		} catch (IOException e) {
			failed = true;
			throw new IOException("Failed to write postings of term " + termId + " to " + postingsPath, e);
		}

		terms.add(new TermEntry(termId, position, encodedPostings.length, encodedTfs.length, postings.size()));
		position += encodedPostings.length + encodedTfs.length;
		lastTermId = termId;

		for (int i = 0; i < postings.size(); i++) {
			documentLengths.merge(postings.get(i), tfs.get(i), Integer::sum);
		}
	}

	public void append(TermPostings termPostings) throws IOException {
		append(termPostings.termId(), termPostings.postings(), termPostings.tfs());
	}

	/**
	 * Marks the index as incomplete; {@link #close()} will then not publish its directory.
	 */
	public void abort() {
		failed = true;
	}

	public int termCount() {
		return terms.size();
	}

	public String getIndexName() {
		return indexName;
	}

	/**
	 * Flushes the postings file and publishes the directory.
	 */
	@Override
	public void close() throws IOException {
		if (closed) {
			return;
		}
		closed = true;

		try {
			if (!failed) {
				channel.force(true);
			}
		} finally {
			channel.close();
		}

		if (failed) {
			logger.warn("Index {} was not finalized after a failure", indexName);
			return;
		}

		writeDirectory();
		logger.info("Wrote index {}: {} terms, {} documents, {} bytes of postings",
				indexName, terms.size(), documentLengths.size(), position);
	}

	private void writeDirectory() throws IOException {
		IndexDirectory directory = new IndexDirectory(codec.name(), terms, documentLengths);
		Path temp = directoryPath.resolveSibling(directoryPath.getFileName() + ".tmp");
		Files.writeString(temp, gson.toJson(directory));
		try {
			Files.move(temp, directoryPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(temp, directoryPath, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private void write(byte[] bytes) throws IOException {
		ByteBuffer buffer = ByteBuffer.wrap(bytes);
		while (buffer.hasRemaining()) {
			channel.write(buffer);
		}
	}

	private void ensureOpen() {
		if (closed) {
			throw new IllegalStateException("Index writer " + indexName + " is closed");
		}
	}
}
