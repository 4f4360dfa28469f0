package org.bsbi.core.index;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.bsbi.core.codec.PostingsCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Read side of an index written by {@link InvertedIndexWriter}.
 *
 * <p>The directory and the document-length table are loaded into memory when the reader is opened; postings are
 * read on demand with positional reads on a shared {@link FileChannel}, so one reader can serve concurrent
 * lookups.</p>
 */
public class InvertedIndexReader implements Closeable, Iterable<TermPostings> {
	private static final Logger logger = LoggerFactory.getLogger(InvertedIndexReader.class);
	private static final Gson gson = new Gson();

	private final String indexName;
	private final Path postingsPath;
	private final PostingsCodec codec;
	private final FileChannel channel;
	private final List<TermEntry> terms;
	private final Map<Integer, TermEntry> termsById;
	private final Map<Integer, Integer> documentLengths;
	private final double averageDocumentLength;
	private final long totalPostings;

	private InvertedIndexReader(String indexName, Path postingsPath, PostingsCodec codec, FileChannel channel,
			IndexDirectory directory) {
		this.indexName = indexName;
		this.postingsPath = postingsPath;
		this.codec = codec;
		this.channel = channel;
		this.terms = List.copyOf(directory.terms());
		this.termsById = new HashMap<>(terms.size() * 2);
		long postingsCount = 0;
		for (TermEntry entry : terms) {
			termsById.put(entry.termId(), entry);
			postingsCount += entry.documentFrequency();
		}
		this.totalPostings = postingsCount;
		this.documentLengths = Collections.unmodifiableMap(new HashMap<>(directory.documentLengths()));
		this.averageDocumentLength = documentLengths.isEmpty() ? 0.0
				: documentLengths.values().stream().mapToLong(Integer::longValue).sum() / (double) documentLengths.size();
	}

	/**
	 * Opens index {@code indexName} under {@code directory}.
	 *
	 * @throws IOException if a file is missing, the directory is malformed or was written with another codec
	 */
	public static InvertedIndexReader open(Path directory, String indexName, PostingsCodec codec) throws IOException {
		Path directoryPath = InvertedIndexWriter.directoryPath(directory, indexName);
		Path postingsPath = InvertedIndexWriter.postingsPath(directory, indexName);

		if (!Files.exists(directoryPath)) {
			throw new IOException("Index directory file not found: " + directoryPath);
		}

		IndexDirectory indexDirectory = readDirectory(directoryPath);
		if (!codec.name().equals(indexDirectory.codec())) {
			throw new IOException("Index " + indexName + " was written with codec '" + indexDirectory.codec()
					+ "' but is being read with '" + codec.name() + "'");
		}

		FileChannel channel = FileChannel.open(postingsPath, StandardOpenOption.READ);
		try {
			validate(indexDirectory, channel.size(), directoryPath);
		} catch (IOException e) {
			channel.close();
			throw e;
		}

		InvertedIndexReader reader = new InvertedIndexReader(indexName, postingsPath, codec, channel, indexDirectory);
		logger.debug("Opened index {}: {} terms, {} documents", indexName, reader.termCount(), reader.documentCount());
		return reader;
	}

	private static IndexDirectory readDirectory(Path directoryPath) throws IOException {
		IndexDirectory directory;
		try {
			directory = gson.fromJson(Files.readString(directoryPath), IndexDirectory.class);
		} catch (JsonParseException e) {
			throw new IOException("Corrupt index directory: " + directoryPath, e);
		}
		if (directory == null || directory.codec() == null || directory.terms() == null
				|| directory.documentLengths() == null) {
			throw new IOException("Incomplete index directory: " + directoryPath);
		}
		if (directory.terms().contains(null)) {
			throw new IOException("Null term entry in index directory: " + directoryPath);
		}
		return directory;
	}

	private static void validate(IndexDirectory directory, long fileSize, Path directoryPath) throws IOException {
		int previous = -1;
		for (TermEntry entry : directory.terms()) {
			if (entry.termId() <= previous) {
				throw new IOException("Term ids out of order in " + directoryPath + ": "
						+ entry.termId() + " after " + previous);
			}
			if (entry.offset() < 0 || entry.postingsLength() < 0 || entry.tfLength() < 0
					|| entry.offset() + entry.totalLength() > fileSize) {
				throw new IOException("Term " + entry.termId() + " points outside the postings file in " + directoryPath);
			}
			previous = entry.termId();
		}
	}

	/**
	 * Decodes the postings of {@code termId}; a term missing from the directory yields an empty result.
	 */
	public TermPostings getPostings(int termId) throws IOException {
		TermEntry entry = termsById.get(termId);
		if (entry == null) {
			return TermPostings.empty(termId);
		}
		return read(entry);
	}

	public boolean containsTerm(int termId) {
		return termsById.containsKey(termId);
	}

	/**
	 * Iterates every term in ascending id order. Read failures surface as {@link UncheckedIOException}.
	 */
	@Override
	public Iterator<TermPostings> iterator() {
		Iterator<TermEntry> entries = terms.iterator();
		return new Iterator<>() {
			@Override
			public boolean hasNext() {
				return entries.hasNext();
			}

			@Override
			public TermPostings next() {
				if (!entries.hasNext()) {
					throw new NoSuchElementException();
				}
				try {
					return read(entries.next());
				} catch (IOException e) {
					throw new UncheckedIOException(e);
				}
			}
		};
	}

	private TermPostings read(TermEntry entry) throws IOException {
		ByteBuffer buffer = ByteBuffer.allocate(entry.totalLength());
		long offset = entry.offset();
		while (buffer.hasRemaining()) {
			int read = channel.read(buffer, offset + buffer.position());
			if (read < 0) {
				throw new EOFException("Unexpected end of " + postingsPath + " while reading term " + entry.termId());
			}
		}

		byte[] bytes = buffer.array();
		int tfStart = (int) (entry.tfOffset() - offset);
		List<Integer> postings = codec.decodePostings(Arrays.copyOfRange(bytes, 0, tfStart));
		List<Integer> tfs = codec.decodeTf(Arrays.copyOfRange(bytes, tfStart, bytes.length));
		if (postings.size() != entry.documentFrequency() || tfs.size() != entry.documentFrequency()) {
			throw new IOException("Term " + entry.termId() + " in index " + indexName + " decoded to "
					+ postings.size() + " postings and " + tfs.size() + " tfs, expected " + entry.documentFrequency());
		}
		return new TermPostings(entry.termId(), postings, tfs);
	}

	/**
	 * Document id to length (sum of term frequencies). Its size is the number of indexed documents.
	 */
	public Map<Integer, Integer> documentLengths() {
		return documentLengths;
	}

	public int documentCount() {
		return documentLengths.size();
	}

	public int documentLength(int docId) {
		return documentLengths.getOrDefault(docId, 0);
	}

	public double averageDocumentLength() {
		return averageDocumentLength;
	}

	public int termCount() {
		return terms.size();
	}

	public String getIndexName() {
		return indexName;
	}

	public IndexStats getStats() {
		double sizeInMB = 0.0;
		try {
			sizeInMB = channel.size() / (1024.0 * 1024.0);
		} catch (IOException e) {
			logger.warn("Failed to get postings file size of {}", indexName, e);
		}
		return new IndexStats(terms.size(), totalPostings, documentLengths.size(), sizeInMB);
	}

	@Override
	public void close() throws IOException {
		channel.close();
	}
}
