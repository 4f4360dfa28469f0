package org.bsbi.core.dictionary;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Bidirectional registry between string keys and dense integer ids.
 *
 * <p>Ids are handed out in first-seen order starting at {@code 0} and never change once assigned.
 * One instance is shared by every block of an indexing run, so assignment is single-writer:
 * callers that parse blocks concurrently must serialize {@link #getOrAssign(String)} themselves.
 * A map restored with {@link #load(Path)} is read-only.</p>
 */
public class IdMap {
	private static final Logger logger = LoggerFactory.getLogger(IdMap.class);
	private static final Gson gson = new Gson();
	private static final Type SNAPSHOT_TYPE = new TypeToken<List<String>>(){}.getType();

	private final Map<String, Integer> keyToId;
	private final List<String> idToKey;
	private final boolean readOnly;

	public IdMap() {
		this(new ArrayList<>(), false);
	}

	private IdMap(List<String> keys, boolean readOnly) {
		this.idToKey = keys;
		this.keyToId = new HashMap<>(keys.size() * 2);
		this.readOnly = readOnly;
		for (int id = 0; id < keys.size(); id++) {
			if (keyToId.putIfAbsent(keys.get(id), id) != null) {
				throw new IllegalArgumentException("Duplicate key in snapshot: " + keys.get(id));
			}
		}
	}

	/**
	 * Returns the id of {@code key}, assigning the next free id if the key is new.
	 */
	public int getOrAssign(String key) {
		Integer id = keyToId.get(key);
		if (id != null) {
			return id;
		}
		if (readOnly) {
			throw new IllegalStateException("Cannot assign an id to '" + key + "': map is read-only");
		}
		int next = idToKey.size();
		idToKey.add(key);
		keyToId.put(key, next);
		return next;
	}

	/**
	 * Looks up {@code key} without assigning anything.
	 */
	public OptionalInt find(String key) {
		Integer id = keyToId.get(key);
		return id == null ? OptionalInt.empty() : OptionalInt.of(id);
	}

	/**
	 * Inverse lookup.
	 */
	public String get(int id) {
		if (id < 0 || id >= idToKey.size()) {
			throw new IllegalArgumentException("Unknown id: " + id);
		}
		return idToKey.get(id);
	}

	public int size() {
		return idToKey.size();
	}

	public boolean isReadOnly() {
		return readOnly;
	}

	public List<String> keys() {
		return Collections.unmodifiableList(idToKey);
	}

	/**
	 * Writes the keys in id order as a JSON array.
	 */
	public void save(Path path) throws IOException {
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(path, gson.toJson(idToKey, SNAPSHOT_TYPE));
		logger.info("Saved {} ids to {}", idToKey.size(), path);
	}

	/**
	 * Restores a snapshot written by {@link #save(Path)} as a read-only map.
	 */
	public static IdMap load(Path path) throws IOException {
		if (!Files.exists(path)) {
			throw new IOException("Dictionary file not found: " + path);
		}

		List<String> keys;
		try {
			keys = gson.fromJson(Files.readString(path), SNAPSHOT_TYPE);
		} catch (JsonParseException e) {
			throw new IOException("Corrupt dictionary file: " + path, e);
		}
		if (keys == null) {
			throw new IOException("Empty dictionary file: " + path);
		}

		IdMap map;
		try {
			map = new IdMap(new ArrayList<>(keys), true);
		} catch (IllegalArgumentException e) {
			throw new IOException("Corrupt dictionary file: " + path, e);
		}
		logger.info("Loaded {} ids from {}", map.size(), path);
		return map;
	}
}
