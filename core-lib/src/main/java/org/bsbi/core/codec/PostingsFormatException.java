package org.bsbi.core.codec;

import java.io.IOException;

/**
 * Thrown when an encoded postings or term-frequency stream cannot be decoded, which means the index is corrupt.
 */
public class PostingsFormatException extends IOException {
    public PostingsFormatException(String message) {
        super(message);
    }
}
