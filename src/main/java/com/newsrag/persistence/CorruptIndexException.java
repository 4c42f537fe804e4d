package com.newsrag.persistence;

import java.io.IOException;

/**
 * Persisted state does not match its manifest. Nothing from it is loaded.
 */
public class CorruptIndexException extends IOException {
    public CorruptIndexException(String message) {
        super(message);
    }

    public CorruptIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
