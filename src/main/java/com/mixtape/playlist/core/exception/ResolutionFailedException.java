package com.mixtape.playlist.core.exception;

/**
 * Domain exception thrown when a URL or library reference cannot be turned into a playlist entry.
 */
public class ResolutionFailedException extends RuntimeException {

    private final String source;

    public ResolutionFailedException(String source, String message) {
        super(message);
        this.source = source;
    }

    public ResolutionFailedException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
