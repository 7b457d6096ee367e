package com.mixtape.playlist.core.exception;

/**
 * Domain exception thrown when paging parameters for a playlist listing are invalid.
 */
public class InvalidPaginationException extends RuntimeException {

    public InvalidPaginationException(String message) {
        super(message);
    }
}
