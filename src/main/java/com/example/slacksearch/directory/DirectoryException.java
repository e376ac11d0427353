package com.example.slacksearch.directory;

/**
 * The workspace directory could not answer: transport failure, HTTP error or an API-level
 * error other than "not found".
 */
public class DirectoryException extends RuntimeException {

    public DirectoryException(String message) {
        super(message);
    }

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
