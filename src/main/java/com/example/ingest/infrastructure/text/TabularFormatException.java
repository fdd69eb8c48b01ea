package com.example.ingest.infrastructure.text;

/**
 * Raised when decoded content cannot be read as a table.
 */
public class TabularFormatException extends Exception {

    /**
     * @param message what made the table unreadable
     */
    public TabularFormatException(String message) {
        super(message);
    }
}
