package com.example.ingest.infrastructure.cad;

/**
 * Checked failure raised by {@link DxfReader} when a file is not a readable ASCII DXF drawing.
 */
public class DxfParseException extends Exception {

    /**
     * @param message reason the drawing was rejected
     */
    public DxfParseException(String message) {
        super(message);
    }
}
