package com.propertyintel.places.output;

/**
 * The shared output file could not be opened, flushed or closed.
 * Fatal to the whole job, since every area writes through the same file.
 */
public class OutputWriteException extends RuntimeException {

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
