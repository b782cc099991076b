package com.example.docexport.exception;

/**
 * The document could not be produced at all (serialization, template parse)
 */
public class ExportFailedException extends RuntimeException {

    public ExportFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
