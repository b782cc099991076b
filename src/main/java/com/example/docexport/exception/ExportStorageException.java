package com.example.docexport.exception;

/**
 * Upload or deletion of an exported document failed. Fatal for the request.
 */
public class ExportStorageException extends RuntimeException {

    public ExportStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
