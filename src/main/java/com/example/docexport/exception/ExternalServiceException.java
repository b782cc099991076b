package com.example.docexport.exception;

/**
 * A remote dependency (image host, video metadata API, snippet source) failed
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
