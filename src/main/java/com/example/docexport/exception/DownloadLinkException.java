package com.example.docexport.exception;

/**
 * A download link was expired or its signature did not match
 */
public class DownloadLinkException extends RuntimeException {

    public DownloadLinkException(String message) {
        super(message);
    }
}
