package com.example.docexport.exception;

/**
 * Image bytes were fetched but could not be decoded
 */
public class ImageFormatException extends RuntimeException {

    public ImageFormatException(String message) {
        super(message);
    }

    public ImageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
