package com.example.docexport.model;

public enum ErrorCategory {
    /** A whole block could not be rendered */
    BLOCK,
    /** A single style attribute could not be copied from the template */
    ATTRIBUTE,
    /** Image bytes could not be decoded */
    IMAGE_FORMAT,
    /** A remote fetch (image, thumbnail metadata, snippet) failed */
    EXTERNAL_SERVICE
}
