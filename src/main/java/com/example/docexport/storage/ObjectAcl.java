package com.example.docexport.storage;

/**
 * Canned access control for stored objects. Private objects are only
 * readable through a presigned URL.
 */
public enum ObjectAcl {
    PRIVATE
}
