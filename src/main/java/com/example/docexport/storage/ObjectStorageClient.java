package com.example.docexport.storage;

import java.io.IOException;
import java.time.Duration;

/**
 * Bucket/key object store the finished documents are uploaded to
 */
public interface ObjectStorageClient {

    /**
     * Stores the object and returns its public URL
     */
    String put(String bucket, String key, byte[] content, String contentType, ObjectAcl acl) throws IOException;

    /**
     * Time-limited download URL for an existing object
     */
    String presignedGet(String bucket, String key, Duration ttl) throws IOException;

    void delete(String bucket, String key) throws IOException;
}
