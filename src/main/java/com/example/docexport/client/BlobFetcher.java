package com.example.docexport.client;

import com.example.docexport.exception.ExternalServiceException;

/**
 * Downloads remote resources (images, video thumbnails, video metadata)
 */
public interface BlobFetcher {

    /**
     * @throws ExternalServiceException when the resource cannot be fetched
     */
    byte[] get(String url);
}
