package com.example.docexport.service;

import com.example.docexport.aspect.LogExecutionTime;
import com.example.docexport.config.StorageProperties;
import com.example.docexport.exception.ExportStorageException;
import com.example.docexport.model.StoredExport;
import com.example.docexport.storage.ObjectAcl;
import com.example.docexport.storage.ObjectStorageClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Uploads finished documents under export/{shelf}/{user}/{filename} and hands
 * back a presigned download URL
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportStorageService {

    private final ObjectStorageClient storageClient;
    private final StorageProperties properties;

    @LogExecutionTime("Uploading Export")
    public StoredExport save(String shelfId, String userId, String filename, byte[] content) {
        String key = objectKey(shelfId, userId, filename);
        try {
            storageClient.put(properties.getBucket(), key, content, DocxOutputService.CONTENT_TYPE, ObjectAcl.PRIVATE);
            String url = storageClient.presignedGet(properties.getBucket(), key, properties.getPresignedTtl());
            log.info("Export stored at {}/{}", properties.getBucket(), key);
            return new StoredExport(key, url);
        } catch (IOException | RuntimeException e) {
            throw new ExportStorageException("Failed to store export " + key, e);
        }
    }

    public void remove(String key) {
        if (key == null || !key.startsWith("export/")) {
            throw new IllegalArgumentException("Not an export key: " + key);
        }
        try {
            storageClient.delete(properties.getBucket(), key);
        } catch (IOException e) {
            throw new ExportStorageException("Failed to delete export " + key, e);
        }
    }

    static String objectKey(String shelfId, String userId, String filename) {
        String name = filename == null || filename.isBlank() ? "export" : filename.trim();
        name = name.replaceAll("[\\\\/%#+@?]", "_");
        if (!name.toLowerCase().endsWith(".docx")) {
            name = name + ".docx";
        }
        return String.format("export/%s/%s/%s", segment(shelfId), segment(userId), name);
    }

    private static String segment(String value) {
        return value == null || value.isBlank() ? "unknown" : value.replaceAll("[\\\\/]", "_");
    }
}
