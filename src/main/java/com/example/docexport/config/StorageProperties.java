package com.example.docexport.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Where exported documents are uploaded.
 *
 * docexport:
 *   storage:
 *     root-directory: ./storage
 *     bucket: docx-exports
 *     public-base-url: http://localhost:8080/files
 *     presigned-ttl: 15m
 *     signing-secret: ${DOCEXPORT_SIGNING_SECRET:}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "docexport.storage")
public class StorageProperties {

    private String rootDirectory = "./storage";

    private String bucket = "docx-exports";

    private String publicBaseUrl = "http://localhost:8080/files";

    /**
     * Lifetime of the download URL handed back after an upload
     */
    private Duration presignedTtl = Duration.ofSeconds(900);

    /**
     * HMAC key for download links. When blank a random key is generated at
     * startup and links issued before a restart stop working.
     */
    private String signingSecret;
}
