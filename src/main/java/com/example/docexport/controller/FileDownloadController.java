package com.example.docexport.controller;

import com.example.docexport.storage.FileSystemObjectStorageClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serves stored exports through their presigned URLs
 *
 * GET /files/{bucket}/{key}?expires={epochSeconds}&signature={hmac}
 */
@Slf4j
@RestController
@RequestMapping("/files")
@RequiredArgsConstructor
public class FileDownloadController {

    private final FileSystemObjectStorageClient storageClient;

    @GetMapping("/{bucket}/{*key}")
    public ResponseEntity<Resource> download(@PathVariable String bucket,
                                             @PathVariable String key,
                                             @RequestParam("expires") long expires,
                                             @RequestParam("signature") String signature) throws IOException {
        String objectKey = key.startsWith("/") ? key.substring(1) : key;
        Path file = storageClient.openSigned(bucket, objectKey, expires, signature);
        log.debug("Serving {}/{}", bucket, objectKey);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaTypeFactory.getMediaType(file.getFileName().toString())
                .orElse(MediaType.APPLICATION_OCTET_STREAM));
        headers.setContentDispositionFormData("attachment", file.getFileName().toString());
        return new ResponseEntity<>(new FileSystemResource(file), headers, HttpStatus.OK);
    }
}
