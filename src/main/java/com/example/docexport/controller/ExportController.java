package com.example.docexport.controller;

import com.example.docexport.model.ExportRequest;
import com.example.docexport.model.ExportResponse;
import com.example.docexport.model.ExportResult;
import com.example.docexport.service.DocxOutputService;
import com.example.docexport.service.ExportService;
import com.example.docexport.service.ExportService.StoredResult;
import com.example.docexport.service.ExportStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for DOCX export
 */
@Slf4j
@RestController
@RequestMapping("/api/exports")
@RequiredArgsConstructor
public class ExportController {

    static final String ERROR_COUNT_HEADER = "X-Export-Errors";

    private final ExportService exportService;
    private final ExportStorageService storageService;

    /**
     * Render a shelf and download the document
     *
     * POST /api/exports/docx
     * {
     *   "shelf": { "shelf_name": "Handbook", "books": [ ... ] },
     *   "templateId": "corporate"
     * }
     *
     * The number of non-fatal render errors is returned in the X-Export-Errors header.
     */
    @PostMapping("/docx")
    public ResponseEntity<byte[]> exportDocx(@RequestBody ExportRequest request) {
        log.info("Received DOCX export request (template: {})", request.getTemplateId());
        ExportResult result = exportService.export(request);

        String filename = request.getFilename() != null ? request.getFilename() : "document.docx";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(DocxOutputService.CONTENT_TYPE));
        headers.setContentDispositionFormData("attachment", filename.endsWith(".docx") ? filename : filename + ".docx");
        headers.setContentLength(result.getContent().length);
        headers.add(ERROR_COUNT_HEADER, String.valueOf(result.getReport().getErrors().size()));
        return new ResponseEntity<>(result.getContent(), headers, HttpStatus.OK);
    }

    /**
     * Render a shelf, upload it and return a presigned download URL
     */
    @PostMapping("/docx/upload")
    public ExportResponse exportAndUpload(@RequestBody ExportRequest request) {
        log.info("Received DOCX export+upload request (template: {})", request.getTemplateId());
        StoredResult result = exportService.exportAndStore(request);
        return ExportResponse.builder()
                .url(result.getStored().getUrl())
                .key(result.getStored().getKey())
                .errors(result.getReport().getErrors())
                .build();
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteExport(@RequestParam("key") String key) {
        storageService.remove(key);
        return ResponseEntity.noContent().build();
    }
}
