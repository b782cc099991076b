package com.example.docexport.service;

import com.example.docexport.exception.ExportFailedException;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Helper service to serialize documents to bytes for HTTP responses or storage.
 */
@Component
public class DocxOutputService {

    public static final String CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    public byte[] toBytes(XWPFDocument document) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            document.write(baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new ExportFailedException("Failed to serialize DOCX document", e);
        }
    }
}
