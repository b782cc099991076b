package com.example.docexport.service;

import com.example.docexport.aspect.LogExecutionTime;
import com.example.docexport.config.CacheConfig;
import com.example.docexport.exception.TemplateLoadingException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Loads the .docx documents whose fonts are merged into exports.
 *
 * A template id is looked up first in the configured template directory and
 * then under {@code templates/} on the classpath; ".docx" is appended when the
 * id has no extension. Raw bytes are cached; every export parses its own copy.
 */
@Slf4j
@Service
public class StyleTemplateLoader {

    private static final String CLASSPATH_PREFIX = "templates/";

    @Value("${docexport.templates.directory:./templates}")
    private String templateDirectory;

    @Cacheable(value = CacheConfig.STYLE_TEMPLATES, key = "#templateId")
    @LogExecutionTime("Loading Style Template")
    public byte[] getTemplateBytes(String templateId) {
        if (templateId == null || templateId.isBlank()) {
            throw new TemplateLoadingException("INVALID_TEMPLATE", "Template id cannot be null or empty");
        }
        if (templateId.contains("..") || templateId.startsWith("/") || templateId.contains("\\")) {
            throw new TemplateLoadingException("INVALID_TEMPLATE", "Illegal template id: " + templateId);
        }
        String fileName = templateId.contains(".") ? templateId : templateId + ".docx";

        Path file = Path.of(templateDirectory, fileName);
        if (Files.isRegularFile(file)) {
            log.info("Loading style template from file system: {}", file);
            try {
                return Files.readAllBytes(file);
            } catch (IOException e) {
                log.error("Failed to read template file: {}", file, e);
                throw new TemplateLoadingException("RESOURCE_READ_ERROR", "Failed to read template: " + templateId, e);
            }
        }

        ClassPathResource resource = new ClassPathResource(CLASSPATH_PREFIX + fileName);
        if (!resource.exists()) {
            throw new TemplateLoadingException("TEMPLATE_NOT_FOUND", "Template not found: " + templateId);
        }
        log.info("Loading style template from classpath: {}", resource.getPath());
        try (InputStream is = resource.getInputStream()) {
            return is.readAllBytes();
        } catch (IOException e) {
            log.error("Failed to read template resource: {}", resource.getPath(), e);
            throw new TemplateLoadingException("RESOURCE_READ_ERROR", "Failed to read template: " + templateId, e);
        }
    }

    public byte[] decodeInline(String templateBase64) {
        try {
            return Base64.getDecoder().decode(templateBase64.trim());
        } catch (IllegalArgumentException e) {
            throw new TemplateLoadingException("INVALID_TEMPLATE", "Template payload is not valid base64", e);
        }
    }

    public XWPFDocument open(byte[] content) {
        try {
            return new XWPFDocument(new ByteArrayInputStream(content));
        } catch (IOException | RuntimeException e) {
            throw new TemplateLoadingException("INVALID_TEMPLATE", "Template is not a readable .docx document", e);
        }
    }
}
