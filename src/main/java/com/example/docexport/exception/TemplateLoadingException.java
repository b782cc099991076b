package com.example.docexport.exception;

import lombok.Getter;

/**
 * Thrown when a style template cannot be located, read or parsed.
 * Codes: TEMPLATE_NOT_FOUND, INVALID_TEMPLATE, RESOURCE_READ_ERROR.
 */
@Getter
public class TemplateLoadingException extends RuntimeException {

    private final String code;
    private final String description;

    public TemplateLoadingException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public TemplateLoadingException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
