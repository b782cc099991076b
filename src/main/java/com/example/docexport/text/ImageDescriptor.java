package com.example.docexport.text;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Inline image reference carried by an IMG entity. The size is the square
 * edge length in pixels.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ImageDescriptor {
    private final String src;
    private final Integer sizePx;
}
