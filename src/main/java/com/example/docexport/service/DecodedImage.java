package com.example.docexport.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.awt.image.BufferedImage;

@Getter
@AllArgsConstructor
public class DecodedImage {
    private final BufferedImage image;
    /**
     * Lower-case ImageIO format name, e.g. "png" or "jpeg"
     */
    private final String format;
    private final byte[] bytes;

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }
}
