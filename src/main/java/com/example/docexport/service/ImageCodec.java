package com.example.docexport.service;

import com.example.docexport.exception.ImageFormatException;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * Decodes, re-encodes and frames raster images with ImageIO
 */
@Component
public class ImageCodec {

    public DecodedImage decode(byte[] bytes) {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                throw new ImageFormatException("Unrecognized image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in);
                BufferedImage image = reader.read(0);
                return new DecodedImage(image, reader.getFormatName().toLowerCase(Locale.ROOT), bytes);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new ImageFormatException("Unreadable image data", e);
        }
    }

    /**
     * Encodes in the requested format, or PNG when ImageIO has no writer for it
     */
    public byte[] encode(BufferedImage image, String format) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, format, out)) {
                out.reset();
                ImageIO.write(image, "png", out);
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new ImageFormatException("Failed to encode image as " + format, e);
        }
    }

    /**
     * Centers the image on a solid canvas {@code borderPx} larger in each dimension
     */
    public BufferedImage composeWithBorder(BufferedImage image, int borderPx, Color color) {
        int width = image.getWidth() + borderPx;
        int height = image.getHeight() + borderPx;
        BufferedImage framed = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = framed.createGraphics();
        try {
            graphics.setColor(color);
            graphics.fillRect(0, 0, width, height);
            graphics.drawImage(image, borderPx / 2, borderPx / 2, null);
        } finally {
            graphics.dispose();
        }
        return framed;
    }
}
