package com.example.docexport.service;

import com.example.docexport.client.BlobFetcher;
import com.example.docexport.config.RenderProperties;
import com.example.docexport.exception.ExportFailedException;
import com.example.docexport.exception.ImageFormatException;
import com.example.docexport.text.ImageDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.util.Units;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Places pictures into runs. Sources are http(s) URLs or base64 data URLs.
 * Fetch failures surface as ExternalServiceException, undecodable bytes as
 * ImageFormatException.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PictureInserter {

    private final BlobFetcher blobFetcher;
    private final ImageCodec imageCodec;
    private final RenderProperties properties;

    public static boolean isDataUrl(String src) {
        return src != null && src.startsWith("data:image");
    }

    public DecodedImage load(String src) {
        if (isDataUrl(src)) {
            int comma = src.indexOf(',');
            if (comma < 0) {
                throw new ImageFormatException("Malformed data URL");
            }
            try {
                return imageCodec.decode(Base64.getDecoder().decode(src.substring(comma + 1).trim()));
            } catch (IllegalArgumentException e) {
                throw new ImageFormatException("Invalid base64 image payload", e);
            }
        }
        return imageCodec.decode(blobFetcher.get(src));
    }

    /**
     * Adds a picture at its natural size (96 px per inch), scaled down to the
     * configured maximum width with the aspect ratio preserved. Returns the
     * picture width in EMU.
     */
    public long insertPicture(XWPFRun run, String src, boolean border) {
        DecodedImage image = load(src);
        if (border) {
            image = frame(image);
        }
        long width = Units.pixelToEMU(image.getWidth());
        long height = Units.pixelToEMU(image.getHeight());
        long maxWidth = Math.round(properties.getMaxImageWidthCm() * Units.EMU_PER_CENTIMETER);
        if (width > maxWidth) {
            double aspectRatio = (double) width / height;
            width = maxWidth;
            height = Math.round(maxWidth / aspectRatio);
        }
        add(run, image, src, width, height);
        return width;
    }

    /**
     * Adds an inline image as a square of the declared pixel size
     */
    public void insertInline(XWPFRun run, ImageDescriptor descriptor) {
        DecodedImage image = load(descriptor.getSrc());
        int size = descriptor.getSizePx() != null ? descriptor.getSizePx() : image.getWidth();
        long edge = Units.pixelToEMU(size);
        add(run, image, descriptor.getSrc(), edge, edge);
    }

    private DecodedImage frame(DecodedImage image) {
        int borderPx = image.getWidth() / properties.getImageBorderDivisor();
        Color color = Color.decode("#" + properties.getImageBorderColor());
        String format = image.getFormat();
        byte[] bytes = imageCodec.encode(imageCodec.composeWithBorder(image.getImage(), borderPx, color), format);
        return imageCodec.decode(bytes);
    }

    private void add(XWPFRun run, DecodedImage image, String src, long width, long height) {
        int pictureType = pictureType(image.getFormat());
        byte[] bytes = image.getBytes();
        if (pictureType == Document.PICTURE_TYPE_PNG && !"png".equals(image.getFormat())) {
            bytes = imageCodec.encode(image.getImage(), "png");
        }
        try {
            run.addPicture(new ByteArrayInputStream(bytes), pictureType, fileName(src, image.getFormat()),
                    Math.toIntExact(width), Math.toIntExact(height));
        } catch (InvalidFormatException e) {
            throw new ImageFormatException("Picture rejected by document: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ExportFailedException("Failed to embed picture " + fileName(src, image.getFormat()), e);
        }
        log.debug("Inserted {} picture {}x{} EMU", image.getFormat(), width, height);
    }

    private static int pictureType(String format) {
        switch (format) {
            case "jpeg":
            case "jpg":
                return Document.PICTURE_TYPE_JPEG;
            case "gif":
                return Document.PICTURE_TYPE_GIF;
            case "bmp":
                return Document.PICTURE_TYPE_BMP;
            default:
                return Document.PICTURE_TYPE_PNG;
        }
    }

    private static String fileName(String src, String format) {
        if (src == null || isDataUrl(src)) {
            return "image." + format;
        }
        String name = src.substring(src.lastIndexOf('/') + 1);
        int query = name.indexOf('?');
        name = query >= 0 ? name.substring(0, query) : name;
        return name.isEmpty() ? "image." + format : name;
    }
}
