package com.example.docexport.config;

import com.example.docexport.text.RunDefaults;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Rendering defaults for generated documents.
 *
 * Example application.yml:
 *
 * docexport:
 *   render:
 *     font-name: Inter
 *     font-size: 12
 *     font-color: "404040"
 *     header-color: "34AB76"
 *     max-image-width-cm: 14.8
 *     legacy-doc-version: 2
 *     fetch-timeout: 10s
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "docexport.render")
public class RenderProperties {

    /**
     * Font family applied to every body run
     */
    private String fontName = "Inter";

    /**
     * Body font size in points
     */
    private double fontSize = 12;

    /**
     * Body font color (hex RGB, no leading #)
     */
    private String fontColor = "404040";

    /**
     * Color of the shelf title and level-two headings
     */
    private String headerColor = "34AB76";

    /**
     * Pictures wider than this are scaled down, keeping their aspect ratio
     */
    private double maxImageWidthCm = 14.8;

    /**
     * Articles with doc_version at or below this value get the cell depth
     * normalization pass and lookback-based table detection
     */
    private int legacyDocVersion = 2;

    /**
     * Border drawn around figures and video thumbnails
     */
    private String imageBorderColor = "E9F0FF";

    /**
     * Border width is the image width divided by this value
     */
    private int imageBorderDivisor = 50;

    /**
     * Connect and read timeout for remote images and video metadata
     */
    private Duration fetchTimeout = Duration.ofSeconds(10);

    public RunDefaults runDefaults() {
        return new RunDefaults(fontName, fontSize, fontColor);
    }
}
