package com.example.docexport.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Article {

    private String name;

    private String description;

    private ArticleMeta meta;

    /**
     * Content format version; versions up to the configured legacy threshold
     * get the cell depth normalization pass
     */
    @Builder.Default
    @JsonProperty("doc_version")
    private int docVersion = 3;

    @Builder.Default
    @JsonProperty("entity_map")
    private Map<String, Entity> entityMap = new HashMap<>();

    @Builder.Default
    private List<Block> blocks = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArticleMeta {
        /**
         * URL of the icon shown above the article title
         */
        private String icon;
    }
}
