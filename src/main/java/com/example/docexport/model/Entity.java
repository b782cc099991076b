package com.example.docexport.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entity-map entry referenced by an {@link EntityRange}. Only LINK and IMG
 * entities influence rendering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Entity {

    public static final String LINK = "LINK";
    public static final String IMG = "IMG";

    private String type;

    private EntityData data;

    public boolean isLink() {
        return LINK.equalsIgnoreCase(type);
    }

    public boolean isImage() {
        return IMG.equalsIgnoreCase(type);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EntityData {
        private String href;
        private String src;
        /**
         * Square pixel size of inline images
         */
        private Integer size;
        /**
         * "block" turns a link into a link card when it is the only entity of an unstyled block
         */
        private String style;
    }
}
