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

/**
 * Root of an export: a named shelf holding books of articles plus the
 * snippet sources those articles refer to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Shelf {

    private String id;

    @JsonProperty("shelf_name")
    private String shelfName;

    @JsonProperty("request_user_id")
    private String requestUserId;

    @Builder.Default
    private List<Book> books = new ArrayList<>();

    @Builder.Default
    private Map<String, SnippetSource> snippets = new HashMap<>();
}
