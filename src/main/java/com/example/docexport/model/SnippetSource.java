package com.example.docexport.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reusable content referenced by snippet blocks. Only blocks whose key is
 * listed in {@code keys} are spliced in, in source order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SnippetSource {

    @Builder.Default
    private List<Block> blocks = new ArrayList<>();

    @Builder.Default
    private List<String> keys = new ArrayList<>();
}
