package com.example.docexport.text;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class StyleRange {
    private final StyleToken token;
    private final int offset;
    private final int length;
}
