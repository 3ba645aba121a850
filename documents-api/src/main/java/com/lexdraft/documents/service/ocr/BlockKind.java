package com.lexdraft.documents.service.ocr;

import java.util.Locale;

public enum BlockKind {
    PAGE,
    LINE,
    WORD,
    OTHER;

    public static BlockKind from(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return BlockKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return OTHER;
        }
    }
}
