package com.lexdraft.documents.service.extraction;

import java.util.Locale;

public final class MimeTypes {

    public static final String PDF = "application/pdf";
    public static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    public static final String TEXT_PLAIN = "text/plain";

    private MimeTypes() {
    }

    /**
     * Lower-cases the type and drops parameters, so {@code "Text/Plain; charset=UTF-8"} becomes
     * {@code "text/plain"}.
     */
    public static String normalise(String mimeType) {
        if (mimeType == null) {
            return "";
        }
        int separator = mimeType.indexOf(';');
        String base = separator > -1 ? mimeType.substring(0, separator) : mimeType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
