package com.lexdraft.documents.service.extraction;

/**
 * Decides whether a PDF is probably made of page images rather than machine-readable text.
 * A document averaging fewer than {@link #MIN_CHARS_PER_PAGE} extracted characters per page is
 * treated as scanned.
 */
public final class ScanHeuristic {

    public static final int MIN_CHARS_PER_PAGE = 100;

    /** A PDF that cannot even be parsed for text almost certainly needs OCR. */
    public static final boolean PARSE_FAILURE_ASSUMES_SCANNED = true;

    private ScanHeuristic() {
    }

    public static boolean isLikelyScanned(int pageCount, int textLength) {
        if (pageCount <= 0) {
            return true;
        }
        double charsPerPage = (double) textLength / pageCount;
        return charsPerPage < MIN_CHARS_PER_PAGE;
    }
}
