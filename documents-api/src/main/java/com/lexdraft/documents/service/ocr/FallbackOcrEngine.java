package com.lexdraft.documents.service.ocr;

/**
 * Local OCR engine used when the remote capability is unavailable.
 */
public interface FallbackOcrEngine {

    boolean isAvailable();

    String extractText(byte[] bytes, String mimeType);
}
