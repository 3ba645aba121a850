package com.lexdraft.documents.service.ocr;

import java.util.List;

/**
 * Remote text-detection service. Implementations return every block the service reports; filtering
 * to lines is done by {@link OcrService}.
 */
public interface OcrCapability {

    List<TextBlock> detectDocumentText(byte[] bytes);
}
