package com.lexdraft.documents.service.ocr;

import java.util.List;

/**
 * Line-level OCR output. {@code averageConfidence} is the arithmetic mean of {@code lineConfidences},
 * and exactly 0 when no lines were detected.
 */
public record OcrResult(String text, List<Double> lineConfidences, double averageConfidence) {

    public int lineCount() {
        return lineConfidences.size();
    }
}
