package com.lexdraft.documents.service.ocr;

public record TextBlock(String text, BlockKind kind, double confidence) {
}
