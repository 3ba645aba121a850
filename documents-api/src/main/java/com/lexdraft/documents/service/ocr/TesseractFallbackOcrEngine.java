package com.lexdraft.documents.service.ocr;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Tesseract-backed fallback. Disabled unless {@code documents.ocr.fallback.enabled} is set, because it
 * needs native Tesseract libraries and trained data on the host.
 */
@Component
public class TesseractFallbackOcrEngine implements FallbackOcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractFallbackOcrEngine.class);

    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", ".jpg",
            "image/jpg", ".jpg",
            "image/png", ".png",
            "image/tiff", ".tiff",
            "application/pdf", ".pdf"
    );

    private final ITesseract tesseract;
    private final boolean enabled;

    public TesseractFallbackOcrEngine(@Value("${documents.ocr.fallback.enabled:false}") boolean enabled,
                                      @Value("${documents.ocr.fallback.language:eng}") String language,
                                      @Value("${documents.ocr.fallback.datapath:}") String datapath) {
        this.enabled = enabled;
        if (enabled) {
            Tesseract engine = new Tesseract();
            if (datapath != null && !datapath.isBlank()) {
                engine.setDatapath(datapath);
            }
            if (language != null && !language.isBlank()) {
                engine.setLanguage(language);
            }
            this.tesseract = engine;
        } else {
            this.tesseract = null;
        }
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public String extractText(byte[] bytes, String mimeType) {
        if (!enabled) {
            throw new IllegalStateException("Tesseract fallback is disabled");
        }
        Path tempFile = null;
        try {
            tempFile = Files.createTempFile("lexdraft-ocr-", extensionFor(mimeType));
            Files.write(tempFile, bytes);
            File file = tempFile.toFile();
            String result = tesseract.doOCR(file);
            String text = result == null ? "" : result.trim();
            log.info("Tesseract OCR completed textLength={}", text.length());
            return text;
        } catch (IOException e) {
            throw new OcrCapabilityException("Failed to create temp file for OCR", e);
        } catch (TesseractException e) {
            throw new OcrCapabilityException("Tesseract OCR failed", e);
        } finally {
            if (tempFile != null && !FileUtils.deleteQuietly(tempFile.toFile())) {
                log.debug("Failed to delete temp file {}", tempFile);
            }
        }
    }

    private String extensionFor(String mimeType) {
        if (mimeType == null) {
            return ".ocr";
        }
        return EXTENSIONS.getOrDefault(mimeType.toLowerCase(Locale.ROOT), ".ocr");
    }
}
