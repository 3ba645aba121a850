package com.lexdraft.documents.service.ocr;

import com.lexdraft.documents.service.extraction.MimeTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Wraps the remote OCR capability: gates on mime type, bounds the remote call with a timeout, reduces
 * the response to lines and falls back to a local engine when the remote call fails.
 */
@Service
public class OcrService {

    private static final Logger log = LoggerFactory.getLogger(OcrService.class);

    static final Set<String> OCR_MIME_TYPES = Set.of(
            "image/jpeg",
            "image/jpg",
            "image/png",
            "image/tiff",
            MimeTypes.PDF
    );

    static final String NO_FALLBACK_MESSAGE = "primary OCR unavailable and no fallback engine configured";
    static final String FALLBACK_FAILED_MESSAGE = "primary OCR unavailable and fallback OCR engine failed";

    private final OcrCapability ocrCapability;
    private final FallbackOcrEngine fallbackEngine;
    private final Executor ocrExecutor;
    private final Duration timeout;

    public OcrService(OcrCapability ocrCapability,
                      FallbackOcrEngine fallbackEngine,
                      @Qualifier("ocrExecutor") Executor ocrExecutor,
                      @Value("${documents.ocr.timeout-seconds:60}") long timeoutSeconds) {
        this.ocrCapability = ocrCapability;
        this.fallbackEngine = fallbackEngine;
        this.ocrExecutor = ocrExecutor;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public boolean isOcrCandidate(String mimeType) {
        return OCR_MIME_TYPES.contains(MimeTypes.normalise(mimeType));
    }

    public void requireOcrCandidate(String mimeType) {
        if (!isOcrCandidate(mimeType)) {
            throw new UnsupportedTypeException("File type not suitable for OCR: " + mimeType);
        }
    }

    public OcrResult detectText(byte[] bytes) {
        List<TextBlock> lines = callPrimary(bytes).stream()
                .filter(block -> block.kind() == BlockKind.LINE)
                .collect(Collectors.toList());
        String text = lines.stream()
                .map(TextBlock::text)
                .collect(Collectors.joining("\n"))
                .trim();
        List<Double> confidences = lines.stream()
                .map(TextBlock::confidence)
                .collect(Collectors.toUnmodifiableList());
        double average = confidences.stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
        log.info("OCR completed textLength={} lines={} averageConfidence={}", text.length(), lines.size(), average);
        return new OcrResult(text, confidences, average);
    }

    public String extractWithFallback(byte[] bytes, String mimeType) {
        requireOcrCandidate(mimeType);
        try {
            return detectText(bytes).text();
        } catch (OcrCapabilityException primaryFailure) {
            log.warn("Primary OCR failed: {}", primaryFailure.getMessage());
            return runFallback(bytes, mimeType, primaryFailure);
        }
    }

    private String runFallback(byte[] bytes, String mimeType, OcrCapabilityException primaryFailure) {
        if (!fallbackEngine.isAvailable()) {
            throw new OcrUnavailableException(NO_FALLBACK_MESSAGE, primaryFailure);
        }
        try {
            String text = fallbackEngine.extractText(bytes, MimeTypes.normalise(mimeType));
            log.info("Fallback OCR produced textLength={}", text.length());
            return text;
        } catch (RuntimeException | LinkageError fallbackFailure) {
            log.error("Fallback OCR failed", fallbackFailure);
            OcrUnavailableException unavailable = new OcrUnavailableException(FALLBACK_FAILED_MESSAGE, fallbackFailure);
            unavailable.addSuppressed(primaryFailure);
            throw unavailable;
        }
    }

    private List<TextBlock> callPrimary(byte[] bytes) {
        CompletableFuture<List<TextBlock>> call;
        try {
            call = CompletableFuture.supplyAsync(() -> ocrCapability.detectDocumentText(bytes), ocrExecutor);
        } catch (RejectedExecutionException e) {
            throw new OcrCapabilityException("OCR queue is full", e);
        }
        try {
            List<TextBlock> blocks = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return blocks == null ? List.of() : blocks;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new OcrCapabilityException("OCR call timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new OcrCapabilityException("OCR extraction failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OcrCapabilityException("Interrupted while waiting for OCR", e);
        }
    }
}
