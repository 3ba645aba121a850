package com.lexdraft.documents.service.extraction;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Calendar;

@Component
public class PdfTextExtractor implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    @Override
    public boolean supports(String mimeType) {
        return MimeTypes.PDF.equals(MimeTypes.normalise(mimeType));
    }

    @Override
    public String extract(byte[] bytes) {
        try (PDDocument document = PDDocument.load(bytes)) {
            String text = stripText(document).trim();
            log.info("PDF text extracted pages={} textLength={}", document.getNumberOfPages(), text.length());
            return text;
        } catch (IOException e) {
            log.error("PDF text extraction failed", e);
            throw new ExtractionException("Failed to extract text from PDF", e);
        }
    }

    /**
     * Applies {@link ScanHeuristic} to the document. Never throws: an unparseable PDF is reported as
     * scanned.
     */
    public boolean isLikelyScanned(byte[] bytes) {
        int pages;
        int textLength;
        try (PDDocument document = PDDocument.load(bytes)) {
            pages = document.getNumberOfPages();
            textLength = stripText(document).trim().length();
        } catch (IOException | RuntimeException e) {
            log.warn("PDF scan check could not parse the document, assuming it is scanned: {}", e.getMessage());
            return ScanHeuristic.PARSE_FAILURE_ASSUMES_SCANNED;
        }
        boolean scanned = ScanHeuristic.isLikelyScanned(pages, textLength);
        log.debug("PDF scan check pages={} textLength={} scanned={}", pages, textLength, scanned);
        return scanned;
    }

    public PdfMetadata metadata(byte[] bytes) {
        try (PDDocument document = PDDocument.load(bytes)) {
            PDDocumentInformation info = document.getDocumentInformation();
            return new PdfMetadata(
                    document.getNumberOfPages(),
                    info.getTitle(),
                    info.getAuthor(),
                    info.getSubject(),
                    info.getKeywords(),
                    info.getCreator(),
                    info.getProducer(),
                    toOffsetDateTime(info.getCreationDate()),
                    toOffsetDateTime(info.getModificationDate())
            );
        } catch (IOException e) {
            log.error("PDF metadata extraction failed", e);
            throw new ExtractionException("Failed to extract PDF metadata", e);
        }
    }

    private String stripText(PDDocument document) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        String text = stripper.getText(document);
        return text == null ? "" : text;
    }

    private OffsetDateTime toOffsetDateTime(Calendar calendar) {
        return calendar == null ? null : calendar.toInstant().atOffset(ZoneOffset.UTC);
    }
}
