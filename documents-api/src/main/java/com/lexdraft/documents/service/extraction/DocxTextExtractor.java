package com.lexdraft.documents.service.extraction;

import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.parser.microsoft.ooxml.OOXMLParser;
import org.apache.tika.sax.BodyContentHandler;
import org.apache.tika.sax.ToHTMLContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * Word (DOCX) conversion. Converter warnings are logged and never fail the extraction.
 */
@Component
public class DocxTextExtractor implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(DocxTextExtractor.class);

    private final Parser parser = new OOXMLParser();

    @Override
    public boolean supports(String mimeType) {
        return MimeTypes.DOCX.equals(MimeTypes.normalise(mimeType));
    }

    @Override
    public String extract(byte[] bytes) {
        BodyContentHandler handler = new BodyContentHandler(-1);
        Metadata metadata = parse(bytes, handler, "text");
        String text = handler.toString().trim();
        int warnings = logWarnings(metadata, "text");
        log.info("DOCX text extracted textLength={} warnings={}", text.length(), warnings);
        return text;
    }

    /**
     * Alternate output mode kept for editors that want formatting; the processing pipeline only uses
     * {@link #extract(byte[])}.
     */
    public String extractHtml(byte[] bytes) {
        ToHTMLContentHandler handler = new ToHTMLContentHandler();
        Metadata metadata = parse(bytes, handler, "HTML");
        String html = handler.toString().trim();
        int warnings = logWarnings(metadata, "HTML");
        log.info("DOCX HTML extracted htmlLength={} warnings={}", html.length(), warnings);
        return html;
    }

    private Metadata parse(byte[] bytes, ContentHandler handler, String mode) {
        Metadata metadata = new Metadata();
        metadata.set(Metadata.CONTENT_TYPE, MimeTypes.DOCX);
        try (InputStream inputStream = new ByteArrayInputStream(bytes)) {
            parser.parse(inputStream, handler, metadata, new ParseContext());
            return metadata;
        } catch (IOException | SAXException | TikaException | RuntimeException e) {
            log.error("DOCX {} extraction failed", mode, e);
            throw new ExtractionException("Failed to extract " + mode + " from DOCX", e);
        }
    }

    private int logWarnings(Metadata metadata, String mode) {
        String[] warnings = metadata.getValues(TikaCoreProperties.TIKA_META_EXCEPTION_WARNING);
        if (warnings.length > 0) {
            log.warn("DOCX {} conversion warnings: {}", mode, Arrays.toString(warnings));
        }
        return warnings.length;
    }
}
