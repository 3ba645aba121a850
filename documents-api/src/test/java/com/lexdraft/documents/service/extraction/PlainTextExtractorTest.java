package com.lexdraft.documents.service.extraction;

import org.junit.jupiter.api.Test;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlainTextExtractorTest {

    private final PlainTextExtractor extractor = new PlainTextExtractor();

    @Test
    void decodesUtf8WithoutTrimming() {
        String text = "  Señora García v. Acme Corp.\n";

        assertThat(extractor.extract(text.getBytes(StandardCharsets.UTF_8))).isEqualTo(text);
    }

    @Test
    void supportsOnlyPlainText() {
        assertThat(extractor.supports("text/plain")).isTrue();
        assertThat(extractor.supports("Text/Plain; charset=UTF-8")).isTrue();
        assertThat(extractor.supports("text/html")).isFalse();
        assertThat(extractor.supports(null)).isFalse();
        assertThat(new PdfTextExtractor().supports("application/pdf")).isTrue();
        assertThat(new DocxTextExtractor().supports(MimeTypes.DOCX)).isTrue();
        assertThat(new DocxTextExtractor().supports("application/msword")).isFalse();
    }

    @Test
    void malformedUtf8IsAnExtractionFailure() {
        byte[] invalid = {(byte) 0x48, (byte) 0xC3, (byte) 0x28};

        assertThatThrownBy(() -> extractor.extract(invalid))
                .isInstanceOf(ExtractionException.class)
                .hasCauseInstanceOf(CharacterCodingException.class);
    }
}
