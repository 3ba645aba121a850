package com.lexdraft.documents.service.extraction;

import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

@Component
public class PlainTextExtractor implements TextExtractor {

    @Override
    public boolean supports(String mimeType) {
        return MimeTypes.TEXT_PLAIN.equals(MimeTypes.normalise(mimeType));
    }

    @Override
    public String extract(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new ExtractionException("Failed to decode plain text document as UTF-8", e);
        }
    }
}
