package com.lexdraft.documents.service.ocr;

import com.lexdraft.documents.service.DocumentProcessingException;
import org.springframework.http.HttpStatus;

public class OcrCapabilityException extends DocumentProcessingException {

    public OcrCapabilityException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, cause);
    }
}
