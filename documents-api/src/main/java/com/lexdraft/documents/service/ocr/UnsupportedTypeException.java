package com.lexdraft.documents.service.ocr;

import com.lexdraft.documents.service.DocumentProcessingException;
import org.springframework.http.HttpStatus;

public class UnsupportedTypeException extends DocumentProcessingException {

    public UnsupportedTypeException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
