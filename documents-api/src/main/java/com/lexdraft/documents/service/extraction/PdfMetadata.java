package com.lexdraft.documents.service.extraction;

import java.time.OffsetDateTime;

public record PdfMetadata(int pages,
                          String title,
                          String author,
                          String subject,
                          String keywords,
                          String creator,
                          String producer,
                          OffsetDateTime creationDate,
                          OffsetDateTime modificationDate) {
}
