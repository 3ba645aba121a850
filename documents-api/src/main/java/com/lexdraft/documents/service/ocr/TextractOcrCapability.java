package com.lexdraft.documents.service.ocr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Document;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class TextractOcrCapability implements OcrCapability {

    private static final Logger log = LoggerFactory.getLogger(TextractOcrCapability.class);

    private final TextractClient textractClient;

    public TextractOcrCapability(TextractClient textractClient) {
        this.textractClient = textractClient;
    }

    @Override
    public List<TextBlock> detectDocumentText(byte[] bytes) {
        DetectDocumentTextRequest request = DetectDocumentTextRequest.builder()
                .document(Document.builder().bytes(SdkBytes.fromByteArray(bytes)).build())
                .build();
        DetectDocumentTextResponse response = textractClient.detectDocumentText(request);
        if (!response.hasBlocks()) {
            log.debug("Textract returned no blocks");
            return List.of();
        }
        log.debug("Textract returned {} blocks", response.blocks().size());
        return response.blocks().stream()
                .map(this::toTextBlock)
                .collect(Collectors.toUnmodifiableList());
    }

    private TextBlock toTextBlock(Block block) {
        String text = block.text() == null ? "" : block.text();
        double confidence = block.confidence() == null ? 0.0 : block.confidence();
        return new TextBlock(text, BlockKind.from(block.blockTypeAsString()), confidence);
    }
}
