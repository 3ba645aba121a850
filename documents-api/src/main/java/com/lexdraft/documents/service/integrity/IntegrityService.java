package com.lexdraft.documents.service.integrity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content addressing and chain-of-custody helpers. Everything here is a pure function of its inputs.
 */
@Service
public class IntegrityService {

    private static final Logger log = LoggerFactory.getLogger(IntegrityService.class);

    private static final String ALGORITHM = "SHA-256";
    private static final int STREAM_BUFFER_SIZE = 8192;

    /** ISO-8601 in UTC, always with millisecond precision. */
    static final DateTimeFormatter EVIDENCE_TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final ObjectMapper canonicalMapper;

    public IntegrityService(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public String hash(byte[] bytes) {
        MessageDigest digest = newDigest();
        return toHex(digest.digest(bytes));
    }

    public String hashString(String value) {
        return hash(value.getBytes(StandardCharsets.UTF_8));
    }

    public String hashStream(InputStream inputStream) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[STREAM_BUFFER_SIZE];
        int read;
        while ((read = inputStream.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return toHex(digest.digest());
    }

    public boolean verify(byte[] bytes, String expectedHash) {
        if (expectedHash == null) {
            return false;
        }
        return hash(bytes).equals(expectedHash);
    }

    /**
     * Hashes the canonical JSON of {@code metadata}. Keys are sorted before serialization, so maps with
     * the same entries always produce the same checksum.
     */
    public String metadataChecksum(Map<String, ?> metadata) {
        return hashString(canonicalJson(metadata == null ? Map.of() : metadata));
    }

    public EvidenceRecord buildEvidenceRecord(String fileHash,
                                              String fileName,
                                              long fileSize,
                                              String uploaderId,
                                              Instant timestamp) {
        String formattedTimestamp = formatTimestamp(timestamp);
        String signature = sign(fileHash, fileName, fileSize, uploaderId, formattedTimestamp);
        log.debug("Evidence record created for file {} with hash {}", fileName, fileHash);
        return new EvidenceRecord(fileHash, fileName, fileSize, uploaderId, formattedTimestamp, signature);
    }

    public String formatTimestamp(Instant timestamp) {
        return EVIDENCE_TIMESTAMP.format(timestamp);
    }

    public boolean verifyEvidenceRecord(EvidenceRecord record) {
        if (record == null || record.signature() == null) {
            return false;
        }
        String expected = sign(record.fileHash(), record.fileName(), record.fileSize(), record.uploaderId(), record.timestamp());
        return expected.equals(record.signature());
    }

    private String sign(String fileHash, String fileName, long fileSize, String uploaderId, String timestamp) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fileHash", fileHash);
        body.put("fileName", fileName);
        body.put("fileSize", fileSize);
        body.put("uploaderId", uploaderId);
        body.put("timestamp", timestamp);
        return hashString(canonicalJson(body));
    }

    String canonicalJson(Map<String, ?> values) {
        try {
            return canonicalMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonicalize metadata", e);
        }
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private String toHex(byte[] hash) {
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
