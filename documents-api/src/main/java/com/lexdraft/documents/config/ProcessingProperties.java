package com.lexdraft.documents.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "documents.processing")
public class ProcessingProperties {

    /**
     * Threads kept alive for background document processing.
     */
    private int corePoolSize = 2;

    private int maxPoolSize = 4;

    /**
     * Documents waiting for a processing thread before submissions are rejected.
     */
    private int queueCapacity = 100;

    /**
     * Threads available for outbound OCR calls; each call holds a thread until it returns or times out.
     */
    private int ocrPoolSize = 4;

    /**
     * OCR calls waiting for a thread. A full queue fails the call immediately instead of letting it
     * time out unseen.
     */
    private int ocrQueueCapacity = 20;

    public int getCorePoolSize() {
        return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
        this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getOcrPoolSize() {
        return ocrPoolSize;
    }

    public void setOcrPoolSize(int ocrPoolSize) {
        this.ocrPoolSize = ocrPoolSize;
    }

    public int getOcrQueueCapacity() {
        return ocrQueueCapacity;
    }

    public void setOcrQueueCapacity(int ocrQueueCapacity) {
        this.ocrQueueCapacity = ocrQueueCapacity;
    }
}
