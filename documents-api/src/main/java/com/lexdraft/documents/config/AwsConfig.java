package com.lexdraft.documents.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.textract.TextractClient;

import java.time.Duration;

@Configuration
public class AwsConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(@Value("${documents.aws.region:us-east-1}") String region) {
        return S3Client.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * The SDK call timeout matches the OCR wait timeout, so an abandoned call also frees its
     * {@code ocrExecutor} thread.
     */
    @Bean(destroyMethod = "close")
    public TextractClient textractClient(@Value("${documents.aws.region:us-east-1}") String region,
                                         @Value("${documents.ocr.timeout-seconds:60}") long timeoutSeconds) {
        return TextractClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofSeconds(timeoutSeconds))
                        .build())
                .build();
    }
}
