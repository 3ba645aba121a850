package com.lexdraft.documents.config;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.textract.TextractClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AwsConfigTest {

    private final AwsConfig config = new AwsConfig();

    @Test
    void textractCallsAreBoundedByTheOcrTimeout() {
        try (TextractClient client = config.textractClient("us-east-1", 7)) {
            assertThat(client.serviceClientConfiguration().overrideConfiguration().apiCallTimeout())
                    .contains(Duration.ofSeconds(7));
        }
    }
}
