package com.codeops.drive.config;

import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the S3 client when the {@code s3} blob provider is selected. Credentials come
 * from the default AWS provider chain (environment, profile, or instance role).
 */
@Configuration
@ConditionalOnProperty(prefix = "codeops.storage", name = "provider", havingValue = "s3")
public class S3Config {

    @Bean
    public AmazonS3 amazonS3(StorageProperties storageProperties) {
        if (storageProperties.getBucket() == null || storageProperties.getBucket().isBlank()) {
            throw new IllegalStateException("codeops.storage.bucket must be set when provider is s3");
        }
        return AmazonS3ClientBuilder.standard()
                .withRegion(storageProperties.getRegion())
                .build();
    }
}
