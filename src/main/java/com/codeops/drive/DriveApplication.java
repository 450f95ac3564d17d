package com.codeops.drive;

import com.codeops.drive.config.JwtProperties;
import com.codeops.drive.config.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * CodeOps-Drive application entry point. Hierarchical file storage with folder trees,
 * per-item sharing and expiring public download links.
 */
@SpringBootApplication
@EnableConfigurationProperties({JwtProperties.class, StorageProperties.class})
public class DriveApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriveApplication.class, args);
    }
}
