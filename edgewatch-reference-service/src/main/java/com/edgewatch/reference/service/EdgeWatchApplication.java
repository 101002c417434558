package com.edgewatch.reference.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Reference service that wires controllers + storage + core. */
@Slf4j
@SpringBootApplication(scanBasePackages = {"com.edgewatch.controller", "com.edgewatch.service"})
public class EdgeWatchApplication {

    public static void main(String[] args) {
        long maxMemory = Runtime.getRuntime().maxMemory();
        log.info("Max memory: {} ({} bytes)", formatBytes(maxMemory), maxMemory);
        SpringApplication.run(EdgeWatchApplication.class, args);
    }

    private static String formatBytes(long bytes) {
        if (bytes >= 1_073_741_824L) return String.format("%.2f GB", bytes / 1_073_741_824.0);
        if (bytes >= 1_048_576L) return String.format("%.2f MB", bytes / 1_048_576.0);
        return String.format("%d bytes", bytes);
    }
}
