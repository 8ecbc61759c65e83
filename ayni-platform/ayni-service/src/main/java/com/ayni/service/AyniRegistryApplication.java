package com.ayni.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Ayni Identity Registry host.
 *
 * Rebuilds the registry from its journal on startup and keeps the audit chain under watch.
 */
@SpringBootApplication(scanBasePackages = "com.ayni.service")
@ConfigurationPropertiesScan(basePackages = "com.ayni.service")
@EnableScheduling
public class AyniRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(AyniRegistryApplication.class, args);
    }
}
