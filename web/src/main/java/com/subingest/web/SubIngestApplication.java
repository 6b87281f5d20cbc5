/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.web;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.subingest.web")
public class SubIngestApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(SubIngestApplication.class);
        app.setRegisterShutdownHook(true); // ContextClosedEvent must fire so inputs are stopped
        app.run(args);
    }
}
