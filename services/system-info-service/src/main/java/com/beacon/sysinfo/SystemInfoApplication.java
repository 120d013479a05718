package com.beacon.sysinfo;

import com.beacon.sysinfo.config.SystemInfoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Single-container application that reports the host and runtime it runs on.
 */
@SpringBootApplication
@EnableConfigurationProperties(SystemInfoProperties.class)
public class SystemInfoApplication {

    private static final Logger log = LoggerFactory.getLogger(SystemInfoApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SystemInfoApplication.class, args);
        log.info("System info service started successfully");
    }
}
