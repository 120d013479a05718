package com.beacon.dashboard;

import com.beacon.dashboard.config.DashboardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Stack dashboard: a web application reporting on its PostgreSQL and Redis dependencies.
 *
 * <p>Serves an HTML dashboard on {@code /}, a health document on {@code /health} that is always
 * answered with 200, and on-demand diagnostics under {@code /api}. A dependency that is down shows
 * up as DEGRADED, never as a failed request.
 */
@SpringBootApplication
@EnableConfigurationProperties(DashboardProperties.class)
public class StackDashboardApplication {

    private static final Logger log = LoggerFactory.getLogger(StackDashboardApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(StackDashboardApplication.class, args);
        log.info("Stack dashboard started successfully");
    }
}
