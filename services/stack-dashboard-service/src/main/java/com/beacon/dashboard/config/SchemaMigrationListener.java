package com.beacon.dashboard.config;

import com.beacon.database.SchemaMigrator;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Applies the request-log schema once the application is ready to serve, so a database that is
 * down at startup delays nothing.
 */
@Component
public class SchemaMigrationListener {

    private final SchemaMigrator migrator;
    private final DashboardProperties properties;

    public SchemaMigrationListener(SchemaMigrator migrator, DashboardProperties properties) {
        this.migrator = migrator;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void migrate() {
        if (properties.migrateOnStartup()) {
            migrator.migrate();
        }
    }
}
