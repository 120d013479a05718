package com.beacon.dashboard.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DashboardProperties")
class DashboardPropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new DashboardProperties(
                "stack-dashboard", "production", "2.0.0", "redis", Duration.ofSeconds(3), 5, false);

        assertThat(props.name()).isEqualTo("stack-dashboard");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.version()).isEqualTo("2.0.0");
        assertThat(props.counterStore()).isEqualTo("redis");
        assertThat(props.probeTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(props.validationTimeoutSeconds()).isEqualTo(5);
        assertThat(props.migrateOnStartup()).isFalse();
    }

    @Test
    @DisplayName("applies defaults for missing values")
    void appliesDefaults() {
        var props = new DashboardProperties("stack-dashboard", null, " ", null, null, null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.version()).isEqualTo("1.0.0");
        assertThat(props.counterStore()).isEqualTo("memory");
        assertThat(props.probeTimeout()).isEqualTo(Duration.ofMillis(5000));
        assertThat(props.validationTimeoutSeconds()).isEqualTo(2);
        assertThat(props.migrateOnStartup()).isTrue();
    }

    @Test
    @DisplayName("replaces a non-positive probe timeout with the default")
    void replacesNonPositiveTimeout() {
        var props = new DashboardProperties("stack-dashboard", null, null, null, Duration.ZERO, 0, null);

        assertThat(props.probeTimeout()).isEqualTo(Duration.ofMillis(5000));
        assertThat(props.validationTimeoutSeconds()).isEqualTo(2);
    }
}
