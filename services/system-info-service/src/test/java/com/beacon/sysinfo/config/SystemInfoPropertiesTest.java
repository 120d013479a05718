package com.beacon.sysinfo.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

@DisplayName("SystemInfoProperties")
class SystemInfoPropertiesTest {

    @Test
    @DisplayName("defaults environment and version when missing")
    void appliesDefaults() {
        var props = new SystemInfoProperties(null, "", false);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.version()).isEqualTo("1.0.0");
        assertThat(props.debug()).isFalse();
    }

    @Test
    @DisplayName("keeps provided values")
    void keepsValues() {
        var props = new SystemInfoProperties("staging", "3.1.0", true);

        assertThat(props.environment()).isEqualTo("staging");
        assertThat(props.version()).isEqualTo("3.1.0");
        assertThat(props.debug()).isTrue();
    }

    @Test
    @DisplayName("binds from environment labels alone")
    void bindsWithoutServiceName() {
        var source = new MapConfigurationPropertySource(Map.of(
                "beacon.system-info.environment", "qa",
                "beacon.system-info.debug", "true"));

        var props = new Binder(source).bind("beacon.system-info", SystemInfoProperties.class).get();

        assertThat(props.environment()).isEqualTo("qa");
        assertThat(props.version()).isEqualTo("1.0.0");
        assertThat(props.debug()).isTrue();
    }
}
