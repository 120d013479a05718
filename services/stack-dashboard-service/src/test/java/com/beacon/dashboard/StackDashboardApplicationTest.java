package com.beacon.dashboard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.beacon.dashboard.config.DashboardProperties;
import com.beacon.observability.CounterStore;
import com.beacon.observability.InMemoryCounterStore;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Context and wiring checks. The test profile needs no PostgreSQL or Redis: connections are only
 * opened on demand.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Stack Dashboard Application")
class StackDashboardApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("Spring context loads successfully")
    void contextLoads() {
        assertThat(context).isNotNull();
    }

    @Test
    @DisplayName("Dashboard properties are loaded from test profile")
    void dashboardPropertiesAreLoaded() {
        var props = context.getBean(DashboardProperties.class);
        assertThat(props.name()).isEqualTo("stack-dashboard-test");
        assertThat(props.environment()).isEqualTo("test");
        assertThat(props.version()).isEqualTo("9.9.9");
        assertThat(props.probeTimeout()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("In-memory counter store is the default")
    void inMemoryCounterStoreIsDefault() {
        assertThat(context.getBean(CounterStore.class)).isInstanceOf(InMemoryCounterStore.class);
    }

    @Test
    @DisplayName("JDBC statements carry a query timeout")
    void jdbcTemplateHasQueryTimeout() {
        assertThat(context.getBean(JdbcTemplate.class).getQueryTimeout()).isEqualTo(5);
    }

    @Test
    @DisplayName("Actuator health endpoint is available and carries a correlation ID")
    void actuatorHealthEndpointIsAvailable() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Correlation-ID"));
    }
}
