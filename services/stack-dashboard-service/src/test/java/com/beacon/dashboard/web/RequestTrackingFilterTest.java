package com.beacon.dashboard.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.beacon.dashboard.service.TrafficCounters;
import com.beacon.database.RequestLogEntry;
import com.beacon.database.RequestLogRepository;
import com.beacon.observability.CounterName;
import com.beacon.observability.InMemoryCounterStore;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
@DisplayName("RequestTrackingFilter")
class RequestTrackingFilterTest {

    @Mock private RequestLogRepository requestLog;

    private InMemoryCounterStore store;
    private RequestTrackingFilter filter;

    @BeforeEach
    void setUp() {
        store = new InMemoryCounterStore();
        filter = new RequestTrackingFilter(new TrafficCounters(store), requestLog);
    }

    @Test
    @DisplayName("counts the request and logs it with caller details")
    void countsAndLogsRequest() throws Exception {
        var request = new MockHttpServletRequest("GET", "/api/stats");
        request.setRemoteAddr("172.18.0.5");
        request.addHeader("User-Agent", "curl/8.4.0");

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(store.get(CounterName.REQUESTS)).isEqualTo(1);
        verify(requestLog).record(new RequestLogEntry("/api/stats", "172.18.0.5", "curl/8.4.0"));
    }

    @Test
    @DisplayName("does not count actuator requests")
    void skipsActuator() throws Exception {
        var request = new MockHttpServletRequest("GET", "/actuator/prometheus");

        filter.doFilter(request, new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(store.get(CounterName.REQUESTS)).isZero();
        verify(requestLog, never()).record(any());
    }

    @Test
    @DisplayName("continues the chain when the request log cannot be written")
    void continuesWhenLogFails() throws Exception {
        doThrow(new DataAccessResourceFailureException("Connection refused"))
                .when(requestLog).record(any(RequestLogEntry.class));
        AtomicBoolean chained = new AtomicBoolean();
        FilterChain chain = (req, resp) -> chained.set(true);

        filter.doFilter(new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), chain);

        assertThat(chained).isTrue();
        assertThat(store.get(CounterName.REQUESTS)).isEqualTo(1);
    }
}
