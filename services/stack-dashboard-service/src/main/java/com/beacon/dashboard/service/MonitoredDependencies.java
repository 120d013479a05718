package com.beacon.dashboard.service;

import com.beacon.observability.DependencyClient;
import java.util.List;

/**
 * The dependencies the dashboard reports on, in display order.
 *
 * <p>Kept as its own type so on-demand exercise clients, which are also {@link DependencyClient}s,
 * never end up in the health report.
 */
public record MonitoredDependencies(List<DependencyClient> clients) {

    public MonitoredDependencies {
        if (clients == null) {
            throw new IllegalArgumentException("clients must not be null");
        }
        clients = List.copyOf(clients);
    }
}
