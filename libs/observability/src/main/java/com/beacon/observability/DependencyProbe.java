package com.beacon.observability;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one liveness check plus metadata query against a {@link DependencyClient}.
 * <p>
 * The probe never throws past its own boundary: any exception raised by the client, whether a
 * network error, an authentication failure, a driver timeout or a malformed reply, is turned
 * into an unreachable {@link DependencyCheck} carrying the cause description. Metadata is only
 * reported when both operations succeed.
 * <p>
 * Stateless and thread-safe.
 */
public final class DependencyProbe {

    private static final Logger log = LoggerFactory.getLogger(DependencyProbe.class);

    /**
     * Probes the given dependency.
     *
     * @param client the dependency to probe
     * @return the check outcome, never {@code null}
     */
    public DependencyCheck probe(DependencyClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        String name = client.name();
        try {
            client.checkLiveness();
            Map<String, String> metadata = client.queryMetadata();
            log.debug("Dependency {} reachable", name);
            return DependencyCheck.reachable(name, metadata);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Probe of {} interrupted", name);
            return DependencyCheck.unreachable(name, "Probe interrupted");
        } catch (Exception e) {
            String cause = describe(e);
            log.warn("Dependency {} unreachable: {}", name, cause);
            return DependencyCheck.unreachable(name, cause);
        }
    }

    /**
     * Returns the most specific non-blank message in the cause chain, falling back to the
     * exception's simple class name.
     */
    static String describe(Throwable error) {
        Throwable current = error;
        String message = null;
        while (current != null) {
            if (current.getMessage() != null && !current.getMessage().isBlank()) {
                message = current.getMessage();
                break;
            }
            current = current.getCause();
        }
        return message != null ? message : error.getClass().getSimpleName();
    }
}
