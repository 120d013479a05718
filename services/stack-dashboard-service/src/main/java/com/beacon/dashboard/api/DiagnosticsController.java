package com.beacon.dashboard.api;

import com.beacon.cache.RedisExerciseClient;
import com.beacon.dashboard.service.StackHealthService;
import com.beacon.database.PostgresExerciseClient;
import com.beacon.observability.DependencyCheck;
import com.beacon.observability.DependencyClient;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * On-demand exercises of PostgreSQL and Redis.
 *
 * <p>Both endpoints answer 200. A successful exercise returns {@code status: success} and the
 * facts it gathered; a failed one returns {@code status: error} and the reason.
 */
@RestController
@RequestMapping("/api")
public class DiagnosticsController {

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_ERROR = "error";

    private static final Set<String> NUMERIC_FIELDS = Set.of("total_requests", "total_keys");

    private final StackHealthService healthService;
    private final PostgresExerciseClient databaseExercise;
    private final RedisExerciseClient cacheExercise;
    private final Clock clock;

    public DiagnosticsController(
            StackHealthService healthService,
            PostgresExerciseClient databaseExercise,
            RedisExerciseClient cacheExercise,
            Clock clock) {
        this.healthService = healthService;
        this.databaseExercise = databaseExercise;
        this.cacheExercise = cacheExercise;
        this.clock = clock;
    }

    @GetMapping("/test-db")
    public Map<String, Object> testDatabase() {
        return exercise(databaseExercise);
    }

    @GetMapping("/test-cache")
    public Map<String, Object> testCache() {
        return exercise(cacheExercise);
    }

    private Map<String, Object> exercise(DependencyClient client) {
        DependencyCheck check = healthService.exercise(client);
        Map<String, Object> body = new LinkedHashMap<>();
        if (check.reachable()) {
            body.put("status", STATUS_SUCCESS);
            check.detail().forEach((key, value) -> body.put(key, typed(key, value)));
        } else {
            body.put("status", STATUS_ERROR);
            body.put("message", check.error());
        }
        body.put("timestamp", Instant.now(clock).toString());
        return body;
    }

    private static Object typed(String key, String value) {
        if (NUMERIC_FIELDS.contains(key)) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                return value;
            }
        }
        return value;
    }
}
