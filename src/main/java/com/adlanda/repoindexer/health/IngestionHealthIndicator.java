package com.adlanda.repoindexer.health;

import com.adlanda.repoindexer.service.IngestionService.IngestionSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for repository ingestion.
 *
 * Reports the outcome of the last scan: the repository, file and SLOC counts,
 * how many records came from the cache, chunks indexed, and the error if the
 * scan failed.
 */
@Component
public class IngestionHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(false, null, "Ingestion not yet run", null)
    );

    /**
     * Marks the ingestion as healthy with the given summary.
     */
    public void markHealthy(IngestionSummary summary) {
        state.set(new HealthState(true, summary, null, Instant.now()));
    }

    /**
     * Marks the ingestion as unhealthy with the given error message.
     */
    public void markUnhealthy(String error) {
        state.set(new HealthState(false, null, error, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.healthy()) {
            Health.Builder builder = Health.up()
                    .withDetail("lastRun", current.timestamp() != null ? current.timestamp().toString() : "never");

            if (current.summary() != null) {
                builder.withDetail("root", current.summary().root())
                       .withDetail("files", current.summary().fileCount())
                       .withDetail("sloc", current.summary().slocTotal())
                       .withDetail("filesReused", current.summary().reusedFiles())
                       .withDetail("filesProcessed", current.summary().processedFiles())
                       .withDetail("chunksIndexed", current.summary().totalChunks());
            }

            return builder.build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastAttempt", current.timestamp() != null ? current.timestamp().toString() : "never")
                .build();
    }

    private record HealthState(
            boolean healthy,
            IngestionSummary summary,
            String error,
            Instant timestamp
    ) {}
}
