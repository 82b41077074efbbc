package com.adlanda.repoindexer;

import com.adlanda.repoindexer.repository.InMemorySnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after ScanRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final InMemorySnapshotStore snapshotStore;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(InMemorySnapshotStore snapshotStore) {
        this.snapshotStore = snapshotStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        String repository = snapshotStore.snapshot().map(s -> s.root()).orElse("none");
        log.info("""

            Repo Indexer v{}
            Repository: {}
            Index: {} chunks

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/scan
              POST http://localhost:{}/api/v1/query
              GET  http://localhost:{}/api/v1/dependencies

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, repository, snapshotStore.size(), port, port, port, port, port
        );
    }
}
