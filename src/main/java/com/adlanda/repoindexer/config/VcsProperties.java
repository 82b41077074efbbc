package com.adlanda.repoindexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for git metadata collection.
 *
 * Maps to properties prefixed with 'indexer.vcs' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "indexer.vcs")
public class VcsProperties {

    /**
     * The git executable, resolved against PATH when not absolute.
     */
    private String executable = "git";

    private Duration headTimeout = Duration.ofSeconds(5);

    private Duration churnTimeout = Duration.ofSeconds(10);

    private Duration lastModifiedTimeout = Duration.ofSeconds(5);

    private Duration ignoreTimeout = Duration.ofSeconds(5);

    public String getExecutable() {
        return executable;
    }

    public void setExecutable(String executable) {
        this.executable = executable;
    }

    public Duration getHeadTimeout() {
        return headTimeout;
    }

    public void setHeadTimeout(Duration headTimeout) {
        this.headTimeout = headTimeout;
    }

    public Duration getChurnTimeout() {
        return churnTimeout;
    }

    public void setChurnTimeout(Duration churnTimeout) {
        this.churnTimeout = churnTimeout;
    }

    public Duration getLastModifiedTimeout() {
        return lastModifiedTimeout;
    }

    public void setLastModifiedTimeout(Duration lastModifiedTimeout) {
        this.lastModifiedTimeout = lastModifiedTimeout;
    }

    public Duration getIgnoreTimeout() {
        return ignoreTimeout;
    }

    public void setIgnoreTimeout(Duration ignoreTimeout) {
        this.ignoreTimeout = ignoreTimeout;
    }
}
