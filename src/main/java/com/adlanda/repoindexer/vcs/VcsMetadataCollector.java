package com.adlanda.repoindexer.vcs;

import com.adlanda.repoindexer.config.VcsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Queries git for per-file churn, last-commit time, HEAD and ignore rules.
 *
 * Every query is time-boxed and returns a {@link VcsResult}; nothing here
 * retries. These are advisory signals, so callers turn failures into defaults.
 */
@Service
public class VcsMetadataCollector {

    private static final Logger log = LoggerFactory.getLogger(VcsMetadataCollector.class);

    private final VcsCommandRunner runner;
    private final VcsProperties properties;

    private volatile Boolean gitAvailable;

    public VcsMetadataCollector(VcsCommandRunner runner, VcsProperties properties) {
        this.runner = runner;
        this.properties = properties;
    }

    /**
     * A root counts as a repository when it contains a .git entry.
     */
    public boolean isRepository(Path root) {
        return Files.exists(root.resolve(".git"));
    }

    /**
     * Whether the git executable can be run at all. Checked once, then remembered.
     */
    public boolean isGitAvailable(Path workingDir) {
        Boolean available = gitAvailable;
        if (available == null) {
            VcsResult<CommandOutput> version = runner.run(workingDir, List.of("--version"), properties.getHeadTimeout());
            available = version.isOk() && version.value().succeeded();
            if (!available) {
                log.info("git is not available, VCS metadata disabled: {}", version.isOk() ? "non-zero exit" : version.error());
            }
            gitAvailable = available;
        }
        return available;
    }

    /**
     * The commit id HEAD points to.
     */
    public VcsResult<String> head(Path root) {
        VcsResult<String> output = query(root, List.of("rev-parse", "HEAD"), properties.getHeadTimeout())
                .map(String::trim);
        if (output.isOk() && output.value().isEmpty()) {
            return VcsResult.failure(VcsError.Kind.COMMAND_FAILED, "Empty HEAD for " + root);
        }
        return output;
    }

    /**
     * Whether git's ignore rules exclude the given path.
     */
    public VcsResult<Boolean> isIgnored(Path root, String relativePath) {
        VcsError unusable = checkUsable(root);
        if (unusable != null) {
            return VcsResult.failure(unusable);
        }
        VcsResult<CommandOutput> output = runner.run(root, List.of("check-ignore", "-q", relativePath),
                properties.getIgnoreTimeout());
        if (output.isOk() && output.value().exitCode() > 1) {
            return VcsResult.failure(VcsError.Kind.COMMAND_FAILED,
                    "git check-ignore exited with " + output.value().exitCode());
        }
        // 0 when ignored, 1 when not
        return output.map(o -> o.exitCode() == 0);
    }

    /**
     * Number of commits touching the file, following renames.
     */
    public VcsResult<Integer> churn(Path root, String relativePath) {
        return query(root, List.of("log", "--follow", "--oneline", "--", relativePath), properties.getChurnTimeout())
                .map(out -> (int) out.lines().filter(line -> !line.isBlank()).count());
    }

    /**
     * Unix seconds of the last commit touching the file.
     */
    public VcsResult<Long> lastModified(Path root, String relativePath) {
        VcsResult<String> output = query(root, List.of("log", "-1", "--format=%ct", "--", relativePath),
                properties.getLastModifiedTimeout()).map(String::trim);
        if (!output.isOk()) {
            return VcsResult.failure(output.error());
        }
        String value = output.value();
        if (value.isEmpty() || !value.chars().allMatch(Character::isDigit)) {
            return VcsResult.failure(VcsError.Kind.COMMAND_FAILED, "No commit time for " + relativePath);
        }
        return VcsResult.ok(Long.parseLong(value));
    }

    private VcsResult<String> query(Path root, List<String> args, Duration timeout) {
        VcsError unusable = checkUsable(root);
        if (unusable != null) {
            return VcsResult.failure(unusable);
        }
        VcsResult<CommandOutput> output = runner.run(root, args, timeout);
        if (!output.isOk()) {
            return VcsResult.failure(output.error());
        }
        if (!output.value().succeeded()) {
            return VcsResult.failure(VcsError.Kind.COMMAND_FAILED,
                    "git " + String.join(" ", args) + " exited with " + output.value().exitCode());
        }
        return VcsResult.ok(output.value().stdout());
    }

    /**
     * @return why git cannot be queried for this root, or null when it can
     */
    private VcsError checkUsable(Path root) {
        if (!isRepository(root)) {
            return VcsError.of(VcsError.Kind.NOT_A_REPOSITORY, root + " is not a git repository");
        }
        if (!isGitAvailable(root)) {
            return VcsError.of(VcsError.Kind.UNAVAILABLE, "git executable not available");
        }
        return null;
    }
}
