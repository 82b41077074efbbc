package com.adlanda.repoindexer.service;

import com.adlanda.repoindexer.exception.PathNotFoundException;
import com.adlanda.repoindexer.model.FileRecord;
import com.adlanda.repoindexer.model.Language;
import com.adlanda.repoindexer.model.RepositorySnapshot;
import com.adlanda.repoindexer.model.ScanStatistics;
import com.adlanda.repoindexer.model.VcsStats;
import com.adlanda.repoindexer.repository.CacheEntry;
import com.adlanda.repoindexer.repository.CacheStore;
import com.adlanda.repoindexer.vcs.VcsMetadataCollector;
import com.adlanda.repoindexer.vcs.VcsResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Walks a repository and builds a {@link RepositorySnapshot}.
 *
 * A scan:
 * 1. Walks the tree, pruning ignored directories, and stops once maxFiles candidates are found
 * 2. Reuses cached records for files whose mtime has not changed
 * 3. Samples the changed files down to the remaining budget
 * 4. Reads and classifies the sampled files on a worker pool
 * 5. Adds git churn and last-commit times
 * 6. Writes the cache back
 *
 * Only a missing root is an error. Unreadable files, git failures and cache
 * failures degrade to missing records or zero values.
 */
@Service
public class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    private static final double MTIME_EPSILON = 1e-6;

    private static final int MAX_WORKERS = 32;

    private final PathClassifier classifier;
    private final ContentReader contentReader;
    private final FileHashService hashService;
    private final CacheStore cacheStore;
    private final VcsMetadataCollector vcs;
    private final PrioritySampler sampler;

    public RepositoryScanner(PathClassifier classifier,
                             ContentReader contentReader,
                             FileHashService hashService,
                             CacheStore cacheStore,
                             VcsMetadataCollector vcs,
                             PrioritySampler sampler) {
        this.classifier = classifier;
        this.contentReader = contentReader;
        this.hashService = hashService;
        this.cacheStore = cacheStore;
        this.vcs = vcs;
        this.sampler = sampler;
    }

    /**
     * Scans a repository.
     *
     * @param root    Repository root; resolved to an absolute path
     * @param options Per-scan limits
     * @return A new immutable snapshot
     * @throws PathNotFoundException if the root does not exist
     */
    public RepositorySnapshot scan(Path root, ScanOptions options) {
        long startTime = System.currentTimeMillis();
        Path resolved = resolve(root);
        log.info("Scanning {} (maxFiles={}, incremental={})", resolved, options.maxFiles(), options.incremental());

        boolean isRepo = vcs.isRepository(resolved);
        String head = isRepo
                ? orDefault(vcs.head(resolved), FileHashService.NO_VCS_HEAD, "HEAD of " + resolved)
                : FileHashService.NO_VCS_HEAD;
        String fingerprint = hashService.fingerprint(resolved, head);

        CacheEntry cached = options.incremental() ? cacheStore.load(fingerprint).orElse(null) : null;

        // 1. Walk
        List<ScanCandidate> candidates = collectCandidates(resolved, options.maxFiles(), isRepo);

        // 2. Partition into reusable and changed
        List<ScanCandidate> unchanged = new ArrayList<>();
        List<ScanCandidate> changed = new ArrayList<>();
        if (cached != null && !cached.mtimes().isEmpty()) {
            for (ScanCandidate candidate : candidates) {
                if (isUnchanged(candidate, cached)) {
                    unchanged.add(candidate);
                } else {
                    changed.add(candidate);
                }
            }
        } else {
            changed.addAll(candidates);
        }

        Map<String, FileRecord> files = new HashMap<>();
        for (ScanCandidate candidate : unchanged) {
            if (files.size() >= options.maxFiles()) {
                changed.clear();
                break;
            }
            files.put(candidate.relativePath(), cached.files().get(candidate.relativePath()));
        }
        int reused = files.size();

        // 3. Sample changed files down to the remaining budget
        int remaining = Math.max(0, options.maxFiles() - files.size());
        List<ScanCandidate> selected = changed.size() > remaining
                ? sampler.select(changed, remaining)
                : changed;
        int sampledOut = changed.size() - selected.size();
        if (sampledOut > 0) {
            log.info("Sampled {} of {} changed files to stay within the file budget", selected.size(), changed.size());
        }

        // 4. Reprocess
        int reprocessed = processConcurrently(selected, options, files);

        // 5. Git metadata
        VcsStats vcsStats = collectVcsStats(resolved, isRepo, files.keySet());

        // 6. Cache
        if (options.incremental()) {
            Map<String, Double> mtimes = new LinkedHashMap<>();
            candidates.forEach(c -> mtimes.put(c.relativePath(), c.mtime()));
            cacheStore.save(fingerprint, new CacheEntry(files, mtimes, resolved.toString(), head));
        }

        long durationMs = System.currentTimeMillis() - startTime;
        ScanStatistics statistics = new ScanStatistics(candidates.size(), reused, reprocessed, sampledOut, durationMs);
        RepositorySnapshot snapshot = RepositorySnapshot.of(resolved.toString(), files, vcsStats, statistics);

        log.info("Scan of {} complete: {} files, {} SLOC, languages {} ({} reused, {} reprocessed) in {}ms",
                resolved, snapshot.summary().fileCount(), snapshot.summary().slocTotal(),
                snapshot.languages(), reused, reprocessed, durationMs);
        return snapshot;
    }

    private Path resolve(Path root) {
        Path absolute = root.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new PathNotFoundException(absolute);
        }
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            log.debug("Could not resolve real path of {}: {}", absolute, e.getMessage());
            return absolute;
        }
    }

    private boolean isUnchanged(ScanCandidate candidate, CacheEntry cached) {
        Double previous = cached.mtimes().get(candidate.relativePath());
        return previous != null
                && Math.abs(previous - candidate.mtime()) < MTIME_EPSILON
                && cached.files().containsKey(candidate.relativePath());
    }

    List<ScanCandidate> collectCandidates(Path root, int maxFiles, boolean isRepo) {
        List<ScanCandidate> candidates = new ArrayList<>();
        if (maxFiles == 0 || !Files.isDirectory(root)) {
            return candidates;
        }
        boolean checkIgnored = isRepo && vcs.isGitAvailable(root);

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && classifier.isIgnoredDirectory(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String relative = root.relativize(file).toString().replace('\\', '/');
                    if (checkIgnored && isIgnored(root, relative)) {
                        return FileVisitResult.CONTINUE;
                    }
                    double mtime = attrs.lastModifiedTime().to(TimeUnit.MICROSECONDS) / 1_000_000.0;
                    candidates.add(new ScanCandidate(file, relative, mtime, attrs.size()));
                    return candidates.size() >= maxFiles ? FileVisitResult.TERMINATE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.debug("Skipping unreadable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Walk of {} stopped early: {}", root, e.getMessage());
        }
        return candidates;
    }

    private boolean isIgnored(Path root, String relativePath) {
        return orDefault(vcs.isIgnored(root, relativePath), false, "ignore check of " + relativePath);
    }

    /**
     * @return the number of records the workers produced and merged into {@code files}
     */
    private int processConcurrently(List<ScanCandidate> selected, ScanOptions options, Map<String, FileRecord> files) {
        if (selected.isEmpty()) {
            return 0;
        }
        int produced = 0;
        int workers = Math.min(Math.min(MAX_WORKERS, 2 * Runtime.getRuntime().availableProcessors()), selected.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("scan-worker-"));
        try {
            CompletionService<Optional<FileRecord>> completion = new ExecutorCompletionService<>(pool);
            for (ScanCandidate candidate : selected) {
                completion.submit(() -> processFile(candidate, options.maxBytesPerFile()));
            }
            for (int i = 0; i < selected.size() && files.size() < options.maxFiles(); i++) {
                Future<Optional<FileRecord>> future = completion.take();
                try {
                    Optional<FileRecord> record = future.get();
                    if (record.isPresent()) {
                        files.put(record.get().path(), record.get());
                        produced++;
                    }
                } catch (ExecutionException e) {
                    log.warn("Failed to process a file: {}", e.getCause().toString());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scan interrupted, keeping {} files processed so far", files.size());
        } finally {
            pool.shutdownNow();
        }
        return produced;
    }

    /**
     * Reads and classifies one file.
     *
     * @return The record, or empty when the file has no detectable language or no text
     */
    Optional<FileRecord> processFile(ScanCandidate candidate, int maxBytesPerFile) {
        String relative = candidate.relativePath();
        Optional<Language> language = classifier.classify(relative, null);
        if (language.isEmpty()) {
            language = classifier.classify(relative, contentReader.readFirstLine(candidate.path()));
        }
        if (language.isEmpty()) {
            return Optional.empty();
        }

        String text = contentReader.readText(candidate.path(), maxBytesPerFile);
        if (text.isBlank()) {
            return Optional.empty();
        }

        int sloc = (int) text.lines().filter(line -> !line.isBlank()).count();
        log.debug("Processed {} ({}, {} SLOC)", relative, language.get(), sloc);
        return Optional.of(new FileRecord(relative, language.get(), text, sloc, hashService.computeHash(text)));
    }

    private VcsStats collectVcsStats(Path root, boolean isRepo, Iterable<String> paths) {
        Map<String, Integer> churn = new TreeMap<>();
        Map<String, Long> lastModified = new TreeMap<>();
        for (String path : paths) {
            if (isRepo) {
                churn.put(path, orDefault(vcs.churn(root, path), 0, "churn of " + path));
                lastModified.put(path, orDefault(vcs.lastModified(root, path), 0L, "last commit of " + path));
            } else {
                churn.put(path, 0);
                lastModified.put(path, 0L);
            }
        }
        return new VcsStats(isRepo, churn, lastModified);
    }

    private <T> T orDefault(VcsResult<T> result, T fallback, String what) {
        if (!result.isOk()) {
            log.debug("No VCS value for {}: {}", what, result.error());
        }
        return result.orElse(fallback);
    }
}
