package com.adlanda.repoindexer.model;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Immutable, point-in-time result of ingesting a repository.
 *
 * {@code languages} and {@code summary} are always derived from {@code files}.
 * Passing {@code null} for either derives it; passing a value that disagrees
 * with {@code files} is rejected. {@link #of} is the usual way to build one.
 *
 * @param root       Absolute path of the scanned repository
 * @param files      Relative path to file record
 * @param languages  Distinct languages of {@code files}, sorted by id
 * @param vcs        Version-control metadata keyed by the same paths
 * @param summary    File count and total SLOC
 * @param statistics Scan diagnostics
 */
public record RepositorySnapshot(
        String root,
        Map<String, FileRecord> files,
        List<Language> languages,
        VcsStats vcs,
        Summary summary,
        ScanStatistics statistics
) {
    public RepositorySnapshot {
        files = Map.copyOf(files);
        List<Language> derivedLanguages = languagesOf(files.values());
        Summary derivedSummary = Summary.of(files.values());
        if (languages != null && !derivedLanguages.equals(languages)) {
            throw new IllegalArgumentException("languages " + languages + " do not match files " + derivedLanguages);
        }
        if (summary != null && !derivedSummary.equals(summary)) {
            throw new IllegalArgumentException("summary " + summary + " does not match files " + derivedSummary);
        }
        languages = derivedLanguages;
        summary = derivedSummary;
    }

    public static RepositorySnapshot of(String root,
                                        Map<String, FileRecord> files,
                                        VcsStats vcs,
                                        ScanStatistics statistics) {
        return new RepositorySnapshot(
                root,
                files,
                null,
                vcs,
                null,
                statistics
        );
    }

    private static List<Language> languagesOf(Collection<FileRecord> records) {
        return records.stream()
                .map(FileRecord::language)
                .distinct()
                .sorted(Comparator.comparing(Language::id))
                .toList();
    }

    /**
     * Read-only counts shown to operators.
     */
    public record Summary(int fileCount, long slocTotal) {
        static Summary of(Collection<FileRecord> records) {
            long sloc = records.stream().mapToLong(FileRecord::sloc).sum();
            return new Summary(records.size(), sloc);
        }
    }
}
