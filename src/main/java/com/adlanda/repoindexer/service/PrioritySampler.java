package com.adlanda.repoindexer.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Chooses which changed files to reprocess when there are more than the
 * remaining budget allows.
 *
 * The budget is split into three tiers: core (about half: files under source
 * directories or with core-sounding names), recent (about a third: newest
 * mtime) and heavy (the rest: largest files). A file picked by one tier is not
 * picked again, and whatever a tier cannot fill is topped up from the recent
 * ordering.
 */
@Component
public class PrioritySampler {

    private static final double CORE_SHARE = 0.5;
    private static final double RECENT_SHARE = 0.3;

    private static final Set<String> SOURCE_DIRS = Set.of("src", "app", "lib");
    private static final List<String> CORE_KEYWORDS = List.of("core", "main", "service", "api", "model");

    public List<ScanCandidate> select(List<ScanCandidate> candidates, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        if (candidates.size() <= limit) {
            return List.copyOf(candidates);
        }

        int coreQuota = Math.max(1, (int) (limit * CORE_SHARE));
        int recentQuota = Math.max(1, (int) (limit * RECENT_SHARE));
        int heavyQuota = Math.max(1, limit - coreQuota - recentQuota);

        Comparator<ScanCandidate> newestFirst = Comparator.comparingDouble(ScanCandidate::mtime).reversed();

        List<ScanCandidate> core = candidates.stream()
                .sorted(Comparator.comparingInt((ScanCandidate c) -> coreScore(c.relativePath())).reversed()
                        .thenComparing(newestFirst))
                .toList();
        List<ScanCandidate> recent = candidates.stream().sorted(newestFirst).toList();
        List<ScanCandidate> heavy = candidates.stream()
                .sorted(Comparator.comparingLong(ScanCandidate::size).reversed())
                .toList();

        List<ScanCandidate> selected = new ArrayList<>(limit);
        Set<String> seen = new HashSet<>();
        take(core, coreQuota, limit, selected, seen);
        take(recent, recentQuota, limit, selected, seen);
        take(heavy, heavyQuota, limit, selected, seen);
        take(recent, limit - selected.size(), limit, selected, seen);
        return selected;
    }

    private void take(List<ScanCandidate> ordered, int quota, int limit,
                      List<ScanCandidate> selected, Set<String> seen) {
        int taken = 0;
        for (ScanCandidate candidate : ordered) {
            if (taken >= quota || selected.size() >= limit) {
                return;
            }
            if (seen.add(candidate.relativePath())) {
                selected.add(candidate);
                taken++;
            }
        }
    }

    /**
     * +3 for every src/app/lib directory on the path, +1 for every core keyword
     * contained in it.
     */
    static int coreScore(String relativePath) {
        String lower = relativePath.toLowerCase(Locale.ROOT);
        String[] segments = lower.split("[/\\\\]");
        int score = 0;
        for (int i = 0; i < segments.length - 1; i++) {
            if (SOURCE_DIRS.contains(segments[i])) {
                score += 3;
            }
        }
        for (String keyword : CORE_KEYWORDS) {
            if (lower.contains(keyword)) {
                score += 1;
            }
        }
        return score;
    }
}
