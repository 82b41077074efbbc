package com.adlanda.repoindexer.service;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrioritySamplerTest {

    private final PrioritySampler sampler = new PrioritySampler();

    private static ScanCandidate candidate(String path, double mtime, long size) {
        return new ScanCandidate(Path.of("/repo").resolve(path), path, mtime, size);
    }

    @Test
    void select_underLimit_returnsAll() {
        List<ScanCandidate> candidates = List.of(candidate("a.py", 1, 1), candidate("b.py", 2, 2));

        assertThat(sampler.select(candidates, 5)).containsExactlyElementsOf(candidates);
    }

    @Test
    void select_zeroLimit_returnsEmpty() {
        assertThat(sampler.select(List.of(candidate("a.py", 1, 1)), 0)).isEmpty();
    }

    @Test
    void select_neverExceedsLimitAndHasNoDuplicates() {
        List<ScanCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            candidates.add(candidate("pkg/file" + i + ".py", i, 100 - i));
        }

        List<ScanCandidate> selected = sampler.select(candidates, 10);

        assertThat(selected).hasSize(10).doesNotHaveDuplicates();
    }

    @Test
    void select_prefersCoreThenRecentThenHeavy() {
        List<ScanCandidate> candidates = List.of(
                candidate("src/service/core.py", 1, 10),   // core
                candidate("scripts/new.py", 100, 10),      // recent
                candidate("scripts/big.py", 2, 10_000),    // heavy
                candidate("scripts/old.py", 3, 20),
                candidate("scripts/older.py", 0, 5)
        );

        List<ScanCandidate> selected = sampler.select(candidates, 3);

        assertThat(selected).extracting(ScanCandidate::relativePath)
                .containsExactly("src/service/core.py", "scripts/new.py", "scripts/big.py");
    }

    @Test
    void coreScore_countsSourceDirectoriesAndKeywords() {
        assertThat(PrioritySampler.coreScore("src/app/main.py")).isEqualTo(3 + 3 + 1);
        assertThat(PrioritySampler.coreScore("docs/readme.py")).isZero();
        // a file named like a source directory is not a directory
        assertThat(PrioritySampler.coreScore("src.py")).isZero();
    }
}
