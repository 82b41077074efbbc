package com.adlanda.repoindexer.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepositorySnapshotTest {

    private static FileRecord record(String path, Language language, int sloc) {
        return new FileRecord(path, language, "x\n".repeat(sloc), sloc, "h-" + path);
    }

    @Test
    void of_derivesSortedDistinctLanguagesAndSummary() {
        Map<String, FileRecord> files = Map.of(
                "b.ts", record("b.ts", Language.TYPESCRIPT, 4),
                "a.py", record("a.py", Language.PYTHON, 10),
                "c.py", record("c.py", Language.PYTHON, 6)
        );

        RepositorySnapshot snapshot = RepositorySnapshot.of("/repo", files,
                new VcsStats(false, Map.of(), Map.of()), ScanStatistics.empty());

        assertThat(snapshot.languages()).containsExactly(Language.PYTHON, Language.TYPESCRIPT);
        assertThat(snapshot.summary().fileCount()).isEqualTo(3);
        assertThat(snapshot.summary().slocTotal()).isEqualTo(20);
    }

    @Test
    void of_copiesFiles() {
        Map<String, FileRecord> files = new HashMap<>();
        files.put("a.py", record("a.py", Language.PYTHON, 1));

        RepositorySnapshot snapshot = RepositorySnapshot.of("/repo", files,
                new VcsStats(false, Map.of(), Map.of()), ScanStatistics.empty());
        files.put("b.py", record("b.py", Language.PYTHON, 1));

        assertThat(snapshot.files()).containsOnlyKeys("a.py");
        assertThatThrownBy(() -> snapshot.files().put("c.py", record("c.py", Language.PYTHON, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void constructor_nullDerivedFields_areComputedFromFiles() {
        RepositorySnapshot snapshot = new RepositorySnapshot("/repo",
                Map.of("a.ts", record("a.ts", Language.TYPESCRIPT, 3)),
                null, new VcsStats(false, Map.of(), Map.of()), null, ScanStatistics.empty());

        assertThat(snapshot.languages()).containsExactly(Language.TYPESCRIPT);
        assertThat(snapshot.summary()).isEqualTo(new RepositorySnapshot.Summary(1, 3));
    }

    @Test
    void constructor_mismatchedSummary_isRejected() {
        Map<String, FileRecord> files = Map.of("a.py", record("a.py", Language.PYTHON, 2));

        assertThatThrownBy(() -> new RepositorySnapshot("/repo", files, List.of(Language.PYTHON),
                new VcsStats(false, Map.of(), Map.of()), new RepositorySnapshot.Summary(5, 2), ScanStatistics.empty()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("summary");
    }

    @Test
    void constructor_mismatchedLanguages_isRejected() {
        Map<String, FileRecord> files = Map.of("a.py", record("a.py", Language.PYTHON, 2));

        assertThatThrownBy(() -> new RepositorySnapshot("/repo", files, List.of(Language.JAVASCRIPT),
                new VcsStats(false, Map.of(), Map.of()), new RepositorySnapshot.Summary(1, 2), ScanStatistics.empty()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("languages");
    }

    @Test
    void scanSummary_omitsFileContents() {
        RepositorySnapshot snapshot = RepositorySnapshot.of("/repo",
                Map.of("a.py", record("a.py", Language.PYTHON, 2)),
                new VcsStats(true, Map.of("a.py", 5), Map.of("a.py", 100L)),
                new ScanStatistics(1, 0, 1, 0, 3));

        ScanSummary summary = ScanSummary.from(snapshot);

        assertThat(summary.root()).isEqualTo("/repo");
        assertThat(summary.fileCount()).isEqualTo(1);
        assertThat(summary.slocTotal()).isEqualTo(2);
        assertThat(summary.languages()).containsExactly("python");
        assertThat(summary.isRepo()).isTrue();
    }
}
