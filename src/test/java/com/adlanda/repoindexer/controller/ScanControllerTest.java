package com.adlanda.repoindexer.controller;

import com.adlanda.repoindexer.config.IngestionProperties;
import com.adlanda.repoindexer.exception.PathNotFoundException;
import com.adlanda.repoindexer.graph.DependencyGraphService;
import com.adlanda.repoindexer.model.FileRecord;
import com.adlanda.repoindexer.model.Language;
import com.adlanda.repoindexer.model.RepositorySnapshot;
import com.adlanda.repoindexer.model.ScanStatistics;
import com.adlanda.repoindexer.model.VcsStats;
import com.adlanda.repoindexer.service.IngestionService;
import com.adlanda.repoindexer.service.ScanOptions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScanController.class)
@Import(IngestionProperties.class)
class ScanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IngestionService ingestionService;

    @MockBean
    private DependencyGraphService dependencyGraphService;

    private final RepositorySnapshot snapshot = RepositorySnapshot.of(
            "/work/repo",
            Map.of(
                    "a.py", new FileRecord("a.py", Language.PYTHON, "x = 1\n", 1, "h1"),
                    "b.ts", new FileRecord("b.ts", Language.TYPESCRIPT, "let y = 2;\nexport {y};\n", 2, "h2")
            ),
            new VcsStats(true, Map.of("a.py", 3, "b.ts", 1), Map.of("a.py", 10L, "b.ts", 20L)),
            new ScanStatistics(2, 1, 1, 0, 12)
    );

    @Test
    void scan_validRequest_returnsSummary() throws Exception {
        when(ingestionService.ingest(any(Path.class), any(ScanOptions.class))).thenReturn(snapshot);

        mockMvc.perform(post("/api/v1/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"path": "/work/repo", "maxFiles": 50}
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.root").value("/work/repo"))
                .andExpect(jsonPath("$.fileCount").value(2))
                .andExpect(jsonPath("$.slocTotal").value(3))
                .andExpect(jsonPath("$.languages[0]").value("python"))
                .andExpect(jsonPath("$.languages[1]").value("typescript"))
                .andExpect(jsonPath("$.isRepo").value(true))
                .andExpect(jsonPath("$.statistics.reused").value(1))
                .andExpect(jsonPath("$.files").doesNotExist());

        verify(ingestionService).ingest(eq(Path.of("/work/repo")), eq(new ScanOptions(50, 1_000_000, true)));
    }

    @Test
    void scan_missingPath_returnsNotFound() throws Exception {
        when(ingestionService.ingest(any(Path.class), any(ScanOptions.class)))
                .thenThrow(new PathNotFoundException(Path.of("/nope")));

        mockMvc.perform(post("/api/v1/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"path": "/nope"}
                            """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Path not found: /nope"))
                .andExpect(jsonPath("$.path").value("/nope"));
    }

    @Test
    void scan_blankPath_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"path": " "}
                            """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void scan_nonPositiveMaxFiles_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"path": "/work/repo", "maxFiles": 0}
                            """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void snapshot_beforeAnyScan_returnsNotFound() throws Exception {
        when(ingestionService.currentSnapshot()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/snapshot"))
                .andExpect(status().isNotFound());
    }

    @Test
    void snapshot_afterScan_returnsSummary() throws Exception {
        when(ingestionService.currentSnapshot()).thenReturn(Optional.of(snapshot));

        mockMvc.perform(get("/api/v1/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fileCount").value(2));
    }

    @Test
    void dependencies_returnsGraph() throws Exception {
        when(ingestionService.currentSnapshot()).thenReturn(Optional.of(snapshot));
        when(dependencyGraphService.build(snapshot)).thenReturn(Map.of("a.py", Set.of(), "b.ts", Set.of("a.py")));

        mockMvc.perform(get("/api/v1/dependencies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['b.ts'][0]").value("a.py"))
                .andExpect(jsonPath("$['a.py']").isEmpty());
    }
}
