package com.adlanda.repoindexer.controller;

import com.adlanda.repoindexer.model.QueryRequest;
import com.adlanda.repoindexer.model.QueryResponse;
import com.adlanda.repoindexer.service.RetrievalService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for searching the chunk index.
 */
@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private final RetrievalService retrievalService;

    public QueryController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    /**
     * Search the index for chunks relevant to a question.
     *
     * @param request The query request containing the question
     * @return QueryResponse with matched chunks and metadata
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        QueryResponse response = retrievalService.query(request.question(), request.maxResults());
        return ResponseEntity.ok(response);
    }

    /**
     * Get index statistics.
     */
    @GetMapping("/sources")
    public ResponseEntity<Map<String, Object>> getSources() {
        int chunks = retrievalService.getIndexSize();
        return ResponseEntity.ok(Map.of(
                "totalChunks", chunks,
                "totalFiles", retrievalService.getFileCount(),
                "status", chunks > 0 ? "indexed" : "empty"
        ));
    }
}
