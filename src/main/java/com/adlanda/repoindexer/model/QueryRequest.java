package com.adlanda.repoindexer.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Request body for the query endpoint.
 */
public record QueryRequest(
        @NotBlank(message = "Question is required")
        String question,

        @Min(1) @Max(50)
        Integer maxResults
) {
    public QueryRequest {
        if (maxResults == null) {
            maxResults = 5;
        }
    }
}
