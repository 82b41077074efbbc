package com.adlanda.repoindexer.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the scan endpoint. Omitted limits fall back to the
 * configured defaults.
 */
public record ScanRequest(
        @NotBlank(message = "Path is required")
        String path,

        @Min(1)
        Integer maxFiles,

        @Min(1)
        Integer maxBytesPerFile,

        Boolean incremental
) {}
