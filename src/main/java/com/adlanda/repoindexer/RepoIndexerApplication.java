package com.adlanda.repoindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Repo Indexer - Main Application
 *
 * Scans a source repository into an immutable snapshot (files, languages,
 * SLOC, git churn) and keeps a TF-IDF index of its chunks for lexical search.
 *
 * Repeated scans are incremental: files whose modification time has not
 * changed are taken from an on-disk cache instead of being read again.
 */
@SpringBootApplication
public class RepoIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RepoIndexerApplication.class, args);
    }
}
