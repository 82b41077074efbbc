package com.adlanda.repoindexer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Source languages recognised by the ingestion pipeline.
 *
 * The extension lists below are the single source of truth for
 * extension to language mapping.
 */
public enum Language {

    PYTHON("python", List.of(".py", ".pyw")),
    JAVASCRIPT("javascript", List.of(".js", ".mjs", ".cjs")),
    TYPESCRIPT("typescript", List.of(".ts", ".tsx"));

    private static final Map<String, Language> BY_EXTENSION = Arrays.stream(values())
            .flatMap(language -> language.extensions.stream().map(ext -> Map.entry(ext, language)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private static final Map<String, Language> BY_ID = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Language::id, Function.identity()));

    private final String id;
    private final List<String> extensions;

    Language(String id, List<String> extensions) {
        this.id = id;
        this.extensions = extensions;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Looks up a language by file extension, including the leading dot.
     */
    public static Optional<Language> fromExtension(String extension) {
        if (extension == null || extension.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_EXTENSION.get(extension.toLowerCase(Locale.ROOT)));
    }

    @JsonCreator
    public static Language fromId(String id) {
        Language language = BY_ID.get(id);
        if (language == null) {
            throw new IllegalArgumentException("Unknown language: " + id);
        }
        return language;
    }

    @Override
    public String toString() {
        return id;
    }
}
