package com.adlanda.repoindexer.service;

import com.adlanda.repoindexer.model.Language;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which directories are pruned from a walk and which language a file is.
 */
@Component
public class PathClassifier {

    /**
     * VCS metadata, dependency, build and virtualenv directories. Pruned during
     * the walk so their subtrees are never visited.
     */
    public static final Set<String> IGNORED_DIR_NAMES = Set.of(
            ".git",
            ".hg",
            ".svn",
            "node_modules",
            "dist",
            "build",
            "out",
            "__pycache__",
            ".venv",
            "venv"
    );

    public boolean isIgnoredDirectory(String directoryName) {
        return IGNORED_DIR_NAMES.contains(directoryName);
    }

    /**
     * Detects the language of a file from its extension, falling back to a
     * shebang on the first line.
     *
     * @param path      File path or name; only the extension is inspected
     * @param firstLine First line of the file, or null when not read
     * @return The language, or empty when the file should be excluded
     */
    public Optional<Language> classify(String path, String firstLine) {
        Optional<Language> byExtension = Language.fromExtension(extensionOf(path));
        if (byExtension.isPresent()) {
            return byExtension;
        }
        if (firstLine != null && firstLine.startsWith("#!/")) {
            String line = firstLine.toLowerCase(Locale.ROOT);
            if (line.contains("python")) {
                return Optional.of(Language.PYTHON);
            }
            if (line.contains("node") || line.contains("deno")) {
                return Optional.of(Language.JAVASCRIPT);
            }
        }
        return Optional.empty();
    }

    static String extensionOf(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        // ".bashrc" has no extension
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot);
    }

    static String fileName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return path.substring(slash + 1);
    }
}
