package com.adlanda.repoindexer.graph;

import com.adlanda.repoindexer.index.TermExtractor;
import com.adlanda.repoindexer.model.FileRecord;
import com.adlanda.repoindexer.model.Language;
import com.adlanda.repoindexer.model.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a file-level import graph from a snapshot.
 *
 * Extraction is regex based and best effort: an edge means "this file
 * appears to import that file". Imports that do not resolve to a file in the
 * snapshot (standard library, packages) are dropped.
 */
@Service
public class DependencyGraphService {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphService.class);

    // "import a.b as c, d" captures the whole comma-separated list
    private static final Pattern PYTHON_IMPORT = Pattern.compile(
            "^[ \\t]*(?:from[ \\t]+([\\w.]+)[ \\t]+import"
                    + "|import[ \\t]+([\\w.]+(?:[ \\t]+as[ \\t]+\\w+)?(?:[ \\t]*,[ \\t]*[\\w.]+(?:[ \\t]+as[ \\t]+\\w+)?)*))",
            Pattern.MULTILINE);

    private static final Pattern ALIAS = Pattern.compile("[ \\t]+as[ \\t]+\\w+$");

    private static final Pattern JS_IMPORT = Pattern.compile(
            "import\\s+(?:[^'\"]*?\\s+from\\s+)?['\"]([^'\"]+)['\"]"
                    + "|require\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    /**
     * Maps every file path in the snapshot to the sorted set of paths it imports.
     * Files without resolvable imports map to an empty set.
     */
    public Map<String, Set<String>> build(RepositorySnapshot snapshot) {
        Map<String, Set<String>> graph = new TreeMap<>();
        Map<String, Set<String>> pathsByStem = new TreeMap<>();
        for (String path : snapshot.files().keySet()) {
            graph.put(path, new TreeSet<>());
            pathsByStem.computeIfAbsent(TermExtractor.fileStem(path), k -> new TreeSet<>()).add(path);
        }

        int edges = 0;
        for (FileRecord file : snapshot.files().values()) {
            Set<String> targets = graph.get(file.path());
            if (file.language() == Language.PYTHON) {
                addPythonEdges(file, pathsByStem, targets);
            } else {
                addScriptEdges(file, graph.keySet(), targets);
            }
            targets.remove(file.path());
            edges += targets.size();
        }

        log.debug("Dependency graph of {}: {} files, {} edges", snapshot.root(), graph.size(), edges);
        return graph;
    }

    private void addPythonEdges(FileRecord file, Map<String, Set<String>> pathsByStem, Set<String> targets) {
        Matcher matcher = PYTHON_IMPORT.matcher(file.text());
        while (matcher.find()) {
            List<String> modules = matcher.group(1) != null
                    ? List.of(matcher.group(1))
                    : importedModules(matcher.group(2));
            for (String module : modules) {
                String head = firstSegment(module);
                if (!head.isEmpty()) {
                    targets.addAll(pathsByStem.getOrDefault(head.toLowerCase(Locale.ROOT), Set.of()));
                }
            }
        }
    }

    /**
     * Splits the names of an {@code import} statement, dropping {@code as} aliases.
     */
    static List<String> importedModules(String names) {
        List<String> modules = new ArrayList<>();
        for (String entry : names.split(",")) {
            String module = ALIAS.matcher(entry.strip()).replaceFirst("");
            if (!module.isEmpty()) {
                modules.add(module);
            }
        }
        return modules;
    }

    private void addScriptEdges(FileRecord file, Set<String> allPaths, Set<String> targets) {
        Matcher matcher = JS_IMPORT.matcher(file.text());
        while (matcher.find()) {
            String specifier = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            // package imports never resolve to a file in the repository
            if (!specifier.startsWith("./") && !specifier.startsWith("../")) {
                continue;
            }
            String resolved = resolveRelative(file.path(), specifier);
            if (resolved == null) {
                continue;
            }
            for (String candidate : allPaths) {
                if (candidate.equals(resolved)
                        || candidate.startsWith(resolved + ".")
                        || candidate.startsWith(resolved + "/")) {
                    targets.add(candidate);
                }
            }
        }
    }

    static String firstSegment(String module) {
        for (String segment : module.split("\\.")) {
            if (!segment.isEmpty()) {
                return segment;
            }
        }
        return "";
    }

    /**
     * Resolves a relative specifier against the importing file's directory.
     *
     * @return The normalised repository-relative path, or null when it escapes the root
     */
    static String resolveRelative(String importer, String specifier) {
        Deque<String> parts = new ArrayDeque<>();
        int slash = importer.lastIndexOf('/');
        if (slash > 0) {
            for (String segment : importer.substring(0, slash).split("/")) {
                parts.addLast(segment);
            }
        }
        for (String segment : List.of(specifier.split("/"))) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (parts.isEmpty()) {
                    return null;
                }
                parts.removeLast();
            } else {
                parts.addLast(segment);
            }
        }
        return parts.isEmpty() ? null : String.join("/", parts);
    }
}
