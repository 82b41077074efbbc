package com.adlanda.repoindexer.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers shared by document and query vectorisation.
 */
public final class TermExtractor {

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]+");

    private static final Pattern DEFINITION = Pattern.compile(
            "def\\s+([A-Za-z_][A-Za-z0-9_]*)"
                    + "|function\\s+([A-Za-z_][A-Za-z0-9_]*)"
                    + "|const\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=");

    private TermExtractor() {
    }

    /**
     * Lowercase identifier-like tokens of at least two characters, in order.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return tokens;
    }

    /**
     * Names introduced by {@code def name}, {@code function name} or
     * {@code const name =}, lowercased, in order of appearance.
     */
    public static List<String> extractFunctions(String text) {
        List<String> names = new ArrayList<>();
        Matcher matcher = DEFINITION.matcher(text);
        while (matcher.find()) {
            for (int group = 1; group <= matcher.groupCount(); group++) {
                String name = matcher.group(group);
                if (name != null) {
                    names.add(name.toLowerCase(Locale.ROOT));
                }
            }
        }
        return names;
    }

    /**
     * File name without its last extension, lowercased: "src/ConfigLoader.py" gives "configloader".
     */
    public static String fileStem(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String name = path.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem.toLowerCase(Locale.ROOT);
    }
}
