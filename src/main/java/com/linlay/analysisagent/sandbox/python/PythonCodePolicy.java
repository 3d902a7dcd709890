package com.linlay.analysisagent.sandbox.python;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PythonCodePolicy {

    public static final Set<String> ALLOWED_IMPORT_ROOTS = Set.of(
            // math
            "math", "statistics", "random", "decimal", "fractions", "cmath",
            // standard library
            "datetime", "time", "calendar", "collections", "itertools", "functools", "operator",
            "heapq", "bisect", "array", "copy", "json", "csv", "re", "string", "textwrap", "unicodedata",
            // analysis and plotting
            "pandas", "numpy", "scipy", "statsmodels", "sklearn", "matplotlib", "plotly", "seaborn"
    );

    public static final Set<String> BANNED_CALLS = Set.of(
            "__import__", "eval", "exec", "compile", "open", "input", "getattr", "setattr", "delattr",
            "globals", "locals", "vars", "dir", "type", "breakpoint"
    );

    private static final Pattern IMPORT_PATTERN = Pattern.compile("(?m)(?:^|;)[ \\t]*import[ \\t]+([^\\n;]+)");
    private static final Pattern FROM_IMPORT_PATTERN = Pattern.compile("(?m)(?:^|;)[ \\t]*from[ \\t]+(\\.*)([\\w.]*)[ \\t]+import\\b");
    private static final Pattern CALL_PATTERN = Pattern.compile("(?<![\\w.])([A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern DUNDER_ATTRIBUTE_PATTERN = Pattern.compile("\\.\\s*(__\\w+__)");

    private PythonCodePolicy() {
    }

    public static Optional<String> check(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String scrubbed = stripStringsAndComments(code);

        Matcher fromMatcher = FROM_IMPORT_PATTERN.matcher(scrubbed);
        while (fromMatcher.find()) {
            if (!fromMatcher.group(1).isEmpty()) {
                return Optional.of("relative imports are not allowed");
            }
            Optional<String> violation = checkModule(fromMatcher.group(2));
            if (violation.isPresent()) {
                return violation;
            }
        }

        Matcher importMatcher = IMPORT_PATTERN.matcher(scrubbed);
        while (importMatcher.find()) {
            for (String module : importedModules(importMatcher.group(1))) {
                Optional<String> violation = checkModule(module);
                if (violation.isPresent()) {
                    return violation;
                }
            }
        }

        Matcher callMatcher = CALL_PATTERN.matcher(scrubbed);
        while (callMatcher.find()) {
            String name = callMatcher.group(1);
            if (BANNED_CALLS.contains(name) && !isDefinition(scrubbed, callMatcher.start(1))) {
                return Optional.of("call to '" + name + "' is not allowed");
            }
        }

        Matcher dunderMatcher = DUNDER_ATTRIBUTE_PATTERN.matcher(scrubbed);
        if (dunderMatcher.find()) {
            return Optional.of("access to dunder attribute '" + dunderMatcher.group(1) + "' is not allowed");
        }
        return Optional.empty();
    }

    private static Optional<String> checkModule(String module) {
        String root = module == null ? "" : module.trim().split("\\.", 2)[0];
        if (!ALLOWED_IMPORT_ROOTS.contains(root)) {
            return Optional.of("import of '" + (module == null ? "" : module.trim()) + "' is not allowed");
        }
        return Optional.empty();
    }

    private static List<String> importedModules(String clause) {
        List<String> modules = new ArrayList<>();
        for (String part : clause.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            // import numpy as np
            modules.add(trimmed.split("\\s+", 2)[0]);
        }
        return modules;
    }

    private static boolean isDefinition(String code, int nameStart) {
        int lineStart = code.lastIndexOf('\n', nameStart) + 1;
        String prefix = code.substring(lineStart, nameStart).trim();
        return prefix.equals("def") || prefix.endsWith(" def");
    }

    // blanks out string literals and comments but keeps newlines
    static String stripStringsAndComments(String code) {
        StringBuilder out = new StringBuilder(code.length());
        int i = 0;
        int length = code.length();
        while (i < length) {
            char ch = code.charAt(i);
            if (ch == '#') {
                while (i < length && code.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                boolean triple = i + 2 < length && code.charAt(i + 1) == ch && code.charAt(i + 2) == ch;
                int quoteLength = triple ? 3 : 1;
                out.append(ch).append(ch);
                i += quoteLength;
                while (i < length) {
                    char current = code.charAt(i);
                    if (current == '\\') {
                        i += 2;
                        continue;
                    }
                    if (current == '\n') {
                        out.append('\n');
                        if (!triple) {
                            i++;
                            break;
                        }
                    }
                    if (current == ch && (!triple || (i + 2 < length
                            && code.charAt(i + 1) == ch && code.charAt(i + 2) == ch))) {
                        i += quoteLength;
                        break;
                    }
                    i++;
                }
                continue;
            }
            out.append(ch);
            i++;
        }
        return out.toString();
    }
}
