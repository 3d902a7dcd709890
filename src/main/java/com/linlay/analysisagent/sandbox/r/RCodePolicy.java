package com.linlay.analysisagent.sandbox.r;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class RCodePolicy {

    public static final Set<String> ALLOWED_PACKAGES = Set.of(
            // base / recommended
            "base", "utils", "stats", "graphics", "grDevices", "methods", "datasets", "grid", "splines",
            "parallel", "stats4", "tcltk",
            // data handling
            "dplyr", "tidyr", "tibble", "readr", "stringr", "forcats", "purrr", "data.table", "janitor",
            "lubridate", "zoo",
            // plotting
            "ggplot2", "scales", "patchwork", "cowplot", "ggpubr", "viridis", "plotly",
            // modelling
            "broom", "car", "lme4", "nlme", "emmeans", "survival", "forecast", "MASS", "mgcv",
            // bioinformatics
            "BiocManager", "Biobase", "BiocGenerics", "S4Vectors", "IRanges", "GenomicRanges",
            "SummarizedExperiment", "DESeq2", "edgeR", "limma", "clusterProfiler", "org.Hs.eg.db",
            "MetaCycle", "JTK_CYCLE", "ComplexHeatmap", "GSVA",
            "jsonlite"
    );

    public static final Set<String> BANNED_CALLS = Set.of(
            "system", "system2", "shell", "shell.exec", "file.remove", "file.rename", "file.copy", "unlink",
            "download.file", "url", "curl", "browseURL", "eval", "parse", "source", "Sys.getenv", "Sys.setenv",
            ".Internal", ".Call", ".External"
    );

    static final Pattern PACKAGE_REFERENCE = Pattern.compile(
            "\\b(?:library|require|requireNamespace)\\s*\\(\\s*['\"]?([A-Za-z][A-Za-z0-9._]*)['\"]?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NAMESPACE_REFERENCE = Pattern.compile("(?<![A-Za-z0-9_.])([A-Za-z][A-Za-z0-9.]*):::?");

    private static final List<BannedCall> BANNED_PATTERNS = BANNED_CALLS.stream()
            .sorted()
            .map(name -> new BannedCall(name, Pattern.compile("(?<![A-Za-z0-9_.])" + Pattern.quote(name) + "\\s*\\(")))
            .toList();

    private RCodePolicy() {
    }

    public static Optional<String> check(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String[] lines = code.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = stripComment(lines[i]);
            if (line.isBlank()) {
                continue;
            }
            int lineNo = i + 1;
            for (BannedCall banned : BANNED_PATTERNS) {
                if (banned.pattern().matcher(line).find()) {
                    return Optional.of("call to '" + banned.name() + "' is not allowed (line " + lineNo + ")");
                }
            }
            Matcher packageMatcher = PACKAGE_REFERENCE.matcher(line);
            while (packageMatcher.find()) {
                String pkg = packageMatcher.group(1);
                if (!ALLOWED_PACKAGES.contains(pkg)) {
                    return Optional.of("package '" + pkg + "' is not allowed (line " + lineNo + ")");
                }
            }
            Matcher namespaceMatcher = NAMESPACE_REFERENCE.matcher(line);
            while (namespaceMatcher.find()) {
                String pkg = namespaceMatcher.group(1);
                if (!ALLOWED_PACKAGES.contains(pkg)) {
                    return Optional.of("package '" + pkg + "' is not allowed (line " + lineNo + ")");
                }
            }
        }
        return Optional.empty();
    }

    // a quoted # does not start a comment
    static String stripComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quote != 0) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '#') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    private record BannedCall(String name, Pattern pattern) {
    }
}
