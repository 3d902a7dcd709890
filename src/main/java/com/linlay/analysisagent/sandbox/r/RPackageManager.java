package com.linlay.analysisagent.sandbox.r;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.stream.Collectors;

public class RPackageManager {

    private static final Logger log = LoggerFactory.getLogger(RPackageManager.class);

    public static final Set<String> BIOC_PACKAGES = Set.of(
            "Biobase", "BiocGenerics", "S4Vectors", "IRanges", "GenomicRanges", "SummarizedExperiment",
            "DESeq2", "edgeR", "limma", "clusterProfiler", "org.Hs.eg.db", "MetaCycle", "JTK_CYCLE",
            "ComplexHeatmap", "GSVA"
    );

    // the wrapper reads and writes JSON with jsonlite
    public static final Set<String> BOOTSTRAP_PACKAGES = Set.of("jsonlite");

    static final String LIB_INIT_EXPR = "lib_target <- Sys.getenv('R_LIBS_USER');"
            + "if (nzchar(lib_target)) {"
            + " dir.create(lib_target, recursive=TRUE, showWarnings=FALSE);"
            + " .libPaths(c(lib_target, .libPaths()));"
            + "};";

    private static final String CHECK_EXPR = "args <- commandArgs(trailingOnly=TRUE);" + LIB_INIT_EXPR
            + "for (p in args) {"
            + "ok <- requireNamespace(p, quietly=TRUE);"
            + "cat(paste0(p, '\\t', ifelse(ok, '1', '0'), '\\n'))"
            + "}";

    // args: repos, CRAN packages, Bioconductor packages; package lists are comma separated, "-" when empty
    private static final String INSTALL_EXPR = "args <- commandArgs(trailingOnly=TRUE);" + LIB_INIT_EXPR
            + "split_arg <- function(x) { v <- strsplit(x, ',')[[1]]; v[v != '' & v != '-'] };"
            + "repos <- args[1];"
            + "cran <- split_arg(args[2]);"
            + "bioc <- split_arg(args[3]);"
            + "lib_target <- ifelse(nzchar(Sys.getenv('R_LIBS_USER')), Sys.getenv('R_LIBS_USER'), .libPaths()[1]);"
            + "if (length(cran) > 0) { install.packages(cran, repos=repos, lib=lib_target); };"
            + "if (length(bioc) > 0) {"
            + " if (!requireNamespace('BiocManager', quietly=TRUE)) {"
            + "   install.packages('BiocManager', repos=repos, lib=lib_target);"
            + " };"
            + " BiocManager::install(bioc, ask=FALSE, update=FALSE, lib=lib_target);"
            + "};"
            + "pkgs <- c(cran, bioc);"
            + "missing <- pkgs[!vapply(pkgs, requireNamespace, logical(1), quietly=TRUE)];"
            + "if (length(missing) > 0) { message('still missing: ', paste(missing, collapse=', ')); quit(status=1) }";

    private final RProcessRunner runner;
    private final String cranMirror;
    private final long checkTimeoutMs;
    private final long installTimeoutMs;

    RPackageManager(RProcessRunner runner, String cranMirror, long checkTimeoutMs, long installTimeoutMs) {
        this.runner = runner;
        this.cranMirror = cranMirror;
        this.checkTimeoutMs = checkTimeoutMs;
        this.installTimeoutMs = installTimeoutMs;
    }

    public static Set<String> referencedPackages(String code) {
        Set<String> packages = new TreeSet<>();
        if (code == null || code.isBlank()) {
            return packages;
        }
        for (String line : code.split("\\R")) {
            Matcher matcher = RCodePolicy.PACKAGE_REFERENCE.matcher(RCodePolicy.stripComment(line));
            while (matcher.find()) {
                packages.add(matcher.group(1));
            }
        }
        return packages;
    }

    // every package counts as missing when the check process fails
    public Map<String, Boolean> checkInstalled(Set<String> packages) throws IOException {
        Map<String, Boolean> status = new LinkedHashMap<>();
        if (packages == null || packages.isEmpty()) {
            return status;
        }
        Set<String> sorted = new TreeSet<>(packages);
        sorted.forEach(pkg -> status.put(pkg, false));

        List<String> arguments = new ArrayList<>(List.of("--vanilla", "-e", CHECK_EXPR));
        arguments.addAll(sorted);
        RProcessRunner.Outcome outcome = runner.run(arguments, null, checkTimeoutMs, 0);
        if (!outcome.succeeded()) {
            log.warn("R package check failed, exitCode={}, timedOut={}", outcome.exitCode(), outcome.timedOut());
            return status;
        }
        for (String line : outcome.stdout().split("\\R")) {
            String[] parts = line.strip().split("\t");
            if (parts.length == 2 && status.containsKey(parts[0])) {
                status.put(parts[0], "1".equals(parts[1]));
            }
        }
        return status;
    }

    public InstallResult install(Set<String> packages) throws IOException {
        if (packages == null || packages.isEmpty()) {
            return new InstallResult(true, "");
        }
        InstallPlan plan = InstallPlan.of(packages);
        List<String> arguments = List.of("--vanilla", "-e", INSTALL_EXPR, cranMirror,
                joinOrDash(plan.cran()), joinOrDash(plan.bioconductor()));
        log.info("installing R packages, cran={}, bioconductor={}", plan.cran(), plan.bioconductor());
        RProcessRunner.Outcome outcome = runner.run(arguments, null, installTimeoutMs, 0);
        if (outcome.timedOut()) {
            return new InstallResult(false, "R package installation timed out after " + installTimeoutMs / 1000 + " seconds");
        }
        String output = List.of(outcome.stdout(), outcome.stderr()).stream()
                .filter(text -> !text.isBlank())
                .collect(Collectors.joining("\n"));
        if (outcome.exitCode() != 0) {
            return new InstallResult(false, output.isBlank() ? "R package installation failed" : output);
        }
        return new InstallResult(true, output);
    }

    private static String joinOrDash(Set<String> packages) {
        return packages.isEmpty() ? "-" : String.join(",", packages);
    }

    public record InstallResult(boolean ok, String log) {
    }

    record InstallPlan(Set<String> cran, Set<String> bioconductor) {

        static InstallPlan of(Set<String> packages) {
            Set<String> cran = new TreeSet<>();
            Set<String> bioconductor = new TreeSet<>();
            for (String pkg : packages) {
                (BIOC_PACKAGES.contains(pkg) ? bioconductor : cran).add(pkg);
            }
            return new InstallPlan(cran, bioconductor);
        }
    }
}
