package com.linlay.analysisagent.sandbox.r;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

/**
 * Shell stand-in for Rscript. Answers --version and package checks, records installs, and for wrapper
 * runs picks its behavior from a marker in user_code.R (mode_ok, mode_envelope, mode_stderr, mode_sleep,
 * mode_output_df).
 */
final class FakeRscript {

    private static final String SCRIPT = """
            #!/bin/sh
            STATE_DIR='@STATE_DIR@'
            if [ "$1" = "--version" ]; then
              echo "R scripting front-end version 4.3.1"
              exit 0
            fi
            if [ "$1" = "--vanilla" ] && [ "$2" = "-e" ]; then
              expr="$3"
              shift 3
              case "$expr" in
                *BiocManager*)
                  echo "install $*" >> "$STATE_DIR/calls.log"
                  if [ -e "$STATE_DIR/install_fails" ]; then
                    echo "package not available" >&2
                    exit 1
                  fi
                  exit 0
                  ;;
              esac
              for pkg in "$@"; do
                if [ -e "$STATE_DIR/missing_$pkg" ]; then
                  printf '%s\\t0\\n' "$pkg"
                else
                  printf '%s\\t1\\n' "$pkg"
                fi
              done
              exit 0
            fi
            echo "run $*" >> "$STATE_DIR/calls.log"
            cat datasets/*.csv > "$STATE_DIR/datasets.csv" 2>/dev/null
            code=$(cat user_code.R)
            case "$code" in
              *mode_ok*)
                echo "fitted model"
                printf '{"success":true,"result_type":"scalar","result":42}' > _result.json
                printf '{"expr":{"columns":["gene","count"],"rows":[["TP53",24]]}}' > _datasets.json
                mkdir -p plots
                printf 'PNGDATA' > plots/plot_001.png
                : > plots/empty.png
                printf 'notes' > plots/readme.txt
                exit 0
                ;;
              *mode_envelope*)
                printf '{"success":false,"error":"object y not found"}' > _result.json
                echo "Execution halted" >&2
                exit 1
                ;;
              *mode_stderr*)
                echo "Error in fit: singular matrix" >&2
                exit 2
                ;;
              *mode_sleep*)
                sleep 30
                exit 0
                ;;
              *mode_output_df*)
                printf '{"success":true,"result_type":"null"}' > _result.json
                printf '{"columns":["a"],"rows":[[1],[2]]}' > _output_df.json
                exit 0
                ;;
            esac
            exit 0
            """;

    private final Path script;
    private final Path stateDir;

    private FakeRscript(Path script, Path stateDir) {
        this.script = script;
        this.stateDir = stateDir;
    }

    static boolean supported() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix")
                && Files.isExecutable(Path.of("/bin/sh"));
    }

    static FakeRscript create(Path dir) throws IOException {
        Path stateDir = Files.createDirectories(dir.resolve("fake-r-state"));
        Path script = dir.resolve("fake-rscript.sh");
        Files.writeString(script, SCRIPT.replace("@STATE_DIR@", stateDir.toString()), StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        return new FakeRscript(script, stateDir);
    }

    String command() {
        return script.toString();
    }

    void markMissing(String pkg) throws IOException {
        Files.writeString(stateDir.resolve("missing_" + pkg), "");
    }

    void failInstalls() throws IOException {
        Files.writeString(stateDir.resolve("install_fails"), "");
    }

    List<String> calls() throws IOException {
        Path log = stateDir.resolve("calls.log");
        return Files.exists(log) ? Files.readAllLines(log) : List.of();
    }

    String datasetsCsv() throws IOException {
        Path csv = stateDir.resolve("datasets.csv");
        return Files.exists(csv) ? Files.readString(csv) : "";
    }
}
