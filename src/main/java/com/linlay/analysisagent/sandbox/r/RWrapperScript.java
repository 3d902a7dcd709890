package com.linlay.analysisagent.sandbox.r;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;

/**
 * Per-run R wrapper. Loads the dataset manifest, binds the active dataset, traps user code errors
 * and writes results to fixed files in the run directory:
 * <ul>
 *     <li>{@code _result.json}: result envelope (success, result_type, result, result_repr, error)</li>
 *     <li>{@code _output_df.json}: explicit output_df table</li>
 *     <li>{@code _datasets.json}: dataset updates when persisting</li>
 *     <li>{@code plots/}: figures</li>
 * </ul>
 */
final class RWrapperScript {

    static final String RESULT_FILE = "_result.json";
    static final String OUTPUT_DF_FILE = "_output_df.json";
    static final String DATASETS_FILE = "_datasets.json";
    static final String PLOTS_DIR = "plots";

    private static final ObjectMapper LITERAL_MAPPER = new ObjectMapper();

    private static final String TEMPLATE = """
            options(stringsAsFactors = FALSE, warn = 1)
            {{LIB_INIT}}

            .sandbox <- new.env()
            .sandbox$manifest_path <- {{MANIFEST_PATH}}
            .sandbox$user_code_path <- {{USER_CODE_PATH}}
            .sandbox$dataset_name <- {{DATASET_NAME}}
            .sandbox$persist <- {{PERSIST}}
            .sandbox$plots_dir <- file.path(getwd(), "{{PLOTS_DIR}}")
            dir.create(.sandbox$plots_dir, recursive = TRUE, showWarnings = FALSE)

            .sandbox$write <- function(value, path) {
              jsonlite::write_json(value, path, auto_unbox = TRUE, null = "null", na = "null",
                                   dataframe = "values", json_verbatim = TRUE, digits = NA)
            }
            .sandbox$table <- function(frame) {
              frame <- as.data.frame(frame)
              list(columns = I(names(frame)), rows = frame)
            }
            .sandbox$fail <- function(message) {
              .sandbox$write(list(success = FALSE, error = message), "{{RESULT_FILE}}")
              quit(save = "no", status = 1)
            }

            datasets <- list()
            for (.entry in jsonlite::fromJSON(.sandbox$manifest_path, simplifyVector = FALSE)) {
              datasets[[.entry$name]] <- utils::read.csv(.entry$path, check.names = FALSE,
                                                         stringsAsFactors = FALSE, na.strings = "")
            }

            if (nzchar(.sandbox$dataset_name)) {
              if (!(.sandbox$dataset_name %in% names(datasets))) {
                .sandbox$fail(paste0("dataset '", .sandbox$dataset_name, "' does not exist"))
              }
              df <- datasets[[.sandbox$dataset_name]]
            }

            .sandbox$device <- tryCatch({
              grDevices::png(file.path(.sandbox$plots_dir, "plot_%03d.png"), width = 1200, height = 750, res = 150)
              "png"
            }, error = function(e) {
              grDevices::pdf(file.path(.sandbox$plots_dir, "base_plots.pdf"))
              "pdf"
            })

            .sandbox$error <- NULL
            tryCatch({
              eval(parse(file = .sandbox$user_code_path, encoding = "UTF-8"), envir = .GlobalEnv)
            }, error = function(e) {
              .sandbox$error <- conditionMessage(e)
            })
            try(grDevices::graphics.off(), silent = TRUE)

            if (!is.null(.sandbox$error)) {
              .sandbox$fail(.sandbox$error)
            }

            if ("ggplot2" %in% loadedNamespaces()) {
              for (.name in ls(envir = .GlobalEnv)) {
                .object <- get(.name, envir = .GlobalEnv)
                if (inherits(.object, "ggplot")) {
                  .safe <- gsub("[^0-9A-Za-z_.-]", "_", .name)
                  try(ggplot2::ggsave(filename = file.path(.sandbox$plots_dir, paste0("ggplot_", .safe, ".png")),
                                      plot = .object, width = 8, height = 5, dpi = 150), silent = TRUE)
                }
              }
            }

            if (.sandbox$persist) {
              if (exists("df", envir = .GlobalEnv, inherits = FALSE) && nzchar(.sandbox$dataset_name)) {
                datasets[[.sandbox$dataset_name]] <- df
              }
              .sandbox$updates <- list()
              for (.name in names(datasets)) {
                if (is.data.frame(datasets[[.name]])) {
                  .sandbox$updates[[.name]] <- .sandbox$table(datasets[[.name]])
                }
              }
              .sandbox$write(.sandbox$updates, "{{DATASETS_FILE}}")
            }

            if (exists("output_df", envir = .GlobalEnv, inherits = FALSE) && is.data.frame(output_df)) {
              .sandbox$write(.sandbox$table(output_df), "{{OUTPUT_DF_FILE}}")
            }

            .sandbox$envelope <- list(success = TRUE, result_type = "null")
            if (exists("result", envir = .GlobalEnv, inherits = FALSE)) {
              .value <- get("result", envir = .GlobalEnv)
              if (is.data.frame(.value)) {
                .sandbox$envelope$result_type <- "table"
                .sandbox$envelope$result <- .sandbox$table(.value)
              } else {
                .json <- tryCatch(jsonlite::toJSON(.value, auto_unbox = TRUE, null = "null", na = "null", digits = NA),
                                  error = function(e) NULL)
                if (!is.null(.json)) {
                  .sandbox$envelope$result_type <- "scalar"
                  .sandbox$envelope$result <- .json
                } else {
                  .sandbox$envelope$result_type <- "opaque"
                  .sandbox$envelope$type_name <- class(.value)[1]
                  .sandbox$envelope$result_repr <- paste(utils::capture.output(utils::str(.value, max.level = 1)),
                                                         collapse = "\\n")
                }
              }
            }
            .sandbox$write(.sandbox$envelope, "{{RESULT_FILE}}")
            """;

    private RWrapperScript() {
    }

    static String build(Path userCodePath, Path manifestPath, String datasetName, boolean persist) {
        return TEMPLATE
                .replace("{{LIB_INIT}}", RPackageManager.LIB_INIT_EXPR)
                .replace("{{MANIFEST_PATH}}", literal(manifestPath.toString()))
                .replace("{{USER_CODE_PATH}}", literal(userCodePath.toString()))
                .replace("{{DATASET_NAME}}", literal(datasetName == null ? "" : datasetName))
                .replace("{{PERSIST}}", persist ? "TRUE" : "FALSE")
                .replace("{{PLOTS_DIR}}", PLOTS_DIR)
                .replace("{{RESULT_FILE}}", RESULT_FILE)
                .replace("{{OUTPUT_DF_FILE}}", OUTPUT_DF_FILE)
                .replace("{{DATASETS_FILE}}", DATASETS_FILE);
    }

    // a JSON string literal is also a valid R string literal
    static String literal(String value) {
        try {
            return LITERAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot encode R literal", ex);
        }
    }
}
