package com.linlay.analysisagent.agent.context;

import java.util.List;
import java.util.Map;

public interface KnowledgeRetriever {

    Retrieval retrieve(String query, List<String> datasetColumns, int maxChars);

    static KnowledgeRetriever none() {
        return (query, datasetColumns, maxChars) -> Retrieval.EMPTY;
    }

    record Retrieval(String text, List<Map<String, Object>> hits, String mode) {

        public static final Retrieval EMPTY = new Retrieval("", List.of(), "keyword");

        public Retrieval {
            text = text == null ? "" : text;
            hits = hits == null ? List.of() : List.copyOf(hits);
            mode = mode == null || mode.isBlank() ? "keyword" : mode;
        }

        public boolean hasText() {
            return !text.isBlank();
        }

        public boolean hasHits() {
            return !hits.isEmpty();
        }
    }
}
