package com.linlay.analysisagent.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.analysisagent.agent.context.CompressionResult;
import com.linlay.analysisagent.agent.context.ContextOverflowClassifier;
import com.linlay.analysisagent.agent.context.ConversationCompressor;
import com.linlay.analysisagent.agent.context.PromptBuilder;
import com.linlay.analysisagent.agent.context.PromptContext;
import com.linlay.analysisagent.agent.context.TokenEstimator;
import com.linlay.analysisagent.agent.context.ToolResultCompactor;
import com.linlay.analysisagent.agent.context.WorkspaceStore;
import com.linlay.analysisagent.agent.plan.AnalysisPlan;
import com.linlay.analysisagent.agent.plan.AnalysisPlanParser;
import com.linlay.analysisagent.agent.plan.PlanStep;
import com.linlay.analysisagent.agent.plan.PlanStepStatus;
import com.linlay.analysisagent.config.RunnerProperties;
import com.linlay.analysisagent.llm.ModelResolver;
import com.linlay.analysisagent.llm.model.ChatMessage;
import com.linlay.analysisagent.llm.model.LlmChunk;
import com.linlay.analysisagent.llm.model.LlmFunctionTool;
import com.linlay.analysisagent.llm.model.ToolCall;
import com.linlay.analysisagent.tool.GenerateReportTool;
import com.linlay.analysisagent.tool.RunCodeTool;
import com.linlay.analysisagent.tool.RunRCodeTool;
import com.linlay.analysisagent.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ReAct loop for one conversation turn. Builds the prompt, streams the model, runs tool calls in order
 * and emits the turn as an ordered event stream.
 */
@Service
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    static final String CHAT_PURPOSE = "chat";
    static final Set<String> CODE_TOOLS = Set.of(RunCodeTool.NAME, RunRCodeTool.NAME);
    static final Set<String> ARTIFACT_PURPOSES = Set.of("visualization", "export");

    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ModelResolver modelResolver;
    private final ToolRegistry toolRegistry;
    private final PromptBuilder promptBuilder;
    private final ConversationCompressor compressor;
    private final ContextOverflowClassifier overflowClassifier;
    private final WorkspaceStore workspaceStore;
    private final RunnerProperties properties;
    private final ObjectMapper objectMapper;

    public AgentRunner(
            ModelResolver modelResolver,
            ToolRegistry toolRegistry,
            PromptBuilder promptBuilder,
            ConversationCompressor compressor,
            ContextOverflowClassifier overflowClassifier,
            WorkspaceStore workspaceStore,
            RunnerProperties properties,
            ObjectMapper objectMapper
    ) {
        this.modelResolver = modelResolver;
        this.toolRegistry = toolRegistry;
        this.promptBuilder = promptBuilder;
        this.compressor = compressor;
        this.overflowClassifier = overflowClassifier;
        this.workspaceStore = workspaceStore;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Flux<AgentEvent> run(Session session, String userMessage) {
        return run(session, userMessage, new CancellationSignal());
    }

    /**
     * Cancelling the subscription trips the stop signal. The last event is always done or error.
     */
    public Flux<AgentEvent> run(Session session, String userMessage, CancellationSignal signal) {
        CancellationSignal stop = signal == null ? new CancellationSignal() : signal;
        return Flux.<AgentEvent>create(sink -> {
            sink.onCancel(stop::cancel);
            Turn turn = new Turn(session, stop, sink);
            try {
                execute(turn, userMessage);
            } catch (RuntimeException ex) {
                log.error("Agent turn failed: session={}, turn={}", session.id(), turn.turnId, ex);
                turn.emit(AgentEvent.error(turn.turnId, errorMessage(ex)));
            } finally {
                sink.complete();
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void execute(Turn turn, String userMessage) {
        Session session = turn.session;
        session.addUserMessage(userMessage);
        log.info("Agent turn started: session={}, turn={}", session.id(), turn.turnId);

        if (properties.isAutoCompressEnabled()) {
            int tokens = TokenEstimator.estimate(session.messages());
            if (tokens > properties.getAutoCompressThresholdTokens()) {
                compress(turn, tokens, "threshold")
                        .ifPresent(result -> emitCompressed(turn, result, tokens, TokenEstimator.estimate(session.messages()), "threshold"));
            }
        }

        List<LlmFunctionTool> tools = toolRegistry.definitions();
        int maxIterations = properties.getMaxIterations();
        AnalysisPlan plan = null;
        for (int iteration = 0; maxIterations <= 0 || iteration < maxIterations; iteration++) {
            if (turn.stop.isCancelled()) {
                log.info("Agent turn stopped: session={}, turn={}, iteration={}", session.id(), turn.turnId, iteration);
                turn.emit(AgentEvent.done(turn.turnId));
                return;
            }
            session.incrementIterations();
            turn.emit(AgentEvent.of(AgentEventType.ITERATION_START, turn.turnId, Map.of("iteration", iteration)));

            PromptContext prompt = promptBuilder.build(session);
            if (iteration == 0 && prompt.retrieval() != null) {
                turn.emit(AgentEvent.of(AgentEventType.RETRIEVAL, turn.turnId, prompt.retrieval()));
            }
            if (properties.isAutoCompressEnabled() && prompt.untrimmedTokens() > properties.getAutoCompressThresholdTokens()) {
                int previous = prompt.untrimmedTokens();
                Optional<CompressionResult> compressed = compress(turn, previous, "threshold");
                if (compressed.isPresent()) {
                    prompt = promptBuilder.build(session);
                    emitCompressed(turn, compressed.get(), previous, prompt.estimatedTokens(), "threshold");
                }
            }

            ModelOutput output = callModel(turn, prompt, tools);
            if (output == null) {
                return;
            }
            if (output.toolCalls().isEmpty()) {
                session.addAssistantMessage(output.text());
                turn.emit(AgentEvent.done(turn.turnId));
                log.info("Agent turn finished: session={}, turn={}, iterations={}", session.id(), turn.turnId, iteration + 1);
                return;
            }

            String leadingText = output.text().trim();
            if (iteration == 0 && !leadingText.isEmpty()) {
                plan = AnalysisPlanParser.parse(leadingText).orElse(null);
                if (plan != null) {
                    turn.emit(AgentEvent.of(AgentEventType.ANALYSIS_PLAN, turn.turnId, plan.toMap()));
                }
                turn.emit(AgentEvent.of(AgentEventType.REASONING, turn.turnId, Map.of("content", leadingText)));
                saveNote(session, "analysis_plan_" + LocalDateTime.now().format(FILE_TS) + ".md", leadingText);
            }

            session.addMessage(ChatMessage.assistantToolCalls(output.text(), output.toolCalls()));
            String reportMarkdown = null;
            for (ToolCall call : output.toolCalls()) {
                if (turn.stop.isCancelled()) {
                    log.info("Agent turn stopped before tool: session={}, tool={}", session.id(), call.name());
                    turn.emit(AgentEvent.done(turn.turnId));
                    return;
                }
                String markdown = dispatch(turn, call, plan);
                if (markdown != null) {
                    reportMarkdown = markdown;
                }
            }
            if (reportMarkdown != null) {
                // the report text is the final reply so the saved report matches what was shown
                session.addAssistantMessage(reportMarkdown);
                turn.emit(AgentEvent.text(turn.turnId, reportMarkdown));
                turn.emit(AgentEvent.done(turn.turnId));
                return;
            }
        }
        turn.emit(AgentEvent.error(turn.turnId, "reached max iterations (" + maxIterations + ")"));
    }

    // on context overflow before any output, compress once and retry;
    // other failures end the turn with an error event and return null
    private ModelOutput callModel(Turn turn, PromptContext initialPrompt, List<LlmFunctionTool> tools) {
        PromptContext prompt = initialPrompt;
        boolean retried = false;
        while (true) {
            StringBuilder text = new StringBuilder();
            List<ToolCall> toolCalls = new ArrayList<>();
            boolean produced = false;
            try {
                for (LlmChunk chunk : modelResolver.chat(prompt.messages(), tools, null, null, CHAT_PURPOSE).toIterable()) {
                    if (!chunk.text().isEmpty()) {
                        produced = true;
                        text.append(chunk.text());
                        turn.emit(AgentEvent.text(turn.turnId, chunk.text()));
                    }
                    if (!chunk.reasoning().isEmpty()) {
                        produced = true;
                        turn.emit(AgentEvent.of(AgentEventType.REASONING, turn.turnId,
                                Map.of("content", chunk.reasoning(), "streaming", true)));
                    }
                    if (chunk.hasToolCalls()) {
                        produced = true;
                        toolCalls.addAll(chunk.toolCalls());
                    }
                }
                return new ModelOutput(text.toString(), toolCalls);
            } catch (RuntimeException raw) {
                Throwable ex = Exceptions.unwrap(raw);
                if (!produced && !retried && overflowClassifier.isContextOverflow(ex)) {
                    retried = true;
                    int previous = prompt.estimatedTokens();
                    log.warn("Context overflow reported by model, compressing and retrying: session={}", turn.session.id());
                    Optional<CompressionResult> compressed = compress(turn, previous, "context_limit_error");
                    if (compressed.isPresent()) {
                        prompt = promptBuilder.build(turn.session);
                        emitCompressed(turn, compressed.get(), previous, prompt.estimatedTokens(), "context_limit_error");
                        continue;
                    }
                }
                if (retried && overflowClassifier.isContextOverflow(ex)) {
                    ex = new ContextOverflowException("context length exceeded after compression: " + errorMessage(ex), ex);
                }
                log.error("Model call failed: session={}, turn={}", turn.session.id(), turn.turnId, ex);
                turn.emit(AgentEvent.error(turn.turnId, errorMessage(ex)));
                return null;
            }
        }
    }

    private String dispatch(Turn turn, ToolCall call, AnalysisPlan plan) {
        Session session = turn.session;
        String toolName = call.name();
        Map<String, Object> args = null;
        JsonNode result = null;
        try {
            args = parseArguments(call.arguments());
        } catch (JsonProcessingException ex) {
            log.warn("Tool argument parsing failed: tool={}, arguments={}", toolName, call.arguments());
            result = errorResult("tool argument parsing failed: " + call.arguments());
        }
        Map<String, Object> intent = intentMetadata(toolName, args);

        PlanStep step = plan == null ? null : plan.claimNextPending().orElse(null);
        if (step != null) {
            emitStepUpdate(turn, step, toolName);
        }
        Map<String, Object> callData = new LinkedHashMap<>();
        callData.put("name", toolName);
        callData.put("arguments", args == null ? call.arguments() : args);
        AgentEvent toolCallEvent = AgentEvent.forTool(AgentEventType.TOOL_CALL, turn.turnId, call.id(), toolName, callData);
        for (Map.Entry<String, Object> entry : intent.entrySet()) {
            toolCallEvent = toolCallEvent.withMetadata(entry.getKey(), entry.getValue());
        }
        turn.emit(toolCallEvent);

        if (args != null) {
            if (CODE_TOOLS.contains(toolName)) {
                persistCode(turn, call, args);
            }
            result = invokeTool(session, toolName, args);
        }
        boolean failed = isError(result);
        String status = failed ? "error" : "success";
        if (step != null) {
            plan.update(step.id(), failed ? PlanStepStatus.ERROR : PlanStepStatus.COMPLETED)
                    .ifPresent(updated -> emitStepUpdate(turn, updated, toolName));
        }

        Map<String, Object> toolMetadata = new LinkedHashMap<>(intent);
        toolMetadata.put("status", status);
        session.addMessage(new ChatMessage(
                ChatMessage.TOOL,
                ToolResultCompactor.serializeForHistory(result, properties.getMaxToolResultChars()),
                null,
                call.id(),
                toolName,
                null,
                toolMetadata
        ));
        Map<String, Object> resultData = new LinkedHashMap<>();
        resultData.put("result", result);
        resultData.put("status", status);
        resultData.put("message", resultMessage(result, failed));
        turn.emit(AgentEvent.forTool(AgentEventType.TOOL_RESULT, turn.turnId, call.id(), toolName, resultData));

        emitPayloads(turn, call, result);

        if (!failed && GenerateReportTool.NAME.equals(toolName)) {
            JsonNode markdown = result.path("data").path(GenerateReportTool.REPORT_MARKDOWN);
            if (markdown.isTextual() && !markdown.asText().isBlank()) {
                return markdown.asText();
            }
        }
        return null;
    }

    private JsonNode invokeTool(Session session, String toolName, Map<String, Object> args) {
        long startedAt = System.currentTimeMillis();
        try {
            JsonNode result = toolRegistry.execute(toolName, session, args);
            log.debug("Tool finished: session={}, tool={}, elapsedMs={}", session.id(), toolName, System.currentTimeMillis() - startedAt);
            return result == null ? objectMapper.createObjectNode() : result;
        } catch (ToolExecutionException ex) {
            log.error("Tool {} failed: session={}", toolName, session.id(), ex);
            return errorResult("tool " + toolName + " failed: " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Tool {} failed: session={}", toolName, session.id(), ex);
            return errorResult("tool " + toolName + " failed: " + errorMessage(ex));
        }
    }

    private void emitPayloads(Turn turn, ToolCall call, JsonNode result) {
        if (result == null || !result.isObject()) {
            return;
        }
        JsonNode chart = result.get("chart_data");
        if (chart != null && !chart.isNull()) {
            turn.emit(AgentEvent.forTool(AgentEventType.CHART, turn.turnId, call.id(), call.name(), chart));
            addNote(turn, call, AgentEventType.CHART, "chart generated", chart);
        }
        JsonNode preview = result.get("dataframe_preview");
        if (preview != null && !preview.isNull()) {
            turn.emit(AgentEvent.forTool(AgentEventType.DATA, turn.turnId, call.id(), call.name(), preview));
            addNote(turn, call, AgentEventType.DATA, "data preview generated", preview);
        }
        JsonNode artifacts = result.get("artifacts");
        if (artifacts != null && artifacts.isArray()) {
            for (JsonNode artifact : artifacts) {
                turn.emit(AgentEvent.forTool(AgentEventType.ARTIFACT, turn.turnId, call.id(), call.name(), artifact));
                addNote(turn, call, AgentEventType.ARTIFACT, "artifact generated: " + artifact.path("name").asText(""), artifact);
            }
        }
        JsonNode images = result.get("images");
        if (images != null && (images.isArray() || images.isTextual())) {
            List<String> urls = new ArrayList<>();
            if (images.isArray()) {
                images.forEach(image -> urls.add(image.asText()));
            } else {
                urls.add(images.asText());
            }
            if (!urls.isEmpty()) {
                turn.emit(AgentEvent.forTool(AgentEventType.IMAGE, turn.turnId, call.id(), call.name(), Map.of("urls", urls)));
                addNote(turn, call, AgentEventType.IMAGE, "images generated", objectMapper.valueToTree(Map.of("urls", urls)));
            }
        }
    }

    // visualization and export code becomes a downloadable artifact, the rest only goes to the execution log
    private void persistCode(Turn turn, ToolCall call, Map<String, Object> args) {
        Object code = args.get("code");
        if (code == null || code.toString().isBlank()) {
            return;
        }
        String purpose = textArg(args, "purpose").toLowerCase(Locale.ROOT);
        String extension = RunRCodeTool.NAME.equals(call.name()) ? "R" : "py";
        String sessionId = turn.session.id();
        try {
            if (ARTIFACT_PURPOSES.contains(purpose)) {
                String label = textArg(args, "label");
                String stem = label.isEmpty() ? call.name() + "_" + LocalDateTime.now().format(FILE_TS) : stripExtension(label);
                Map<String, Object> artifact = workspaceStore.saveTextArtifact(
                        sessionId, WorkspaceStore.safeFileName(stem) + "." + extension, code.toString(), "code");
                JsonNode artifactNode = objectMapper.valueToTree(artifact);
                turn.emit(AgentEvent.forTool(AgentEventType.ARTIFACT, turn.turnId, call.id(), call.name(), artifactNode));
                addNote(turn, call, AgentEventType.ARTIFACT, "code saved: " + artifact.get("name"), artifactNode);
                return;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("tool_call_id", call.id());
            entry.put("tool", call.name());
            entry.put("purpose", purpose.isEmpty() ? "exploration" : purpose);
            entry.put("label", textArg(args, "label"));
            entry.put("intent", textArg(args, "intent"));
            entry.put("code", code.toString());
            workspaceStore.appendExecutionLog(sessionId, entry);
        } catch (UncheckedIOException | IllegalArgumentException ex) {
            log.warn("Failed to persist code for tool call: session={}, tool={}", sessionId, call.name(), ex);
        }
    }

    private Optional<CompressionResult> compress(Turn turn, int currentTokens, String trigger) {
        log.info("Auto compression triggered ({}): session={}, tokens={}, threshold={}",
                trigger, turn.session.id(), currentTokens, properties.getAutoCompressThresholdTokens());
        try {
            CompressionResult result = compressor.compress(
                    turn.session, properties.getCompressRatio(), properties.getCompressMinMessages());
            if (!result.success()) {
                log.info("Auto compression skipped: session={}, reason={}", turn.session.id(), result.message());
                return Optional.empty();
            }
            return Optional.of(result);
        } catch (RuntimeException ex) {
            log.warn("Auto compression failed ({}): session={}", trigger, turn.session.id(), ex);
            return Optional.empty();
        }
    }

    private void emitCompressed(Turn turn, CompressionResult result, int previousTokens, int currentTokens, String trigger) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("archived_count", result.archivedCount());
        data.put("remaining_count", result.remainingCount());
        data.put("previous_tokens", previousTokens);
        data.put("current_tokens", currentTokens);
        data.put("archive_path", result.archivePath() == null ? "" : result.archivePath().toString());
        data.put("trigger", trigger);
        data.put("message", "context_limit_error".equals(trigger)
                ? "context limit exceeded, compressed " + result.archivedCount() + " messages automatically"
                : "context compressed automatically, archived " + result.archivedCount() + " messages");
        turn.emit(AgentEvent.of(AgentEventType.CONTEXT_COMPRESSED, turn.turnId, data));
    }

    private void emitStepUpdate(Turn turn, PlanStep step, String toolName) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", step.id());
        data.put("status", step.status().wireName());
        data.put("tool_name", toolName);
        turn.emit(AgentEvent.of(AgentEventType.PLAN_STEP_UPDATE, turn.turnId, data));
    }

    private void addNote(Turn turn, ToolCall call, AgentEventType type, String content, JsonNode payload) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool_call_id", call.id() == null ? "" : call.id());
        metadata.put("tool_name", call.name());
        metadata.put("payload", payload == null ? Map.of() : objectMapper.convertValue(payload, Object.class));
        turn.session.addNote(type.wireName(), content, metadata);
    }

    private void saveNote(Session session, String fileName, String text) {
        try {
            workspaceStore.saveNote(session.id(), fileName, text);
        } catch (UncheckedIOException ex) {
            log.warn("Failed to save note: session={}, file={}", session.id(), fileName, ex);
        }
    }

    private Map<String, Object> parseArguments(String arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        Map<String, Object> parsed = objectMapper.readValue(arguments, MAP_TYPE);
        return parsed == null ? Map.of() : parsed;
    }

    private Map<String, Object> intentMetadata(String toolName, Map<String, Object> args) {
        if (!CODE_TOOLS.contains(toolName) || args == null) {
            return Map.of();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        String intent = textArg(args, "intent");
        if (intent.isEmpty()) {
            intent = textArg(args, "label");
        }
        if (!intent.isEmpty()) {
            metadata.put("intent", intent);
        }
        String purpose = textArg(args, "purpose");
        if (!purpose.isEmpty()) {
            metadata.put("purpose", purpose);
        }
        return metadata;
    }

    static boolean isError(JsonNode result) {
        if (result == null) {
            return true;
        }
        if (!result.isObject()) {
            return false;
        }
        JsonNode error = result.get("error");
        if (error != null && !error.isNull()) {
            return true;
        }
        JsonNode success = result.get("success");
        return success != null && success.isBoolean() && !success.booleanValue();
    }

    private static String resultMessage(JsonNode result, boolean failed) {
        if (result != null && result.isObject()) {
            JsonNode error = result.get("error");
            if (error != null && !error.isNull()) {
                return error.isTextual() ? error.asText() : error.toString();
            }
            JsonNode message = result.get("message");
            if (message != null && message.isTextual() && !message.asText().isBlank()) {
                return message.asText();
            }
        }
        return failed ? "tool execution failed" : "tool execution succeeded";
    }

    private ObjectNode errorResult(String message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", message);
        return node;
    }

    private static String textArg(Map<String, Object> args, String key) {
        Object value = args == null ? null : args.get(key);
        return value == null ? "" : value.toString().trim();
    }

    private static String stripExtension(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".py")) {
            return label.substring(0, label.length() - 3);
        }
        if (lower.endsWith(".r")) {
            return label.substring(0, label.length() - 2);
        }
        return label;
    }

    private static String errorMessage(Throwable ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    private record ModelOutput(String text, List<ToolCall> toolCalls) {
    }

    private static final class Turn {

        private final String turnId = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        private final AtomicLong seq = new AtomicLong();
        private final Session session;
        private final CancellationSignal stop;
        private final FluxSink<AgentEvent> sink;

        private Turn(Session session, CancellationSignal stop, FluxSink<AgentEvent> sink) {
            this.session = session;
            this.stop = stop;
            this.sink = sink;
        }

        private void emit(AgentEvent event) {
            if (sink.isCancelled()) {
                return;
            }
            sink.next(event.withSeq(seq.incrementAndGet()));
        }
    }
}
