package com.lucidreview.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.lucidreview.entity.RunStatus;
import com.lucidreview.orchestration.api.AuditTrail;
import com.lucidreview.orchestration.api.ModelClient;
import com.lucidreview.orchestration.api.RunStore;
import com.lucidreview.orchestration.api.SystemPromptProvider;
import com.lucidreview.orchestration.api.ToolExecutionClient;
import com.lucidreview.orchestration.model.AuditEventType;
import com.lucidreview.orchestration.model.AuditRecord;
import com.lucidreview.orchestration.model.ContentBlock;
import com.lucidreview.orchestration.model.ConversationMessage;
import com.lucidreview.orchestration.model.ModelRequest;
import com.lucidreview.orchestration.model.ModelResponse;
import com.lucidreview.orchestration.model.ModelToolSpec;
import com.lucidreview.orchestration.model.NewToolCall;
import com.lucidreview.orchestration.model.NewTurn;
import com.lucidreview.orchestration.model.PromptSelection;
import com.lucidreview.orchestration.model.RunCompletion;
import com.lucidreview.orchestration.model.RunResult;
import com.lucidreview.orchestration.model.StopReason;
import com.lucidreview.orchestration.model.TokenUsage;
import com.lucidreview.orchestration.model.ToolResult;
import com.lucidreview.orchestration.model.ToolResultBlock;
import com.lucidreview.orchestration.model.ToolUseBlock;
import com.lucidreview.orchestration.service.BestEffort;
import com.lucidreview.orchestration.service.DefaultSystemPromptProvider;
import com.lucidreview.orchestration.service.DeterminationExtractor;
import com.lucidreview.orchestration.service.ToolExecutionException;
import com.lucidreview.orchestration.service.ToolSchemaBridge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static com.lucidreview.orchestration.OrchestrationConstants.AGENT_ACTOR_ID;
import static com.lucidreview.orchestration.OrchestrationConstants.INITIAL_USER_MESSAGE_TEMPLATE;

/**
 * Drives one review run: the model is called turn by turn with the full conversation, every
 * tool it asks for is executed and fed back, and each response and tool call is persisted as
 * it happens. The loop is bound to a single tool connection and is not shared between runs.
 * <p>
 * {@link #run(String, UUID)} never throws. Any failure is recorded on the run row and returned
 * as a {@link RunStatus#FAILED} result.
 */
@Slf4j
public class AgentRunLoop {

    private final ModelClient modelClient;
    private final ToolExecutionClient toolClient;
    private final RunStore runStore;
    private final SystemPromptProvider promptProvider;
    private final AuditTrail auditTrail;
    private final DeterminationExtractor determinationExtractor;
    private final RunLoopSettings settings;

    public AgentRunLoop(ModelClient modelClient,
                        ToolExecutionClient toolClient,
                        RunStore runStore,
                        SystemPromptProvider promptProvider,
                        AuditTrail auditTrail,
                        DeterminationExtractor determinationExtractor,
                        RunLoopSettings settings) {
        this.modelClient = modelClient;
        this.toolClient = toolClient;
        this.runStore = runStore;
        this.promptProvider = promptProvider;
        this.auditTrail = auditTrail;
        this.determinationExtractor = determinationExtractor;
        this.settings = settings;
    }

    /**
     * Reviews a case end to end.
     *
     * @param caseNumber The case under review.
     * @param existingRunId The pre-created pending run to drive, or {@code null} to create a new run.
     * @return The run id with its final status, and the determination when one was captured.
     */
    public RunResult run(String caseNumber, @Nullable UUID existingRunId) {
        PromptSelection prompt = BestEffort.get("prompt selection", promptProvider::activePrompt,
                DefaultSystemPromptProvider.fallback());
        UUID runId = existingRunId != null ? existingRunId : UUID.randomUUID();
        try {
            if (!enterRunning(runId, caseNumber, existingRunId != null, prompt)) {
                log.info("Run {} for case {} was cancelled before it started.", runId, caseNumber);
                return RunResult.cancelled(runId);
            }
            auditTrail.record(new AuditRecord(caseNumber, AuditEventType.AGENT_RUN_STARTED,
                    AuditRecord.ActorType.SYSTEM, AGENT_ACTOR_ID,
                    detail("runId", runId, "modelId", settings.modelId(), "promptVersion", prompt.version())));
            return drive(runId, caseNumber, prompt);
        } catch (Exception ex) {
            String error = describe(ex);
            log.error("Run {} for case {} failed: {}", runId, caseNumber, error, ex);
            BestEffort.run("failure record for run " + runId, () -> runStore.failRun(runId, error));
            BestEffort.run("failure audit for run " + runId, () -> auditTrail.record(new AuditRecord(caseNumber,
                    AuditEventType.AGENT_RUN_FAILED, AuditRecord.ActorType.SYSTEM, AGENT_ACTOR_ID,
                    detail("runId", runId, "error", error))));
            return RunResult.failed(runId, error);
        }
    }

    private boolean enterRunning(UUID runId, String caseNumber, boolean preCreated, PromptSelection prompt) {
        if (!preCreated) {
            runStore.createRunningRun(runId, caseNumber, settings.modelId(), prompt.version());
            return true;
        }
        if (runStore.markRunning(runId, settings.modelId(), prompt.version())) {
            return true;
        }
        Optional<RunStatus> status = runStore.findStatus(runId);
        if (status.isPresent() && status.get() == RunStatus.CANCELLED) {
            return false;
        }
        throw new IllegalStateException("Run " + runId + " cannot start from status "
                + status.map(Enum::name).orElse("MISSING"));
    }

    private RunResult drive(UUID runId, String caseNumber, PromptSelection prompt) {
        List<ModelToolSpec> tools = ToolSchemaBridge.toModelTools(toolClient.listTools());
        log.info("Run {} started for case {} with {} tools (prompt version {}).",
                runId, caseNumber, tools.size(), prompt.version() != null ? prompt.version() : "built-in");

        List<ConversationMessage> history = new ArrayList<>();
        history.add(ConversationMessage.user(INITIAL_USER_MESSAGE_TEMPLATE.formatted(caseNumber)));

        TokenUsage usage = TokenUsage.ZERO;
        JsonNode determination = null;
        int turns = 0;

        while (turns < settings.maxTurns()) {
            if (isCancelled(runId)) {
                log.info("Run {} observed cancellation after {} turns.", runId, turns);
                return RunResult.cancelled(runId);
            }
            int turnNumber = turns + 1;
            long started = System.nanoTime();
            ModelResponse response = modelClient.converse(
                    new ModelRequest(settings.modelId(), prompt.prompt(), history, tools));
            long latencyMs = elapsedMillis(started);

            runStore.appendTurn(new NewTurn(runId, turnNumber, response.content(),
                    response.stopReason(), response.usage(), latencyMs));
            turns = turnNumber;
            usage = usage.plus(response.usage());
            history.add(ConversationMessage.assistant(response.content()));
            log.debug("Run {} turn {} stopped with {} in {} ms.", runId, turnNumber,
                    response.stopReason().wireValue(), latencyMs);

            if (response.stopReason() == StopReason.END_TURN) {
                break;
            }
            if (response.stopReason() == StopReason.TOOL_USE) {
                List<ContentBlock> results = new ArrayList<>();
                int callIndex = 0;
                for (ToolUseBlock toolUse : response.toolUses()) {
                    ToolResult result = executeTool(runId, turnNumber, callIndex++, toolUse);
                    if (settings.determinationTool().equals(toolUse.name())) {
                        Optional<JsonNode> captured = determinationExtractor.extract(result);
                        if (captured.isPresent()) {
                            determination = captured.get();
                            log.info("Run {} captured a determination on turn {}.", runId, turnNumber);
                        }
                    }
                    results.add(new ToolResultBlock(toolUse.toolUseId(), toolUse.name(), result.content(),
                            result.error()));
                }
                history.add(ConversationMessage.user(results));
            }
        }

        if (turns >= settings.maxTurns()) {
            log.warn("Run {} reached the turn budget of {}.", runId, settings.maxTurns());
        }
        if (!runStore.completeRun(runId, new RunCompletion(turns, usage, determination))) {
            log.info("Run {} was cancelled before it could complete.", runId);
            return RunResult.cancelled(runId);
        }
        auditTrail.record(new AuditRecord(caseNumber, AuditEventType.AGENT_RUN_COMPLETED,
                AuditRecord.ActorType.LLM, settings.modelId(),
                detail("runId", runId, "totalTurns", turns, "determined", determination != null)));
        log.info("Run {} completed after {} turns ({} input / {} output tokens).",
                runId, turns, usage.inputTokens(), usage.outputTokens());
        return RunResult.completed(runId, determination);
    }

    private ToolResult executeTool(UUID runId, int turnNumber, int callIndex, ToolUseBlock toolUse) {
        long started = System.nanoTime();
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= settings.toolCallAttempts(); attempt++) {
            try {
                ToolResult result = toolClient.callTool(toolUse.name(), toolUse.input());
                runStore.appendToolCall(new NewToolCall(runId, turnNumber, callIndex, toolUse.toolUseId(),
                        toolUse.name(), toolUse.input(), result.content(), elapsedMillis(started), null));
                return result;
            } catch (RuntimeException ex) {
                lastFailure = ex;
                if (attempt < settings.toolCallAttempts()) {
                    log.warn("Tool {} failed on attempt {} of {}: {}", toolUse.name(), attempt,
                            settings.toolCallAttempts(), ex.getMessage());
                }
            }
        }
        String error = describe(lastFailure);
        runStore.appendToolCall(new NewToolCall(runId, turnNumber, callIndex, toolUse.toolUseId(),
                toolUse.name(), toolUse.input(), null, elapsedMillis(started), error));
        if (lastFailure instanceof ToolExecutionException toolFailure) {
            throw toolFailure;
        }
        throw new ToolExecutionException(toolUse.name(), "Tool " + toolUse.name() + " failed: " + error, lastFailure);
    }

    private boolean isCancelled(UUID runId) {
        return runStore.findStatus(runId)
                .map(status -> status == RunStatus.CANCELLED)
                .orElse(false);
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String describe(@Nullable Throwable ex) {
        if (ex == null) {
            return "Unknown error";
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private static Map<String, Object> detail(Object... keyValues) {
        Map<String, Object> detail = new HashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                detail.put(String.valueOf(keyValues[i]), keyValues[i + 1] instanceof UUID id ? id.toString() : keyValues[i + 1]);
            }
        }
        return detail;
    }
}
