package com.lucidreview.orchestration.service;

import com.lucidreview.entity.AgentRun;
import com.lucidreview.entity.AgentToolCall;
import com.lucidreview.entity.AgentTurn;
import com.lucidreview.entity.RunStatus;
import com.lucidreview.orchestration.api.RunStore;
import com.lucidreview.orchestration.model.NewToolCall;
import com.lucidreview.orchestration.model.NewTurn;
import com.lucidreview.orchestration.model.RunCompletion;
import com.lucidreview.orchestration.model.RunTrace;
import com.lucidreview.orchestration.model.RunView;
import com.lucidreview.orchestration.model.ToolCallView;
import com.lucidreview.orchestration.model.TurnTrace;
import com.lucidreview.orchestration.model.TurnView;
import com.lucidreview.repository.AgentRunRepository;
import com.lucidreview.repository.AgentToolCallRepository;
import com.lucidreview.repository.AgentTurnRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.lucidreview.orchestration.OrchestrationConstants.ROLE_ASSISTANT;

@Service
@RequiredArgsConstructor
public class RunPersistenceService implements RunStore {

    private static final Set<RunStatus> ACTIVE = EnumSet.of(RunStatus.PENDING, RunStatus.RUNNING);

    private final AgentRunRepository runRepository;
    private final AgentTurnRepository turnRepository;
    private final AgentToolCallRepository toolCallRepository;
    private final JsonProcessingService jsonProcessingService;
    private final Clock clock;

    @Override
    @Transactional
    public void createPendingRun(UUID runId, String caseNumber, String modelId) {
        runRepository.save(AgentRun.builder()
                .id(runId)
                .caseNumber(caseNumber)
                .status(RunStatus.PENDING)
                .modelId(modelId)
                .startedAt(now())
                .build());
    }

    @Override
    @Transactional
    public void createRunningRun(UUID runId, String caseNumber, String modelId, @Nullable String promptVersion) {
        runRepository.save(AgentRun.builder()
                .id(runId)
                .caseNumber(caseNumber)
                .status(RunStatus.RUNNING)
                .modelId(modelId)
                .promptVersion(promptVersion)
                .startedAt(now())
                .build());
    }

    @Override
    @Transactional
    public boolean markRunning(UUID runId, String modelId, @Nullable String promptVersion) {
        return runRepository.transition(runId, RunStatus.PENDING, RunStatus.RUNNING,
                modelId, promptVersion, now()) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RunStatus> findStatus(UUID runId) {
        return runRepository.findStatusById(runId);
    }

    @Override
    @Transactional
    public void appendTurn(NewTurn turn) {
        turnRepository.save(AgentTurn.builder()
                .run(runRepository.getReferenceById(turn.runId()))
                .turnNumber(turn.turnNumber())
                .role(ROLE_ASSISTANT)
                .content(jsonProcessingService.writeContentBlocks(turn.content()))
                .stopReason(turn.stopReason().wireValue())
                .inputTokens(turn.usage().inputTokens())
                .outputTokens(turn.usage().outputTokens())
                .latencyMs(turn.latencyMs())
                .build());
    }

    @Override
    @Transactional
    public void appendToolCall(NewToolCall toolCall) {
        toolCallRepository.save(AgentToolCall.builder()
                .run(runRepository.getReferenceById(toolCall.runId()))
                .turnNumber(toolCall.turnNumber())
                .callIndex(toolCall.callIndex())
                .toolUseId(toolCall.toolUseId())
                .toolName(toolCall.toolName())
                .input(jsonProcessingService.toJson(toolCall.input()))
                .output(jsonProcessingService.toJsonOrNull(toolCall.output()))
                .latencyMs(toolCall.latencyMs())
                .error(toolCall.error())
                .build());
    }

    @Override
    @Transactional
    public boolean completeRun(UUID runId, RunCompletion completion) {
        return runRepository.complete(runId, RunStatus.RUNNING, RunStatus.COMPLETED,
                jsonProcessingService.toJsonOrNull(completion.determination()),
                completion.totalTurns(),
                completion.usage().inputTokens(),
                completion.usage().outputTokens(),
                now()) == 1;
    }

    @Override
    @Transactional
    public boolean failRun(UUID runId, String error) {
        return runRepository.finish(runId, ACTIVE, RunStatus.FAILED, error, now()) == 1;
    }

    @Override
    @Transactional
    public boolean cancelRun(UUID runId) {
        return runRepository.finish(runId, ACTIVE, RunStatus.CANCELLED, null, now()) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RunView> findRun(UUID runId) {
        return runRepository.findById(runId).map(this::toView);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RunView> findRunsForCase(String caseNumber) {
        return runRepository.findByCaseNumberOrderByStartedAtDesc(caseNumber).stream()
                .map(this::toView)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RunTrace> loadTrace(UUID runId) {
        return runRepository.findById(runId).map(run -> {
            Map<Integer, List<ToolCallView>> callsByTurn = toolCallRepository
                    .findByRun_IdOrderByTurnNumberAscCallIndexAsc(runId).stream()
                    .map(call -> toView(runId, call))
                    .collect(Collectors.groupingBy(ToolCallView::turnNumber));
            List<TurnTrace> turns = turnRepository.findByRun_IdOrderByTurnNumberAsc(runId).stream()
                    .map(turn -> new TurnTrace(toView(runId, turn),
                            callsByTurn.getOrDefault(turn.getTurnNumber(), List.of())))
                    .toList();
            return new RunTrace(toView(run), turns);
        });
    }

    private RunView toView(AgentRun run) {
        return new RunView(
                run.getId(),
                run.getCaseNumber(),
                run.getStatus(),
                run.getModelId(),
                run.getPromptVersion(),
                run.getTotalTurns(),
                jsonProcessingService.readTree(run.getDetermination()),
                run.getError(),
                run.getInputTokensTotal(),
                run.getOutputTokensTotal(),
                run.getStartedAt(),
                run.getCompletedAt());
    }

    private TurnView toView(UUID runId, AgentTurn turn) {
        return new TurnView(
                turn.getId(),
                runId,
                turn.getTurnNumber(),
                turn.getRole(),
                jsonProcessingService.readContentBlocks(turn.getContent()),
                turn.getStopReason(),
                turn.getInputTokens(),
                turn.getOutputTokens(),
                turn.getLatencyMs(),
                turn.getCreatedAt());
    }

    private ToolCallView toView(UUID runId, AgentToolCall call) {
        return new ToolCallView(
                call.getId(),
                runId,
                call.getTurnNumber(),
                call.getToolUseId(),
                call.getToolName(),
                jsonProcessingService.readTree(call.getInput()),
                jsonProcessingService.readTree(call.getOutput()),
                call.getLatencyMs(),
                call.getError(),
                call.getCreatedAt());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
