package com.lucidreview.orchestration.api;

import com.lucidreview.entity.RunStatus;
import com.lucidreview.orchestration.model.NewToolCall;
import com.lucidreview.orchestration.model.NewTurn;
import com.lucidreview.orchestration.model.RunCompletion;
import com.lucidreview.orchestration.model.RunTrace;
import com.lucidreview.orchestration.model.RunView;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store for agent runs, their turns and their tool calls. The only mutable data
 * is the status and summary fields of a run row, and every status change is conditional on
 * the current status so terminal runs stay immutable.
 */
public interface RunStore {

    /**
     * Inserts a run that is queued but not yet picked up by a worker.
     *
     * @param runId The identifier shared by the run and its queue job.
     * @param caseNumber The case under review.
     * @param modelId The model the run is expected to use.
     */
    void createPendingRun(UUID runId, String caseNumber, String modelId);

    /**
     * Inserts a run directly in the {@link RunStatus#RUNNING} state.
     *
     * @param runId The identifier of the new run.
     * @param caseNumber The case under review.
     * @param modelId The model used for the run.
     * @param promptVersion The active prompt version, or {@code null} for the built-in prompt.
     */
    void createRunningRun(UUID runId, String caseNumber, String modelId, @Nullable String promptVersion);

    /**
     * Moves a pending run to {@link RunStatus#RUNNING}.
     *
     * @return {@code true} if the run was pending and is now running.
     */
    boolean markRunning(UUID runId, String modelId, @Nullable String promptVersion);

    /**
     * Current persisted status, re-read from the store on every call.
     */
    Optional<RunStatus> findStatus(UUID runId);

    /**
     * Persists one model response as a turn row.
     */
    void appendTurn(NewTurn turn);

    /**
     * Persists one tool invocation, successful or not.
     */
    void appendToolCall(NewToolCall toolCall);

    /**
     * Finalizes a running run as {@link RunStatus#COMPLETED}.
     *
     * @return {@code false} if the run was no longer running (for example, cancelled meanwhile).
     */
    boolean completeRun(UUID runId, RunCompletion completion);

    /**
     * Marks a pending or running run as {@link RunStatus#FAILED}.
     *
     * @return {@code false} if the run had already reached a terminal state.
     */
    boolean failRun(UUID runId, String error);

    /**
     * Marks a pending or running run as {@link RunStatus#CANCELLED}.
     *
     * @return {@code false} if the run does not exist or had already reached a terminal state.
     */
    boolean cancelRun(UUID runId);

    Optional<RunView> findRun(UUID runId);

    List<RunView> findRunsForCase(String caseNumber);

    /**
     * Reconstructs the full trace: the run plus its turns ordered by turn number, each with the
     * tool calls it produced. Reading never mutates anything.
     */
    Optional<RunTrace> loadTrace(UUID runId);
}
