package com.lucidreview.api;

import com.lucidreview.entity.RunStatus;
import com.lucidreview.orchestration.model.AuditEventView;
import com.lucidreview.orchestration.model.RunTrace;
import com.lucidreview.orchestration.model.RunView;
import com.lucidreview.orchestration.service.AgentRunService;
import com.lucidreview.queue.QueueStats;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/agent-runs")
public class AgentRunController {

    private final AgentRunService agentRunService;

    public AgentRunController(AgentRunService agentRunService) {
        this.agentRunService = agentRunService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CreateRunResponse create(@Valid @RequestBody CreateRunRequest request) {
        UUID runId = agentRunService.createAndEnqueue(request.caseNumber().trim());
        return new CreateRunResponse(runId, RunStatus.PENDING);
    }

    @GetMapping
    public List<RunView> listForCase(@RequestParam String caseNumber) {
        return agentRunService.getRunsForCase(caseNumber);
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunView> get(@PathVariable UUID runId) {
        return ResponseEntity.of(agentRunService.getRun(runId));
    }

    @GetMapping("/{runId}/trace")
    public ResponseEntity<RunTrace> trace(@PathVariable UUID runId) {
        return ResponseEntity.of(agentRunService.getTrace(runId));
    }

    @DeleteMapping("/{runId}")
    public CancelRunResponse delete(@PathVariable UUID runId) {
        return cancel(runId);
    }

    @PostMapping("/{runId}/cancel")
    public CancelRunResponse cancel(@PathVariable UUID runId) {
        return agentRunService.cancelRun(runId) ? CancelRunResponse.success() : CancelRunResponse.notCancellable();
    }

    @GetMapping("/queue/stats")
    public QueueStats queueStats() {
        return agentRunService.queueStats();
    }

    @GetMapping("/audit")
    public List<AuditEventView> audit(@RequestParam String caseNumber) {
        return agentRunService.getAuditTrail(caseNumber);
    }
}
