package com.delta.mailverify.api;

import com.delta.mailverify.pipeline.model.PipelineRun;
import com.delta.mailverify.pipeline.model.PipelineRunRequest;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.pipeline.service.MaintenanceScheduler;
import com.delta.mailverify.pipeline.service.PipelineOrchestratorService;
import com.delta.mailverify.verify.bounce.BounceImportResult;
import com.delta.mailverify.verify.bounce.BounceImportService;
import com.delta.mailverify.verify.model.DeadLetterRecord;
import com.delta.mailverify.verify.persistence.DeadLetterRepository;
import com.delta.mailverify.verify.service.CatchAllClassifier;
import com.delta.mailverify.verify.service.CatchAllClassifier.ReclassifyResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class PipelineController {
    private static final int MAX_DEAD_LETTERS = 500;

    private final PipelineOrchestratorService orchestratorService;
    private final PipelineRunRepository runRepository;
    private final BounceImportService bounceImportService;
    private final DeadLetterRepository deadLetterRepository;
    private final CatchAllClassifier catchAllClassifier;
    private final MaintenanceScheduler maintenanceScheduler;

    public PipelineController(
        PipelineOrchestratorService orchestratorService,
        PipelineRunRepository runRepository,
        BounceImportService bounceImportService,
        DeadLetterRepository deadLetterRepository,
        CatchAllClassifier catchAllClassifier,
        MaintenanceScheduler maintenanceScheduler
    ) {
        this.orchestratorService = orchestratorService;
        this.runRepository = runRepository;
        this.bounceImportService = bounceImportService;
        this.deadLetterRepository = deadLetterRepository;
        this.catchAllClassifier = catchAllClassifier;
        this.maintenanceScheduler = maintenanceScheduler;
    }

    @PostMapping("/pipeline/runs")
    public PipelineRun startRun(
        @RequestBody PipelineRunRequest request,
        @RequestParam(name = "async", required = false, defaultValue = "false") boolean async
    ) {
        if (!async) {
            return orchestratorService.startRun(request);
        }
        long runId = orchestratorService.submitRun(request);
        return findRun(runId);
    }

    @GetMapping("/pipeline/runs/{runId}")
    public PipelineRun getRun(@PathVariable("runId") long runId) {
        return findRun(runId);
    }

    @PostMapping("/bounces")
    public BounceImportResult importBounce(@RequestBody String body) {
        return bounceImportService.importMessage(body);
    }

    @GetMapping("/dead-letters")
    public List<DeadLetterRecord> deadLetters(
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return deadLetterRepository.findRecent(Math.max(1, Math.min(limit, MAX_DEAD_LETTERS)));
    }

    @PostMapping("/maintenance/reclassify")
    public List<ReclassifyResult> reclassify(@RequestParam(name = "domain", required = false) String domain) {
        if (domain == null || domain.isBlank()) {
            return catchAllClassifier.reclassifyAll();
        }
        return List.of(catchAllClassifier.reclassifyDomain(domain.trim().toLowerCase(Locale.ROOT)));
    }

    @PostMapping("/maintenance/run")
    public Map<String, Object> runMaintenance() {
        return maintenanceScheduler.runOnce(Instant.now());
    }

    private PipelineRun findRun(long runId) {
        return runRepository.findRun(runId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Run " + runId + " not found"));
    }
}
