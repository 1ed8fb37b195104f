package com.forgebot.worker.api;

import com.forgebot.worker.api.dto.RunResponse;
import com.forgebot.worker.api.dto.TargetResponse;
import com.forgebot.worker.service.RunService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * Read-only view of Runs and their Targets.
 *
 * GET /runs/{id}: aggregate status of a Run
 * GET /runs/{id}/targets: its Targets in processing order
 * GET /runs/targets/{id}: one Target including captured logs (the result URL)
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return runService.findRun(id)
                .map(RunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + id));
    }

    @GetMapping("/{id}/targets")
    public List<TargetResponse> getTargets(@PathVariable UUID id) {
        runService.findRun(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
        return runService.targets(id).stream()
                .map(TargetResponse::from)
                .toList();
    }

    @GetMapping("/targets/{id}")
    public TargetResponse getTarget(@PathVariable UUID id) {
        return runService.findTarget(id)
                .map(t -> TargetResponse.from(t, true))
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Target not found: " + id));
    }
}
