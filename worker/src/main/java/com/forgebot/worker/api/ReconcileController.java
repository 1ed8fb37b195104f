package com.forgebot.worker.api;

import com.forgebot.worker.babysit.Babysitter;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * On-demand reconciliation, for when waiting for the next sweep is too slow.
 *
 * POST /reconcile/builds/{buildId}: check one build now; {@code resolved}
 *                                    is false while the build is still running
 */
@RestController
@RequestMapping("/reconcile")
public class ReconcileController {

    private final Babysitter babysitter;

    public ReconcileController(Babysitter babysitter) {
        this.babysitter = babysitter;
    }

    @PostMapping("/builds/{buildId}")
    public Map<String, Object> checkBuild(@PathVariable String buildId) {
        return Map.of("buildId", buildId, "resolved", babysitter.checkBuild(buildId));
    }
}
