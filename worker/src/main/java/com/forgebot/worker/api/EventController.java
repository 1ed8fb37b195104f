package com.forgebot.worker.api;

import com.forgebot.worker.api.dto.DispatchResponse;
import com.forgebot.worker.api.dto.SubmitEventRequest;
import com.forgebot.worker.dispatch.Dispatcher;
import com.forgebot.worker.dispatch.HandlerInvocation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Intake for normalized events.
 *
 * POST /events: classify the event and schedule its handlers; 202 with the
 *                scheduled (handler, job) list, which may be empty
 */
@RestController
@RequestMapping("/events")
public class EventController {

    private final Dispatcher dispatcher;

    public EventController(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping
    public ResponseEntity<DispatchResponse> submit(@RequestBody SubmitEventRequest req) {
        if (req.event() == null || req.packageConfig() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Both event and packageConfig are required");
        }
        List<HandlerInvocation> scheduled = dispatcher.dispatch(req.event(), req.packageConfig());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(DispatchResponse.from(scheduled));
    }
}
