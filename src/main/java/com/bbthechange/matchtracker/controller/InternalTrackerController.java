package com.bbthechange.matchtracker.controller;

import com.bbthechange.matchtracker.dto.TickResult;
import com.bbthechange.matchtracker.dto.TrackerStatus;
import com.bbthechange.matchtracker.dto.UpcomingMatchSummary;
import com.bbthechange.matchtracker.service.MatchTrackerService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Internal diagnostics for the tracker: manual tick, upcoming matches and poll state.
 * Not meant to be exposed publicly.
 */
@RestController
@RequestMapping("/internal/tracker")
public class InternalTrackerController {

    private static final Logger logger = LoggerFactory.getLogger(InternalTrackerController.class);

    private final MatchTrackerService trackerService;
    private final MeterRegistry meterRegistry;

    public InternalTrackerController(MatchTrackerService trackerService, MeterRegistry meterRegistry) {
        this.trackerService = trackerService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a tick now. Returns 409 if a tick was already running.
     */
    @PostMapping("/tick")
    public ResponseEntity<TickResult> triggerTick() {
        logger.info("Manual tick triggered");
        meterRegistry.counter("tracker_manual_tick_total").increment();

        TickResult result = trackerService.tick();
        if (TickResult.STATUS_SKIPPED.equals(result.getStatus())) {
            return ResponseEntity.status(409).body(result);
        }
        if (TickResult.STATUS_ERROR.equals(result.getStatus())) {
            return ResponseEntity.internalServerError().body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/upcoming")
    public ResponseEntity<List<UpcomingMatchSummary>> getUpcoming() {
        return ResponseEntity.ok(trackerService.getUpcomingSummary());
    }

    @GetMapping("/state")
    public ResponseEntity<TrackerStatus> getState() {
        return ResponseEntity.ok(trackerService.getStatus());
    }
}
