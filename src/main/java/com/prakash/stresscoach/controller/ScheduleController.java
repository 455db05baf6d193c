package com.prakash.stresscoach.controller;

import com.prakash.stresscoach.dto.QuickScheduleRequest;
import com.prakash.stresscoach.dto.ScheduleRequest;
import com.prakash.stresscoach.dto.ScheduleResult;
import com.prakash.stresscoach.dto.ScoreRequest;
import com.prakash.stresscoach.dto.StressAnalysis;
import com.prakash.stresscoach.exception.InvalidScheduleRequestException;
import com.prakash.stresscoach.model.ScoredTask;
import com.prakash.stresscoach.service.StressSchedulingService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/schedule") // Base path for scheduling endpoints
public class ScheduleController {

    private static final Logger log = LoggerFactory.getLogger(ScheduleController.class);

    private final StressSchedulingService schedulingService;

    @Autowired
    public ScheduleController(StressSchedulingService schedulingService) {
        this.schedulingService = schedulingService;
    }

    /**
     * Endpoint to build a schedule from structured tasks and time windows.
     *
     * @param request tasks, windows, stress level and mood
     * @return the schedule with one item per task, in request order
     */
    @PostMapping
    public ResponseEntity<ScheduleResult> schedule(@Valid @RequestBody ScheduleRequest request) {
        log.info("Received schedule request: {} tasks, {} windows, stress {}",
                request.getTasks().size(), request.getWindows().size(), request.getStressLevel());
        try {
            return ResponseEntity.ok(schedulingService.schedule(request));
        } catch (InvalidScheduleRequestException e) {
            // @ResponseStatus maps this to 400
            log.warn("Schedule request rejected: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Endpoint for the line-based quick entry form.
     *
     * @param request task lines ("Title | Duration | Priority | Deadline") and window lines ("09:00-11:00 Label")
     * @return the schedule for the parsed tasks
     */
    @PostMapping("/quick")
    public ResponseEntity<ScheduleResult> scheduleQuickEntry(@Valid @RequestBody QuickScheduleRequest request) {
        log.info("Received quick-entry schedule request at stress {}", request.getStressLevel());
        try {
            return ResponseEntity.ok(schedulingService.scheduleQuickEntry(request));
        } catch (InvalidScheduleRequestException e) {
            log.warn("Quick-entry request rejected: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Endpoint to preview task ranking without placing anything.
     */
    @PostMapping("/score")
    public ResponseEntity<List<ScoredTask>> scoreTasks(@Valid @RequestBody ScoreRequest request) {
        log.debug("Received scoring request for {} tasks", request.getTasks().size());
        return ResponseEntity.ok(schedulingService.scoreTasks(request.getTasks(), request.getStressLevel()));
    }

    @GetMapping("/stress-profile")
    public ResponseEntity<StressAnalysis> stressProfile(@RequestParam int level) {
        log.debug("Received stress profile request for level {}", level);
        return ResponseEntity.ok(schedulingService.stressProfile(level));
    }
}
