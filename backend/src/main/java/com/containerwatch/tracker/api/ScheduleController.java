package com.containerwatch.tracker.api;

import com.containerwatch.tracker.model.ScheduleEntry;
import com.containerwatch.tracker.schedule.TrackingScheduler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {
    private final TrackingScheduler scheduler;

    public ScheduleController(TrackingScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping
    public List<ScheduleEntry> list(@RequestParam(name = "ownerId", required = false) Long ownerId) {
        if (ownerId == null) {
            return scheduler.entries();
        }
        return scheduler.entriesFor(ownerId);
    }

    @PutMapping
    public ScheduleEntry register(@RequestBody ScheduleRequest request) {
        if (request == null || request.ownerId() == null) {
            throw new IllegalArgumentException("ownerId is required");
        }
        ScheduleEntry entry = new ScheduleEntry(
            request.ownerId(),
            request.query(),
            request.daysOfWeek(),
            request.timeOfDay(),
            null,
            request.enabled() == null || request.enabled(),
            request.destination()
        );
        return scheduler.register(entry);
    }

    @DeleteMapping("/{ownerId}/{query}")
    public ResponseEntity<Void> cancel(@PathVariable("ownerId") long ownerId, @PathVariable("query") String query) {
        if (!scheduler.cancel(ownerId, query)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{ownerId}/{query}/enabled")
    public ResponseEntity<ScheduleEntry> setEnabled(
        @PathVariable("ownerId") long ownerId,
        @PathVariable("query") String query,
        @RequestParam(name = "value") boolean value
    ) {
        return scheduler.setEnabled(ownerId, query, value)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
