package com.containerwatch.tracker.api;

import com.containerwatch.tracker.geo.GeoCache;
import com.containerwatch.tracker.geo.GeoCacheMaintenance;
import com.containerwatch.tracker.geo.GeoCacheStats;
import com.containerwatch.tracker.model.JobOutcome;
import com.containerwatch.tracker.model.TrackingJob;
import com.containerwatch.tracker.model.TrackingRequest;
import com.containerwatch.tracker.schedule.JobDispatcher;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class TrackController {
    private final JobDispatcher dispatcher;
    private final GeoCache geoCache;
    private final GeoCacheMaintenance maintenance;

    public TrackController(JobDispatcher dispatcher, GeoCache geoCache, GeoCacheMaintenance maintenance) {
        this.dispatcher = dispatcher;
        this.geoCache = geoCache;
        this.maintenance = maintenance;
    }

    @PostMapping("/track")
    public JobOutcome track(@RequestBody TrackRequest request) {
        if (request == null || request.ownerId() == null || request.ownerId() == 0) {
            throw new IllegalArgumentException("ownerId must not be 0");
        }
        TrackingRequest trackingRequest = new TrackingRequest(request.query(), request.destination());
        return dispatcher.dispatch(new TrackingJob.InteractiveCheck(request.ownerId(), trackingRequest)).join();
    }

    @GetMapping("/geocache/stats")
    public GeoCacheStats geocacheStats() {
        return geoCache.stats();
    }

    @PostMapping("/geocache/evict")
    public Map<String, Integer> evict() {
        int removed = maintenance.sweep();
        return Map.of("removed", removed, "remaining", geoCache.size());
    }
}
