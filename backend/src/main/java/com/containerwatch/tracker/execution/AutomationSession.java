package com.containerwatch.tracker.execution;

import com.containerwatch.tracker.model.TrackingResult;

/**
 * One exclusive browser context. Not thread safe; used by a single job and closed exactly once.
 */
public interface AutomationSession extends AutoCloseable {

    /**
     * @throws TrackingNotFoundException when the site has no data for {@code query}
     * @throws TransientTrackingException on browser or network trouble worth retrying later
     */
    TrackingResult track(String query, CancellationToken token);

    @Override
    void close();
}
