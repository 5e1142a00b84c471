package com.containerwatch.tracker.schedule;

import com.containerwatch.tracker.model.JobOutcome;
import com.containerwatch.tracker.model.ScheduleEntry;

/**
 * Delivers the result of a scheduled check to its owner. Only called for outcomes the owner
 * should see: success, not found and fatal failures.
 */
public interface CheckNotifier {

    void deliver(ScheduleEntry entry, JobOutcome outcome);
}
