package com.containerwatch.tracker.model;

/**
 * The closed set of work the dispatcher accepts. Scheduled and interactive checks share the
 * automation gate but differ in timeout and in who consumes the outcome.
 */
public sealed interface TrackingJob permits TrackingJob.ScheduledCheck, TrackingJob.InteractiveCheck {

    long ownerId();

    TrackingRequest request();

    String kind();

    record ScheduledCheck(ScheduleEntry entry) implements TrackingJob {
        @Override
        public long ownerId() {
            return entry.ownerId();
        }

        @Override
        public TrackingRequest request() {
            return new TrackingRequest(entry.query(), entry.destination());
        }

        @Override
        public String kind() {
            return "scheduled";
        }
    }

    record InteractiveCheck(long ownerId, TrackingRequest request) implements TrackingJob {
        @Override
        public String kind() {
            return "interactive";
        }
    }
}
