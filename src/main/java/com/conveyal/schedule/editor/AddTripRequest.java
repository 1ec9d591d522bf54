package com.conveyal.schedule.editor;

/**
 * Parameters for inserting a single trip. Use the static factories, which require the fields each mode needs.
 */
public class AddTripRequest {

    public enum Mode {
        /** Continue the block of the anchor trip after its last trip. */
        AFTER_LAST,
        /** Run a trip in the anchor trip's block that ends exactly when the block's first trip starts. */
        EARLY,
        /** Run a trip on a vehicle of its own, between existing blocks. */
        MID_ROUTE
    }

    public final Mode mode;
    /** Trip whose block the new trip joins. Null for mid-route trips. */
    public final Integer anchorTripNumber;
    public final Integer startTime;
    public final Integer targetEndTime;
    /** Band to generate the trip with, or null to classify it by its start time. */
    public final String serviceBand;

    private AddTripRequest (Mode mode, Integer anchorTripNumber, Integer startTime, Integer targetEndTime, String serviceBand) {
        this.mode = mode;
        this.anchorTripNumber = anchorTripNumber;
        this.startTime = startTime;
        this.targetEndTime = targetEndTime;
        this.serviceBand = serviceBand;
    }

    public static AddTripRequest afterLast (int anchorTripNumber, String serviceBand) {
        return new AddTripRequest(Mode.AFTER_LAST, anchorTripNumber, null, null, serviceBand);
    }

    public static AddTripRequest early (int anchorTripNumber, int startTime, String serviceBand) {
        return new AddTripRequest(Mode.EARLY, anchorTripNumber, startTime, null, serviceBand);
    }

    /** @param targetEndTime when the trip should leave its last timepoint, or null to use standard running times. */
    public static AddTripRequest midRoute (int startTime, Integer targetEndTime, String serviceBand) {
        return new AddTripRequest(Mode.MID_ROUTE, null, startTime, targetEndTime, serviceBand);
    }

    @Override
    public String toString () {
        return String.format("AddTripRequest %s (anchor %s, start %s, end %s, band %s)",
            mode, anchorTripNumber, startTime, targetEndTime, serviceBand);
    }
}
