package com.conveyal.schedule.model;

import java.io.Serializable;

/**
 * The service window of one vehicle, from which a chain of back-to-back trips is generated.
 */
public class BlockConfiguration implements Serializable {

    private static final long serialVersionUID = 1L;

    public int blockNumber;
    /** HH:MM */
    public String startTime;
    /** HH:MM, no trip starts at or after this time. */
    public String endTime;
    /** Band to use for every trip of the block, or null to classify each trip by its departure time. */
    public String serviceBand;

    public BlockConfiguration () { }

    public BlockConfiguration (int blockNumber, String startTime, String endTime) {
        this.blockNumber = blockNumber;
        this.startTime = startTime;
        this.endTime = endTime;
    }

}
