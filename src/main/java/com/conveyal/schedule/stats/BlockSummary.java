package com.conveyal.schedule.stats;

/**
 * The service one vehicle runs: when it leaves the first timepoint of its first trip, when it leaves the last
 * timepoint of its last trip, and how much of that is recovery.
 */
public class BlockSummary {
    private int blockNumber;
    private int tripCount;
    private String startTime;
    private String endTime;
    private int serviceMinutes;
    private int recoveryMinutes;

    public int getBlockNumber() {
        return blockNumber;
    }
    public void setBlockNumber(int blockNumber) {
        this.blockNumber = blockNumber;
    }
    public int getTripCount() {
        return tripCount;
    }
    public void setTripCount(int tripCount) {
        this.tripCount = tripCount;
    }
    public String getStartTime() {
        return startTime;
    }
    public void setStartTime(String startTime) {
        this.startTime = startTime;
    }
    public String getEndTime() {
        return endTime;
    }
    public void setEndTime(String endTime) {
        this.endTime = endTime;
    }
    public int getServiceMinutes() {
        return serviceMinutes;
    }
    public void setServiceMinutes(int serviceMinutes) {
        this.serviceMinutes = serviceMinutes;
    }
    public int getRecoveryMinutes() {
        return recoveryMinutes;
    }
    public void setRecoveryMinutes(int recoveryMinutes) {
        this.recoveryMinutes = recoveryMinutes;
    }
}
