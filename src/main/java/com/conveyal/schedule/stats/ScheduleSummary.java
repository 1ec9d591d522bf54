package com.conveyal.schedule.stats;

/**
 * Totals over all trips of a schedule that have a positive trip time.
 */
public class ScheduleSummary {
    private int tripCount;
    private int totalTripMinutes;
    private int totalTravelMinutes;
    private int totalRecoveryMinutes;
    private double averageRecoveryPercent;

    public int getTripCount() {
        return tripCount;
    }
    public void setTripCount(int tripCount) {
        this.tripCount = tripCount;
    }
    public int getTotalTripMinutes() {
        return totalTripMinutes;
    }
    public void setTotalTripMinutes(int totalTripMinutes) {
        this.totalTripMinutes = totalTripMinutes;
    }
    public int getTotalTravelMinutes() {
        return totalTravelMinutes;
    }
    public void setTotalTravelMinutes(int totalTravelMinutes) {
        this.totalTravelMinutes = totalTravelMinutes;
    }
    public int getTotalRecoveryMinutes() {
        return totalRecoveryMinutes;
    }
    public void setTotalRecoveryMinutes(int totalRecoveryMinutes) {
        this.totalRecoveryMinutes = totalRecoveryMinutes;
    }
    /** Total recovery as a percentage of total travel time. */
    public double getAverageRecoveryPercent() {
        return averageRecoveryPercent;
    }
    public void setAverageRecoveryPercent(double averageRecoveryPercent) {
        this.averageRecoveryPercent = averageRecoveryPercent;
    }

    @Override
    public String toString() {
        return String.format("%d trips, trip time %s, travel time %s, recovery %s (%.1f%%)",
            tripCount,
            ScheduleStats.formatHours(totalTripMinutes),
            ScheduleStats.formatHours(totalTravelMinutes),
            ScheduleStats.formatHours(totalRecoveryMinutes),
            averageRecoveryPercent);
    }
}
