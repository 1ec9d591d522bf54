package com.conveyal.schedule.model;

import java.io.Serializable;

/**
 * One row of a travel time analysis: observed running time between two timepoints during a 30 minute window.
 */
public class TravelTimeRow implements Serializable {

    private static final long serialVersionUID = 1L;

    public String fromTimePoint;
    public String toTimePoint;
    /** Window label such as "07:00 - 07:29". */
    public String timePeriod;
    public double percentile50;
    public double percentile80;

    public TravelTimeRow () { }

    public TravelTimeRow (String fromTimePoint, String toTimePoint, String timePeriod, double percentile50, double percentile80) {
        this.fromTimePoint = fromTimePoint;
        this.toTimePoint = toTimePoint;
        this.timePeriod = timePeriod;
        this.percentile50 = percentile50;
        this.percentile80 = percentile80;
    }

}
