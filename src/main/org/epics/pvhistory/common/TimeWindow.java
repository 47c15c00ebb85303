/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.common;

import org.epics.pvhistory.config.exception.ConfigException;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Wall clock time window with start and end times; the start is always strictly before the end.
 */
public final class TimeWindow {
    /**
     * Tolerance (in hours) when checking that a start, end and duration agree with each other.
     */
    public static final double DURATION_TOLERANCE_HOURS = 1e-6;

    private final LocalDateTime startTime;
    private final LocalDateTime endTime;

    private TimeWindow(LocalDateTime startTime, LocalDateTime endTime) {
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public static TimeWindow of(LocalDateTime startTime, LocalDateTime endTime) throws ConfigException {
        if (startTime == null || endTime == null) {
            throw new ConfigException("Both the start and the end of a time window are needed");
        }
        if (!startTime.isBefore(endTime)) {
            throw new ConfigException("The start time " + TimeUtils.formatWallClock(startTime)
                    + " has to be before the end time " + TimeUtils.formatWallClock(endTime));
        }
        return new TimeWindow(startTime, endTime);
    }

    public static TimeWindow endingAt(LocalDateTime endTime, double durationHours) throws ConfigException {
        checkDuration(durationHours);
        return of(endTime.minus(TimeUtils.hoursToDuration(durationHours)), endTime);
    }

    public static TimeWindow startingAt(LocalDateTime startTime, double durationHours) throws ConfigException {
        checkDuration(durationHours);
        return of(startTime, startTime.plus(TimeUtils.hoursToDuration(durationHours)));
    }

    /**
     * Resolve a window from any two of start, end and duration.
     * If all three are supplied, they have to agree within {@link #DURATION_TOLERANCE_HOURS}.
     * @param startTime Wall clock start; may be null
     * @param endTime Wall clock end; may be null
     * @param durationHours Duration in hours; may be null
     * @return TimeWindow
     * @throws ConfigException if fewer than two are supplied or if they are inconsistent
     */
    public static TimeWindow resolve(LocalDateTime startTime, LocalDateTime endTime, Double durationHours) throws ConfigException {
        if (startTime != null && endTime != null) {
            TimeWindow window = of(startTime, endTime);
            if (durationHours != null && Math.abs(window.getDurationHours() - durationHours) > DURATION_TOLERANCE_HOURS) {
                throw new ConfigException("The start time " + TimeUtils.formatWallClock(startTime)
                        + ", end time " + TimeUtils.formatWallClock(endTime)
                        + " and duration of " + durationHours + " hours do not satisfy duration = end - start");
            }
            return window;
        }
        if (endTime != null && durationHours != null) {
            return endingAt(endTime, durationHours);
        }
        if (startTime != null && durationHours != null) {
            return startingAt(startTime, durationHours);
        }
        throw new ConfigException("Need at least two of start time, end time and duration to determine the time window");
    }

    private static void checkDuration(double durationHours) throws ConfigException {
        if (Double.isNaN(durationHours) || Double.isInfinite(durationHours) || durationHours <= 0) {
            throw new ConfigException("The duration has to be a positive number of hours; got " + durationHours);
        }
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public LocalDateTime getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    public double getDurationHours() {
        return TimeUtils.durationToHours(getDuration());
    }

    public double getStartEpochSeconds() {
        return TimeUtils.toWallClockEpochSeconds(startTime);
    }

    public double getEndEpochSeconds() {
        return TimeUtils.toWallClockEpochSeconds(endTime);
    }

    /**
     * True if the wall clock epoch seconds fall within this window, both ends inclusive.
     * @param epochSeconds Wall clock epoch seconds
     * @return boolean True or False
     */
    public boolean contains(double epochSeconds) {
        return epochSeconds >= getStartEpochSeconds() && epochSeconds <= getEndEpochSeconds();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof TimeWindow)) return false;
        TimeWindow that = (TimeWindow) other;
        return startTime.equals(that.startTime) && endTime.equals(that.endTime);
    }

    @Override
    public int hashCode() {
        return 31 * startTime.hashCode() + endTime.hashCode();
    }

    @Override
    public String toString() {
        return TimeUtils.formatWallClock(this.startTime) + " - " + TimeUtils.formatWallClock(this.endTime);
    }
}
