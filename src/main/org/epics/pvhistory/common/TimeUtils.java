/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.common;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * There are two clocks in play when talking to the archiver.
 * <ol>
 * <li>The wall clock - this is what users type in, using the <code>MM/dd/yyyy HH:mm:ss</code> format.
 * Internally we carry wall clock times as "wall clock epoch seconds"; that is, the wall clock reading interpreted on the UTC scale, as a double.</li>
 * <li>The service clock - the archiver speaks UTC; both in the ISO 8601 request parameters and in the secs/nanos of the returned samples.</li>
 * </ol>
 * The two are separated by a fixed offset; the service time is the wall clock time plus the offset.
 * This class contains utilities to convert between these.
 */
public class TimeUtils {
    /**
     * Wall clock format accepted in the configuration.
     */
    public static final String WALL_CLOCK_FORMAT = "MM/dd/yyyy HH:mm:ss";

    /**
     * The wall clock at SLAC is seven hours behind UTC during daylight savings time.
     */
    public static final int DEFAULT_UTC_OFFSET_HOURS = 7;

    private static final String ISO_DATE_MILLIS_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";
    private static final DateTimeFormatter WALL_CLOCK_FORMATTER = DateTimeFormatter.ofPattern(WALL_CLOCK_FORMAT);
    private static final Logger logger = LogManager.getLogger(TimeUtils.class);

    private TimeUtils() {}

    /**
     * Parse a wall clock string
     * @param tsstr Sample 06/05/2023 08:08:08
     * @return LocalDateTime
     * @throws DateTimeParseException if the string does not match {@link #WALL_CLOCK_FORMAT}
     */
    public static LocalDateTime parseWallClock(String tsstr) {
        if (StringUtils.isBlank(tsstr)) {
            throw new DateTimeParseException("Empty wall clock string", String.valueOf(tsstr), 0);
        }
        return LocalDateTime.parse(tsstr.trim(), WALL_CLOCK_FORMATTER);
    }

    public static String formatWallClock(LocalDateTime ts) {
        return WALL_CLOCK_FORMATTER.format(ts);
    }

    public static double toWallClockEpochSeconds(LocalDateTime ts) {
        return ts.toEpochSecond(ZoneOffset.UTC) + ts.getNano() / 1000000000.0;
    }

    public static LocalDateTime fromWallClockEpochSeconds(double epochSeconds) {
        long secs = (long) Math.floor(epochSeconds);
        int nanos = (int) Math.round((epochSeconds - secs) * 1000000000.0);
        if (nanos >= 1000000000) {
            secs++;
            nanos -= 1000000000;
        }
        return LocalDateTime.ofEpochSecond(secs, nanos, ZoneOffset.UTC);
    }

    /**
     * Convert a wall clock time into the instant the service understands.
     * @param ts Wall clock time
     * @param utcOffsetSeconds Seconds to add to the wall clock to get UTC
     * @return Instant
     */
    public static Instant convertWallClockToServiceInstant(LocalDateTime ts, long utcOffsetSeconds) {
        return ts.toInstant(ZoneOffset.UTC).plusSeconds(utcOffsetSeconds);
    }

    /**
     * Convert a secs/nanos pair as returned by the service into wall clock epoch seconds.
     * @param secs Java epoch seconds (UTC)
     * @param nanos Nanos into the second
     * @param utcOffsetSeconds Seconds to add to the wall clock to get UTC
     * @return Wall clock epoch seconds
     */
    public static double convertServiceTimeToWallClockSeconds(long secs, long nanos, long utcOffsetSeconds) {
        return (secs - utcOffsetSeconds) + nanos / 1000000000.0;
    }

    public static String convertToISO8601String(Instant ts) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(ISO_DATE_MILLIS_FORMAT);
        var truncTs = ts.truncatedTo(ChronoUnit.MILLIS).atZone(ZoneId.from(ZoneOffset.UTC));
        return formatter.format(truncTs);
    }

    public static Instant convertFromISO8601String(String tsstr) {
        // Sample ISO8601 string 2011-02-01T08:00:00.000Z
        return Instant.parse(tsstr);
    }

    public static Duration hoursToDuration(double hours) {
        return Duration.ofNanos(Math.round(hours * 3600.0 * 1000000000.0));
    }

    public static double durationToHours(Duration duration) {
        return duration.getSeconds() / 3600.0 + duration.getNano() / 3600.0e9;
    }

    /**
     * Log a wall clock time along with its service equivalent; used when debugging offset issues.
     * @param label What this time is
     * @param ts Wall clock time
     * @param utcOffsetSeconds Seconds to add to the wall clock to get UTC
     */
    public static void logTimeConversion(String label, LocalDateTime ts, long utcOffsetSeconds) {
        if (logger.isDebugEnabled()) {
            logger.debug("{} wall clock {} is {} on the service clock",
                    label, formatWallClock(ts), convertToISO8601String(convertWallClockToServiceInstant(ts, utcOffsetSeconds)));
        }
    }
}
