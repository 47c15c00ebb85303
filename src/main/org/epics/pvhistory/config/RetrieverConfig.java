/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.config;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.epics.pvhistory.common.TimeUtils;
import org.epics.pvhistory.common.TimeWindow;
import org.epics.pvhistory.config.exception.ConfigException;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * The configuration of a {@link org.epics.pvhistory.retrieval.HistoryRetriever}.
 * Every setter validates its argument; a setter that throws leaves the configuration unchanged.
 * <p>
 * The time window is kept consistent with the duration.
 * Setting the start time moves the end time; setting the end time moves the start time; setting the duration moves the start time.
 */
public class RetrieverConfig {
    private static final Logger logger = LogManager.getLogger(RetrieverConfig.class);

    public static final double DEFAULT_DURATION_HOURS = 4.0;

    private List<String> signals;
    private ArchiverServer server;
    private TimeWindow window;
    private AlignSetup alignSetup;
    private double utcOffsetHours;
    private int fetchMaxThreads;
    private int fetchTimeoutMillis;

    private RetrieverConfig(List<String> signals, ArchiverServer server, TimeWindow window, AlignSetup alignSetup,
            double utcOffsetHours, int fetchMaxThreads, int fetchTimeoutMillis) {
        this.signals = signals;
        this.server = server;
        this.window = window;
        this.alignSetup = alignSetup;
        this.utcOffsetHours = utcOffsetHours;
        this.fetchMaxThreads = fetchMaxThreads;
        this.fetchTimeoutMillis = fetchTimeoutMillis;
    }

    public static Builder builder(InstallationProperties installationProperties) {
        return new Builder(installationProperties);
    }

    /**
     * @return An independent copy of this configuration
     */
    public RetrieverConfig copy() {
        return new RetrieverConfig(signals, server, window, alignSetup, utcOffsetHours, fetchMaxThreads, fetchTimeoutMillis);
    }

    public List<String> getSignals() {
        return signals;
    }

    public void setSignals(List<String> newSignals) throws ConfigException {
        List<String> cleaned = cleanSignals(newSignals);
        AlignSetup newSetup;
        int newIndex = cleaned.indexOf(alignSetup.getReferenceSignal());
        if (newIndex >= 0) {
            newSetup = alignSetup.withReference(alignSetup.getReferenceSignal(), newIndex);
        } else {
            logger.warn("Reference signal " + alignSetup.getReferenceSignal() + " is no longer configured; using " + cleaned.get(0) + " as the reference");
            newSetup = alignSetup.withReference(cleaned.get(0), 0);
        }
        this.signals = cleaned;
        this.alignSetup = newSetup;
    }

    public void setSignal(String signal) throws ConfigException {
        setSignals(Collections.singletonList(signal));
    }

    public ArchiverServer getServer() {
        return server;
    }

    public void setServer(ArchiverServer server) throws ConfigException {
        if (server == null) {
            throw new ConfigException("The archiver server cannot be null");
        }
        this.server = server;
    }

    public void setServer(String serverName) throws ConfigException {
        setServer(ArchiverServer.fromName(serverName));
    }

    public TimeWindow getWindow() {
        return window;
    }

    public LocalDateTime getStartTime() {
        return window.getStartTime();
    }

    public LocalDateTime getEndTime() {
        return window.getEndTime();
    }

    public double getDurationHours() {
        return window.getDurationHours();
    }

    public void setStartTime(LocalDateTime startTime) throws ConfigException {
        if (startTime == null) throw new ConfigException("The start time cannot be null");
        this.window = TimeWindow.startingAt(startTime, window.getDurationHours());
    }

    public void setStartTime(String startTime) throws ConfigException {
        setStartTime(parseWallClock("start time", startTime));
    }

    public void setEndTime(LocalDateTime endTime) throws ConfigException {
        if (endTime == null) throw new ConfigException("The end time cannot be null");
        this.window = TimeWindow.endingAt(endTime, window.getDurationHours());
    }

    public void setEndTime(String endTime) throws ConfigException {
        setEndTime(parseWallClock("end time", endTime));
    }

    public void setDurationHours(double durationHours) throws ConfigException {
        this.window = TimeWindow.endingAt(window.getEndTime(), durationHours);
    }

    public void setDurationHours(Number durationHours) throws ConfigException {
        if (durationHours == null) {
            throw new ConfigException("duration_hour must be a number");
        }
        setDurationHours(durationHours.doubleValue());
    }

    public AlignSetup getAlignSetup() {
        return alignSetup;
    }

    public void setAlignSetup(AlignSetup newSetup) throws ConfigException {
        if (newSetup == null) {
            throw new ConfigException("alignSetup cannot be null");
        }
        checkReference(signals, newSetup);
        this.alignSetup = newSetup;
    }

    public void setAlignSetup(Map<String, ?> setup) throws ConfigException {
        setAlignSetup(AlignSetup.fromMap(setup));
    }

    /**
     * Change the reference signal and its trim parameters.
     * If the signal name is specified, it takes precedence over the index.
     * @param referenceSignal Name of the reference; may be null if the index is specified
     * @param referenceIndex Position of the reference in the signal list; may be null if the name is specified
     * @param valueRanges Valid ranges for the reference
     * @param bridgeSeconds Seam inserted for each trimmed interval
     * @param resampleSeconds Resample interval
     * @param trim Whether to trim out-of-range data
     * @throws ConfigException if the reference is not a configured signal, or the index is out of range
     */
    public void setBaseSignal(String referenceSignal, Integer referenceIndex, List<ValueRange> valueRanges,
            double bridgeSeconds, double resampleSeconds, boolean trim) throws ConfigException {
        String name;
        int index;
        if (StringUtils.isNotBlank(referenceSignal)) {
            index = signals.indexOf(referenceSignal);
            if (index < 0) {
                throw new ConfigException("The base PV '" + referenceSignal + "' is not in the list of PV names.");
            }
            name = referenceSignal;
        } else if (referenceIndex != null) {
            if (referenceIndex < 0 || referenceIndex >= signals.size()) {
                throw new ConfigException("The base ID '" + referenceIndex + "' is out of range.");
            }
            index = referenceIndex;
            name = signals.get(index);
        } else {
            throw new ConfigException("Either the base PV or the base ID must be provided.");
        }
        setAlignSetup(AlignSetup.of(name, index, valueRanges, bridgeSeconds, resampleSeconds, trim));
    }

    public double getUTCOffsetHours() {
        return utcOffsetHours;
    }

    public long getUTCOffsetSeconds() {
        return Math.round(utcOffsetHours * 3600.0);
    }

    public void setUTCOffsetHours(double utcOffsetHours) throws ConfigException {
        checkUTCOffset(utcOffsetHours);
        this.utcOffsetHours = utcOffsetHours;
    }

    public int getFetchMaxThreads() {
        return fetchMaxThreads;
    }

    public void setFetchMaxThreads(int fetchMaxThreads) throws ConfigException {
        if (fetchMaxThreads < 1) {
            throw new ConfigException("Need at least one fetch thread; got " + fetchMaxThreads);
        }
        this.fetchMaxThreads = fetchMaxThreads;
    }

    public int getFetchTimeoutMillis() {
        return fetchTimeoutMillis;
    }

    /**
     * @param fetchTimeoutMillis Per request timeout; 0 means wait forever
     * @throws ConfigException if negative
     */
    public void setFetchTimeoutMillis(int fetchTimeoutMillis) throws ConfigException {
        if (fetchTimeoutMillis < 0) {
            throw new ConfigException("The fetch timeout cannot be negative; got " + fetchTimeoutMillis);
        }
        this.fetchTimeoutMillis = fetchTimeoutMillis;
    }

    private static List<String> cleanSignals(List<String> newSignals) throws ConfigException {
        if (newSignals == null || newSignals.isEmpty()) {
            throw new ConfigException("Need at least one PV name");
        }
        LinkedHashSet<String> cleaned = new LinkedHashSet<>();
        for (String signal : newSignals) {
            if (StringUtils.isBlank(signal)) {
                throw new ConfigException("PV names cannot be blank");
            }
            cleaned.add(signal.trim());
        }
        return Collections.unmodifiableList(new ArrayList<>(cleaned));
    }

    private static void checkUTCOffset(double utcOffsetHours) throws ConfigException {
        if (Double.isNaN(utcOffsetHours) || Math.abs(utcOffsetHours) > 18) {
            throw new ConfigException("The UTC offset has to be between -18 and 18 hours; got " + utcOffsetHours);
        }
    }

    private static void checkReference(List<String> signals, AlignSetup setup) throws ConfigException {
        int index = signals.indexOf(setup.getReferenceSignal());
        if (index < 0) {
            throw new ConfigException("The base PV '" + setup.getReferenceSignal() + "' is not in the list of PV names.");
        }
        if (setup.getReferenceIndex() >= signals.size()) {
            throw new ConfigException("The base ID '" + setup.getReferenceIndex() + "' is out of range.");
        }
        if (setup.getReferenceIndex() != index) {
            throw new ConfigException("The base ID '" + setup.getReferenceIndex() + "' does not point to the base PV '"
                    + setup.getReferenceSignal() + "'; that PV is at position " + index);
        }
    }

    private static LocalDateTime parseWallClock(String what, String value) throws ConfigException {
        try {
            return TimeUtils.parseWallClock(value);
        } catch (DateTimeParseException ex) {
            throw new ConfigException("Cannot parse the " + what + " " + value + "; expecting " + TimeUtils.WALL_CLOCK_FORMAT, ex);
        }
    }

    @Override
    public String toString() {
        return "RetrieverConfig{signals=" + signals + ", server=" + server + ", window=" + window
                + ", alignSetup=" + alignSetup + "}";
    }

    /**
     * Collects the constructor arguments; any two of start, end and duration determine the window.
     */
    public static class Builder {
        private final InstallationProperties installationProperties;
        private List<String> signals;
        private String serverName;
        private LocalDateTime startTime;
        private LocalDateTime endTime;
        private Double durationHours;
        private AlignSetup alignSetup;
        private Map<String, ?> alignSetupMap;

        private Builder(InstallationProperties installationProperties) {
            this.installationProperties = installationProperties;
        }

        public Builder signals(List<String> signals) {
            this.signals = signals;
            return this;
        }

        public Builder signal(String signal) {
            this.signals = Collections.singletonList(signal);
            return this;
        }

        public Builder server(String serverName) {
            this.serverName = serverName;
            return this;
        }

        public Builder server(ArchiverServer server) {
            this.serverName = server.name();
            return this;
        }

        public Builder startTime(LocalDateTime startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(LocalDateTime endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder startTime(String startTime) throws ConfigException {
            this.startTime = startTime == null ? null : parseWallClock("start time", startTime);
            return this;
        }

        public Builder endTime(String endTime) throws ConfigException {
            this.endTime = endTime == null ? null : parseWallClock("end time", endTime);
            return this;
        }

        public Builder durationHours(Double durationHours) {
            this.durationHours = durationHours;
            return this;
        }

        public Builder alignSetup(AlignSetup alignSetup) {
            this.alignSetup = alignSetup;
            return this;
        }

        public Builder alignSetup(Map<String, ?> alignSetupMap) {
            this.alignSetupMap = alignSetupMap;
            return this;
        }

        public RetrieverConfig build() throws ConfigException {
            List<String> resolvedSignals = cleanSignals(signals != null ? signals : installationProperties.getSignals());
            ArchiverServer server = serverName != null ? ArchiverServer.fromName(serverName) : installationProperties.getServer();

            Double resolvedDuration = durationHours;
            LocalDateTime resolvedEnd = endTime;
            if (startTime == null && endTime == null) {
                resolvedEnd = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
            }
            int specified = (startTime != null ? 1 : 0) + (resolvedEnd != null ? 1 : 0) + (resolvedDuration != null ? 1 : 0);
            if (specified < 2) {
                resolvedDuration = DEFAULT_DURATION_HOURS;
            }
            TimeWindow window = TimeWindow.resolve(startTime, resolvedEnd, resolvedDuration);

            AlignSetup resolvedSetup = alignSetup;
            if (resolvedSetup == null && alignSetupMap != null) {
                resolvedSetup = AlignSetup.fromMap(alignSetupMap);
            }
            if (resolvedSetup == null) {
                resolvedSetup = installationProperties.getAlignSetup(resolvedSignals);
            }
            checkReference(resolvedSignals, resolvedSetup);

            double utcOffsetHours = installationProperties.getUTCOffsetHours();
            checkUTCOffset(utcOffsetHours);

            RetrieverConfig config = new RetrieverConfig(resolvedSignals, server, window, resolvedSetup,
                    utcOffsetHours,
                    installationProperties.getFetchMaxThreads(),
                    installationProperties.getFetchTimeoutMillis());
            logger.debug("Built retriever configuration {}", config);
            return config;
        }
    }
}
