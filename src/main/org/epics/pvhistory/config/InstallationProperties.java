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
import org.epics.pvhistory.config.exception.ConfigException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Installation specific defaults for the retriever.
 * These come from a <code>pvhistory.properties</code> file.
 * We look for the file using the JVM property or environment variable {@link #PVHISTORY_PROPERTIES_FILENAME}; failing that we load it from the classpath.
 * Anything missing from the file falls back to the built in defaults.
 */
public class InstallationProperties {
    private static final Logger configlogger = LogManager.getLogger("config." + InstallationProperties.class.getName());

    public static final String PVHISTORY_PROPERTIES_FILENAME = "PVHISTORY_PROPERTIES";
    public static final String DEFAULT_PVHISTORY_PROPERTIES_FILENAME = "pvhistory.properties";

    public static final String SERVER = "org.epics.pvhistory.server";
    public static final String UTC_OFFSET_HOURS = "org.epics.pvhistory.utcOffsetHours";
    public static final String FETCH_MAX_THREADS = "org.epics.pvhistory.fetch.maxThreads";
    public static final String FETCH_TIMEOUT_MILLIS = "org.epics.pvhistory.fetch.timeoutMillis";
    public static final String SIGNALS = "org.epics.pvhistory.signals";
    public static final String ALIGN_VALUE_RANGES = "org.epics.pvhistory.align.valueRanges";
    public static final String ALIGN_BRIDGE_SECONDS = "org.epics.pvhistory.align.bridgeSeconds";
    public static final String ALIGN_RESAMPLE_SECONDS = "org.epics.pvhistory.align.resampleSeconds";
    public static final String ALIGN_TRIM = "org.epics.pvhistory.align.trim";

    public static final int DEFAULT_FETCH_MAX_THREADS = 8;
    public static final int DEFAULT_FETCH_TIMEOUT_MILLIS = 30 * 1000;
    public static final List<String> DEFAULT_SIGNALS = List.of("GUN:GUNB:100:FWD:PWR", "GUN:GUNB:100:DFACT", "GUN:GUNB:100:REV1:PWR");

    private final Properties properties;

    public InstallationProperties(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load the installation properties.
     * @return InstallationProperties
     * @throws ConfigException if a file was explicitly specified and could not be loaded
     */
    public static InstallationProperties load() throws ConfigException {
        Properties props = new Properties();
        String fileName = System.getProperty(PVHISTORY_PROPERTIES_FILENAME);
        if (fileName == null) {
            fileName = System.getenv(PVHISTORY_PROPERTIES_FILENAME);
        }
        if (fileName != null) {
            configlogger.info("Loading " + DEFAULT_PVHISTORY_PROPERTIES_FILENAME + " using the environment/JVM property from " + fileName);
            try (InputStream is = new FileInputStream(fileName)) {
                props.load(is);
            } catch (IOException ex) {
                throw new ConfigException("Exception loading installation specific properties file " + fileName, ex);
            }
            return new InstallationProperties(props);
        }

        try (InputStream is = InstallationProperties.class.getClassLoader().getResourceAsStream(DEFAULT_PVHISTORY_PROPERTIES_FILENAME)) {
            if (is == null) {
                configlogger.info("Did not find " + DEFAULT_PVHISTORY_PROPERTIES_FILENAME + " on the classpath; using built in defaults");
            } else {
                props.load(is);
                configlogger.info("Done loading " + DEFAULT_PVHISTORY_PROPERTIES_FILENAME + " from the classpath");
            }
        } catch (IOException ex) {
            throw new ConfigException("Exception loading " + DEFAULT_PVHISTORY_PROPERTIES_FILENAME + " from the classpath", ex);
        }
        return new InstallationProperties(props);
    }

    public ArchiverServer getServer() throws ConfigException {
        return ArchiverServer.fromName(properties.getProperty(SERVER, ArchiverServer.LCLS.name()));
    }

    public double getUTCOffsetHours() throws ConfigException {
        return getDouble(UTC_OFFSET_HOURS, TimeUtils.DEFAULT_UTC_OFFSET_HOURS);
    }

    public int getFetchMaxThreads() throws ConfigException {
        int threads = getInt(FETCH_MAX_THREADS, DEFAULT_FETCH_MAX_THREADS);
        if (threads < 1) {
            throw new ConfigException(FETCH_MAX_THREADS + " has to be at least 1; got " + threads);
        }
        return threads;
    }

    public int getFetchTimeoutMillis() throws ConfigException {
        int timeout = getInt(FETCH_TIMEOUT_MILLIS, DEFAULT_FETCH_TIMEOUT_MILLIS);
        if (timeout < 0) {
            throw new ConfigException(FETCH_TIMEOUT_MILLIS + " cannot be negative; got " + timeout);
        }
        return timeout;
    }

    public List<String> getSignals() {
        String signals = properties.getProperty(SIGNALS);
        if (StringUtils.isBlank(signals)) {
            return DEFAULT_SIGNALS;
        }
        List<String> ret = new ArrayList<>();
        for (String signal : signals.split(",")) {
            if (StringUtils.isNotBlank(signal)) {
                ret.add(signal.trim());
            }
        }
        return ret;
    }

    /**
     * The alignment defaults; the first of the signals is the reference.
     * Value ranges are written as <code>low:high</code> pairs separated by commas; for example <code>1000:100000,5:10</code>.
     * @param signals Configured signals
     * @return AlignSetup
     * @throws ConfigException if any of the align properties cannot be parsed
     */
    public AlignSetup getAlignSetup(List<String> signals) throws ConfigException {
        if (signals == null || signals.isEmpty()) {
            throw new ConfigException("Cannot build a default alignment without any signals");
        }
        List<ValueRange> ranges = AlignSetup.DEFAULT_VALUE_RANGES;
        String rangesStr = properties.getProperty(ALIGN_VALUE_RANGES);
        if (StringUtils.isNotBlank(rangesStr)) {
            ranges = new ArrayList<>();
            for (String rangeStr : rangesStr.split(",")) {
                String[] parts = rangeStr.trim().split(":");
                if (parts.length != 2) {
                    throw new ConfigException("Cannot parse value range " + rangeStr + " in " + ALIGN_VALUE_RANGES + "; expecting low:high");
                }
                ranges.add(ValueRange.of(parseDouble(ALIGN_VALUE_RANGES, parts[0]), parseDouble(ALIGN_VALUE_RANGES, parts[1])));
            }
        }
        return AlignSetup.of(signals.get(0), 0, ranges,
                getDouble(ALIGN_BRIDGE_SECONDS, AlignSetup.DEFAULT_BRIDGE_SECONDS),
                getDouble(ALIGN_RESAMPLE_SECONDS, AlignSetup.DEFAULT_RESAMPLE_SECONDS),
                getBoolean(ALIGN_TRIM, true));
    }

    private double getDouble(String key, double defaultValue) throws ConfigException {
        String value = properties.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        return parseDouble(key, value);
    }

    private int getInt(String key, int defaultValue) throws ConfigException {
        String value = properties.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new ConfigException("Cannot parse " + value + " for " + key + " as an integer", ex);
        }
    }

    private boolean getBoolean(String key, boolean defaultValue) throws ConfigException {
        String value = properties.getProperty(key);
        if (StringUtils.isBlank(value)) {
            return defaultValue;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new ConfigException("Cannot parse " + value + " for " + key + "; expecting true or false");
    }

    private static double parseDouble(String key, String value) throws ConfigException {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            throw new ConfigException("Cannot parse " + value + " for " + key + " as a number", ex);
        }
    }
}
