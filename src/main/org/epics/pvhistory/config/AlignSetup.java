/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.config;

import org.apache.commons.lang3.StringUtils;
import org.epics.pvhistory.config.exception.ConfigException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How the signals are aligned to each other.
 * <ul>
 * <li>The reference signal (and its position in the signal list) decides which time intervals we keep.</li>
 * <li>When trimming, only the intervals where the reference is within one of the value ranges are kept.</li>
 * <li>Each removed interval is replaced by a seam of the bridge duration.</li>
 * <li>The aligned data is resampled onto a grid with the resample interval.</li>
 * </ul>
 * Instances are immutable; use the <code>with</code> methods to derive a modified copy.
 */
public final class AlignSetup {
    public static final String BASE_ID = "base_id";
    public static final String BASE_PV = "base_pv";
    public static final String VAL_RANGE = "val_range";
    public static final String BRIDGE_SECONDS = "disTimeAddBack_sec";
    public static final String RESAMPLE_SECONDS = "dtResample_sec";
    public static final String TRIM = "Trim";

    /**
     * Every one of these has to be present when an AlignSetup is created from a map.
     */
    public static final List<String> REQUIRED_KEYS = List.of(BASE_ID, BASE_PV, VAL_RANGE, BRIDGE_SECONDS, RESAMPLE_SECONDS, TRIM);

    public static final List<ValueRange> DEFAULT_VALUE_RANGES = List.of(new ValueRange(1e3, 1e5));
    public static final double DEFAULT_BRIDGE_SECONDS = 1.0;
    public static final double DEFAULT_RESAMPLE_SECONDS = 1.0;

    private final String referenceSignal;
    private final int referenceIndex;
    private final List<ValueRange> valueRanges;
    private final double bridgeSeconds;
    private final double resampleSeconds;
    private final boolean trim;

    private AlignSetup(String referenceSignal, int referenceIndex, List<ValueRange> valueRanges, double bridgeSeconds, double resampleSeconds, boolean trim) {
        this.referenceSignal = referenceSignal;
        this.referenceIndex = referenceIndex;
        this.valueRanges = Collections.unmodifiableList(new ArrayList<>(valueRanges));
        this.bridgeSeconds = bridgeSeconds;
        this.resampleSeconds = resampleSeconds;
        this.trim = trim;
    }

    public static AlignSetup of(String referenceSignal, int referenceIndex, List<ValueRange> valueRanges, double bridgeSeconds, double resampleSeconds, boolean trim) throws ConfigException {
        if (StringUtils.isBlank(referenceSignal)) {
            throw new ConfigException("The reference signal of an alignment cannot be blank");
        }
        if (referenceIndex < 0) {
            throw new ConfigException("The reference index " + referenceIndex + " is out of range");
        }
        if (valueRanges == null || valueRanges.isEmpty()) {
            throw new ConfigException("Need at least one valid value range for the reference signal " + referenceSignal);
        }
        for (ValueRange range : valueRanges) {
            ValueRange.of(range.low(), range.high());
        }
        checkPositive(BRIDGE_SECONDS, bridgeSeconds);
        checkPositive(RESAMPLE_SECONDS, resampleSeconds);
        return new AlignSetup(referenceSignal, referenceIndex, valueRanges, bridgeSeconds, resampleSeconds, trim);
    }

    /**
     * The setup used when nothing else is specified; the first signal is the reference.
     * @param signals Configured signals
     * @return AlignSetup
     * @throws ConfigException if there are no signals
     */
    public static AlignSetup defaultFor(List<String> signals) throws ConfigException {
        if (signals == null || signals.isEmpty()) {
            throw new ConfigException("Cannot build a default alignment without any signals");
        }
        return of(signals.get(0), 0, DEFAULT_VALUE_RANGES, DEFAULT_BRIDGE_SECONDS, DEFAULT_RESAMPLE_SECONDS, true);
    }

    /**
     * Build an AlignSetup from name/value pairs, for example those decoded from JSON.
     * The value range may be a single [low, high] pair or a list of such pairs.
     * @param setup Map with all of {@link #REQUIRED_KEYS}
     * @return AlignSetup
     * @throws ConfigException if a key is missing or a value has the wrong type
     */
    public static AlignSetup fromMap(Map<String, ?> setup) throws ConfigException {
        if (setup == null) {
            throw new ConfigException("alignSetup must be a map");
        }
        for (String key : REQUIRED_KEYS) {
            if (!setup.containsKey(key)) {
                throw new ConfigException("alignSetup must contain the key '" + key + "'");
            }
        }
        Object basePV = setup.get(BASE_PV);
        if (!(basePV instanceof String)) {
            throw new ConfigException(BASE_PV + " must be a string; got " + basePV);
        }
        Object trimObj = setup.get(TRIM);
        if (!(trimObj instanceof Boolean)) {
            throw new ConfigException(TRIM + " must be a boolean; got " + trimObj);
        }
        return of((String) basePV,
                asInteger(BASE_ID, setup.get(BASE_ID)),
                parseValueRanges(setup.get(VAL_RANGE)),
                asNumber(BRIDGE_SECONDS, setup.get(BRIDGE_SECONDS)),
                asNumber(RESAMPLE_SECONDS, setup.get(RESAMPLE_SECONDS)),
                (Boolean) trimObj);
    }

    /**
     * Accepts [low, high] or [[low, high], [low, high], ...]
     * @param obj A list
     * @return List of value ranges
     * @throws ConfigException if this is not one of the accepted shapes
     */
    public static List<ValueRange> parseValueRanges(Object obj) throws ConfigException {
        if (!(obj instanceof List<?>)) {
            throw new ConfigException(VAL_RANGE + " must be a list of [low, high] pairs; got " + obj);
        }
        List<?> list = (List<?>) obj;
        List<ValueRange> ranges = new ArrayList<>();
        if (list.size() == 2 && !(list.get(0) instanceof List<?>)) {
            ranges.add(ValueRange.of(asNumber(VAL_RANGE, list.get(0)), asNumber(VAL_RANGE, list.get(1))));
            return ranges;
        }
        for (Object pairObj : list) {
            if (!(pairObj instanceof List<?>) || ((List<?>) pairObj).size() != 2) {
                throw new ConfigException(VAL_RANGE + " entries must be [low, high] pairs; got " + pairObj);
            }
            List<?> pair = (List<?>) pairObj;
            ranges.add(ValueRange.of(asNumber(VAL_RANGE, pair.get(0)), asNumber(VAL_RANGE, pair.get(1))));
        }
        return ranges;
    }

    private static double asNumber(String key, Object obj) throws ConfigException {
        if (!(obj instanceof Number)) {
            throw new ConfigException(key + " must be a number; got " + obj);
        }
        return ((Number) obj).doubleValue();
    }

    private static int asInteger(String key, Object obj) throws ConfigException {
        double value = asNumber(key, obj);
        if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigException(key + " must be an integer; got " + obj);
        }
        return (int) value;
    }

    private static void checkPositive(String key, double value) throws ConfigException {
        if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0) {
            throw new ConfigException(key + " must be a positive number of seconds; got " + value);
        }
    }

    public AlignSetup withReference(String referenceSignal, int referenceIndex) throws ConfigException {
        return of(referenceSignal, referenceIndex, valueRanges, bridgeSeconds, resampleSeconds, trim);
    }

    /**
     * @return The setup as name/value pairs using the same keys accepted by {@link #fromMap(Map)}
     */
    public Map<String, Object> toMap() {
        LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
        ret.put(BASE_ID, referenceIndex);
        ret.put(BASE_PV, referenceSignal);
        List<List<Double>> ranges = new ArrayList<>();
        for (ValueRange range : valueRanges) {
            ranges.add(List.of(range.low(), range.high()));
        }
        ret.put(VAL_RANGE, ranges);
        ret.put(BRIDGE_SECONDS, bridgeSeconds);
        ret.put(RESAMPLE_SECONDS, resampleSeconds);
        ret.put(TRIM, trim);
        return ret;
    }

    public String getReferenceSignal() {
        return referenceSignal;
    }

    public int getReferenceIndex() {
        return referenceIndex;
    }

    public List<ValueRange> getValueRanges() {
        return valueRanges;
    }

    public double getBridgeSeconds() {
        return bridgeSeconds;
    }

    public double getResampleSeconds() {
        return resampleSeconds;
    }

    public boolean isTrim() {
        return trim;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof AlignSetup)) return false;
        AlignSetup that = (AlignSetup) other;
        return referenceIndex == that.referenceIndex
                && Double.compare(bridgeSeconds, that.bridgeSeconds) == 0
                && Double.compare(resampleSeconds, that.resampleSeconds) == 0
                && trim == that.trim
                && referenceSignal.equals(that.referenceSignal)
                && valueRanges.equals(that.valueRanges);
    }

    @Override
    public int hashCode() {
        return referenceSignal.hashCode() * 31 + valueRanges.hashCode();
    }

    @Override
    public String toString() {
        return toMap().toString();
    }
}
