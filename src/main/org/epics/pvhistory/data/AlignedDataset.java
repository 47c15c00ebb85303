/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.data;

import org.epics.pvhistory.common.TimeUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The PVs aligned onto a common, uniformly spaced relative time axis.
 * <ul>
 * <li>Row <code>i</code> of the values holds PV <code>i</code>; column <code>j</code> is the sample at relative time <code>j</code>.</li>
 * <li>NaN marks a point that is not covered by that PV's data.</li>
 * <li>The relative time axis is in seconds after trim; trimmed intervals are replaced by the bridge duration.</li>
 * </ul>
 */
public final class AlignedDataset {
    public static final String DESCRIPTION = "Index is relative time in seconds after trim.";

    private final LocalDateTime startTime;
    private final List<String> signalNames;
    private final double[] relTime;
    private final double[][] vals;
    private final double totalDurationSeconds;

    public AlignedDataset(LocalDateTime startTime, List<String> signalNames, double[] relTime, double[][] vals, double totalDurationSeconds) {
        if (vals.length != signalNames.size()) {
            throw new IllegalArgumentException("Have " + signalNames.size() + " PVs but " + vals.length + " rows of values");
        }
        for (int i = 0; i < vals.length; i++) {
            if (vals[i].length != relTime.length) {
                throw new IllegalArgumentException("Row for PV " + signalNames.get(i) + " has " + vals[i].length
                        + " values; expecting " + relTime.length);
            }
        }
        this.startTime = startTime;
        this.signalNames = Collections.unmodifiableList(new ArrayList<>(signalNames));
        this.relTime = relTime.clone();
        this.vals = new double[vals.length][];
        for (int i = 0; i < vals.length; i++) {
            this.vals[i] = vals[i].clone();
        }
        this.totalDurationSeconds = totalDurationSeconds;
    }

    /**
     * @return The wall clock time of the first kept sample of the reference PV
     */
    public LocalDateTime getStartTime() {
        return startTime;
    }

    public List<String> getSignalNames() {
        return signalNames;
    }

    public double[] getRelTime() {
        return relTime.clone();
    }

    public int size() {
        return relTime.length;
    }

    public double getValue(int signalIndex, int sampleIndex) {
        return vals[signalIndex][sampleIndex];
    }

    public double[][] getValues() {
        double[][] ret = new double[vals.length][];
        for (int i = 0; i < vals.length; i++) {
            ret[i] = vals[i].clone();
        }
        return ret;
    }

    /**
     * @param signalName PV name
     * @return The aligned values for this PV
     * @throws IllegalArgumentException if this PV is not part of the dataset
     */
    public double[] getColumn(String signalName) {
        int index = signalNames.indexOf(signalName);
        if (index < 0) {
            throw new IllegalArgumentException("PV " + signalName + " is not part of this dataset");
        }
        return vals[index].clone();
    }

    /**
     * @return The total elapsed time on the bridged axis, before resampling dropped the partial last interval
     */
    public double getTotalDurationSeconds() {
        return totalDurationSeconds;
    }

    public double getDurationHours() {
        return totalDurationSeconds / 3600.0;
    }

    public String getDescription() {
        return DESCRIPTION;
    }

    /**
     * Scale each PV to [0, 1] using its own minimum and maximum.
     * NaN's are ignored when determining the range and stay NaN.
     * A PV with a constant value is scaled to 0.
     * @return A new dataset
     */
    public AlignedDataset normalized() {
        double[][] scaled = new double[vals.length][];
        for (int i = 0; i < vals.length; i++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : vals[i]) {
                if (Double.isNaN(v)) continue;
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            double span = max - min;
            scaled[i] = new double[vals[i].length];
            for (int j = 0; j < vals[i].length; j++) {
                double v = vals[i][j];
                if (Double.isNaN(v)) {
                    scaled[i][j] = Double.NaN;
                } else {
                    scaled[i][j] = span > 0 ? (v - min) / span : 0.0;
                }
            }
        }
        return new AlignedDataset(startTime, signalNames, relTime, scaled, totalDurationSeconds);
    }

    /**
     * The part of this dataset between two relative times, both ends inclusive.
     * @param fromSeconds Relative start
     * @param toSeconds Relative end
     * @return A new dataset sharing this one's start time; relative times are not rebased
     */
    public AlignedDataset window(double fromSeconds, double toSeconds) {
        int first = 0;
        while (first < relTime.length && relTime[first] < fromSeconds) first++;
        int last = first;
        while (last < relTime.length && relTime[last] <= toSeconds) last++;
        double[] sliceTime = Arrays.copyOfRange(relTime, first, last);
        double[][] sliceVals = new double[vals.length][];
        for (int i = 0; i < vals.length; i++) {
            sliceVals[i] = Arrays.copyOfRange(vals[i], first, last);
        }
        double duration = sliceTime.length > 0 ? sliceTime[sliceTime.length - 1] - sliceTime[0] : 0.0;
        return new AlignedDataset(startTime, signalNames, sliceTime, sliceVals, duration);
    }

    /**
     * Consecutive windows of the given length, starting from the first point on the axis.
     * Window <code>i</code> covers <code>[t0 + i*w, min(t0 + (i+1)*w, last)]</code>.
     * Note that neighbouring windows share the point on their common boundary.
     * @param windowSeconds Length of each window
     * @return The windows; empty if this dataset is empty
     */
    public List<AlignedDataset> movingWindows(double windowSeconds) {
        if (!(windowSeconds > 0)) {
            throw new IllegalArgumentException("Window length has to be positive; got " + windowSeconds);
        }
        List<AlignedDataset> windows = new ArrayList<>();
        if (relTime.length == 0) {
            return windows;
        }
        double first = relTime[0];
        double last = relTime[relTime.length - 1];
        int count = (int) Math.floor((last - first) / windowSeconds) + 1;
        for (int i = 0; i < count; i++) {
            double from = first + i * windowSeconds;
            double to = Math.min(from + windowSeconds, last);
            AlignedDataset slice = window(from, to);
            if (slice.size() == 0) {
                break;
            }
            windows.add(slice);
        }
        return windows;
    }

    @Override
    public String toString() {
        return "AlignedDataset starting at " + (startTime == null ? "-" : TimeUtils.formatWallClock(startTime))
                + " with " + signalNames.size() + " PVs and " + relTime.length + " samples covering "
                + String.format("%.1f", getDurationHours()) + " hours";
    }
}
