/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.align;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.epics.pvhistory.common.Interpolation;
import org.epics.pvhistory.common.Result;
import org.epics.pvhistory.common.TimeUtils;
import org.epics.pvhistory.config.AlignSetup;
import org.epics.pvhistory.config.ValueRange;
import org.epics.pvhistory.data.RawDataset;
import org.epics.pvhistory.data.Signal;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Aligns the PVs of a raw dataset against a reference PV.
 * <ol>
 * <li>When trimming, only the reference samples whose value falls in one of the value ranges are kept.</li>
 * <li>The time axis is the time since the first reference sample, summed step by step over the kept samples.
 * A step across a trimmed gap counts as the bridge duration instead of the time that actually elapsed.</li>
 * <li>The reference PV contributes its own kept values.
 * The other PVs are linearly interpolated at the (unbridged) times of the kept reference samples, each against its own first sample.
 * Points outside a PV's data are NaN.</li>
 * </ol>
 * The start time is the timestamp of the first kept reference sample; trimmed gaps do not move it.
 */
public class AlignmentEngine {
    private static final Logger logger = LogManager.getLogger(AlignmentEngine.class);

    /**
     * @param raw The raw data
     * @param setup How to align
     * @param signalOrder PVs in the order of the rows of the result
     * @return The alignment, or an {@link AlignmentException} if the reference PV has no samples within range
     */
    public Result<Alignment, AlignmentException> align(RawDataset raw, AlignSetup setup, List<String> signalOrder) {
        String referenceName = setup.getReferenceSignal();
        Signal reference = raw.getSignal(referenceName);
        if (reference == null) {
            return Result.failure(new AlignmentException("The reference PV " + referenceName + " is not part of the raw data"));
        }

        double[] refSecs = reference.getSecs();
        double[] refVals = reference.getVals();
        double[] relTime = reference.getRelativeSecs();

        int[] keptIndices;
        int[] breakPositions;
        double[] cumulativeTime;
        if (!setup.isTrim()) {
            keptIndices = new int[refSecs.length];
            for (int i = 0; i < keptIndices.length; i++) keptIndices[i] = i;
            breakPositions = new int[0];
            cumulativeTime = relTime;
        } else {
            keptIndices = keptIndices(keepMask(refVals, setup.getValueRanges()));
            if (keptIndices.length == 0) {
                logger.warn("All data are out of range for the reference PV " + referenceName);
                return Result.failure(new AlignmentException("No data in range " + setup.getValueRanges() + " for the reference PV " + referenceName));
            }
            breakPositions = breakPositions(keptIndices);
            cumulativeTime = bridgedTime(relTime, keptIndices, breakPositions, setup.getBridgeSeconds());
        }

        // Cumulative time zero is the first kept reference sample, whether or not leading samples were trimmed.
        LocalDateTime startTime = keptIndices.length == 0 ? null : TimeUtils.fromWallClockEpochSeconds(refSecs[keptIndices[0]]);

        double[] keptRelTime = new double[keptIndices.length];
        for (int p = 0; p < keptIndices.length; p++) {
            keptRelTime[p] = relTime[keptIndices[p]];
        }

        double[][] vals = new double[signalOrder.size()][];
        for (int i = 0; i < signalOrder.size(); i++) {
            String pvName = signalOrder.get(i);
            Signal signal = raw.getSignal(pvName);
            if (pvName.equals(referenceName)) {
                vals[i] = new double[keptIndices.length];
                for (int p = 0; p < keptIndices.length; p++) {
                    vals[i][p] = refVals[keptIndices[p]];
                }
            } else if (signal == null || signal.isEmpty()) {
                logger.warn("Warning: No data for PV " + pvName + " -- and will fill with NaN");
                vals[i] = new double[keptIndices.length];
                Arrays.fill(vals[i], Double.NaN);
            } else if (signal.size() == 1) {
                logger.warn("Warning: Only one data point for PV " + pvName + " -- and will fill with same data");
                vals[i] = new double[keptIndices.length];
                Arrays.fill(vals[i], signal.getVal(0));
            } else {
                vals[i] = Interpolation.linear(signal.getRelativeSecs(), signal.getVals(), keptRelTime);
            }
        }

        logger.debug("Kept {} of {} samples of the reference PV {} with {} discontinuities",
                keptIndices.length, refSecs.length, referenceName, breakPositions.length);
        return Result.ok(new Alignment(startTime, signalOrder, keptIndices, breakPositions, cumulativeTime, vals));
    }

    /**
     * @param vals Values of the reference PV
     * @param ranges Valid ranges
     * @return True for each value that falls within any of the ranges, both ends inclusive
     */
    public static boolean[] keepMask(double[] vals, List<ValueRange> ranges) {
        boolean[] mask = new boolean[vals.length];
        for (ValueRange range : ranges) {
            for (int i = 0; i < vals.length; i++) {
                mask[i] |= range.contains(vals[i]);
            }
        }
        return mask;
    }

    static int[] keptIndices(boolean[] mask) {
        int count = 0;
        for (boolean keep : mask) {
            if (keep) count++;
        }
        int[] kept = new int[count];
        int k = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) kept[k++] = i;
        }
        return kept;
    }

    /**
     * @param keptIndices Ascending indices of kept samples
     * @return Positions p (p &gt; 0) where keptIndices[p] does not immediately follow keptIndices[p-1]
     */
    static int[] breakPositions(int[] keptIndices) {
        return IntStream.range(1, keptIndices.length)
                .filter(p -> keptIndices[p] - keptIndices[p - 1] > 1)
                .toArray();
    }

    static double[] bridgedTime(double[] relTime, int[] keptIndices, int[] breakPositions, double bridgeSeconds) {
        double[] deltas = new double[keptIndices.length];
        for (int p = 1; p < keptIndices.length; p++) {
            deltas[p] = relTime[keptIndices[p]] - relTime[keptIndices[p - 1]];
        }
        for (int p : breakPositions) {
            deltas[p] = bridgeSeconds;
        }
        double[] cumulative = new double[keptIndices.length];
        double sum = 0.0;
        for (int p = 0; p < keptIndices.length; p++) {
            sum += deltas[p];
            cumulative[p] = sum;
        }
        return cumulative;
    }
}
