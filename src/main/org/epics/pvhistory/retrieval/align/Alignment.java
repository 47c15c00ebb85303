/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.align;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The PVs projected onto the kept samples of the reference PV, before resampling.
 * There is one column per kept sample; the cumulative time of a column is the bridged time since the first kept sample.
 */
public final class Alignment {
    private final LocalDateTime startTime;
    private final List<String> signalNames;
    private final int[] keptIndices;
    private final int[] breakPositions;
    private final double[] cumulativeTime;
    private final double[][] vals;

    Alignment(LocalDateTime startTime, List<String> signalNames, int[] keptIndices, int[] breakPositions, double[] cumulativeTime, double[][] vals) {
        this.startTime = startTime;
        this.signalNames = Collections.unmodifiableList(new ArrayList<>(signalNames));
        this.keptIndices = keptIndices;
        this.breakPositions = breakPositions;
        this.cumulativeTime = cumulativeTime;
        this.vals = vals;
    }

    /**
     * @return Wall clock time of the first kept reference sample; null if nothing was kept
     */
    public LocalDateTime getStartTime() {
        return startTime;
    }

    public List<String> getSignalNames() {
        return signalNames;
    }

    /**
     * @return Indices into the reference PV's samples that were kept, ascending
     */
    public int[] getKeptIndices() {
        return keptIndices.clone();
    }

    /**
     * @return Positions in the kept indices that follow a trimmed gap
     */
    public int[] getBreakPositions() {
        return breakPositions.clone();
    }

    public double[] getCumulativeTime() {
        return cumulativeTime.clone();
    }

    public double[][] getValues() {
        double[][] ret = new double[vals.length][];
        for (int i = 0; i < vals.length; i++) {
            ret[i] = vals[i].clone();
        }
        return ret;
    }

    public double[] getRow(String signalName) {
        int index = signalNames.indexOf(signalName);
        if (index < 0) {
            throw new IllegalArgumentException("PV " + signalName + " is not part of this alignment");
        }
        return vals[index].clone();
    }
}
