/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.align;

/**
 * Values on a uniform time grid.
 * @param time Grid points, seconds since the synchronized start
 * @param values One row per PV, one column per grid point; NaN where a PV has no value
 * @param totalDurationSeconds Last point of the axis the grid was built from
 */
public record ResampledData(double[] time, double[][] values, double totalDurationSeconds) {
    public int size() {
        return time.length;
    }
}
