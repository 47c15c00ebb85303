/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.data;

import java.util.Arrays;

/**
 * The samples of one PV; timestamps are wall clock epoch seconds.
 * Timestamps are strictly ascending (and therefore unique).
 * A signal whose fetch failed is empty.
 */
public final class Signal {
    private final String name;
    private final double[] secs;
    private final double[] vals;

    public Signal(String name, double[] secs, double[] vals) {
        if (secs.length != vals.length) {
            throw new IllegalArgumentException("PV " + name + " has " + secs.length + " timestamps and " + vals.length + " values");
        }
        for (int i = 1; i < secs.length; i++) {
            if (!(secs[i] > secs[i - 1])) {
                throw new IllegalArgumentException("Timestamps for PV " + name + " are not strictly ascending at index " + i);
            }
        }
        this.name = name;
        this.secs = secs.clone();
        this.vals = vals.clone();
    }

    public static Signal empty(String name) {
        return new Signal(name, new double[0], new double[0]);
    }

    public String getName() {
        return name;
    }

    public int size() {
        return secs.length;
    }

    public boolean isEmpty() {
        return secs.length == 0;
    }

    public double getSecs(int index) {
        return secs[index];
    }

    public double getVal(int index) {
        return vals[index];
    }

    public double[] getSecs() {
        return secs.clone();
    }

    public double[] getVals() {
        return vals.clone();
    }

    /**
     * @return The timestamps relative to the first sample
     */
    public double[] getRelativeSecs() {
        double[] rel = new double[secs.length];
        for (int i = 0; i < secs.length; i++) {
            rel[i] = secs[i] - secs[0];
        }
        return rel;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Signal)) return false;
        Signal that = (Signal) other;
        return name.equals(that.name) && Arrays.equals(secs, that.secs) && Arrays.equals(vals, that.vals);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(secs);
    }

    @Override
    public String toString() {
        return name + " with " + secs.length + " samples";
    }
}
