/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.config;

import org.epics.pvhistory.config.exception.ConfigException;

/**
 * An inclusive range of valid values for the reference signal.
 */
public record ValueRange(double low, double high) {

    public static ValueRange of(double low, double high) throws ConfigException {
        if (Double.isNaN(low) || Double.isNaN(high)) {
            throw new ConfigException("Value range bounds cannot be NaN");
        }
        if (low > high) {
            throw new ConfigException("Value range [" + low + ", " + high + "] has its low bound above its high bound");
        }
        return new ValueRange(low, high);
    }

    public boolean contains(double value) {
        return value >= low && value <= high;
    }

    @Override
    public String toString() {
        return "[" + low + ", " + high + "]";
    }
}
