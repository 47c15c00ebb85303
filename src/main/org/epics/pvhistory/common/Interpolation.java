/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.common;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.Arrays;

/**
 * Piecewise linear interpolation of sampled data.
 * Points outside the sampled range are NaN; we never extrapolate.
 * NaN samples stay NaN and poison the segments on either side of them.
 */
public class Interpolation {
    private Interpolation() {}

    /**
     * Interpolate ys (sampled at xs) at each of the points in at.
     * @param xs Abscissae; strictly increasing
     * @param ys Ordinates; same length as xs
     * @param at Points at which we want values
     * @return One value per point in at
     */
    public static double[] linear(double[] xs, double[] ys, double[] at) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Have " + xs.length + " abscissae but " + ys.length + " ordinates");
        }
        double[] result = new double[at.length];
        Arrays.fill(result, Double.NaN);
        if (xs.length == 0) {
            return result;
        }
        if (xs.length == 1) {
            // A spline needs two knots; a single sample only covers its own abscissa.
            for (int i = 0; i < at.length; i++) {
                if (at[i] == xs[0]) result[i] = ys[0];
            }
            return result;
        }
        PolynomialSplineFunction fn = new LinearInterpolator().interpolate(xs, ys);
        for (int i = 0; i < at.length; i++) {
            if (fn.isValidPoint(at[i])) {
                result[i] = fn.value(at[i]);
            }
        }
        return result;
    }
}
