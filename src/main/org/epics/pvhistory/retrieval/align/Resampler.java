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

/**
 * Resamples rows of values given on a strictly increasing but irregular axis onto a uniform grid.
 * The grid starts at the first point of the axis and steps by the resample interval, stopping before the last point.
 * A partial final interval is dropped.
 */
public class Resampler {
	private static final Logger logger = LogManager.getLogger(Resampler.class);
	/**
	 * Relative slack when counting grid steps, so that a span that is a whole number of steps is not short by one.
	 */
	private static final double GRID_TOLERANCE = 1e-9;

	public Result<ResampledData, DimensionException> resample(double[] cumulativeTime, double[][] matrix, double dtResample) {
		if (!(dtResample > 0)) {
			throw new IllegalArgumentException("The resample interval must be positive; got " + dtResample);
		}
		if (cumulativeTime.length == 0) {
			return Result.failure(new DimensionException("'relTime' is empty"));
		}
		for (int row = 0; row < matrix.length; row++) {
			if (matrix[row].length != cumulativeTime.length) {
				return Result.failure(new DimensionException("Row " + row + " has " + matrix[row].length
						+ " values for a time axis of " + cumulativeTime.length + " points"));
			}
		}

		double first = cumulativeTime[0];
		double last = cumulativeTime[cumulativeTime.length - 1];
		double[] grid = grid(first, last, dtResample);

		double[][] resampled = new double[matrix.length][];
		for (int row = 0; row < matrix.length; row++) {
			resampled[row] = Interpolation.linear(cumulativeTime, matrix[row], grid);
		}
		logger.debug("Resampled {} points onto {} points every {}s", cumulativeTime.length, grid.length, dtResample);
		return Result.ok(new ResampledData(grid, resampled, last));
	}

	static double[] grid(double first, double last, double dt) {
		double steps = (last - first) / dt;
		int n = (int) Math.floor(steps * (1 + GRID_TOLERANCE));
		double[] grid = new double[n];
		for (int k = 0; k < n; k++) {
			grid[k] = first + k * dt;
		}
		return grid;
	}
}
