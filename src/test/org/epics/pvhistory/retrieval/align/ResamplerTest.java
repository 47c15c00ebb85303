/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.align;

import org.epics.pvhistory.common.Result;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Test the resampling onto a uniform grid.
 */
public class ResamplerTest {
	private final Resampler resampler = new Resampler();

	@ParameterizedTest
	@CsvSource({
		"10.0, 1.0, 10",
		"10.5, 1.0, 10",
		"9.99, 1.0, 9",
		"600.0, 0.1, 6000",
		"7.0, 2.5, 2",
		"0.5, 1.0, 0",
	})
	public void testGridLength(double last, double dt, int expectedLength) {
		double[] axis = { 0.0, last / 3, last };
		double[][] matrix = { { 1.0, 2.0, 3.0 } };
		ResampledData resampled = resampler.resample(axis, matrix, dt).getValue();
		Assertions.assertEquals(expectedLength, resampled.size());
		Assertions.assertEquals(expectedLength, resampled.values()[0].length);
		Assertions.assertEquals(last, resampled.totalDurationSeconds(), 0.0);
		double[] grid = resampled.time();
		for (int k = 0; k < grid.length; k++) {
			Assertions.assertEquals(k * dt, grid[k], 1e-9);
			Assertions.assertTrue(grid[k] < last);
		}
	}

	@Test
	public void testInterpolatesOntoGrid() {
		// Bridged axis with a seam of two seconds.
		double[] axis = { 0.0, 1.0, 2.0, 4.0, 5.0, 6.0 };
		double[][] matrix = {
			{ 10.0, 11.0, 12.0, 14.0, 15.0, 16.0 },
			{ Double.NaN, 1.0, 2.0, 3.0, 4.0, Double.NaN },
		};
		ResampledData resampled = resampler.resample(axis, matrix, 0.5).getValue();
		Assertions.assertArrayEquals(new double[] { 0, 0.5, 1, 1.5, 2, 2.5, 3, 3.5, 4, 4.5, 5, 5.5 }, resampled.time(), 1e-12);
		Assertions.assertArrayEquals(new double[] { 10, 10.5, 11, 11.5, 12, 12.5, 13, 13.5, 14, 14.5, 15, 15.5 }, resampled.values()[0], 1e-9);

		// Regions without a value stay without a value.
		double[] second = resampled.values()[1];
		Assertions.assertTrue(Double.isNaN(second[0]));
		Assertions.assertTrue(Double.isNaN(second[1]));
		Assertions.assertEquals(1.0, second[2], 1e-9);
		Assertions.assertEquals(2.5, second[6], 1e-9);
		Assertions.assertTrue(Double.isNaN(second[11]));
	}

	@Test
	public void testAxisNotStartingAtZero() {
		double[] axis = { 3.0, 4.0, 8.0 };
		double[][] matrix = { { 0.0, 1.0, 5.0 } };
		ResampledData resampled = resampler.resample(axis, matrix, 2.0).getValue();
		Assertions.assertArrayEquals(new double[] { 3.0, 5.0 }, resampled.time(), 1e-12);
		Assertions.assertArrayEquals(new double[] { 0.0, 2.0 }, resampled.values()[0], 1e-9);
		Assertions.assertEquals(8.0, resampled.totalDurationSeconds(), 0.0);
	}

	@Test
	public void testEmptyAxis() {
		Result<ResampledData, DimensionException> result = resampler.resample(new double[0], new double[][] { {}, {} }, 1.0);
		Assertions.assertFalse(result.isOk());
		Assertions.assertTrue(result.getError() instanceof DimensionException);
	}

	@Test
	public void testMismatchedRow() {
		Result<ResampledData, DimensionException> result = resampler.resample(new double[] { 0, 1, 2 }, new double[][] { { 0, 1 } }, 1.0);
		Assertions.assertFalse(result.isOk());
		Assertions.assertThrows(DimensionException.class, result::orElseThrow);
	}

	@Test
	public void testBadInterval() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> resampler.resample(new double[] { 0, 1 }, new double[][] { { 0, 1 } }, 0.0));
	}
}
