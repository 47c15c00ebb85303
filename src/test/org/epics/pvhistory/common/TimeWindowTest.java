/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.common;

import org.epics.pvhistory.config.exception.ConfigException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

/**
 * Test the resolution of time windows from any two of start, end and duration.
 */
public class TimeWindowTest {
	private static final LocalDateTime START = TimeUtils.parseWallClock("06/05/2023 08:00:00");
	private static final LocalDateTime END = TimeUtils.parseWallClock("06/05/2023 12:00:00");

	@Test
	public void testResolve() throws Exception {
		TimeWindow expected = TimeWindow.of(START, END);
		Assertions.assertEquals(4.0, expected.getDurationHours(), 1e-12);
		Assertions.assertEquals(expected, TimeWindow.resolve(START, END, null));
		Assertions.assertEquals(expected, TimeWindow.resolve(START, END, 4.0));
		Assertions.assertEquals(expected, TimeWindow.resolve(START, null, 4.0));
		Assertions.assertEquals(expected, TimeWindow.resolve(null, END, 4.0));
		// Within the tolerance
		Assertions.assertEquals(expected, TimeWindow.resolve(START, END, 4.0000001));
	}

	@Test
	public void testInconsistent() {
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.resolve(START, END, 3.0));
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.resolve(START, END, 4.001));
	}

	@Test
	public void testNotEnough() {
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.resolve(START, null, null));
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.resolve(null, END, null));
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.resolve(null, null, 4.0));
	}

	@Test
	public void testInvalid() {
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.of(END, START));
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.of(START, START));
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.endingAt(END, 0.0));
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.startingAt(START, -1.0));
		Assertions.assertThrows(ConfigException.class, () -> TimeWindow.startingAt(START, Double.NaN));
	}

	@Test
	public void testFractionalDuration() throws Exception {
		TimeWindow window = TimeWindow.endingAt(END, 0.5);
		Assertions.assertEquals(TimeUtils.parseWallClock("06/05/2023 11:30:00"), window.getStartTime());
		Assertions.assertEquals(1800.0, window.getEndEpochSeconds() - window.getStartEpochSeconds(), 1e-9);
	}

	@Test
	public void testContains() throws Exception {
		TimeWindow window = TimeWindow.of(START, END);
		Assertions.assertTrue(window.contains(window.getStartEpochSeconds()));
		Assertions.assertTrue(window.contains(window.getEndEpochSeconds()));
		Assertions.assertFalse(window.contains(window.getEndEpochSeconds() + 0.001));
		Assertions.assertFalse(window.contains(window.getStartEpochSeconds() - 1));
		Assertions.assertEquals("06/05/2023 08:00:00 - 06/05/2023 12:00:00", window.toString());
	}
}
