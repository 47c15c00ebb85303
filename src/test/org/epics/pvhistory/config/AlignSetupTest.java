/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.config;

import org.epics.pvhistory.config.exception.ConfigException;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test building an AlignSetup from name/value pairs.
 */
public class AlignSetupTest {

	private static Map<String, Object> validSetup() {
		Map<String, Object> setup = new HashMap<>();
		setup.put(AlignSetup.BASE_ID, 0);
		setup.put(AlignSetup.BASE_PV, "GUN:GUNB:100:FWD:PWR");
		setup.put(AlignSetup.VAL_RANGE, List.of(List.of(1000.0, 100000.0), List.of(5, 10)));
		setup.put(AlignSetup.BRIDGE_SECONDS, 2.0);
		setup.put(AlignSetup.RESAMPLE_SECONDS, 0.5);
		setup.put(AlignSetup.TRIM, Boolean.TRUE);
		return setup;
	}

	static List<String> requiredKeys() {
		return AlignSetup.REQUIRED_KEYS;
	}

	@Test
	public void testFromMap() throws Exception {
		AlignSetup setup = AlignSetup.fromMap(validSetup());
		Assertions.assertEquals("GUN:GUNB:100:FWD:PWR", setup.getReferenceSignal());
		Assertions.assertEquals(0, setup.getReferenceIndex());
		Assertions.assertEquals(List.of(new ValueRange(1000, 100000), new ValueRange(5, 10)), setup.getValueRanges());
		Assertions.assertEquals(2.0, setup.getBridgeSeconds(), 0.0);
		Assertions.assertEquals(0.5, setup.getResampleSeconds(), 0.0);
		Assertions.assertTrue(setup.isTrim());
		Assertions.assertEquals(setup, AlignSetup.fromMap(setup.toMap()));
	}

	@Test
	public void testFromJSON() throws Exception {
		String json = "{\"base_id\": 1, \"base_pv\": \"GUN:GUNB:100:DFACT\", \"val_range\": [0, 100],"
				+ " \"disTimeAddBack_sec\": 1, \"dtResample_sec\": 1, \"Trim\": false}";
		@SuppressWarnings("unchecked")
		Map<String, Object> decoded = (JSONObject) new JSONParser().parse(json);
		AlignSetup setup = AlignSetup.fromMap(decoded);
		Assertions.assertEquals(List.of(new ValueRange(0, 100)), setup.getValueRanges());
		Assertions.assertEquals(1, setup.getReferenceIndex());
		Assertions.assertFalse(setup.isTrim());
	}

	@ParameterizedTest
	@MethodSource("requiredKeys")
	public void testMissingKey(String key) {
		Map<String, Object> setup = validSetup();
		setup.remove(key);
		ConfigException ex = Assertions.assertThrows(ConfigException.class, () -> AlignSetup.fromMap(setup));
		Assertions.assertTrue(ex.getMessage().contains(key), ex.getMessage());
	}

	@Test
	public void testWrongTypes() {
		Map<String, Object> setup = validSetup();
		setup.put(AlignSetup.TRIM, "yes");
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.fromMap(setup));

		Map<String, Object> setup2 = validSetup();
		setup2.put(AlignSetup.BRIDGE_SECONDS, "2");
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.fromMap(setup2));

		Map<String, Object> setup3 = validSetup();
		setup3.put(AlignSetup.VAL_RANGE, List.of(List.of(1, 2, 3)));
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.fromMap(setup3));

		Map<String, Object> setup4 = validSetup();
		setup4.put(AlignSetup.VAL_RANGE, 5);
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.fromMap(setup4));

		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.fromMap(null));
	}

	@Test
	public void testFractionalBaseIndex() throws Exception {
		Map<String, Object> setup = validSetup();
		setup.put(AlignSetup.BASE_ID, 0.9);
		ConfigException ex = Assertions.assertThrows(ConfigException.class, () -> AlignSetup.fromMap(setup));
		Assertions.assertTrue(ex.getMessage().contains(AlignSetup.BASE_ID), ex.getMessage());

		// A whole number decoded as a double is still an index.
		setup.put(AlignSetup.BASE_ID, 2.0);
		Assertions.assertEquals(2, AlignSetup.fromMap(setup).getReferenceIndex());
	}

	@Test
	public void testInvalidValues() {
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.of("X", 0, List.of(), 1.0, 1.0, true));
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.of("X", 0, AlignSetup.DEFAULT_VALUE_RANGES, 0.0, 1.0, true));
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.of("X", 0, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, -1.0, true));
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.of("X", -1, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, 1.0, true));
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.of(" ", 0, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, 1.0, true));
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.of("X", 0, List.of(new ValueRange(10, 1)), 1.0, 1.0, true));
		Assertions.assertThrows(ConfigException.class, () -> ValueRange.of(Double.NaN, 1));
	}

	@Test
	public void testDefaults() throws Exception {
		AlignSetup setup = AlignSetup.defaultFor(List.of("A", "B"));
		Assertions.assertEquals("A", setup.getReferenceSignal());
		Assertions.assertEquals(0, setup.getReferenceIndex());
		Assertions.assertEquals(List.of(new ValueRange(1e3, 1e5)), setup.getValueRanges());
		Assertions.assertEquals(1.0, setup.getBridgeSeconds(), 0.0);
		Assertions.assertEquals(1.0, setup.getResampleSeconds(), 0.0);
		Assertions.assertTrue(setup.isTrim());
		Assertions.assertThrows(ConfigException.class, () -> AlignSetup.defaultFor(List.of()));
	}
}
