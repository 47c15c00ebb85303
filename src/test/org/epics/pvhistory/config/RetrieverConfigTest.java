/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.config;

import org.epics.pvhistory.common.TimeUtils;
import org.epics.pvhistory.config.exception.ConfigException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Properties;

/**
 * Test the validation and the coupled time fields of the retriever configuration.
 */
public class RetrieverConfigTest {
    private static final String FWD = "GUN:GUNB:100:FWD:PWR";
    private static final String DFACT = "GUN:GUNB:100:DFACT";
    private static final String REV = "GUN:GUNB:100:REV1:PWR";

    private InstallationProperties installationProperties;

    @BeforeEach
    public void setUp() {
        installationProperties = new InstallationProperties(new Properties());
    }

    private RetrieverConfig config() throws ConfigException {
        return RetrieverConfig.builder(installationProperties)
                .signals(List.of(FWD, DFACT, REV))
                .startTime("06/05/2023 08:00:00")
                .endTime("06/05/2023 12:00:00")
                .build();
    }

    @Test
    public void testBuilderWindow() throws Exception {
        RetrieverConfig config = config();
        Assertions.assertEquals(4.0, config.getDurationHours(), 1e-12);
        Assertions.assertEquals(ArchiverServer.LCLS, config.getServer());
        Assertions.assertEquals(FWD, config.getAlignSetup().getReferenceSignal());
        Assertions.assertEquals(25200, config.getUTCOffsetSeconds());

        RetrieverConfig fromDuration = RetrieverConfig.builder(installationProperties)
                .signal(FWD)
                .endTime("06/05/2023 12:00:00")
                .durationHours(0.5)
                .build();
        Assertions.assertEquals(TimeUtils.parseWallClock("06/05/2023 11:30:00"), fromDuration.getStartTime());

        RetrieverConfig fromStart = RetrieverConfig.builder(installationProperties)
                .signal(FWD)
                .startTime("06/05/2023 08:00:00")
                .build();
        Assertions.assertEquals(TimeUtils.parseWallClock("06/05/2023 12:00:00"), fromStart.getEndTime());

        RetrieverConfig nothing = RetrieverConfig.builder(installationProperties).build();
        Assertions.assertEquals(RetrieverConfig.DEFAULT_DURATION_HOURS, nothing.getDurationHours(), 1e-12);
        Assertions.assertFalse(nothing.getEndTime().isAfter(LocalDateTime.now()));
        Assertions.assertEquals(InstallationProperties.DEFAULT_SIGNALS, nothing.getSignals());
    }

    @Test
    public void testBuilderErrors() {
        Assertions.assertThrows(ConfigException.class, () -> RetrieverConfig.builder(installationProperties)
                .signal(FWD).startTime("06/05/2023 08:00:00").endTime("06/05/2023 12:00:00").durationHours(3.0).build());
        Assertions.assertThrows(ConfigException.class, () -> RetrieverConfig.builder(installationProperties)
                .signal(FWD).startTime("06/05/2023 12:00:00").endTime("06/05/2023 08:00:00").build());
        Assertions.assertThrows(ConfigException.class, () -> RetrieverConfig.builder(installationProperties)
                .signal(FWD).startTime("2023-06-05 08:00"));
        Assertions.assertThrows(ConfigException.class, () -> RetrieverConfig.builder(installationProperties)
                .signal(FWD).server("APS").build());
        Assertions.assertThrows(ConfigException.class, () -> RetrieverConfig.builder(installationProperties)
                .signals(List.of()).build());
        Assertions.assertThrows(ConfigException.class, () -> RetrieverConfig.builder(installationProperties)
                .signals(List.of(FWD, DFACT))
                .alignSetup(AlignSetup.of(REV, 0, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, 1.0, true))
                .build());
        // The index has to point to the reference PV
        Assertions.assertThrows(ConfigException.class, () -> RetrieverConfig.builder(installationProperties)
                .signals(List.of(FWD, DFACT))
                .alignSetup(AlignSetup.of(DFACT, 0, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, 1.0, true))
                .build());
    }

    @Test
    public void testTimeSetters() throws Exception {
        RetrieverConfig config = config();

        // Moving the start keeps the duration
        config.setStartTime("06/05/2023 09:00:00");
        Assertions.assertEquals(TimeUtils.parseWallClock("06/05/2023 13:00:00"), config.getEndTime());
        Assertions.assertEquals(4.0, config.getDurationHours(), 1e-12);

        // Moving the end keeps the duration
        config.setEndTime("06/05/2023 10:00:00");
        Assertions.assertEquals(TimeUtils.parseWallClock("06/05/2023 06:00:00"), config.getStartTime());

        // Changing the duration keeps the end
        config.setDurationHours(2.5);
        Assertions.assertEquals(TimeUtils.parseWallClock("06/05/2023 07:30:00"), config.getStartTime());
        Assertions.assertEquals(TimeUtils.parseWallClock("06/05/2023 10:00:00"), config.getEndTime());

        Assertions.assertThrows(ConfigException.class, () -> config.setDurationHours(-1.0));
        Assertions.assertThrows(ConfigException.class, () -> config.setDurationHours((Number) null));
        Assertions.assertThrows(ConfigException.class, () -> config.setStartTime("not a time"));
        Assertions.assertThrows(ConfigException.class, () -> config.setEndTime((LocalDateTime) null));
        Assertions.assertEquals(2.5, config.getDurationHours(), 1e-12);
    }

    @Test
    public void testSetSignals() throws Exception {
        RetrieverConfig config = config();
        config.setBaseSignal(DFACT, null, List.of(ValueRange.of(0, 1)), 1.0, 1.0, true);
        Assertions.assertEquals(1, config.getAlignSetup().getReferenceIndex());

        config.setSignals(List.of(" " + REV + " ", DFACT, REV));
        Assertions.assertEquals(List.of(REV, DFACT), config.getSignals());
        // The reference is still configured; only its position changed
        Assertions.assertEquals(DFACT, config.getAlignSetup().getReferenceSignal());
        Assertions.assertEquals(1, config.getAlignSetup().getReferenceIndex());
        Assertions.assertEquals(List.of(new ValueRange(0, 1)), config.getAlignSetup().getValueRanges());

        config.setSignal(FWD);
        Assertions.assertEquals(List.of(FWD), config.getSignals());
        Assertions.assertEquals(FWD, config.getAlignSetup().getReferenceSignal());
        Assertions.assertEquals(0, config.getAlignSetup().getReferenceIndex());

        Assertions.assertThrows(ConfigException.class, () -> config.setSignals(List.of()));
        Assertions.assertThrows(ConfigException.class, () -> config.setSignals(List.of(DFACT, "")));
        Assertions.assertEquals(List.of(FWD), config.getSignals());
    }

    @Test
    public void testSetBaseSignal() throws Exception {
        RetrieverConfig config = config();
        // The name takes precedence over the index
        config.setBaseSignal(REV, 0, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, 1.0, true);
        Assertions.assertEquals(REV, config.getAlignSetup().getReferenceSignal());
        Assertions.assertEquals(2, config.getAlignSetup().getReferenceIndex());

        config.setBaseSignal(null, 1, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, 1.0, true);
        Assertions.assertEquals(DFACT, config.getAlignSetup().getReferenceSignal());

        Assertions.assertThrows(ConfigException.class, () -> config.setBaseSignal(null, 3, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, 1.0, true));
        Assertions.assertThrows(ConfigException.class, () -> config.setBaseSignal("NOT:CONFIGURED", null, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, 1.0, true));
        Assertions.assertThrows(ConfigException.class, () -> config.setBaseSignal(null, null, AlignSetup.DEFAULT_VALUE_RANGES, 1.0, 1.0, true));
        Assertions.assertEquals(DFACT, config.getAlignSetup().getReferenceSignal());
    }

    @Test
    public void testOtherSetters() throws Exception {
        RetrieverConfig config = config();
        config.setServer("Ssrl");
        Assertions.assertEquals(ArchiverServer.SSRL, config.getServer());
        Assertions.assertThrows(ConfigException.class, () -> config.setServer((ArchiverServer) null));

        config.setUTCOffsetHours(8);
        Assertions.assertEquals(28800, config.getUTCOffsetSeconds());
        Assertions.assertThrows(ConfigException.class, () -> config.setUTCOffsetHours(25));

        Assertions.assertThrows(ConfigException.class, () -> config.setFetchMaxThreads(0));
        Assertions.assertThrows(ConfigException.class, () -> config.setFetchTimeoutMillis(-5));

        RetrieverConfig copy = config.copy();
        copy.setServer(ArchiverServer.LCLS);
        Assertions.assertEquals(ArchiverServer.SSRL, config.getServer());
    }
}
