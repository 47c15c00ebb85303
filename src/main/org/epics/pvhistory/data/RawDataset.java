/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.data;

import org.epics.pvhistory.common.TimeWindow;
import org.epics.pvhistory.retrieval.client.FetchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The raw samples for each configured PV over a time window, in the order the PVs were configured.
 * PVs whose fetch failed have an empty signal and an entry in the failures.
 */
public final class RawDataset {
    private final TimeWindow window;
    private final Map<String, Signal> signals;
    private final Map<String, FetchException> failures;

    public RawDataset(TimeWindow window, Map<String, Signal> signals, Map<String, FetchException> failures) {
        this.window = window;
        this.signals = Collections.unmodifiableMap(new LinkedHashMap<>(signals));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public TimeWindow getWindow() {
        return window;
    }

    public List<String> getSignalNames() {
        return new ArrayList<>(signals.keySet());
    }

    public boolean containsSignal(String name) {
        return signals.containsKey(name);
    }

    /**
     * @param name PV name
     * @return The signal; null if this PV is not part of this dataset
     */
    public Signal getSignal(String name) {
        return signals.get(name);
    }

    public Map<String, Signal> getSignals() {
        return signals;
    }

    public Map<String, FetchException> getFailures() {
        return failures;
    }

    public int getPopulatedCount() {
        int count = 0;
        for (Signal signal : signals.values()) {
            if (!signal.isEmpty()) count++;
        }
        return count;
    }

    public int getEmptyCount() {
        return signals.size() - getPopulatedCount();
    }

    public boolean isEmpty() {
        return getPopulatedCount() == 0;
    }

    @Override
    public String toString() {
        return "RawDataset for " + window + " with " + getPopulatedCount() + " populated and " + getEmptyCount() + " empty PVs";
    }
}
