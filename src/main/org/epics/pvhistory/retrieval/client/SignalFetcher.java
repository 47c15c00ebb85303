/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.client;

import org.epics.pvhistory.common.TimeWindow;

/**
 * Gets the samples for one PV over a time window.
 * Implementations never throw; failures are reported in the {@link FetchResult}.
 * Calls for different PVs may run at the same time.
 */
public interface SignalFetcher {
	/**
	 * Get the samples for a PV covering the window.
	 * On success the first sample is at the start of the window and the last sample is at the end of the window.
	 * @param pvName The name of the PV
	 * @param window Wall clock time window
	 * @return FetchResult The samples, or an empty signal and the reason for the failure
	 */
	public FetchResult fetch(String pvName, TimeWindow window);
}
