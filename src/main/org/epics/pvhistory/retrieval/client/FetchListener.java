/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.client;

/**
 * Out-of-band notifications while a batch of PVs is being fetched.
 * Calls are made from the thread that merges the results, one PV at a time.
 */
public interface FetchListener {
	/**
	 * Called once for each PV in the batch.
	 * @param result What came back for this PV
	 * @param completed How many PVs have been merged so far, including this one
	 * @param total Number of PVs in the batch
	 */
	public void fetchCompleted(FetchResult result, int completed, int total);
}
