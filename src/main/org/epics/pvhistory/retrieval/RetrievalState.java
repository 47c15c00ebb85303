/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval;

/**
 * What a {@link HistoryRetriever} currently holds.
 */
public enum RetrievalState {
	/**
	 * Nothing fetched for the current configuration.
	 */
	UNCONFIGURED,
	/**
	 * Raw data fetched; nothing aligned yet.
	 */
	RAW_FETCHED,
	/**
	 * Raw data fetched and aligned with the current alignment setup.
	 */
	ALIGNED
}
