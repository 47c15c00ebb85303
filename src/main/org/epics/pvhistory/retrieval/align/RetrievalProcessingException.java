/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.align;

/**
 * Super class for the ways in which turning raw data into an aligned dataset can fail.
 * These are returned as part of a {@link org.epics.pvhistory.common.Result} rather than thrown.
 */
public class RetrievalProcessingException extends Exception {
	private static final long serialVersionUID = 7316593720845917303L;

	public RetrievalProcessingException(String msg) {
		super(msg);
	}
}
