/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.align;

/**
 * The time axis handed to the resampler is empty or does not match the values.
 */
public class DimensionException extends RetrievalProcessingException {
	private static final long serialVersionUID = 2867436907260712178L;

	public DimensionException(String msg) {
		super(msg);
	}
}
