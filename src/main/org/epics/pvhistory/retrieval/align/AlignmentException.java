/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.align;

/**
 * No samples of the reference PV survived trimming, or there is no reference PV to align against.
 */
public class AlignmentException extends RetrievalProcessingException {
	private static final long serialVersionUID = -5014722880451364930L;

	public AlignmentException(String msg) {
		super(msg);
	}
}
