/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.config.exception;

/**
 * Thrown for invalid or inconsistent retriever configuration.
 * The configuration that raised this is left as it was before the call.
 */
public class ConfigException extends Exception {
	private static final long serialVersionUID = -1195048537953477832L;

	public ConfigException(String msg) {
		super(msg);
	}

	public ConfigException(String msg, Throwable ex) {
		super(msg, ex);
	}
}
