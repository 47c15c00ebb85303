/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.client;

import java.io.IOException;

/**
 * Why we could not get data for a PV.
 * These never abort a batch; the PV simply ends up with no data.
 */
public class FetchException extends IOException {
    private static final long serialVersionUID = 4462119880123470385L;

    public enum Reason {
        /** Could not talk to the server, or the server returned an error status */
        NETWORK,
        /** The server did not respond within the configured timeout */
        TIMEOUT,
        /** The response did not follow the documented schema */
        MALFORMED_RESPONSE,
        /** The server does not know about this PV or has no data for it */
        UNKNOWN_PV
    }

    private final String pvName;
    private final Reason reason;

    public FetchException(String pvName, Reason reason, String message) {
        super(message);
        this.pvName = pvName;
        this.reason = reason;
    }

    public FetchException(String pvName, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.pvName = pvName;
        this.reason = reason;
    }

    public String getPvName() {
        return pvName;
    }

    public Reason getReason() {
        return reason;
    }
}
