/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.client;

import org.epics.pvhistory.data.Signal;

/**
 * What came back from fetching one PV.
 * On failure, the signal is empty and the error says why.
 */
public record FetchResult(Signal signal, FetchException error) {

    public static FetchResult success(Signal signal) {
        return new FetchResult(signal, null);
    }

    public static FetchResult failure(String pvName, FetchException error) {
        return new FetchResult(Signal.empty(pvName), error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
