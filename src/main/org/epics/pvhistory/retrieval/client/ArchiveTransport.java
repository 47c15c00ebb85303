/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.client;

import org.json.simple.JSONArray;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;

/**
 * Gets the contents of a retrieval URL as a JSON array.
 * Implementations must be safe to call from multiple threads at the same time.
 */
public interface ArchiveTransport extends Closeable {
    /**
     * @param url Fully formed retrieval URL
     * @return The parsed response
     * @throws SocketTimeoutException if the server took too long
     * @throws MalformedResponseException if the response is not a JSON array
     * @throws IOException for network errors and error statuses
     */
    public JSONArray getJSONArray(String url) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
