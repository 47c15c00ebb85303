/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.config;

import org.apache.commons.lang3.StringUtils;
import org.epics.pvhistory.config.exception.ConfigException;

/**
 * The archiver appliances we know how to get data from.
 * Each one maps to the JSON retrieval endpoint of that appliance.
 */
public enum ArchiverServer {
    LCLS("http://lcls-archapp.slac.stanford.edu/retrieval/data/getData.json"),
    SSRL("http://spear-arch1.slac.stanford.edu/retrieval/data/getData.json");

    private final String retrievalURL;

    ArchiverServer(String retrievalURL) {
        this.retrievalURL = retrievalURL;
    }

    public String getRetrievalURL() {
        return retrievalURL;
    }

    /**
     * Case insensitive lookup by name.
     * @param name LCLS or SSRL
     * @return ArchiverServer
     * @throws ConfigException if this is not a server we know about
     */
    public static ArchiverServer fromName(String name) throws ConfigException {
        if (StringUtils.isBlank(name)) {
            throw new ConfigException("No archiver server specified");
        }
        for (ArchiverServer server : values()) {
            if (server.name().equalsIgnoreCase(name.trim())) {
                return server;
            }
        }
        throw new ConfigException("Invalid archiver server " + name + ". Please choose either LCLS or SSRL.");
    }
}
