/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.client;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logs progress and failures; this is what a retriever uses unless told otherwise.
 */
public class LoggingFetchListener implements FetchListener {
    private static final Logger logger = LogManager.getLogger(LoggingFetchListener.class);
    private static final int BAR_LENGTH = 40;

    @Override
    public void fetchCompleted(FetchResult result, int completed, int total) {
        String pvName = result.signal().getName();
        if (!result.isSuccess()) {
            logger.warn("Warning: The PV " + pvName + " is not valid! Error: " + result.error().getMessage());
        }
        double progress = total == 0 ? 1.0 : completed / (double) total;
        int block = (int) Math.round(BAR_LENGTH * progress);
        logger.info("Progress: {}% [{}{}] - [{}]",
                Math.round(progress * 100), "#".repeat(block), "-".repeat(BAR_LENGTH - block), pvName);
    }
}
