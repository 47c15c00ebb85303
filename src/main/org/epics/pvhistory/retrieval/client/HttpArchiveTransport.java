/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval.client;

import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Gets JSON from the archiver's retrieval service over HTTP using a pooled Apache HttpClient.
 * The same timeout is used for connecting, waiting for a pooled connection and waiting for data.
 */
public class HttpArchiveTransport implements ArchiveTransport {
    private static final Logger logger = LogManager.getLogger(HttpArchiveTransport.class);
    private final CloseableHttpClient httpclient;

    /**
     * @param timeoutMillis Per request timeout; 0 means wait forever
     * @param maxConnections Largest number of requests in flight at the same time
     */
    public HttpArchiveTransport(int timeoutMillis, int maxConnections) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();
        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(Math.max(1, maxConnections));
        connectionManager.setDefaultMaxPerRoute(Math.max(1, maxConnections));
        this.httpclient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Override
    public JSONArray getJSONArray(String url) throws IOException {
        logger.debug("Getting the contents of " + url + " as a JSON array.");
        HttpGet getMethod = new HttpGet(url);
        getMethod.addHeader("Accept", "application/json");
        try (CloseableHttpResponse response = httpclient.execute(getMethod)) {
            int statusCode = response.getStatusLine().getStatusCode();
            if (statusCode != 200) {
                throw new IOException("Invalid status calling " + url + ". Got " + statusCode + " " + response.getStatusLine().getReasonPhrase());
            }
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new IOException("HTTP response did not have an entity associated with it");
            }
            logger.debug("Obtained a HTTP entity of length {}", entity.getContentLength());
            try (InputStream is = entity.getContent()) {
                Object parsed = new JSONParser().parse(new InputStreamReader(is, StandardCharsets.UTF_8));
                if (!(parsed instanceof JSONArray)) {
                    throw new MalformedResponseException("Expecting a JSON array from " + url + "; got " + (parsed == null ? "null" : parsed.getClass().getSimpleName()));
                }
                return (JSONArray) parsed;
            } catch (ParseException pex) {
                throw new MalformedResponseException("Parse exception getting contents of URL " + url + " at " + pex.getPosition(), pex);
            }
        }
    }

    @Override
    public void close() throws IOException {
        httpclient.close();
    }
}
