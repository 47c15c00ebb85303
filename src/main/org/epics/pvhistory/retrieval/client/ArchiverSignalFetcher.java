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
import org.epics.pvhistory.common.TimeUtils;
import org.epics.pvhistory.common.TimeWindow;
import org.epics.pvhistory.data.Signal;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.StringWriter;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Gets the samples for a PV from the JSON retrieval endpoint of the archiver appliance.
 * <p>
 * The response is expected to look like <code>[ { "meta": {...}, "data": [ {"secs": ..., "nanos": ..., "val": ...}, ... ] } ]</code>.
 * <p>
 * The samples are then extended to cover the whole window.
 * The value at the start of the window is the last sample at or before the start; or the earliest sample if there is none.
 * The value at the end of the window is the first sample at or after the end; or the latest sample if there is none.
 * Samples outside the window are dropped.
 */
public class ArchiverSignalFetcher implements SignalFetcher {
	private static final Logger logger = LogManager.getLogger(ArchiverSignalFetcher.class.getName());
	private final ArchiveTransport transport;
	private final String accessURL;
	private final long utcOffsetSeconds;

	/**
	 * @param transport Used to make the calls
	 * @param accessURL The getData.json URL of the appliance
	 * @param utcOffsetSeconds Seconds to add to the wall clock to get UTC
	 */
	public ArchiverSignalFetcher(ArchiveTransport transport, String accessURL, long utcOffsetSeconds) {
		this.transport = transport;
		this.accessURL = accessURL;
		this.utcOffsetSeconds = utcOffsetSeconds;
	}

	@Override
	public FetchResult fetch(String pvName, TimeWindow window) {
		String getURL = buildURL(pvName, window);
		logger.info("URL to fetch data is " + getURL);
		JSONArray response;
		try {
			response = transport.getJSONArray(getURL);
		} catch (InterruptedIOException ex) {
			return FetchResult.failure(pvName, new FetchException(pvName, FetchException.Reason.TIMEOUT,
					"Timed out fetching data for PV " + pvName + " from " + getURL, ex));
		} catch (MalformedResponseException ex) {
			return FetchResult.failure(pvName, new FetchException(pvName, FetchException.Reason.MALFORMED_RESPONSE, ex.getMessage(), ex));
		} catch (IOException | RuntimeException ex) {
			return FetchResult.failure(pvName, new FetchException(pvName, FetchException.Reason.NETWORK,
					"Exception fetching data for PV " + pvName + " from " + getURL + ": " + ex.getMessage(), ex));
		}

		try {
			Signal signal = extendToWindow(pvName, parseSamples(pvName, response), window);
			logger.debug("Got {} samples for PV {}", signal.size(), pvName);
			return FetchResult.success(signal);
		} catch (FetchException ex) {
			return FetchResult.failure(pvName, ex);
		} catch (RuntimeException ex) {
			logger.error("Unexpected exception processing the response for PV " + pvName + " from " + getURL, ex);
			return FetchResult.failure(pvName, new FetchException(pvName, FetchException.Reason.MALFORMED_RESPONSE,
					"Cannot process the response for PV " + pvName + ": " + ex, ex));
		}
	}

	/**
	 * @param pvName The name of the PV
	 * @param window Wall clock window
	 * @return The retrieval URL for this PV and window, with the times converted to the service's UTC convention
	 */
	public String buildURL(String pvName, TimeWindow window) {
		TimeUtils.logTimeConversion("Start of window", window.getStartTime(), utcOffsetSeconds);
		StringWriter buf = new StringWriter();
		buf.append(accessURL)
		.append("?pv=").append(URLEncoder.encode(pvName, StandardCharsets.UTF_8))
		.append("&from=").append(TimeUtils.convertToISO8601String(TimeUtils.convertWallClockToServiceInstant(window.getStartTime(), utcOffsetSeconds)))
		.append("&to=").append(TimeUtils.convertToISO8601String(TimeUtils.convertWallClockToServiceInstant(window.getEndTime(), utcOffsetSeconds)));
		return buf.toString();
	}

	/**
	 * Parse the samples out of the response; sorted by time with duplicate timestamps removed.
	 * @param pvName The name of the PV
	 * @param response What the server sent
	 * @return Samples as [secs, val] pairs; never empty
	 * @throws FetchException if the response does not follow the schema or has no samples
	 */
	List<double[]> parseSamples(String pvName, JSONArray response) throws FetchException {
		if (response == null) {
			throw new FetchException(pvName, FetchException.Reason.MALFORMED_RESPONSE, "No response body for PV " + pvName);
		}
		if (response.isEmpty()) {
			throw new FetchException(pvName, FetchException.Reason.UNKNOWN_PV, "The server returned no data for PV " + pvName);
		}
		if (!(response.get(0) instanceof JSONObject)) {
			throw new FetchException(pvName, FetchException.Reason.MALFORMED_RESPONSE, "Expecting an object as the first element of the response for PV " + pvName);
		}
		Object dataObj = ((JSONObject) response.get(0)).get("data");
		if (!(dataObj instanceof JSONArray)) {
			throw new FetchException(pvName, FetchException.Reason.MALFORMED_RESPONSE, "Response for PV " + pvName + " does not have a data array");
		}
		JSONArray data = (JSONArray) dataObj;
		if (data.isEmpty()) {
			throw new FetchException(pvName, FetchException.Reason.UNKNOWN_PV, "The server has no samples for PV " + pvName);
		}

		List<double[]> samples = new ArrayList<>(data.size());
		for (Object recordObj : data) {
			if (!(recordObj instanceof JSONObject)) {
				throw new FetchException(pvName, FetchException.Reason.MALFORMED_RESPONSE, "Sample " + recordObj + " for PV " + pvName + " is not an object");
			}
			JSONObject record = (JSONObject) recordObj;
			Object secs = record.get("secs");
			Object nanos = record.get("nanos");
			Object val = record.get("val");
			if (!(secs instanceof Number) || !(val instanceof Number) || (nanos != null && !(nanos instanceof Number))) {
				throw new FetchException(pvName, FetchException.Reason.MALFORMED_RESPONSE, "Sample " + record.toJSONString() + " for PV " + pvName + " is not a scalar sample");
			}
			long nanosVal = nanos == null ? 0 : ((Number) nanos).longValue();
			double ts = TimeUtils.convertServiceTimeToWallClockSeconds(((Number) secs).longValue(), nanosVal, utcOffsetSeconds);
			samples.add(new double[] { ts, ((Number) val).doubleValue() });
		}

		samples.sort(Comparator.comparingDouble(s -> s[0]));
		List<double[]> deduped = new ArrayList<>(samples.size());
		for (double[] sample : samples) {
			if (deduped.isEmpty() || sample[0] > deduped.get(deduped.size() - 1)[0]) {
				deduped.add(sample);
			}
		}
		return deduped;
	}

	/**
	 * Add samples at the start and end of the window and drop everything outside it.
	 * @param pvName The name of the PV
	 * @param samples Sorted, unique [secs, val] pairs; at least one
	 * @param window Wall clock window
	 * @return Signal whose first sample is at the start of the window and last sample is at the end
	 */
	static Signal extendToWindow(String pvName, List<double[]> samples, TimeWindow window) {
		double startSecs = window.getStartEpochSeconds();
		double endSecs = window.getEndEpochSeconds();

		double startVal = samples.get(0)[1];
		for (double[] sample : samples) {
			if (sample[0] <= startSecs) {
				startVal = sample[1];
			} else {
				break;
			}
		}
		double endVal = samples.get(samples.size() - 1)[1];
		for (double[] sample : samples) {
			if (sample[0] >= endSecs) {
				endVal = sample[1];
				break;
			}
		}

		double[] secs = new double[samples.size() + 2];
		double[] vals = new double[samples.size() + 2];
		int count = 0;
		secs[count] = startSecs;
		vals[count++] = startVal;
		for (double[] sample : samples) {
			if (sample[0] > startSecs && sample[0] < endSecs) {
				secs[count] = sample[0];
				vals[count++] = sample[1];
			}
		}
		secs[count] = endSecs;
		vals[count++] = endVal;
		return new Signal(pvName, Arrays.copyOf(secs, count), Arrays.copyOf(vals, count));
	}
}
