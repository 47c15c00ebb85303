/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.epics.pvhistory.retrieval;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.epics.pvhistory.common.Result;
import org.epics.pvhistory.common.TimeWindow;
import org.epics.pvhistory.config.AlignSetup;
import org.epics.pvhistory.config.ArchiverServer;
import org.epics.pvhistory.config.RetrieverConfig;
import org.epics.pvhistory.config.ValueRange;
import org.epics.pvhistory.config.exception.ConfigException;
import org.epics.pvhistory.data.AlignedDataset;
import org.epics.pvhistory.data.RawDataset;
import org.epics.pvhistory.data.Signal;
import org.epics.pvhistory.retrieval.align.Alignment;
import org.epics.pvhistory.retrieval.align.AlignmentEngine;
import org.epics.pvhistory.retrieval.align.ResampledData;
import org.epics.pvhistory.retrieval.align.Resampler;
import org.epics.pvhistory.retrieval.align.RetrievalProcessingException;
import org.epics.pvhistory.retrieval.client.ArchiveTransport;
import org.epics.pvhistory.retrieval.client.ArchiverSignalFetcher;
import org.epics.pvhistory.retrieval.client.FetchException;
import org.epics.pvhistory.retrieval.client.FetchListener;
import org.epics.pvhistory.retrieval.client.FetchResult;
import org.epics.pvhistory.retrieval.client.HttpArchiveTransport;
import org.epics.pvhistory.retrieval.client.LoggingFetchListener;
import org.epics.pvhistory.retrieval.client.SignalFetcher;

import java.io.Closeable;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches the history of a set of PVs from the archiver and aligns them onto a common, uniform time axis.
 * <p>
 * {@link #getHistory()} fetches all the PVs in parallel and replaces the raw dataset.
 * {@link #alignHistory()} trims, bridges and resamples the raw dataset (fetching it first if needed) and replaces the aligned dataset.
 * Changing the PVs, the server, the time window or the UTC offset discards everything fetched so far;
 * changing the alignment setup discards only the aligned dataset.
 * <p>
 * The HTTP client is created once; its timeout and pool size come from the configuration at construction time.
 * A retriever is meant to be used from one thread at a time.
 */
public class HistoryRetriever implements Closeable {
	private static final Logger logger = LogManager.getLogger(HistoryRetriever.class);

	private final RetrieverConfig config;
	private final ArchiveTransport transport;
	private final FetchListener listener;
	private final AlignmentEngine alignmentEngine = new AlignmentEngine();
	private final Resampler resampler = new Resampler();

	private RetrievalState state = RetrievalState.UNCONFIGURED;
	private RawDataset rawDataset;
	private AlignedDataset alignedDataset;

	public HistoryRetriever(RetrieverConfig config) {
		this(config, new HttpArchiveTransport(config.getFetchTimeoutMillis(), config.getFetchMaxThreads()), new LoggingFetchListener());
	}

	/**
	 * @param config Copied; later changes go through the setters of this retriever
	 * @param transport Used for all calls to the archiver; closed when this retriever is closed
	 * @param listener Told about each completed fetch
	 */
	public HistoryRetriever(RetrieverConfig config, ArchiveTransport transport, FetchListener listener) {
		this.config = config.copy();
		this.transport = transport;
		this.listener = listener;
	}

	/**
	 * Fetch all the configured PVs over the configured window.
	 * Failures of individual PVs do not fail the batch; those PVs have an empty signal and an entry in the failures of the dataset.
	 * @return The raw dataset, with the PVs in the configured order
	 * @throws ConfigException if there are no PVs to fetch
	 */
	public RawDataset getHistory() throws ConfigException {
		List<String> pvNames = config.getSignals();
		if (pvNames.isEmpty()) {
			throw new ConfigException("No PVs to fetch");
		}
		TimeWindow window = config.getWindow();
		SignalFetcher fetcher = new ArchiverSignalFetcher(transport, config.getServer().getRetrievalURL(), config.getUTCOffsetSeconds());
		int total = pvNames.size();
		int threads = Math.min(total, config.getFetchMaxThreads());
		logger.info("Fetching {} PVs from {} for {} using {} threads", total, config.getServer(), window, threads);

		AtomicInteger completed = new AtomicInteger(0);
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			List<CompletableFuture<FetchResult>> fetches = new LinkedList<>();
			for (String pvName : pvNames) {
				fetches.add(CompletableFuture
						.supplyAsync(() -> fetcher.fetch(pvName, window), executor)
						.thenApply(result -> notifyListener(result, completed.incrementAndGet(), total)));
			}
			CompletableFuture.allOf(toArray(fetches)).join();

			Map<String, Signal> signals = new LinkedHashMap<>();
			Map<String, FetchException> failures = new LinkedHashMap<>();
			for (CompletableFuture<FetchResult> fetch : fetches) {
				FetchResult result = fetch.join();
				signals.put(result.signal().getName(), result.signal());
				if (!result.isSuccess()) {
					failures.put(result.signal().getName(), result.error());
				}
			}

			RawDataset fetched = new RawDataset(window, signals, failures);
			if (fetched.isEmpty()) {
				logger.error("Could not get data for any of the " + total + " PVs " + pvNames + " from " + config.getServer());
			} else {
				logger.info("Got data for {} of {} PVs", fetched.getPopulatedCount(), total);
			}
			this.rawDataset = fetched;
			this.alignedDataset = null;
			this.state = RetrievalState.RAW_FETCHED;
			return fetched;
		} finally {
			executor.shutdown();
		}
	}

	/**
	 * Align the raw dataset against the reference PV and resample it; the raw dataset is fetched first if there is none.
	 * If this fails, whatever was fetched or aligned earlier is left as it was.
	 * @return The aligned dataset; or an AlignmentException if no reference sample is within range, or a DimensionException if there is nothing to resample
	 * @throws ConfigException if the raw data has to be fetched and there are no PVs to fetch
	 */
	public Result<AlignedDataset, RetrievalProcessingException> alignHistory() throws ConfigException {
		if (rawDataset == null) {
			getHistory();
		}
		AlignSetup setup = config.getAlignSetup();
		Result<AlignedDataset, RetrievalProcessingException> result = Result
				.<Alignment, RetrievalProcessingException>widen(alignmentEngine.align(rawDataset, setup, config.getSignals()))
				.flatMap(alignment -> resampler
						.resample(alignment.getCumulativeTime(), alignment.getValues(), setup.getResampleSeconds())
						.map(resampled -> toDataset(alignment, resampled)));

		if (result.isOk()) {
			this.alignedDataset = result.getValue();
			this.state = RetrievalState.ALIGNED;
			logger.info("Aligned {} PVs onto {} points starting at {}", alignedDataset.getSignalNames().size(), alignedDataset.size(), alignedDataset.getStartTime());
		} else {
			logger.error("Could not align the data for " + config.getSignals() + ": " + result.getError().getMessage());
		}
		return result;
	}

	private static AlignedDataset toDataset(Alignment alignment, ResampledData resampled) {
		return new AlignedDataset(alignment.getStartTime(), alignment.getSignalNames(), resampled.time(), resampled.values(), resampled.totalDurationSeconds());
	}

	private FetchResult notifyListener(FetchResult result, int completedCount, int total) {
		try {
			listener.fetchCompleted(result, completedCount, total);
		} catch (RuntimeException ex) {
			logger.error("Exception notifying the fetch listener about " + result.signal().getName(), ex);
		}
		return result;
	}

	private static <T> CompletableFuture<T>[] toArray(List<CompletableFuture<T>> list) {
		@SuppressWarnings("unchecked")
		CompletableFuture<T>[] futures = list.toArray(new CompletableFuture[0]);
		return futures;
	}

	public RetrievalState getState() {
		return state;
	}

	/**
	 * @return The last fetched raw dataset; null if nothing has been fetched for the current configuration
	 */
	public RawDataset getRawDataset() {
		return rawDataset;
	}

	/**
	 * @return The last aligned dataset; null if nothing has been aligned for the current configuration
	 */
	public AlignedDataset getAlignedDataset() {
		return alignedDataset;
	}

	/**
	 * @return A copy of the current configuration
	 */
	public RetrieverConfig getConfig() {
		return config.copy();
	}

	public List<String> getSignals() {
		return config.getSignals();
	}

	public void setSignals(List<String> signals) throws ConfigException {
		config.setSignals(signals);
		discardRawData();
	}

	public void setSignal(String signal) throws ConfigException {
		config.setSignal(signal);
		discardRawData();
	}

	public ArchiverServer getServer() {
		return config.getServer();
	}

	public void setServer(ArchiverServer server) throws ConfigException {
		config.setServer(server);
		discardRawData();
	}

	public void setServer(String serverName) throws ConfigException {
		config.setServer(serverName);
		discardRawData();
	}

	public LocalDateTime getStartTime() {
		return config.getStartTime();
	}

	public void setStartTime(LocalDateTime startTime) throws ConfigException {
		config.setStartTime(startTime);
		discardRawData();
	}

	public void setStartTime(String startTime) throws ConfigException {
		config.setStartTime(startTime);
		discardRawData();
	}

	public LocalDateTime getEndTime() {
		return config.getEndTime();
	}

	public void setEndTime(LocalDateTime endTime) throws ConfigException {
		config.setEndTime(endTime);
		discardRawData();
	}

	public void setEndTime(String endTime) throws ConfigException {
		config.setEndTime(endTime);
		discardRawData();
	}

	public double getDurationHours() {
		return config.getDurationHours();
	}

	public void setDurationHours(double durationHours) throws ConfigException {
		config.setDurationHours(durationHours);
		discardRawData();
	}

	public double getUTCOffsetHours() {
		return config.getUTCOffsetHours();
	}

	public void setUTCOffsetHours(double utcOffsetHours) throws ConfigException {
		config.setUTCOffsetHours(utcOffsetHours);
		discardRawData();
	}

	public int getFetchMaxThreads() {
		return config.getFetchMaxThreads();
	}

	public void setFetchMaxThreads(int fetchMaxThreads) throws ConfigException {
		config.setFetchMaxThreads(fetchMaxThreads);
	}

	public AlignSetup getAlignSetup() {
		return config.getAlignSetup();
	}

	public void setAlignSetup(AlignSetup alignSetup) throws ConfigException {
		config.setAlignSetup(alignSetup);
		discardAlignedData();
	}

	public void setAlignSetup(Map<String, ?> alignSetup) throws ConfigException {
		config.setAlignSetup(alignSetup);
		discardAlignedData();
	}

	/**
	 * @see RetrieverConfig#setBaseSignal(String, Integer, List, double, double, boolean)
	 */
	public void setBaseSignal(String referenceSignal, Integer referenceIndex, List<ValueRange> valueRanges,
			double bridgeSeconds, double resampleSeconds, boolean trim) throws ConfigException {
		config.setBaseSignal(referenceSignal, referenceIndex, valueRanges, bridgeSeconds, resampleSeconds, trim);
		discardAlignedData();
	}

	private void discardRawData() {
		if (state != RetrievalState.UNCONFIGURED) {
			logger.debug("Discarding the fetched data as the configuration has changed");
		}
		this.rawDataset = null;
		this.alignedDataset = null;
		this.state = RetrievalState.UNCONFIGURED;
	}

	private void discardAlignedData() {
		this.alignedDataset = null;
		this.state = rawDataset == null ? RetrievalState.UNCONFIGURED : RetrievalState.RAW_FETCHED;
	}

	@Override
	public void close() throws IOException {
		transport.close();
	}
}
