/* Copyright (C) 2006-2014 National and University Library of Iceland (NULI)
 * 
 * This file is part of the SnapshotFinder (Wayback CDX snapshot resolver).
 * 
 *  NULI licenses this file to You under the Apache License, Version 2.0
 *  (the "License"); you may not use this file except in compliance with
 *  the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package is.landsbokasafn.snapshotfinder.resolver;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import is.landsbokasafn.snapshotfinder.CaptureRow;
import is.landsbokasafn.snapshotfinder.DateWindow;
import is.landsbokasafn.snapshotfinder.MasterListEntry;
import is.landsbokasafn.snapshotfinder.Snapshot;
import is.landsbokasafn.snapshotfinder.cdx.CaptureQuery;
import is.landsbokasafn.snapshotfinder.cdx.CaptureSource;

/**
 * Resolves a master list by splitting it into batches and querying for each batch on its own thread.
 * <p>
 * Each batch builds a private index. Once every batch has finished (or failed, or timed out) the coordinating
 * thread merges the indexes in batch order. A failed batch contributes an empty index, the run goes on without
 * the URLs it held.
 */
public class ParallelSnapshotResolver {
	private static final Log log = LogFactory.getLog(ParallelSnapshotResolver.class);

	private final CaptureSource source;
	private final SnapshotIndexer indexer = new SnapshotIndexer();
	private final SnapshotMatcher matcher;
	private final int parallelism;
	private final int batchRowLimit;
	private final long batchTimeoutMs;

	/**
	 * @param source Where captures are looked up, shared by all batches
	 * @param matcher Produces the snapshots from the merged index
	 * @param parallelism Number of batches, and of worker threads
	 * @param batchRowLimit Row limit of each batch query, 0 for none
	 * @param batchTimeoutMs Time allowed for all batches to finish. Batches still running then are failed.
	 */
	public ParallelSnapshotResolver(CaptureSource source, SnapshotMatcher matcher, int parallelism,
			int batchRowLimit, long batchTimeoutMs) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("Parallelism must be at least 1, was " + parallelism);
		}
		if (batchTimeoutMs <= 0) {
			throw new IllegalArgumentException("Batch timeout must be positive, was " + batchTimeoutMs);
		}
		this.source = source;
		this.matcher = matcher;
		this.parallelism = parallelism;
		this.batchRowLimit = batchRowLimit;
		this.batchTimeoutMs = batchTimeoutMs;
	}

	/**
	 * @param domain The domain, used for the <code>domain/*</code> query of multi URL batches
	 * @param window Query window
	 * @param targetTimestamp Target as a 14 digit number
	 * @param masterList Entries to resolve
	 * @param stats Counters to update
	 * @return Ranked snapshots for the entries a capture was found for
	 * @throws InterruptedException If the calling thread is interrupted while waiting for batches
	 */
	public List<Snapshot> resolve(String domain, DateWindow window, long targetTimestamp,
			List<MasterListEntry> masterList, ResolutionStatistics stats) throws InterruptedException {
		List<List<MasterListEntry>> batches = BatchPartitioner.partition(masterList, parallelism);
		if (batches.isEmpty()) {
			return new ArrayList<Snapshot>();
		}
		log.info("Resolving " + masterList.size() + " URLs of " + domain + " in " + batches.size() + " batches");

		ExecutorService pool = Executors.newFixedThreadPool(batches.size(), new BatchThreadFactory(domain));
		List<SnapshotIndex> indexes = new ArrayList<SnapshotIndex>(batches.size());
		try {
			List<Future<SnapshotIndex>> futures = new ArrayList<Future<SnapshotIndex>>(batches.size());
			for (int i = 0; i < batches.size(); i++) {
				stats.batchStarted();
				stats.queryIssued();
				futures.add(pool.submit(new BatchTask(i, domain, window, targetTimestamp, batches.get(i))));
			}

			long deadline = System.currentTimeMillis() + batchTimeoutMs;
			for (int i = 0; i < futures.size(); i++) {
				SnapshotIndex index = collect(i, futures.get(i), deadline, stats);
				stats.addRows(index);
				indexes.add(index);
			}
		} finally {
			pool.shutdownNow();
		}

		SnapshotIndex merged = SnapshotIndex.mergeAll(indexes);
		log.info("Merged batches hold captures for " + merged.size() + " URLs. Failed batches: "
				+ stats.getBatchesFailed() + "/" + batches.size());
		return matcher.match(masterList, merged);
	}

	private SnapshotIndex collect(int batchNumber, Future<SnapshotIndex> future, long deadline,
			ResolutionStatistics stats) throws InterruptedException {
		try {
			long wait = Math.max(0L, deadline - System.currentTimeMillis());
			return future.get(wait, TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			stats.batchFailed();
			log.warn("Batch " + batchNumber + " timed out after " + batchTimeoutMs + " ms. Its URLs are skipped.");
		} catch (ExecutionException e) {
			stats.batchFailed();
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				log.error("Batch " + batchNumber + " failed unexpectedly. Its URLs are skipped.", cause);
			} else {
				log.warn("Batch " + batchNumber + " failed. Its URLs are skipped. " + cause.getMessage());
			}
		}
		return new SnapshotIndex();
	}

	public int getParallelism() {
		return parallelism;
	}

	/**
	 * Query and index one batch. Touches nothing but its own index.
	 */
	private class BatchTask implements Callable<SnapshotIndex> {
		private final int batchNumber;
		private final CaptureQuery query;
		private final long targetTimestamp;
		private final Set<String> allowedUrls = new HashSet<String>();

		BatchTask(int batchNumber, String domain, DateWindow window, long targetTimestamp,
				List<MasterListEntry> batch) {
			this.batchNumber = batchNumber;
			this.targetTimestamp = targetTimestamp;
			for (MasterListEntry entry : batch) {
				allowedUrls.add(entry.getOriginal());
			}
			if (batch.size() == 1) {
				query = CaptureQuery.forUrl(batch.get(0).getOriginal(), window, batchRowLimit);
			} else {
				query = CaptureQuery.forDomain(domain, window, batchRowLimit);
			}
		}

		@Override
		public SnapshotIndex call() throws Exception {
			if (log.isDebugEnabled()) {
				log.debug("Batch " + batchNumber + ": " + allowedUrls.size() + " URLs, " + query);
			}
			List<CaptureRow> rows = source.query(query);
			SnapshotIndex index = indexer.buildIndex(rows, targetTimestamp, allowedUrls);
			if (log.isDebugEnabled()) {
				log.debug("Batch " + batchNumber + " done: " + index);
			}
			return index;
		}
	}

	private static class BatchThreadFactory implements ThreadFactory {
		private final AtomicInteger counter = new AtomicInteger(0);
		private final String domain;

		BatchThreadFactory(String domain) {
			this.domain = domain;
		}

		@Override
		public Thread newThread(Runnable r) {
			Thread t = new Thread(r, "batch-" + domain + "-" + counter.getAndIncrement());
			t.setDaemon(true);
			return t;
		}
	}
}
