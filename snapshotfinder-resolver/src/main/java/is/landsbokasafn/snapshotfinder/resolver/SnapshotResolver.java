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

import static is.landsbokasafn.snapshotfinder.SnapshotFinderConstants.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import is.landsbokasafn.snapshotfinder.CaptureRow;
import is.landsbokasafn.snapshotfinder.DateWindow;
import is.landsbokasafn.snapshotfinder.EmptyWindowResultException;
import is.landsbokasafn.snapshotfinder.InvalidDateFormatException;
import is.landsbokasafn.snapshotfinder.MasterListEntry;
import is.landsbokasafn.snapshotfinder.Snapshot;
import is.landsbokasafn.snapshotfinder.SnapshotFinderException;
import is.landsbokasafn.snapshotfinder.Timestamps;
import is.landsbokasafn.snapshotfinder.cdx.CaptureQuery;
import is.landsbokasafn.snapshotfinder.cdx.CaptureSource;
import is.landsbokasafn.snapshotfinder.cdx.FixedIntervalPacer;
import is.landsbokasafn.snapshotfinder.cdx.Pacer;
import is.landsbokasafn.snapshotfinder.cdx.QueryFailedException;

/**
 * Finds, for each URL of a domain's master list, the archived capture closest to a target date.
 * <p>
 * Configure through the setters, then call {@link #resolve(String, String, List)}. An instance may be reused
 * for any number of runs but should not run two at the same time.
 */
public class SnapshotResolver {
	private static final Log log = LogFactory.getLog(SnapshotResolver.class);

	private final CaptureSource source;

	private ResolutionStrategy strategy = ResolutionStrategy.AUTO;
	private int parallelism = DEFAULT_PARALLELISM;
	private int windowDays = DEFAULT_WINDOW_DAYS;
	private String archiveBase = DEFAULT_ARCHIVE_BASE;
	private int domainRowLimit = DEFAULT_DOMAIN_ROW_LIMIT;
	private int batchRowLimit = DEFAULT_BATCH_ROW_LIMIT;
	private long batchTimeoutMs = DEFAULT_BATCH_TIMEOUT_MS;
	private int sequentialThreshold = DEFAULT_SEQUENTIAL_THRESHOLD;
	private Pacer sequentialPacer = new FixedIntervalPacer(DEFAULT_SEQUENTIAL_DELAY_MS);

	public SnapshotResolver(CaptureSource source) {
		if (source == null) {
			throw new IllegalArgumentException("A capture source is required");
		}
		this.source = source;
	}

	/**
	 * Resolve snapshots.
	 * @param domain The domain the master list belongs to, e.g. <code>example.com</code>
	 * @param targetDate Target date as <pre>YYYYMMDD</pre>
	 * @param masterList The canonical URLs of the domain
	 * @return The result, possibly with no snapshots
	 * @throws InvalidDateFormatException If the target date is invalid. Nothing is queried in that case.
	 * @throws EmptyWindowResultException If the {@link ResolutionStrategy#SINGLE_QUERY} query yields no usable rows
	 * @throws QueryFailedException If a query fails in a strategy where that is fatal
	 * @throws InterruptedException If interrupted while waiting on queries
	 */
	public ResolutionResult resolve(String domain, String targetDate, List<MasterListEntry> masterList)
			throws SnapshotFinderException, QueryFailedException, InterruptedException {
		LocalDate date = Timestamps.parseTargetDate(targetDate);
		long targetTimestamp = Timestamps.targetTimestamp(targetDate);
		if (domain == null || domain.isEmpty()) {
			throw new IllegalArgumentException("Domain is required");
		}
		DateWindow window = DateWindow.around(date, windowDays);
		ResolutionStrategy effective = strategy.effective(masterList.size(), sequentialThreshold);
		ResolutionStatistics stats = new ResolutionStatistics();
		SnapshotMatcher matcher = new SnapshotMatcher(archiveBase);

		long start = System.currentTimeMillis();
		log.info("Resolving " + domain + " for " + targetDate + ", window " + window + ", strategy " + effective);

		List<Snapshot> snapshots;
		if (masterList.isEmpty()) {
			log.warn("Master list for " + domain + " is empty, nothing to resolve");
			snapshots = new ArrayList<Snapshot>();
		} else {
			switch (effective) {
			case SINGLE_QUERY:
				snapshots = resolveSingleQuery(domain, window, targetTimestamp, masterList, matcher, stats);
				break;
			case PER_URL:
				snapshots = new SequentialSnapshotResolver(source, matcher, sequentialPacer, 0)
						.resolve(window, targetTimestamp, masterList, stats);
				break;
			case PARALLEL_BATCHES:
				snapshots = new ParallelSnapshotResolver(source, matcher, parallelism, batchRowLimit, batchTimeoutMs)
						.resolve(domain, window, targetTimestamp, masterList, stats);
				break;
			default:
				throw new IllegalStateException("Unhandled strategy " + effective);
			}
		}

		long elapsed = System.currentTimeMillis() - start;
		log.info("Found " + snapshots.size() + " snapshots for " + masterList.size() + " URLs of " + domain
				+ " in " + elapsed + " ms");
		return new ResolutionResult(domain, targetDate, window, effective, masterList.size(), snapshots, stats,
				elapsed);
	}

	private List<Snapshot> resolveSingleQuery(String domain, DateWindow window, long targetTimestamp,
			List<MasterListEntry> masterList, SnapshotMatcher matcher, ResolutionStatistics stats)
			throws QueryFailedException, EmptyWindowResultException {
		CaptureQuery query = CaptureQuery.forDomain(domain, window, domainRowLimit);
		stats.queryIssued();
		List<CaptureRow> rows = source.query(query);
		SnapshotIndex index = new SnapshotIndexer().buildIndex(rows, targetTimestamp, null);
		stats.addRows(index);
		if (index.isEmpty()) {
			throw new EmptyWindowResultException(query.getUrlPattern(), window);
		}
		if (domainRowLimit > 0 && rows.size() >= domainRowLimit) {
			log.warn("Query for " + domain + " returned " + rows.size() + " rows, the row limit. "
					+ "Some URLs may be missed, consider the " + ResolutionStrategy.PARALLEL_BATCHES + " strategy.");
		}
		return matcher.match(masterList, index);
	}

	public CaptureSource getSource() {
		return source;
	}

	public ResolutionStrategy getStrategy() {
		return strategy;
	}

	public void setStrategy(ResolutionStrategy strategy) {
		this.strategy = strategy;
	}

	public int getParallelism() {
		return parallelism;
	}

	public void setParallelism(int parallelism) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("Parallelism must be at least 1, was " + parallelism);
		}
		this.parallelism = parallelism;
	}

	public int getWindowDays() {
		return windowDays;
	}

	public void setWindowDays(int windowDays) {
		if (windowDays < 0) {
			throw new IllegalArgumentException("Window can not be negative, was " + windowDays);
		}
		this.windowDays = windowDays;
	}

	public String getArchiveBase() {
		return archiveBase;
	}

	public void setArchiveBase(String archiveBase) {
		this.archiveBase = archiveBase;
	}

	public int getDomainRowLimit() {
		return domainRowLimit;
	}

	public void setDomainRowLimit(int domainRowLimit) {
		this.domainRowLimit = domainRowLimit;
	}

	public int getBatchRowLimit() {
		return batchRowLimit;
	}

	public void setBatchRowLimit(int batchRowLimit) {
		this.batchRowLimit = batchRowLimit;
	}

	public long getBatchTimeoutMs() {
		return batchTimeoutMs;
	}

	public void setBatchTimeoutMs(long batchTimeoutMs) {
		this.batchTimeoutMs = batchTimeoutMs;
	}

	public int getSequentialThreshold() {
		return sequentialThreshold;
	}

	public void setSequentialThreshold(int sequentialThreshold) {
		this.sequentialThreshold = sequentialThreshold;
	}

	public Pacer getSequentialPacer() {
		return sequentialPacer;
	}

	/**
	 * @param sequentialPacer Pacing of the queries made by the {@link ResolutionStrategy#PER_URL} strategy
	 */
	public void setSequentialPacer(Pacer sequentialPacer) {
		this.sequentialPacer = sequentialPacer;
	}
}
