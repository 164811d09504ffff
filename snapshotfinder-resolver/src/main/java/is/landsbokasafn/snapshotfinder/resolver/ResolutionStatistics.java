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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters collected while resolving snapshots for a domain.
 */
public class ResolutionStatistics {
	private final AtomicLong queriesIssued = new AtomicLong(0);
	private final AtomicLong batchesTotal = new AtomicLong(0);
	private final AtomicLong batchesFailed = new AtomicLong(0);
	private final AtomicLong rowsSeen = new AtomicLong(0);
	private final AtomicLong invalidRows = new AtomicLong(0);
	private final AtomicLong filteredRows = new AtomicLong(0);

	void queryIssued() {
		queriesIssued.incrementAndGet();
	}

	void batchStarted() {
		batchesTotal.incrementAndGet();
	}

	void batchFailed() {
		batchesFailed.incrementAndGet();
	}

	/**
	 * Add the row counters of an index built during the run.
	 * @param index The index
	 */
	void addRows(SnapshotIndex index) {
		rowsSeen.addAndGet(index.getRowsSeen());
		invalidRows.addAndGet(index.getInvalidRows());
		filteredRows.addAndGet(index.getFilteredRows());
	}

	public long getQueriesIssued() {
		return queriesIssued.get();
	}

	public long getBatchesTotal() {
		return batchesTotal.get();
	}

	public long getBatchesFailed() {
		return batchesFailed.get();
	}

	public long getRowsSeen() {
		return rowsSeen.get();
	}

	public long getInvalidRows() {
		return invalidRows.get();
	}

	public long getFilteredRows() {
		return filteredRows.get();
	}
}
