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

import java.util.Collections;
import java.util.List;

import is.landsbokasafn.snapshotfinder.DateWindow;
import is.landsbokasafn.snapshotfinder.Snapshot;

/**
 * Outcome of resolving one domain against one target date. No matches at all is a valid, empty result.
 */
public class ResolutionResult {
	private final String domain;
	private final String targetDate;
	private final DateWindow window;
	private final ResolutionStrategy strategy;
	private final int masterListSize;
	private final List<Snapshot> snapshots;
	private final ResolutionStatistics statistics;
	private final long elapsedMillis;

	public ResolutionResult(String domain, String targetDate, DateWindow window, ResolutionStrategy strategy,
			int masterListSize, List<Snapshot> snapshots, ResolutionStatistics statistics, long elapsedMillis) {
		this.domain = domain;
		this.targetDate = targetDate;
		this.window = window;
		this.strategy = strategy;
		this.masterListSize = masterListSize;
		this.snapshots = Collections.unmodifiableList(snapshots);
		this.statistics = statistics;
		this.elapsedMillis = elapsedMillis;
	}

	public String getDomain() {
		return domain;
	}

	public String getTargetDate() {
		return targetDate;
	}

	public DateWindow getWindow() {
		return window;
	}

	/**
	 * @return The strategy that was run. Never {@link ResolutionStrategy#AUTO}.
	 */
	public ResolutionStrategy getStrategy() {
		return strategy;
	}

	public int getMasterListSize() {
		return masterListSize;
	}

	/**
	 * @return Snapshots, ranked by closeness to the target
	 */
	public List<Snapshot> getSnapshots() {
		return snapshots;
	}

	public boolean isEmpty() {
		return snapshots.isEmpty();
	}

	public ResolutionStatistics getStatistics() {
		return statistics;
	}

	public long getElapsedMillis() {
		return elapsedMillis;
	}
}
