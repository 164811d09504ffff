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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import is.landsbokasafn.snapshotfinder.SnapshotCandidate;

/**
 * The closest known capture for each URL, keyed by the URL as it appears in the <code>original</code> column.
 * <p>
 * An index is built by one thread and then handed to the coordinator, it is not thread safe.
 */
public class SnapshotIndex {
	private final Map<String, SnapshotCandidate> candidates = new LinkedHashMap<String, SnapshotCandidate>();
	private SnapshotCandidate nearest = null;

	private long rowsSeen = 0;
	private long invalidRows = 0;
	private long filteredRows = 0;

	/**
	 * Offer a candidate to the index. It is kept if no candidate is held for its URL or if it is strictly closer
	 * to the target than the one held.
	 * @param candidate The candidate
	 * @return true if the candidate was stored
	 */
	public boolean offer(SnapshotCandidate candidate) {
		if (candidate.isCloserThan(nearest)) {
			nearest = candidate;
		}
		String url = candidate.getOriginalUrl();
		if (candidate.isCloserThan(candidates.get(url))) {
			candidates.put(url, candidate);
			return true;
		}
		return false;
	}

	/**
	 * Fold another index into this one, candidate by candidate, applying the same rule as {@link #offer}. Row
	 * counters are not carried over. Merging an index into itself changes nothing.
	 * @param other The index to merge in
	 */
	public void merge(SnapshotIndex other) {
		List<SnapshotCandidate> incoming = new ArrayList<SnapshotCandidate>(other.candidates.values());
		for (SnapshotCandidate candidate : incoming) {
			offer(candidate);
		}
	}

	/**
	 * Merge a number of indexes, in list order. On equal distance the candidate from the earlier index wins.
	 * @param indexes Indexes to merge, in batch order
	 * @return A new index, the inputs are not modified
	 */
	public static SnapshotIndex mergeAll(List<SnapshotIndex> indexes) {
		SnapshotIndex merged = new SnapshotIndex();
		for (SnapshotIndex index : indexes) {
			merged.merge(index);
		}
		return merged;
	}

	public SnapshotCandidate get(String url) {
		return candidates.get(url);
	}

	/**
	 * @return The closest candidate of all offered, regardless of URL. First offered wins on equal distance.
	 *         Null if the index is empty.
	 */
	public SnapshotCandidate getNearest() {
		return nearest;
	}

	public Collection<SnapshotCandidate> candidates() {
		return Collections.unmodifiableCollection(candidates.values());
	}

	public int size() {
		return candidates.size();
	}

	public boolean isEmpty() {
		return candidates.isEmpty();
	}

	void rowSeen() {
		rowsSeen++;
	}

	void rowInvalid() {
		invalidRows++;
	}

	void rowFiltered() {
		filteredRows++;
	}

	/**
	 * @return Number of rows processed while building this index
	 */
	public long getRowsSeen() {
		return rowsSeen;
	}

	/**
	 * @return Number of structurally invalid rows that were dropped
	 */
	public long getInvalidRows() {
		return invalidRows;
	}

	/**
	 * @return Number of valid rows dropped because their URL was not among the allowed URLs
	 */
	public long getFilteredRows() {
		return filteredRows;
	}

	@Override
	public String toString() {
		return "SnapshotIndex[" + candidates.size() + " urls, " + rowsSeen + " rows]";
	}
}
