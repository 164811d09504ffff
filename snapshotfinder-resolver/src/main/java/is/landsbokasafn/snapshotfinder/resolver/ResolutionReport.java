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

import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import is.landsbokasafn.snapshotfinder.Snapshot;

/**
 * Human readable summary of a {@link ResolutionResult}.
 */
public class ResolutionReport {
	static final int CLOSEST_SHOWN = 5;
	static final int DISTRIBUTION_GROUPS_SHOWN = 8;

	private final ResolutionResult result;

	public ResolutionReport(ResolutionResult result) {
		this.result = result;
	}

	public String report() {
		ResolutionStatistics stats = result.getStatistics();
		List<Snapshot> snapshots = result.getSnapshots();

		StringBuilder ret = new StringBuilder();
		ret.append("Domain: " + result.getDomain() + "\n");
		ret.append("  Target date:       " + result.getTargetDate() + " (window " + result.getWindow() + ")\n");
		ret.append("  Strategy:          " + result.getStrategy() + "\n");
		ret.append("  Master list URLs:  " + result.getMasterListSize() + "\n");
		ret.append("  Snapshots found:   " + snapshots.size() + " (" +
				getPercentage(snapshots.size(), result.getMasterListSize()) + ")\n");
		ret.append("  Queries issued:    " + stats.getQueriesIssued() + "\n");
		if (stats.getBatchesTotal() > 0) {
			ret.append("  Batches failed:    " + stats.getBatchesFailed() + "/" + stats.getBatchesTotal() + "\n");
		}
		ret.append("  Rows seen:         " + stats.getRowsSeen() + "\n");
		ret.append("  Invalid rows:      " + stats.getInvalidRows() + "\n");
		ret.append("  Filtered rows:     " + stats.getFilteredRows() + "\n");
		ret.append("  Run time:          " + result.getElapsedMillis() + " ms\n");

		if (snapshots.isEmpty()) {
			ret.append("No snapshots found\n");
			return ret.toString();
		}

		ret.append("Closest snapshots:\n");
		for (int i = 0; i < Math.min(CLOSEST_SHOWN, snapshots.size()); i++) {
			Snapshot s = snapshots.get(i);
			ret.append("  " + s.getDaysDiff() + " days: " + s.getOriginalUrl() + "\n");
		}

		ret.append("Distribution (days from target):\n");
		int shown = 0;
		for (Map.Entry<Long, Integer> group : distribution(snapshots).entrySet()) {
			if (shown++ == DISTRIBUTION_GROUPS_SHOWN) {
				break;
			}
			ret.append("  " + group.getKey() + " days: " + group.getValue() + " snapshots\n");
		}
		return ret.toString();
	}

	/**
	 * @param snapshots Snapshots
	 * @return Number of snapshots per <code>days_diff</code> value, ascending
	 */
	static Map<Long, Integer> distribution(List<Snapshot> snapshots) {
		Map<Long, Integer> groups = new TreeMap<Long, Integer>();
		for (Snapshot s : snapshots) {
			Integer count = groups.get(s.getDaysDiff());
			groups.put(s.getDaysDiff(), count == null ? 1 : count + 1);
		}
		return groups;
	}

	protected static String getPercentage(double portion, double total) {
		if (total == 0) {
			return "-";
		}
		NumberFormat percentFormat = NumberFormat.getPercentInstance(Locale.ENGLISH);
		percentFormat.setMaximumFractionDigits(1);
		return percentFormat.format(portion / total);
	}
}
