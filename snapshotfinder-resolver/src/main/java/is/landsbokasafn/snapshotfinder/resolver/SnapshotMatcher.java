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
import java.util.List;

import is.landsbokasafn.snapshotfinder.MasterListEntry;
import is.landsbokasafn.snapshotfinder.Snapshot;
import is.landsbokasafn.snapshotfinder.SnapshotCandidate;
import is.landsbokasafn.snapshotfinder.SnapshotFinderConstants;

/**
 * Joins a master list with an index. Entries without a capture in the index are left out.
 */
public class SnapshotMatcher {
	private final String archiveBase;

	public SnapshotMatcher() {
		this(SnapshotFinderConstants.DEFAULT_ARCHIVE_BASE);
	}

	/**
	 * @param archiveBase Prefix of the archive URLs produced, e.g. <code>https://web.archive.org/web</code>
	 */
	public SnapshotMatcher(String archiveBase) {
		if (archiveBase == null || archiveBase.isEmpty()) {
			throw new IllegalArgumentException("Archive base URL is required");
		}
		this.archiveBase = archiveBase.endsWith("/")
				? archiveBase.substring(0, archiveBase.length() - 1)
				: archiveBase;
	}

	/**
	 * @param masterList The master list entries, in master list order
	 * @param index Closest capture per URL
	 * @return One snapshot per matched entry, ranked
	 */
	public List<Snapshot> match(List<MasterListEntry> masterList, SnapshotIndex index) {
		List<Snapshot> matched = new ArrayList<Snapshot>();
		for (MasterListEntry entry : masterList) {
			SnapshotCandidate candidate = index.get(entry.getOriginal());
			if (candidate != null) {
				matched.add(toSnapshot(candidate));
			}
		}
		return SnapshotRanker.rank(matched);
	}

	public Snapshot toSnapshot(SnapshotCandidate candidate) {
		return candidate.toSnapshot(archiveBase);
	}

	public String getArchiveBase() {
		return archiveBase;
	}
}
