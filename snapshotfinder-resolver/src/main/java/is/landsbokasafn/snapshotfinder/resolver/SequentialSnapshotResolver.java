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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import is.landsbokasafn.snapshotfinder.CaptureRow;
import is.landsbokasafn.snapshotfinder.DateWindow;
import is.landsbokasafn.snapshotfinder.MasterListEntry;
import is.landsbokasafn.snapshotfinder.Snapshot;
import is.landsbokasafn.snapshotfinder.SnapshotCandidate;
import is.landsbokasafn.snapshotfinder.cdx.CaptureQuery;
import is.landsbokasafn.snapshotfinder.cdx.CaptureSource;
import is.landsbokasafn.snapshotfinder.cdx.Pacer;
import is.landsbokasafn.snapshotfinder.cdx.QueryFailedException;

/**
 * Resolves a master list one URL at a time. Each entry gets its own narrow query and the nearest capture in the
 * response is taken, whatever URL form the archive recorded it under.
 */
public class SequentialSnapshotResolver {
	private static final Log log = LogFactory.getLog(SequentialSnapshotResolver.class);

	private static final int PROGRESS_INTERVAL = 50;

	private final CaptureSource source;
	private final SnapshotIndexer indexer = new SnapshotIndexer();
	private final SnapshotMatcher matcher;
	private final Pacer pacer;
	private final int rowLimit;

	/**
	 * @param source Where captures are looked up
	 * @param matcher Produces archive URLs
	 * @param pacer Called before every query
	 * @param rowLimit Row limit of each query, 0 for none
	 */
	public SequentialSnapshotResolver(CaptureSource source, SnapshotMatcher matcher, Pacer pacer, int rowLimit) {
		this.source = source;
		this.matcher = matcher;
		this.pacer = pacer;
		this.rowLimit = rowLimit;
	}

	/**
	 * @param window Query window
	 * @param targetTimestamp Target as a 14 digit number
	 * @param masterList Entries to resolve
	 * @param stats Counters to update
	 * @return Ranked snapshots
	 * @throws QueryFailedException If any query fails. Nothing is returned for the entries already resolved.
	 * @throws InterruptedException If interrupted while pacing
	 */
	public List<Snapshot> resolve(DateWindow window, long targetTimestamp, List<MasterListEntry> masterList,
			ResolutionStatistics stats) throws QueryFailedException, InterruptedException {
		log.info("Resolving " + masterList.size() + " URLs one at a time, " + pacer.getInfo());
		List<Snapshot> found = new ArrayList<Snapshot>();
		int done = 0;
		for (MasterListEntry entry : masterList) {
			pacer.pace();
			CaptureQuery query = CaptureQuery.forUrl(entry.getOriginal(), window, rowLimit);
			stats.queryIssued();
			List<CaptureRow> rows = source.query(query);

			SnapshotIndex index = indexer.buildIndex(rows, targetTimestamp, null);
			stats.addRows(index);
			SnapshotCandidate nearest = index.getNearest();
			if (nearest != null) {
				found.add(matcher.toSnapshot(nearest));
			} else if (log.isDebugEnabled()) {
				log.debug("No capture of " + entry.getOriginal() + " in " + window);
			}

			done++;
			if (done % PROGRESS_INTERVAL == 0) {
				log.info("Processed " + done + "/" + masterList.size() + " URLs, " + found.size() + " found");
			}
		}
		return SnapshotRanker.rank(found);
	}
}
