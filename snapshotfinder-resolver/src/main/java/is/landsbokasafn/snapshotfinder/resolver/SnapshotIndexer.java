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

import java.util.Set;
import java.util.regex.Pattern;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import is.landsbokasafn.snapshotfinder.CaptureRow;
import is.landsbokasafn.snapshotfinder.SnapshotCandidate;
import is.landsbokasafn.snapshotfinder.Timestamps;

/**
 * Turns the rows of a CDX response into a {@link SnapshotIndex}. Rows are processed in the order received.
 * Malformed rows are skipped, a single bad row never fails the pass.
 */
public class SnapshotIndexer {
	private static final Log log = LogFactory.getLog(SnapshotIndexer.class);

	private static final Pattern LENGTH_SHAPE = Pattern.compile("^[0-9]+$");

	/**
	 * Validate a row and compute its distance from the target.
	 * @param row A row from a CDX response
	 * @param targetTimestamp Target as a 14 digit number
	 * @return The candidate, or null if the row lacks a timestamp, URL or length, or if any of them is malformed
	 */
	public static SnapshotCandidate parseRow(CaptureRow row, long targetTimestamp) {
		if (row == null) {
			return null;
		}
		String original = row.getOriginal();
		if (original == null || original.isEmpty()) {
			return null;
		}
		String timestamp = row.getTimestamp();
		if (!Timestamps.isValidTimestamp(timestamp)) {
			return null;
		}
		String length = row.getLength();
		if (length == null || !LENGTH_SHAPE.matcher(length).matches()) {
			return null;
		}
		long size;
		try {
			size = Long.parseLong(length);
		} catch (NumberFormatException e) {
			// More digits than a long holds
			return null;
		}
		return new SnapshotCandidate(original, timestamp, row.getStatusCode(), row.getMimeType(), size,
				Timestamps.timeDistance(timestamp, targetTimestamp));
	}

	/**
	 * Build an index from a sequence of rows.
	 * @param rows The rows, in the order the server returned them
	 * @param targetTimestamp Target as a 14 digit number
	 * @param allowedUrls If not null, rows for any other URL are discarded
	 * @return The index, with its row counters filled in
	 */
	public SnapshotIndex buildIndex(Iterable<CaptureRow> rows, long targetTimestamp, Set<String> allowedUrls) {
		SnapshotIndex index = new SnapshotIndex();
		for (CaptureRow row : rows) {
			index.rowSeen();
			SnapshotCandidate candidate = parseRow(row, targetTimestamp);
			if (candidate == null) {
				index.rowInvalid();
				if (log.isDebugEnabled()) {
					log.debug("Dropping malformed row " + row);
				}
				continue;
			}
			if (allowedUrls != null && !allowedUrls.contains(candidate.getOriginalUrl())) {
				index.rowFiltered();
				continue;
			}
			index.offer(candidate);
		}
		if (log.isDebugEnabled()) {
			log.debug("Indexed " + index.getRowsSeen() + " rows into " + index.size() + " urls. Invalid: "
					+ index.getInvalidRows() + ", filtered: " + index.getFilteredRows());
		}
		return index;
	}
}
