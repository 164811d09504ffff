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

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import is.landsbokasafn.snapshotfinder.Snapshot;

/**
 * Orders snapshots for output and writes them as the JSON result file.
 */
public class SnapshotRanker {

	private static final ObjectMapper MAPPER = new ObjectMapper()
			.enable(SerializationFeature.INDENT_OUTPUT)
			.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

	private static final Comparator<Snapshot> BY_DAYS_DIFF = new Comparator<Snapshot>() {
		@Override
		public int compare(Snapshot s1, Snapshot s2) {
			return Long.compare(s1.getDaysDiff(), s2.getDaysDiff());
		}
	};

	private SnapshotRanker() {
	}

	/**
	 * Remove duplicate URLs (the first occurrence is kept) and sort ascending by <code>days_diff</code>. The sort
	 * is stable, snapshots with equal <code>days_diff</code> keep their relative order.
	 * @param snapshots Snapshots, not modified
	 * @return A new, ranked list
	 */
	public static List<Snapshot> rank(List<Snapshot> snapshots) {
		Set<String> seen = new HashSet<String>();
		List<Snapshot> ranked = new ArrayList<Snapshot>(snapshots.size());
		for (Snapshot snapshot : snapshots) {
			if (seen.add(snapshot.getOriginalUrl())) {
				ranked.add(snapshot);
			}
		}
		Collections.sort(ranked, BY_DAYS_DIFF);
		return ranked;
	}

	/**
	 * Write snapshots as a pretty printed JSON array, UTF-8 encoded. The stream is not closed.
	 * @param snapshots Snapshots, in output order
	 * @param out Stream to write to
	 * @throws IOException If writing fails
	 */
	public static void serialize(List<Snapshot> snapshots, OutputStream out) throws IOException {
		MAPPER.writeValue(out, snapshots);
		out.flush();
	}

	/**
	 * Write snapshots to a file, replacing any existing content.
	 * @param snapshots Snapshots, in output order
	 * @param file The result file
	 * @throws IOException If writing fails
	 */
	public static void serialize(List<Snapshot> snapshots, File file) throws IOException {
		MAPPER.writeValue(file, snapshots);
	}

	/**
	 * Read a result file written by {@link #serialize(List, File)}.
	 * @param file The result file
	 * @return The snapshots, in file order
	 * @throws IOException If the file can not be read or parsed
	 */
	public static List<Snapshot> read(File file) throws IOException {
		return new ArrayList<Snapshot>(Arrays.asList(MAPPER.readValue(file, Snapshot[].class)));
	}
}
