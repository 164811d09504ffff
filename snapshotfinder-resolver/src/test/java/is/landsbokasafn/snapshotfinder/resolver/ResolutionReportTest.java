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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import is.landsbokasafn.snapshotfinder.DateWindow;
import is.landsbokasafn.snapshotfinder.Snapshot;
import junit.framework.TestCase;

public class ResolutionReportTest extends TestCase {

	private static Snapshot snapshot(String url, long daysDiff) {
		return new Snapshot("https://web.archive.org/web/20191115000000/" + url, "20191115000000", url, "200",
				10L, daysDiff * 1000000L);
	}

	private static ResolutionResult result(List<Snapshot> snapshots, int masterSize) {
		ResolutionStatistics stats = new ResolutionStatistics();
		stats.queryIssued();
		stats.batchStarted();
		stats.batchStarted();
		stats.batchFailed();
		return new ResolutionResult("a.com", "20191115", DateWindow.around(LocalDate.of(2019, 11, 15), 90),
				ResolutionStrategy.PARALLEL_BATCHES, masterSize, snapshots, stats, 1234L);
	}

	public void testReport() {
		List<Snapshot> snapshots = new ArrayList<Snapshot>();
		for (int i = 0; i < 10; i++) {
			snapshots.add(snapshot("a.com/" + i, i));
		}
		String report = new ResolutionReport(result(snapshots, 40)).report();

		assertTrue(report, report.contains("Snapshots found:   10 (25%)"));
		assertTrue(report, report.contains("Batches failed:    1/2"));
		assertTrue(report, report.contains("20190817 - 20200213"));
		assertTrue(report, report.contains("0 days: a.com/0"));
		assertTrue(report, report.contains("4 days: a.com/4"));
		assertFalse(report, report.contains("5 days: a.com/5"));
		assertTrue(report, report.contains("7 days: 1 snapshots"));
		assertFalse(report, report.contains("8 days: 1 snapshots"));
		assertTrue(report, report.contains("1234 ms"));
	}

	public void testEmptyReport() {
		String report = new ResolutionReport(result(new ArrayList<Snapshot>(), 3)).report();
		assertTrue(report, report.contains("No snapshots found"));
		assertTrue(report, report.contains("Snapshots found:   0 (0%)"));
	}

	public void testDistribution() {
		List<Snapshot> snapshots = new ArrayList<Snapshot>();
		snapshots.add(snapshot("a", 3));
		snapshots.add(snapshot("b", 1));
		snapshots.add(snapshot("c", 3));
		Map<Long, Integer> groups = ResolutionReport.distribution(snapshots);
		assertEquals(2, groups.size());
		assertEquals(Long.valueOf(1L), groups.keySet().iterator().next());
		assertEquals(Integer.valueOf(2), groups.get(3L));
	}

	public void testPercentage() {
		assertEquals("33.3%", ResolutionReport.getPercentage(1, 3));
		assertEquals("-", ResolutionReport.getPercentage(1, 0));
	}
}
