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

import static is.landsbokasafn.snapshotfinder.resolver.FakeCaptureSource.row;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import is.landsbokasafn.snapshotfinder.DateWindow;
import is.landsbokasafn.snapshotfinder.MasterListEntry;
import is.landsbokasafn.snapshotfinder.Snapshot;
import is.landsbokasafn.snapshotfinder.cdx.Pacer;
import is.landsbokasafn.snapshotfinder.cdx.QueryFailedException;
import junit.framework.TestCase;

public class SequentialSnapshotResolverTest extends TestCase {
	private static final long TARGET = 20191115000000L;
	private static final DateWindow WINDOW = DateWindow.around(LocalDate.of(2019, 11, 15), 90);

	/** Counts how often it is asked to pace **/
	private static class CountingPacer implements Pacer {
		int calls = 0;

		@Override
		public void pace() {
			calls++;
		}

		@Override
		public String getInfo() {
			return "counting";
		}
	}

	public void testOneQueryPerUrlAndPaced() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource()
				.respond("a.com/x",
						row("20191110000000", "a.com/x", "6000"),
						row("20191201000000", "a.com/x", "7000"))
				.respond("a.com/y", row("20191116000000", "a.com/y", "10"));
		CountingPacer pacer = new CountingPacer();
		ResolutionStatistics stats = new ResolutionStatistics();

		List<Snapshot> snapshots = new SequentialSnapshotResolver(source, new SnapshotMatcher(), pacer, 0)
				.resolve(WINDOW, TARGET, Arrays.asList(
						new MasterListEntry("a.com/x"),
						new MasterListEntry("a.com/y"),
						new MasterListEntry("a.com/none")), stats);

		assertEquals(Arrays.asList("a.com/x", "a.com/y", "a.com/none"), source.getQueriedPatterns());
		assertEquals(3, pacer.calls);
		assertEquals(3L, stats.getQueriesIssued());
		assertEquals(2, snapshots.size());
		assertEquals("a.com/y", snapshots.get(0).getOriginalUrl());
		assertEquals("20191110000000", snapshots.get(1).getTimestamp());
		assertEquals(5L, snapshots.get(1).getDaysDiff());
	}

	public void testNearestRowWhateverItsUrlForm() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource().respond("a.com/x",
				row("20191101000000", "a.com/x", "1"),
				row("20191114000000", "a.com:80/x", "1"),
				row("20191116000000", "www.a.com/x", "1"));

		List<Snapshot> snapshots = new SequentialSnapshotResolver(source, new SnapshotMatcher(), Pacer.NONE, 0)
				.resolve(WINDOW, TARGET, Arrays.asList(new MasterListEntry("a.com/x")), new ResolutionStatistics());

		assertEquals(1, snapshots.size());
		// Equal distance on both sides of the target, the first row wins
		assertEquals("a.com:80/x", snapshots.get(0).getOriginalUrl());
		assertEquals("https://web.archive.org/web/20191114000000/a.com:80/x", snapshots.get(0).getArchiveUrl());
	}

	public void testFailedQueryIsFatal() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource()
				.respond("a.com/x", row("20191110000000", "a.com/x", "1"))
				.fail("a.com/y");
		try {
			new SequentialSnapshotResolver(source, new SnapshotMatcher(), Pacer.NONE, 0)
					.resolve(WINDOW, TARGET, Arrays.asList(
							new MasterListEntry("a.com/x"),
							new MasterListEntry("a.com/y"),
							new MasterListEntry("a.com/z")), new ResolutionStatistics());
			fail("Expected QueryFailedException");
		} catch (QueryFailedException e) {
			assertEquals("a.com/y", e.getQuery().getUrlPattern());
			// Nothing after the failure is queried
			assertEquals(2, source.getQueries().size());
		}
	}
}
