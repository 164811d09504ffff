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

import java.util.Arrays;
import java.util.List;

import is.landsbokasafn.snapshotfinder.MasterListEntry;
import is.landsbokasafn.snapshotfinder.Snapshot;
import junit.framework.TestCase;

public class SnapshotMatcherTest extends TestCase {
	private static final long TARGET = 20191115000000L;

	public void testUnmatchedEntriesAreOmitted() {
		SnapshotIndex index = new SnapshotIndexer().buildIndex(Arrays.asList(
				row("20191110000000", "a.com/x", "1"),
				row("20191114000000", "a.com/z", "1")), TARGET, null);
		List<MasterListEntry> master = Arrays.asList(
				new MasterListEntry("a.com/x"),
				new MasterListEntry("a.com/y"),
				new MasterListEntry("a.com/z"));

		List<Snapshot> snapshots = new SnapshotMatcher().match(master, index);
		assertEquals(2, snapshots.size());
		// Ranked, z is a day away and x five
		assertEquals("a.com/z", snapshots.get(0).getOriginalUrl());
		assertEquals(1L, snapshots.get(0).getDaysDiff());
		assertEquals("a.com/x", snapshots.get(1).getOriginalUrl());
		assertEquals("https://web.archive.org/web/20191110000000/a.com/x", snapshots.get(1).getArchiveUrl());
	}

	public void testIndexEntriesOutsideMasterListIgnored() {
		SnapshotIndex index = new SnapshotIndexer().buildIndex(Arrays.asList(
				row("20191110000000", "a.com/other", "1")), TARGET, null);
		assertTrue(new SnapshotMatcher().match(Arrays.asList(new MasterListEntry("a.com/x")), index).isEmpty());
	}

	public void testArchiveBase() {
		SnapshotIndex index = new SnapshotIndexer().buildIndex(Arrays.asList(
				row("20191110000000", "http://a.com/x?q=1", "1")), TARGET, null);
		List<MasterListEntry> master = Arrays.asList(new MasterListEntry("http://a.com/x?q=1"));

		Snapshot s = new SnapshotMatcher("http://localhost:8080/wayback/").match(master, index).get(0);
		assertEquals("http://localhost:8080/wayback/20191110000000/http://a.com/x?q=1", s.getArchiveUrl());
	}
}
