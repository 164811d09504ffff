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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import is.landsbokasafn.snapshotfinder.CaptureRow;
import is.landsbokasafn.snapshotfinder.SnapshotCandidate;
import junit.framework.TestCase;

public class SnapshotIndexerTest extends TestCase {
	private static final long TARGET = 20191115000000L;

	private final SnapshotIndexer indexer = new SnapshotIndexer();

	public void testParseRow() {
		SnapshotCandidate c = SnapshotIndexer.parseRow(row("20191110000000", "a.com/x", "6000"), TARGET);
		assertNotNull(c);
		assertEquals("a.com/x", c.getOriginalUrl());
		assertEquals(6000L, c.getSize());
		assertEquals(5000000L, c.getTimeDistance());
		assertEquals(5L, c.getDaysDiff());
		assertEquals("200", c.getStatusCode());
	}

	public void testParseRowRejectsMalformed() {
		assertNull(SnapshotIndexer.parseRow(row("20191110000000", "a.com/x", "abc"), TARGET));
		assertNull(SnapshotIndexer.parseRow(row("20191110000000", "a.com/x", "-"), TARGET));
		assertNull(SnapshotIndexer.parseRow(row("20191110000000", "a.com/x", "-5"), TARGET));
		assertNull(SnapshotIndexer.parseRow(row("20191110000000", "a.com/x", null), TARGET));
		assertNull(SnapshotIndexer.parseRow(row("20191110000000", "a.com/x", "99999999999999999999"), TARGET));
		assertNull(SnapshotIndexer.parseRow(row("201911100000", "a.com/x", "10"), TARGET));
		assertNull(SnapshotIndexer.parseRow(row("2019111000000x", "a.com/x", "10"), TARGET));
		assertNull(SnapshotIndexer.parseRow(row(null, "a.com/x", "10"), TARGET));
		assertNull(SnapshotIndexer.parseRow(row("20191110000000", null, "10"), TARGET));
		assertNull(SnapshotIndexer.parseRow(row("20191110000000", "", "10"), TARGET));
		assertNull(SnapshotIndexer.parseRow(null, TARGET));
	}

	public void testMissingStatusAndMimeAreAccepted() {
		CaptureRow r = new CaptureRow("20191110000000", "a.com/x", null, null, "10");
		assertNotNull(SnapshotIndexer.parseRow(r, TARGET));
	}

	public void testClosestCaptureIsKept() {
		SnapshotIndex index = indexer.buildIndex(Arrays.asList(
				row("20191110000000", "a.com/x", "6000"),
				row("20191201000000", "a.com/x", "7000")), TARGET, null);
		assertEquals(1, index.size());
		SnapshotCandidate c = index.get("a.com/x");
		assertEquals("20191110000000", c.getTimestamp());
		assertEquals(5L, c.getDaysDiff());
		assertEquals(2L, index.getRowsSeen());
	}

	public void testCaptureAfterTargetCanWin() {
		SnapshotIndex index = indexer.buildIndex(Arrays.asList(
				row("20190901000000", "a.com/x", "1"),
				row("20191116120000", "a.com/x", "2")), TARGET, null);
		assertEquals("20191116120000", index.get("a.com/x").getTimestamp());
	}

	public void testFirstSeenWinsOnTies() {
		// Both exactly 1000000 from the target
		SnapshotIndex index = indexer.buildIndex(Arrays.asList(
				row("20191114000000", "a.com/x", "1"),
				row("20191116000000", "a.com/x", "2")), TARGET, null);
		assertEquals("20191114000000", index.get("a.com/x").getTimestamp());

		index = indexer.buildIndex(Arrays.asList(
				row("20191116000000", "a.com/x", "2"),
				row("20191114000000", "a.com/x", "1")), TARGET, null);
		assertEquals("20191116000000", index.get("a.com/x").getTimestamp());
	}

	public void testMalformedRowsAreDroppedAndCounted() {
		SnapshotIndex index = indexer.buildIndex(Arrays.asList(
				row("20191112000000", "a.com/x", "abc"),
				row("20191101000000", "a.com/x", "100"),
				row("20191110000000", "a.com/y", "200")), TARGET, null);
		assertEquals(2, index.size());
		assertEquals("20191101000000", index.get("a.com/x").getTimestamp());
		assertEquals(1L, index.getInvalidRows());
		assertEquals(3L, index.getRowsSeen());
	}

	public void testAllowedUrlsFilter() {
		SnapshotIndex index = indexer.buildIndex(Arrays.asList(
				row("20191110000000", "a.com/x", "1"),
				row("20191110000000", "a.com/other", "1"),
				row("20191110000000", "a.com/y", "1")), TARGET,
				new HashSet<String>(Arrays.asList("a.com/x", "a.com/y")));
		assertEquals(2, index.size());
		assertNull(index.get("a.com/other"));
		assertEquals(1L, index.getFilteredRows());
	}

	public void testEmptyResponse() {
		SnapshotIndex index = indexer.buildIndex(Collections.<CaptureRow>emptyList(), TARGET, null);
		assertTrue(index.isEmpty());
		assertNull(index.getNearest());
	}

	public void testSameRowsGiveSameIndex() {
		List<CaptureRow> rows = Arrays.asList(
				row("20191114000000", "a.com/x", "1"),
				row("20191116000000", "a.com/x", "2"),
				row("20191110000000", "a.com/y", "3"),
				row("20191120000000", "a.com/y", "4"));
		SnapshotIndex first = indexer.buildIndex(rows, TARGET, null);
		SnapshotIndex second = indexer.buildIndex(rows, TARGET, null);
		assertEquals(first.size(), second.size());
		for (SnapshotCandidate c : first.candidates()) {
			assertEquals(c.getTimestamp(), second.get(c.getOriginalUrl()).getTimestamp());
		}
	}
}
