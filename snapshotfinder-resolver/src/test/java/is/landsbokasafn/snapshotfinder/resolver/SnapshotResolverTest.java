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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import is.landsbokasafn.snapshotfinder.EmptyWindowResultException;
import is.landsbokasafn.snapshotfinder.InvalidDateFormatException;
import is.landsbokasafn.snapshotfinder.MasterListEntry;
import is.landsbokasafn.snapshotfinder.Snapshot;
import is.landsbokasafn.snapshotfinder.cdx.CaptureQuery;
import is.landsbokasafn.snapshotfinder.cdx.Pacer;
import is.landsbokasafn.snapshotfinder.cdx.QueryFailedException;
import junit.framework.TestCase;

public class SnapshotResolverTest extends TestCase {

	private static List<MasterListEntry> master(String... urls) {
		List<MasterListEntry> list = new ArrayList<MasterListEntry>();
		for (String url : urls) {
			list.add(new MasterListEntry(url));
		}
		return list;
	}

	private static SnapshotResolver resolver(FakeCaptureSource source, ResolutionStrategy strategy) {
		SnapshotResolver resolver = new SnapshotResolver(source);
		resolver.setStrategy(strategy);
		resolver.setSequentialPacer(Pacer.NONE);
		return resolver;
	}

	public void testSingleUrl() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource().respond("a.com/*",
				row("20191110000000", "a.com/x", "6000"),
				row("20191201000000", "a.com/x", "7000"));

		ResolutionResult result = resolver(source, ResolutionStrategy.SINGLE_QUERY)
				.resolve("a.com", "20191115", master("a.com/x"));

		assertEquals(1, result.getSnapshots().size());
		Snapshot s = result.getSnapshots().get(0);
		assertEquals("20191110000000", s.getTimestamp());
		assertEquals(5L, s.getDaysDiff());
		assertEquals(6000L, s.getSize());
		assertEquals("https://web.archive.org/web/20191110000000/a.com/x", s.getArchiveUrl());
		assertEquals(ResolutionStrategy.SINGLE_QUERY, result.getStrategy());

		CaptureQuery q = source.getQueries().get(0);
		assertEquals("20190817", q.getWindow().getFromParameter());
		assertEquals("20200213", q.getWindow().getToParameter());
		assertEquals(100000, q.getLimit());
	}

	public void testPartialCoverageIsNotAnError() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource().respond("a.com/*",
				row("20191110000000", "a.com/1", "1"),
				row("20191120000000", "a.com/3", "1"));

		ResolutionResult result = resolver(source, ResolutionStrategy.SINGLE_QUERY)
				.resolve("a.com", "20191115", master("a.com/1", "a.com/2", "a.com/3"));

		assertEquals(2, result.getSnapshots().size());
		assertEquals(3, result.getMasterListSize());
	}

	public void testMalformedRowDoesNotAbort() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource().respond("a.com/*",
				row("20191114000000", "a.com/x", "abc"),
				row("20191110000000", "a.com/x", "10"));

		ResolutionResult result = resolver(source, ResolutionStrategy.SINGLE_QUERY)
				.resolve("a.com", "20191115", master("a.com/x"));

		assertEquals("20191110000000", result.getSnapshots().get(0).getTimestamp());
		assertEquals(1L, result.getStatistics().getInvalidRows());
	}

	public void testInvalidDateQueriesNothing() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource();
		for (ResolutionStrategy strategy : ResolutionStrategy.values()) {
			try {
				resolver(source, strategy).resolve("a.com", "2019-11-15", master("a.com/x"));
				fail("Expected InvalidDateFormatException");
			} catch (InvalidDateFormatException e) {
				assertEquals("2019-11-15", e.getDate());
			}
		}
		try {
			resolver(source, ResolutionStrategy.AUTO).resolve("a.com", "20190230", master("a.com/x"));
			fail("Expected InvalidDateFormatException");
		} catch (InvalidDateFormatException e) {
			// Expected
		}
		assertTrue(source.getQueries().isEmpty());
	}

	public void testSingleQueryWithNoUsableRows() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource().respond("a.com/*",
				row("20191110000000", "a.com/x", "-"));
		try {
			resolver(source, ResolutionStrategy.SINGLE_QUERY).resolve("a.com", "20191115", master("a.com/x"));
			fail("Expected EmptyWindowResultException");
		} catch (EmptyWindowResultException e) {
			assertEquals("20190817", e.getWindow().getFromParameter());
		}
	}

	public void testSingleQueryFailureIsFatal() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource().fail("a.com/*");
		try {
			resolver(source, ResolutionStrategy.SINGLE_QUERY).resolve("a.com", "20191115", master("a.com/x"));
			fail("Expected QueryFailedException");
		} catch (QueryFailedException e) {
			// Expected
		}
	}

	public void testNoMatchesInOtherStrategiesIsEmptyResult() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource();
		ResolutionResult result = resolver(source, ResolutionStrategy.PARALLEL_BATCHES)
				.resolve("a.com", "20191115", master("a.com/1", "a.com/2", "a.com/3"));
		assertTrue(result.isEmpty());
		assertEquals(0L, result.getStatistics().getBatchesFailed());
	}

	public void testAutoPicksPerUrlForShortLists() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource()
				.respond("a.com/1", row("20191110000000", "a.com/1", "1"));
		ResolutionResult result = resolver(source, ResolutionStrategy.AUTO)
				.resolve("a.com", "20191115", master("a.com/1", "a.com/2"));
		assertEquals(ResolutionStrategy.PER_URL, result.getStrategy());
		assertEquals(Arrays.asList("a.com/1", "a.com/2"), source.getQueriedPatterns());
		assertEquals(1, result.getSnapshots().size());
	}

	public void testAutoPicksBatchesForLongLists() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource();
		SnapshotResolver resolver = resolver(source, ResolutionStrategy.AUTO);
		resolver.setSequentialThreshold(2);
		resolver.setParallelism(2);
		ResolutionResult result = resolver.resolve("a.com", "20191115", master("a.com/1", "a.com/2", "a.com/3"));
		assertEquals(ResolutionStrategy.PARALLEL_BATCHES, result.getStrategy());
		assertEquals(2L, result.getStatistics().getBatchesTotal());
	}

	public void testEmptyMasterList() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource();
		ResolutionResult result = resolver(source, ResolutionStrategy.SINGLE_QUERY)
				.resolve("a.com", "20191115", master());
		assertTrue(result.isEmpty());
		assertTrue(source.getQueries().isEmpty());
	}

	public void testWindowSetting() throws Exception {
		FakeCaptureSource source = new FakeCaptureSource().respond("a.com/*",
				row("20191110000000", "a.com/x", "1"));
		SnapshotResolver resolver = resolver(source, ResolutionStrategy.SINGLE_QUERY);
		resolver.setWindowDays(30);
		ResolutionResult result = resolver.resolve("a.com", "20200301", master("a.com/x"));
		assertEquals("20200131", result.getWindow().getFromParameter());
		assertEquals("20200331", result.getWindow().getToParameter());
	}

	public void testStrategyNames() {
		assertEquals(ResolutionStrategy.PARALLEL_BATCHES, ResolutionStrategy.forName("parallel-batches"));
		assertEquals(ResolutionStrategy.PER_URL, ResolutionStrategy.forName("per_url"));
		assertEquals(ResolutionStrategy.AUTO, ResolutionStrategy.forName(" Auto "));
		try {
			ResolutionStrategy.forName("fastest");
			fail("Expected IllegalArgumentException");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}
}
