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

/**
 * Splits a list into contiguous batches for parallel processing.
 */
public class BatchPartitioner {

	private BatchPartitioner() {
	}

	/**
	 * Partition a list into at most <code>parallelism</code> batches of <code>ceil(total/parallelism)</code>
	 * items. The last batch may be smaller. No batch is empty, so fewer batches than <code>parallelism</code>
	 * are returned when the list is short.
	 * @param items The items, order is preserved
	 * @param parallelism Maximum number of batches, at least 1
	 * @return The batches, concatenated they equal <code>items</code>
	 */
	public static <T> List<List<T>> partition(List<T> items, int parallelism) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("Parallelism must be at least 1, was " + parallelism);
		}
		List<List<T>> batches = new ArrayList<List<T>>();
		int total = items.size();
		if (total == 0) {
			return batches;
		}
		int batchSize = (total + parallelism - 1) / parallelism;
		for (int start = 0; start < total; start += batchSize) {
			int end = Math.min(start + batchSize, total);
			batches.add(new ArrayList<T>(items.subList(start, end)));
		}
		return batches;
	}
}
