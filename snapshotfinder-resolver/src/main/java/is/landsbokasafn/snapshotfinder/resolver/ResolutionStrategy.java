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

import java.util.Arrays;
import java.util.Locale;

public enum ResolutionStrategy {
	/**
	 * One query for the whole domain (<code>domain/*</code>) within the window, matched against the entire master
	 * list. Fewest requests, but a large domain may hit the row limit of the query and lose coverage. A failed
	 * query, or one that yields no usable rows, fails the run.
	 */
	SINGLE_QUERY,

	/**
	 * Split the master list into batches and run one windowed query per batch on a thread pool. A failing batch
	 * only costs the URLs in that batch.
	 */
	PARALLEL_BATCHES,

	/**
	 * One query per master list URL, paced so the archive is not flooded. Slow but precise. Any failed query
	 * fails the run.
	 */
	PER_URL,

	/**
	 * {@link #PER_URL} for short master lists, {@link #PARALLEL_BATCHES} otherwise.
	 */
	AUTO;

	/**
	 * Pick the strategy to actually run.
	 * @param masterListSize Number of entries in the master list
	 * @param sequentialThreshold Master lists shorter than this are resolved per URL when this is {@link #AUTO}
	 * @return This strategy, unless it is {@link #AUTO}
	 */
	public ResolutionStrategy effective(int masterListSize, int sequentialThreshold) {
		if (this != AUTO) {
			return this;
		}
		return masterListSize < sequentialThreshold ? PER_URL : PARALLEL_BATCHES;
	}

	/**
	 * Lenient lookup for configuration and command line values. Case and dashes are ignored, so
	 * <code>parallel-batches</code> is understood.
	 * @param name The strategy name
	 * @return The strategy
	 * @throws IllegalArgumentException If no strategy has that name
	 */
	public static ResolutionStrategy forName(String name) {
		if (name == null) {
			throw new IllegalArgumentException("No strategy given");
		}
		String normalized = name.trim().toUpperCase(Locale.ENGLISH).replace('-', '_');
		for (ResolutionStrategy strategy : values()) {
			if (strategy.name().equals(normalized)) {
				return strategy;
			}
		}
		throw new IllegalArgumentException("Unknown strategy '" + name + "'. Valid strategies are "
				+ Arrays.toString(values()));
	}
}
