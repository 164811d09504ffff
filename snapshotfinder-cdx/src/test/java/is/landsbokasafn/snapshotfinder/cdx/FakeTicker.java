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
package is.landsbokasafn.snapshotfinder.cdx;

import java.util.ArrayList;
import java.util.List;

/**
 * A ticker whose clock only moves when something sleeps on it.
 */
public class FakeTicker implements Ticker {
	private long now;
	private final List<Long> sleeps = new ArrayList<Long>();

	public FakeTicker(long start) {
		this.now = start;
	}

	@Override
	public long currentTimeMillis() {
		return now;
	}

	@Override
	public void sleep(long millis) {
		sleeps.add(millis);
		if (millis > 0) {
			now += millis;
		}
	}

	public void advance(long millis) {
		now += millis;
	}

	public List<Long> getSleeps() {
		return sleeps;
	}
}
