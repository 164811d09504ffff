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

/**
 * Guarantees a minimum interval between consecutive queries. The first query is never delayed.
 */
public class FixedIntervalPacer implements Pacer {

	private final long intervalMs;
	private final Ticker ticker;
	private long lastPermit = -1L;

	public FixedIntervalPacer(long intervalMs) {
		this(intervalMs, Ticker.SYSTEM);
	}

	public FixedIntervalPacer(long intervalMs, Ticker ticker) {
		if (intervalMs < 0) {
			throw new IllegalArgumentException("Interval can not be negative: " + intervalMs);
		}
		this.intervalMs = intervalMs;
		this.ticker = ticker;
	}

	@Override
	public synchronized void pace() throws InterruptedException {
		long now = ticker.currentTimeMillis();
		if (lastPermit >= 0) {
			long wait = intervalMs - (now - lastPermit);
			if (wait > 0) {
				ticker.sleep(wait);
				now = ticker.currentTimeMillis();
			}
		}
		lastPermit = now;
	}

	public long getIntervalMs() {
		return intervalMs;
	}

	@Override
	public String getInfo() {
		return "At least " + intervalMs + " ms between queries";
	}
}
