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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Paces queries to a steady rate while counting bursts. Once <code>burstLimit</code> queries have been issued
 * within a burst window the next query waits for twice the regular delay and a new burst begins.
 */
public class BurstPacer implements Pacer {
	private static final Log log = LogFactory.getLog(BurstPacer.class);

	/** A burst count older than this is forgotten **/
	public static final long BURST_WINDOW_MS = 10000L;

	private final long delayMs;
	private final int burstLimit;
	private final Ticker ticker;

	private long lastRequest = 0L;
	private int burstCount = 0;
	private long burstStart = 0L;

	/**
	 * @param requestsPerSecond Sustained rate, must be positive
	 * @param burstLimit Queries allowed in one burst before the longer pause
	 */
	public BurstPacer(double requestsPerSecond, int burstLimit) {
		this(requestsPerSecond, burstLimit, Ticker.SYSTEM);
	}

	public BurstPacer(double requestsPerSecond, int burstLimit, Ticker ticker) {
		if (requestsPerSecond <= 0) {
			throw new IllegalArgumentException("Rate must be positive: " + requestsPerSecond);
		}
		if (burstLimit < 1) {
			throw new IllegalArgumentException("Burst limit must be at least 1: " + burstLimit);
		}
		this.delayMs = Math.round(1000d / requestsPerSecond);
		this.burstLimit = burstLimit;
		this.ticker = ticker;
	}

	@Override
	public synchronized void pace() throws InterruptedException {
		long now = ticker.currentTimeMillis();

		if (now - burstStart > BURST_WINDOW_MS) {
			burstCount = 0;
			burstStart = now;
		}

		if (burstCount >= burstLimit) {
			long wait = delayMs * 2;
			log.debug("Burst limit reached, waiting " + wait + " ms");
			ticker.sleep(wait);
			now = ticker.currentTimeMillis();
			burstCount = 0;
			burstStart = now;
		}

		long sinceLast = now - lastRequest;
		if (sinceLast < delayMs) {
			long wait = delayMs - sinceLast;
			log.debug("Rate limiting, waiting " + wait + " ms");
			ticker.sleep(wait);
		}

		lastRequest = ticker.currentTimeMillis();
		burstCount++;
	}

	/**
	 * Forget all history. The next query is not delayed.
	 */
	public synchronized void reset() {
		lastRequest = 0L;
		burstCount = 0;
		burstStart = 0L;
	}

	public long getDelayMs() {
		return delayMs;
	}

	@Override
	public String getInfo() {
		return "At most one query per " + delayMs + " ms, bursts of " + burstLimit;
	}
}
