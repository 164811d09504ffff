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
 * Source of time for pacing policies. Lets tests advance time without sleeping.
 */
public interface Ticker {

	/**
	 * @return Current time in milliseconds
	 */
	long currentTimeMillis();

	/**
	 * Block for the given number of milliseconds.
	 * @param millis Time to wait, nothing happens if zero or less
	 * @throws InterruptedException If interrupted while waiting
	 */
	void sleep(long millis) throws InterruptedException;

	/** Wall clock time and {@link Thread#sleep(long)} **/
	Ticker SYSTEM = new Ticker() {
		@Override
		public long currentTimeMillis() {
			return System.currentTimeMillis();
		}

		@Override
		public void sleep(long millis) throws InterruptedException {
			if (millis > 0) {
				Thread.sleep(millis);
			}
		}
	};
}
