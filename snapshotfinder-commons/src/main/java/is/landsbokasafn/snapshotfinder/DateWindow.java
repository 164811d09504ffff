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
package is.landsbokasafn.snapshotfinder;

import java.time.LocalDate;

/**
 * An inclusive range of calendar days that a CDX query is restricted to.
 */
public final class DateWindow {
	private final LocalDate from;
	private final LocalDate to;

	public DateWindow(LocalDate from, LocalDate to) {
		if (from.isAfter(to)) {
			throw new IllegalArgumentException("Window starts after it ends: " + from + " > " + to);
		}
		this.from = from;
		this.to = to;
	}

	/**
	 * A window of <code>days</code> days before and after <code>target</code>. Month and year boundaries (and
	 * leap days) are handled by calendar arithmetic.
	 * @param target The center of the window
	 * @param days Days on either side, not negative
	 * @return The window
	 */
	public static DateWindow around(LocalDate target, int days) {
		if (days < 0) {
			throw new IllegalArgumentException("Window size can not be negative: " + days);
		}
		return new DateWindow(target.minusDays(days), target.plusDays(days));
	}

	public LocalDate getFrom() {
		return from;
	}

	public LocalDate getTo() {
		return to;
	}

	/**
	 * @return Start of the window as <pre>YYYYMMDD</pre>, the form the CDX <code>from</code> parameter takes
	 */
	public String getFromParameter() {
		return Timestamps.formatDate(from);
	}

	/**
	 * @return End of the window as <pre>YYYYMMDD</pre>, the form the CDX <code>to</code> parameter takes
	 */
	public String getToParameter() {
		return Timestamps.formatDate(to);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof DateWindow)) {
			return false;
		}
		DateWindow other = (DateWindow) obj;
		return from.equals(other.from) && to.equals(other.to);
	}

	@Override
	public int hashCode() {
		return 31 * from.hashCode() + to.hashCode();
	}

	@Override
	public String toString() {
		return getFromParameter() + " - " + getToParameter();
	}
}
