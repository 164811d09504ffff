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

import static is.landsbokasafn.snapshotfinder.SnapshotFinderConstants.MIDNIGHT_SUFFIX;
import static is.landsbokasafn.snapshotfinder.SnapshotFinderConstants.TIMESTAMP_UNITS_PER_DAY;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Pattern;

/**
 * Conversions between target dates, 14 digit CDX timestamps and the distances used to rank captures.
 */
public final class Timestamps {

	/** YYYYMMDD, validated against the calendar (no February 30th) **/
	public static final DateTimeFormatter TARGET_DATE_FORMAT =
			DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

	private static final Pattern TARGET_DATE_SHAPE = Pattern.compile("^[0-9]{8}$");
	private static final Pattern TIMESTAMP_SHAPE = Pattern.compile("^[0-9]{14}$");

	private Timestamps() {
	}

	/**
	 * Parse an operator supplied target date.
	 * @param targetDate Date as <pre>YYYYMMDD</pre>
	 * @return The date
	 * @throws InvalidDateFormatException If the string is not eight digits or not a real calendar date
	 */
	public static LocalDate parseTargetDate(String targetDate) throws InvalidDateFormatException {
		if (targetDate == null || !TARGET_DATE_SHAPE.matcher(targetDate).matches()) {
			throw new InvalidDateFormatException(targetDate);
		}
		try {
			return LocalDate.parse(targetDate, TARGET_DATE_FORMAT);
		} catch (DateTimeParseException e) {
			throw new InvalidDateFormatException(targetDate, e);
		}
	}

	/**
	 * @param date A date
	 * @return The date as <pre>YYYYMMDD</pre>
	 */
	public static String formatDate(LocalDate date) {
		return date.format(TARGET_DATE_FORMAT);
	}

	/**
	 * The target date expanded to a 14 digit timestamp at midnight, as a number.
	 * @param targetDate Date as <pre>YYYYMMDD</pre>
	 * @return e.g. 20191115000000 for 20191115
	 * @throws InvalidDateFormatException If the date is invalid
	 */
	public static long targetTimestamp(String targetDate) throws InvalidDateFormatException {
		parseTargetDate(targetDate);
		return Long.parseLong(targetDate + MIDNIGHT_SUFFIX);
	}

	/**
	 * @param timestamp A value from the timestamp column of the CDX index
	 * @return true if it is exactly 14 digits
	 */
	public static boolean isValidTimestamp(String timestamp) {
		return timestamp != null && TIMESTAMP_SHAPE.matcher(timestamp).matches();
	}

	/**
	 * @param timestamp A valid 14 digit timestamp
	 * @param targetTimestamp The target timestamp, see {@link #targetTimestamp(String)}
	 * @return The absolute numeric difference of the two
	 */
	public static long timeDistance(String timestamp, long targetTimestamp) {
		return Math.abs(Long.parseLong(timestamp) - targetTimestamp);
	}

	/**
	 * Approximate number of days represented by a time distance. This is integer division by 10^6 and must stay
	 * that way: result files written by earlier runs use the same figure.
	 * @param timeDistance A distance as returned by {@link #timeDistance(String, long)}
	 * @return Distance in "days"
	 */
	public static long daysDiff(long timeDistance) {
		return timeDistance / TIMESTAMP_UNITS_PER_DAY;
	}
}
