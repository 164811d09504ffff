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

/**
 * The target date is not a valid <pre>YYYYMMDD</pre> date.
 */
public class InvalidDateFormatException extends SnapshotFinderException {
	private static final long serialVersionUID = 1L;

	private final String date;

	public InvalidDateFormatException(String date) {
		super(message(date));
		this.date = date;
	}

	public InvalidDateFormatException(String date, Throwable cause) {
		super(message(date), cause);
		this.date = date;
	}

	private static String message(String date) {
		return "Invalid target date '" + date + "'. Use the format YYYYMMDD, e.g. 20191115 (15 November 2019)";
	}

	public String getDate() {
		return date;
	}
}
