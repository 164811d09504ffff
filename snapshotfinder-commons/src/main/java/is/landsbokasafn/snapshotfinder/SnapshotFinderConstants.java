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
 * Constants shared by the query client and the resolver.
 */
public final class SnapshotFinderConstants {

	/** Prefix of all archive URLs handed to downstream tools **/
	public static final String DEFAULT_ARCHIVE_BASE = "https://web.archive.org/web";

	/** The Wayback Machine CDX server **/
	public static final String DEFAULT_CDX_ENDPOINT = "http://web.archive.org/cdx/search/cdx";

	/** Number of days searched on either side of the target date **/
	public static final int DEFAULT_WINDOW_DAYS = 90;

	/** Degree of parallelism for batched resolution **/
	public static final int DEFAULT_PARALLELISM = 8;

	/** Row cap on a single domain-wide query **/
	public static final int DEFAULT_DOMAIN_ROW_LIMIT = 100000;

	/** Row cap on the domain-wide query issued by each batch **/
	public static final int DEFAULT_BATCH_ROW_LIMIT = 10000;

	/** Master lists smaller than this are resolved one URL at a time when the strategy is AUTO **/
	public static final int DEFAULT_SEQUENTIAL_THRESHOLD = 50;

	/** Pause between consecutive per-URL queries, in milliseconds **/
	public static final long DEFAULT_SEQUENTIAL_DELAY_MS = 500L;

	/** Connect and read timeout of a single query, in milliseconds **/
	public static final int DEFAULT_QUERY_TIMEOUT_MS = 60000;

	/** Time allowed for all batches of a parallel run to finish, in milliseconds **/
	public static final long DEFAULT_BATCH_TIMEOUT_MS = 300000L;

	/**
	 * Divisor turning a difference of two 14 digit timestamps into "days". The timestamps are compared as plain
	 * numbers so this is an approximation (YYYYMMDDhhmmss puts the day digits at 10^6), not calendar arithmetic.
	 */
	public static final long TIMESTAMP_UNITS_PER_DAY = 1000000L;

	/** Appended to a YYYYMMDD target date to get the 14 digit target timestamp (midnight) **/
	public static final String MIDNIGHT_SUFFIX = "000000";

	/** Only successful captures are of interest **/
	public static final String FILTER_STATUS_OK = "statuscode:200";

	/** Only HTML pages are of interest **/
	public static final String FILTER_MIME_HTML = "mimetype:text/html";

	public static final String MASTER_LIST_SUFFIX = "_master_list.json";

	public static final String SNAPSHOTS_INFIX = "_snapshots_";

	public static final String DEFAULT_USER_AGENT = "SnapshotFinder/1.0";

	private SnapshotFinderConstants() {
	}

	/**
	 * @param domain The domain
	 * @return Name of the file holding the master list of the domain
	 */
	public static String masterListFilename(String domain) {
		return domain + MASTER_LIST_SUFFIX;
	}

	/**
	 * @param domain The domain
	 * @param targetDate Target date, YYYYMMDD
	 * @return Name of the file the resolved snapshots of a run are written to
	 */
	public static String snapshotsFilename(String domain, String targetDate) {
		return domain + SNAPSHOTS_INFIX + targetDate + ".json";
	}
}
