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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The capture chosen for one URL of the master list. This is what the result file of a run contains and what
 * the downloader consumes, hence the JSON property names.
 */
@JsonPropertyOrder({"archive_url", "timestamp", "original_url", "statuscode", "size", "days_diff"})
public final class Snapshot {
	private final String archiveUrl;
	private final String timestamp;
	private final String originalUrl;
	private final String statusCode;
	private final long size;
	private final long daysDiff;
	private final long timeDistance;

	public Snapshot(String archiveUrl, String timestamp, String originalUrl, String statusCode, long size,
			long timeDistance) {
		this.archiveUrl = archiveUrl;
		this.timestamp = timestamp;
		this.originalUrl = originalUrl;
		this.statusCode = statusCode;
		this.size = size;
		this.timeDistance = timeDistance;
		this.daysDiff = Timestamps.daysDiff(timeDistance);
	}

	/**
	 * Used when reading a result file back. The time distance is not stored, so it is recovered from
	 * <code>days_diff</code> and is only accurate to the day.
	 */
	@JsonCreator
	static Snapshot fromJson(
			@JsonProperty("archive_url") String archiveUrl,
			@JsonProperty("timestamp") String timestamp,
			@JsonProperty("original_url") String originalUrl,
			@JsonProperty("statuscode") String statusCode,
			@JsonProperty("size") long size,
			@JsonProperty("days_diff") long daysDiff) {
		return new Snapshot(archiveUrl, timestamp, originalUrl, statusCode, size,
				daysDiff * SnapshotFinderConstants.TIMESTAMP_UNITS_PER_DAY);
	}

	@JsonProperty("archive_url")
	public String getArchiveUrl() {
		return archiveUrl;
	}

	@JsonProperty("timestamp")
	public String getTimestamp() {
		return timestamp;
	}

	@JsonProperty("original_url")
	public String getOriginalUrl() {
		return originalUrl;
	}

	@JsonProperty("statuscode")
	public String getStatusCode() {
		return statusCode;
	}

	@JsonProperty("size")
	public long getSize() {
		return size;
	}

	@JsonProperty("days_diff")
	public long getDaysDiff() {
		return daysDiff;
	}

	@JsonIgnore
	public long getTimeDistance() {
		return timeDistance;
	}

	@Override
	public String toString() {
		return daysDiff + " days: " + originalUrl;
	}
}
