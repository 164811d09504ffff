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
 * A validated capture of a URL together with its distance from the target timestamp. Instances are compared
 * while an index is being built; the closest one for each URL becomes a {@link Snapshot}.
 */
public class SnapshotCandidate {
	private final String originalUrl;
	private final String timestamp;
	private final String statusCode;
	private final String mimeType;
	private final long size;
	private final long timeDistance;

	public SnapshotCandidate(String originalUrl, String timestamp, String statusCode, String mimeType,
			long size, long timeDistance) {
		if (originalUrl == null || timestamp == null) {
			throw new IllegalArgumentException("URL and timestamp are required");
		}
		this.originalUrl = originalUrl;
		this.timestamp = timestamp;
		this.statusCode = statusCode;
		this.mimeType = mimeType;
		this.size = size;
		this.timeDistance = timeDistance;
	}

	public String getOriginalUrl() {
		return originalUrl;
	}

	public String getTimestamp() {
		return timestamp;
	}

	public String getStatusCode() {
		return statusCode;
	}

	public String getMimeType() {
		return mimeType;
	}

	public long getSize() {
		return size;
	}

	/**
	 * @return Absolute difference between the capture timestamp and the target timestamp, both read as numbers
	 */
	public long getTimeDistance() {
		return timeDistance;
	}

	/**
	 * @return The approximate number of days between capture and target. See {@link Timestamps#daysDiff(long)}
	 */
	public long getDaysDiff() {
		return Timestamps.daysDiff(timeDistance);
	}

	/**
	 * A candidate only replaces another one if it is strictly closer to the target. On equal distance the one
	 * seen first is kept.
	 * @param other The candidate currently held, may be null
	 * @return true if this candidate should replace <code>other</code>
	 */
	public boolean isCloserThan(SnapshotCandidate other) {
		return other == null || timeDistance < other.timeDistance;
	}

	/**
	 * Turn this candidate into the final snapshot record.
	 * @param archiveBase Archive URL prefix, e.g. <code>https://web.archive.org/web</code>
	 * @return The snapshot
	 */
	public Snapshot toSnapshot(String archiveBase) {
		return new Snapshot(archiveBase + "/" + timestamp + "/" + originalUrl,
				timestamp, originalUrl, statusCode, size, timeDistance);
	}

	@Override
	public String toString() {
		return originalUrl + " @ " + timestamp + " (distance " + timeDistance + ")";
	}
}
