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

import java.io.IOException;

/**
 * A query against the capture index failed: transport error, an error status, or a response that is empty, not
 * JSON or cut short.
 */
public class QueryFailedException extends IOException {
	private static final long serialVersionUID = 1L;

	private final CaptureQuery query;

	public QueryFailedException(CaptureQuery query, String reason) {
		super("Query for " + describe(query) + " failed: " + reason);
		this.query = query;
	}

	public QueryFailedException(CaptureQuery query, String reason, Throwable cause) {
		super("Query for " + describe(query) + " failed: " + reason, cause);
		this.query = query;
	}

	private static String describe(CaptureQuery query) {
		return query == null ? "<unknown>" : query.toString();
	}

	/**
	 * @return The query that failed
	 */
	public CaptureQuery getQuery() {
		return query;
	}
}
