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

import java.util.List;

import is.landsbokasafn.snapshotfinder.CaptureRow;

/**
 * A time indexed source of captures, typically a remote CDX server.
 */
public interface CaptureSource {

	/**
	 * Run a query against the index.
	 * 
	 * @param query The URL pattern, date window, fields and filters to query for
	 * @return The rows returned, in the order the index returned them. Rows are not validated. An empty list
	 *         means the index holds nothing matching the query.
	 * @throws QueryFailedException If the index could not be reached or did not return a complete JSON answer
	 */
	List<CaptureRow> query(CaptureQuery query) throws QueryFailedException;

	/**
	 * @return A short, human readable, description of the source and its settings
	 */
	String getInfo();

}
