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
 * These enums correspond to the columns requested from, and returned by, the CDX index
 */
public enum CaptureFields {
    /** The capture time, 14 digits <pre>YYYYMMDDhhmmss</pre> **/
	TIMESTAMP("timestamp"),
    /** The URL as it was captured. Used verbatim in the archive URL of a snapshot **/
	ORIGINAL("original"),
    /** HTTP status code of the capture, as a string **/
	STATUSCODE("statuscode"),
    /** The captured document's mime type **/
	MIMETYPE("mimetype"),
    /** Size of the (compressed) capture record in bytes **/
	LENGTH("length");

	private final String cdxName;

	private CaptureFields(String cdxName) {
		this.cdxName = cdxName;
	}

	/**
	 * @return The column name used by the CDX API for this field (in the <code>fl</code> parameter and the
	 *         header row of a JSON response).
	 */
	public String cdxName() {
		return cdxName;
	}

	/**
	 * Find the field with the given CDX column name.
	 * @param cdxName A column name from a CDX header row
	 * @return The matching field or null if the column is not one we use
	 */
	public static CaptureFields forCdxName(String cdxName) {
		for (CaptureFields field : values()) {
			if (field.cdxName.equals(cdxName)) {
				return field;
			}
		}
		return null;
	}

}
