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

import static is.landsbokasafn.snapshotfinder.SnapshotFinderConstants.FILTER_MIME_HTML;
import static is.landsbokasafn.snapshotfinder.SnapshotFinderConstants.FILTER_STATUS_OK;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import is.landsbokasafn.snapshotfinder.CaptureFields;
import is.landsbokasafn.snapshotfinder.DateWindow;

/**
 * A bounded, windowed query against the capture index. Instances are immutable.
 */
public final class CaptureQuery {

	/** The fields every query asks for, in the order the original CDX tooling asks for them **/
	public static final List<CaptureFields> DEFAULT_FIELDS = Collections.unmodifiableList(Arrays.asList(
			CaptureFields.TIMESTAMP, CaptureFields.ORIGINAL, CaptureFields.STATUSCODE, 
			CaptureFields.MIMETYPE, CaptureFields.LENGTH));

	/** Successful HTML captures only **/
	public static final List<String> DEFAULT_FILTERS = Collections.unmodifiableList(Arrays.asList(
			FILTER_STATUS_OK, FILTER_MIME_HTML));

	private final String urlPattern;
	private final DateWindow window;
	private final List<CaptureFields> fields;
	private final List<String> filters;
	private final int limit;

	/**
	 * @param urlPattern A URL or a wildcard pattern such as <code>example.com/*</code>
	 * @param window Inclusive date range
	 * @param fields Fields to return
	 * @param filters CDX filter expressions (<code>field:regex</code>)
	 * @param limit Maximum number of rows, 0 or less for no limit
	 */
	public CaptureQuery(String urlPattern, DateWindow window, List<CaptureFields> fields, List<String> filters,
			int limit) {
		if (urlPattern == null || urlPattern.isEmpty()) {
			throw new IllegalArgumentException("A URL pattern is required");
		}
		if (window == null) {
			throw new IllegalArgumentException("A date window is required");
		}
		if (fields == null || fields.isEmpty()) {
			throw new IllegalArgumentException("At least one field must be requested");
		}
		this.urlPattern = urlPattern;
		this.window = window;
		this.fields = Collections.unmodifiableList(new ArrayList<CaptureFields>(fields));
		this.filters = filters == null ? Collections.<String>emptyList()
				: Collections.unmodifiableList(new ArrayList<String>(filters));
		this.limit = limit;
	}

	/**
	 * All successful HTML captures of any URL under the domain.
	 * @param domain The domain, e.g. <code>example.com</code>
	 * @param window The window
	 * @param limit Row limit
	 * @return The query
	 */
	public static CaptureQuery forDomain(String domain, DateWindow window, int limit) {
		return new CaptureQuery(domainPattern(domain), window, DEFAULT_FIELDS, DEFAULT_FILTERS, limit);
	}

	/**
	 * All successful HTML captures of a single URL.
	 * @param url The URL
	 * @param window The window
	 * @param limit Row limit
	 * @return The query
	 */
	public static CaptureQuery forUrl(String url, DateWindow window, int limit) {
		return new CaptureQuery(url, window, DEFAULT_FIELDS, DEFAULT_FILTERS, limit);
	}

	/**
	 * @param domain A domain
	 * @return The CDX wildcard pattern matching every URL under the domain
	 */
	public static String domainPattern(String domain) {
		return domain + "/*";
	}

	public String getUrlPattern() {
		return urlPattern;
	}

	public DateWindow getWindow() {
		return window;
	}

	public List<CaptureFields> getFields() {
		return fields;
	}

	public List<String> getFilters() {
		return filters;
	}

	public int getLimit() {
		return limit;
	}

	/**
	 * @return The fields as the comma separated list the CDX <code>fl</code> parameter expects
	 */
	public String getFieldList() {
		StringBuilder sb = new StringBuilder();
		for (CaptureFields field : fields) {
			if (sb.length() > 0) {
				sb.append(",");
			}
			sb.append(field.cdxName());
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return urlPattern + " [" + window + "]";
	}
}
