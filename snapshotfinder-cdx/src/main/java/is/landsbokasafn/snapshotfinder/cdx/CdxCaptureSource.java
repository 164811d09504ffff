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
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.httpclient.HttpClient;
import org.apache.commons.httpclient.HttpStatus;
import org.apache.commons.httpclient.MultiThreadedHttpConnectionManager;
import org.apache.commons.httpclient.NameValuePair;
import org.apache.commons.httpclient.methods.GetMethod;
import org.apache.commons.httpclient.params.HttpConnectionManagerParams;
import org.apache.commons.httpclient.params.HttpMethodParams;
import org.apache.commons.io.IOUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import is.landsbokasafn.snapshotfinder.CaptureRow;
import is.landsbokasafn.snapshotfinder.SnapshotFinderConstants;

/**
 * Queries a Wayback style CDX server over HTTP.
 * <p>
 * A single instance may be shared by many threads, connections are pooled. Call {@link #close()} when done.
 */
public class CdxCaptureSource implements CaptureSource {
	private static final Log log = LogFactory.getLog(CdxCaptureSource.class);

	private final String endpoint;
	private final String userAgent;
	private final int timeoutMs;
	private final MultiThreadedHttpConnectionManager connectionManager;
	private final HttpClient httpClient;
	private final CdxResponseParser parser = new CdxResponseParser();

	/**
	 * Settings with the default endpoint, user agent and a 60 second timeout.
	 * @param maxConnections Number of queries that may be in flight at the same time
	 */
	public CdxCaptureSource(int maxConnections) {
		this(SnapshotFinderConstants.DEFAULT_CDX_ENDPOINT, SnapshotFinderConstants.DEFAULT_USER_AGENT, 
				SnapshotFinderConstants.DEFAULT_QUERY_TIMEOUT_MS, maxConnections);
	}

	/**
	 * @param endpoint URL of the CDX server, e.g. <code>http://web.archive.org/cdx/search/cdx</code>
	 * @param userAgent User agent sent with every query
	 * @param timeoutMs Connect and read timeout, in milliseconds
	 * @param maxConnections Number of queries that may be in flight at the same time
	 */
	public CdxCaptureSource(String endpoint, String userAgent, int timeoutMs, int maxConnections) {
		if (endpoint == null || endpoint.isEmpty()) {
			throw new IllegalArgumentException("CDX endpoint is required");
		}
		if (maxConnections < 1) {
			throw new IllegalArgumentException("At least one connection is required");
		}
		this.endpoint = endpoint;
		this.userAgent = userAgent;
		this.timeoutMs = timeoutMs;

		connectionManager = new MultiThreadedHttpConnectionManager();
		HttpConnectionManagerParams params = connectionManager.getParams();
		params.setConnectionTimeout(timeoutMs);
		params.setSoTimeout(timeoutMs);
		params.setDefaultMaxConnectionsPerHost(maxConnections);
		params.setMaxTotalConnections(maxConnections);

		httpClient = new HttpClient(connectionManager);
		httpClient.getParams().setParameter(HttpMethodParams.USER_AGENT, userAgent);
	}

	@Override
	public List<CaptureRow> query(CaptureQuery query) throws QueryFailedException {
		GetMethod get = new GetMethod(endpoint);
		get.setQueryString(buildParameters(query));
		get.setFollowRedirects(true);
		InputStream in = null;
		try {
			log.debug("Querying " + endpoint + "?" + get.getQueryString());
			int status = httpClient.executeMethod(get);
			if (status != HttpStatus.SC_OK) {
				throw new QueryFailedException(query, "CDX server answered " + status + " " + 
						HttpStatus.getStatusText(status));
			}
			in = get.getResponseBodyAsStream();
			if (in == null) {
				throw new QueryFailedException(query, "empty response");
			}
			return parser.parse(query, in);
		} catch (QueryFailedException e) {
			throw e;
		} catch (IOException e) {
			throw new QueryFailedException(query, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
		} finally {
			IOUtils.closeQuietly(in);
			get.releaseConnection();
		}
	}

	/**
	 * @param query A query
	 * @return The HTTP query parameters for the query. Filters become repeated <code>filter</code> parameters.
	 */
	protected NameValuePair[] buildParameters(CaptureQuery query) {
		List<NameValuePair> params = new ArrayList<NameValuePair>();
		params.add(new NameValuePair("url", query.getUrlPattern()));
		params.add(new NameValuePair("from", query.getWindow().getFromParameter()));
		params.add(new NameValuePair("to", query.getWindow().getToParameter()));
		params.add(new NameValuePair("output", "json"));
		params.add(new NameValuePair("fl", query.getFieldList()));
		for (String filter : query.getFilters()) {
			params.add(new NameValuePair("filter", filter));
		}
		if (query.getLimit() > 0) {
			params.add(new NameValuePair("limit", Integer.toString(query.getLimit())));
		}
		return params.toArray(new NameValuePair[params.size()]);
	}

	/**
	 * Release pooled connections.
	 */
	public void close() {
		connectionManager.shutdown();
	}

	public String getEndpoint() {
		return endpoint;
	}

	@Override
	public String getInfo() {
		StringBuilder sb = new StringBuilder();
		sb.append(CdxCaptureSource.class.getCanonicalName());
		sb.append("\n");
		sb.append(" Endpoint: " + endpoint);
		sb.append("\n");
		sb.append(" User agent: " + userAgent);
		sb.append("\n");
		sb.append(" Timeout: " + timeoutMs + " ms");
		sb.append("\n");
		sb.append(" Max connections: " + connectionManager.getParams().getMaxTotalConnections());
		sb.append("\n");
		return sb.toString();
	}
}
