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
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import is.landsbokasafn.snapshotfinder.CaptureFields;
import is.landsbokasafn.snapshotfinder.CaptureRow;

/**
 * Reads the <code>output=json</code> form of a CDX response. That is a JSON array of arrays where the first
 * array is a header naming the columns and every following array is one capture, positionally. Columns are
 * located through the header so any subset or ordering of fields is understood.
 */
public class CdxResponseParser {
	private static final Log log = LogFactory.getLog(CdxResponseParser.class);

	private static final ObjectMapper MAPPER = new ObjectMapper();

	/**
	 * Parse a complete response body.
	 * 
	 * @param query The query the response answers. Only used to describe failures.
	 * @param body The response body. Not closed by this method.
	 * @return The rows in the order they appear. Empty if the response is <code>[]</code> or only a header.
	 * @throws QueryFailedException If the body is empty, not JSON, truncated or not an array
	 */
	public List<CaptureRow> parse(CaptureQuery query, InputStream body) throws QueryFailedException {
		byte[] content;
		try {
			content = IOUtils.toByteArray(body);
		} catch (IOException e) {
			throw new QueryFailedException(query, "error reading response", e);
		}
		return parse(query, content);
	}

	/**
	 * Parse a complete response body.
	 * @see #parse(CaptureQuery, InputStream)
	 */
	public List<CaptureRow> parse(CaptureQuery query, byte[] content) throws QueryFailedException {
		if (content == null || content.length == 0) {
			throw new QueryFailedException(query, "empty response");
		}
		JsonNode root;
		try {
			root = MAPPER.readTree(content);
		} catch (JsonProcessingException e) {
			throw new QueryFailedException(query, "response is not valid JSON", e);
		} catch (IOException e) {
			throw new QueryFailedException(query, "error reading response", e);
		}
		if (root == null || root.isMissingNode()) {
			throw new QueryFailedException(query, "empty response");
		}
		if (!root.isArray()) {
			throw new QueryFailedException(query, "expected a JSON array, got " + root.getNodeType());
		}
		if (root.size() <= 1) {
			// Nothing, or just the header
			return Collections.emptyList();
		}

		CaptureFields[] columns = readHeader(query, root.get(0));
		List<CaptureRow> rows = new ArrayList<CaptureRow>(root.size() - 1);
		for (int i = 1; i < root.size(); i++) {
			rows.add(toRow(root.get(i), columns));
		}
		log.debug("Parsed " + rows.size() + " rows for " + query);
		return rows;
	}

	private CaptureFields[] readHeader(CaptureQuery query, JsonNode header) throws QueryFailedException {
		if (!header.isArray()) {
			throw new QueryFailedException(query, "first row of response is not a header");
		}
		CaptureFields[] columns = new CaptureFields[header.size()];
		for (int i = 0; i < header.size(); i++) {
			columns[i] = CaptureFields.forCdxName(header.get(i).asText());
			if (columns[i] == null) {
				log.debug("Ignoring unknown column '" + header.get(i).asText() + "'");
			}
		}
		return columns;
	}

	/**
	 * Map one positional row onto a {@link CaptureRow}. Rows that are not arrays, or are shorter than the
	 * header, produce a row with the corresponding fields missing. Whether such a row is usable is up to the
	 * indexer.
	 */
	protected CaptureRow toRow(JsonNode node, CaptureFields[] columns) {
		CaptureRow row = new CaptureRow();
		if (node == null || !node.isArray()) {
			return row;
		}
		int n = Math.min(node.size(), columns.length);
		for (int i = 0; i < n; i++) {
			if (columns[i] == null) {
				continue;
			}
			JsonNode value = node.get(i);
			if (value != null && !value.isNull()) {
				row.set(columns[i], value.asText());
			}
		}
		return row;
	}
}
