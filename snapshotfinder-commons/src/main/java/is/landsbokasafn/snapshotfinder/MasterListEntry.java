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

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One canonical URL of a domain's master list. Only <code>original</code> is used when resolving snapshots. Any
 * other properties written by the master list builder (size, priority score etc.) are carried along untouched.
 */
public class MasterListEntry {
	private String original;
	private Map<String, Object> metadata = new LinkedHashMap<String, Object>();

	public MasterListEntry() {
	}

	public MasterListEntry(String original) {
		this.original = original;
	}

	@JsonProperty("original")
	public String getOriginal() {
		return original;
	}

	public void setOriginal(String original) {
		this.original = original;
	}

	@JsonAnyGetter
	public Map<String, Object> getMetadata() {
		return metadata;
	}

	@JsonAnySetter
	public void setMetadata(String name, Object value) {
		metadata.put(name, value);
	}

	/**
	 * @return The <code>size</code> recorded by the master list builder, or -1 if it is absent or not a number
	 */
	public long recordedSize() {
		Object size = metadata.get("size");
		if (size instanceof Number) {
			return ((Number) size).longValue();
		}
		if (size instanceof String) {
			try {
				return Long.parseLong((String) size);
			} catch (NumberFormatException e) {
				return -1L;
			}
		}
		return -1L;
	}

	@Override
	public String toString() {
		return original;
	}
}
