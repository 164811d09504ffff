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
package is.landsbokasafn.snapshotfinder.resolver;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import is.landsbokasafn.snapshotfinder.MasterListEntry;
import is.landsbokasafn.snapshotfinder.MasterListMissingException;
import is.landsbokasafn.snapshotfinder.MasterListUnreadableException;
import is.landsbokasafn.snapshotfinder.SnapshotFinderConstants;

/**
 * Reads the master list of a domain, <code>&lt;domain&gt;_master_list.json</code>.
 */
public class MasterListReader {
	private static final Log log = LogFactory.getLog(MasterListReader.class);

	private final ObjectMapper mapper = new ObjectMapper();
	private long minimumSize = 0;

	/**
	 * Read the master list of a domain from a working directory.
	 * @param directory Directory holding the master list
	 * @param domain The domain
	 * @return Entries, in file order
	 * @throws MasterListMissingException If there is no master list for the domain
	 * @throws MasterListUnreadableException If the file is not a valid master list
	 */
	public List<MasterListEntry> read(File directory, String domain)
			throws MasterListMissingException, MasterListUnreadableException {
		return read(new File(directory, SnapshotFinderConstants.masterListFilename(domain)));
	}

	/**
	 * Read a master list file. Entries repeating an earlier URL are skipped, as are entries whose recorded size
	 * is below the minimum size. Entries with no recorded size are kept.
	 * @param file The master list
	 * @return Entries, in file order
	 * @throws MasterListMissingException If the file does not exist
	 * @throws MasterListUnreadableException If the file is not a valid master list
	 */
	public List<MasterListEntry> read(File file) throws MasterListMissingException, MasterListUnreadableException {
		if (!file.isFile()) {
			throw new MasterListMissingException(file);
		}
		List<MasterListEntry> entries;
		try {
			entries = mapper.readValue(file, new TypeReference<List<MasterListEntry>>() {});
		} catch (JsonProcessingException e) {
			throw new MasterListUnreadableException(file, "not a JSON array of URL entries", e);
		} catch (IOException e) {
			throw new MasterListUnreadableException(file, e.getMessage(), e);
		}
		if (entries == null) {
			throw new MasterListUnreadableException(file, "no content", null);
		}

		List<MasterListEntry> accepted = new ArrayList<MasterListEntry>(entries.size());
		Set<String> seen = new HashSet<String>();
		int duplicates = 0;
		int tooSmall = 0;
		for (int i = 0; i < entries.size(); i++) {
			MasterListEntry entry = entries.get(i);
			if (entry == null || entry.getOriginal() == null || entry.getOriginal().isEmpty()) {
				throw new MasterListUnreadableException(file, "entry " + i + " has no 'original' URL", null);
			}
			if (!seen.add(entry.getOriginal())) {
				duplicates++;
				continue;
			}
			long size = entry.recordedSize();
			if (minimumSize > 0 && size >= 0 && size < minimumSize) {
				tooSmall++;
				continue;
			}
			accepted.add(entry);
		}
		if (duplicates > 0) {
			log.warn("Skipped " + duplicates + " repeated URLs in " + file);
		}
		if (tooSmall > 0) {
			log.info("Skipped " + tooSmall + " URLs smaller than " + minimumSize + " bytes");
		}
		log.info("Read " + accepted.size() + " URLs from " + file);
		return accepted;
	}

	public long getMinimumSize() {
		return minimumSize;
	}

	/**
	 * @param minimumSize Entries with a recorded size below this are skipped. 0 keeps everything.
	 */
	public void setMinimumSize(long minimumSize) {
		if (minimumSize < 0) {
			throw new IllegalArgumentException("Minimum size can not be negative, was " + minimumSize);
		}
		this.minimumSize = minimumSize;
	}
}
