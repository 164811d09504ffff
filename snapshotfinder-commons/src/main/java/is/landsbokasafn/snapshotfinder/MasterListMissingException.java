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

import java.io.File;

/**
 * No master list exists for the domain.
 */
public class MasterListMissingException extends SnapshotFinderException {
	private static final long serialVersionUID = 1L;

	private final File file;

	public MasterListMissingException(File file) {
		super("Master list not found: " + file.getPath() + ". Build the master list for the domain first");
		this.file = file;
	}

	public File getFile() {
		return file;
	}
}
