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
 * The master list exists but could not be read or is not a JSON array of objects with an <code>original</code>
 * URL.
 */
public class MasterListUnreadableException extends SnapshotFinderException {
	private static final long serialVersionUID = 1L;

	private final File file;

	public MasterListUnreadableException(File file, String reason, Throwable cause) {
		super("Unable to read master list " + file.getPath() + " (" + reason + "). Rebuild the master list", cause);
		this.file = file;
	}

	public File getFile() {
		return file;
	}
}
