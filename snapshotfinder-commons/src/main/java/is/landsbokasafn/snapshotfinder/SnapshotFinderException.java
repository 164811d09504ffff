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
 * Base class of the conditions that stop a resolution run. Each subclass carries a message telling the operator
 * what failed and what to do about it.
 */
public class SnapshotFinderException extends Exception {
	private static final long serialVersionUID = 1L;

	public SnapshotFinderException(String message) {
		super(message);
	}

	public SnapshotFinderException(String message, Throwable cause) {
		super(message, cause);
	}
}
