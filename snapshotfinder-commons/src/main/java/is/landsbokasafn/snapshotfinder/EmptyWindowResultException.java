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
 * A domain-wide query succeeded but the archive holds no usable captures in the searched window.
 */
public class EmptyWindowResultException extends SnapshotFinderException {
	private static final long serialVersionUID = 1L;

	private final DateWindow window;

	public EmptyWindowResultException(String urlPattern, DateWindow window) {
		super("No captures of " + urlPattern + " found between " + window.getFromParameter() + " and " 
				+ window.getToParameter() + ". Try another target date");
		this.window = window;
	}

	public DateWindow getWindow() {
		return window;
	}
}
