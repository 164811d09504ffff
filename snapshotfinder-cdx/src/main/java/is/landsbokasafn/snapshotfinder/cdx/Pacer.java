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

/**
 * A policy governing how often queries may be sent to the archive. Callers invoke {@link #pace()} before each
 * query; the pacer blocks for as long as its policy requires.
 */
public interface Pacer {

	/**
	 * Wait, if needed, until the next query may be issued.
	 * @throws InterruptedException If interrupted while waiting
	 */
	void pace() throws InterruptedException;

	/**
	 * @return A short description of the policy
	 */
	String getInfo();

	/** Never waits **/
	Pacer NONE = new Pacer() {
		@Override
		public void pace() {
		}

		@Override
		public String getInfo() {
			return "No pacing";
		}
	};
}
