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
 * One row of a CDX index response. Values are kept exactly as the index returned them. Any of them may be null
 * if the column was not part of the response. Rows are only checked for validity when they are indexed.
 */
public class CaptureRow {

    protected String timestamp;
    protected String original;
    protected String statusCode;
    protected String mimeType;
    protected String length;

    /**
     * Constructor. Creates a new CaptureRow with all its data initialized to null.
     */
    public CaptureRow(){
    }

    public CaptureRow(String timestamp, String original, String statusCode, String mimeType, String length) {
    	this.timestamp = timestamp;
    	this.original = original;
    	this.statusCode = statusCode;
    	this.mimeType = mimeType;
    	this.length = length;
    }

    /**
     * Returns the capture time, 14 digits <pre>YYYYMMDDhhmmss</pre>
     * @return the capture timestamp
     */
    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp){
        this.timestamp = timestamp;
    }

    /**
     * Returns the URL as it was captured
     * @return the original URL
     */
    public String getOriginal(){
        return original;
    }

    public void setOriginal(String original){
        this.original = original;
    }

    public String getStatusCode(){
        return statusCode;
    }

    public void setStatusCode(String statusCode){
        this.statusCode = statusCode;
    }

    public String getMimeType(){
        return mimeType;
    }

    public void setMimeType(String mimeType){
        this.mimeType = mimeType;
    }

    /**
     * Returns the size of the capture in bytes, as returned by the index. Not necessarily numeric.
     * @return the length column
     */
	public String getLength() {
		return length;
	}

	public void setLength(String length) {
		this.length = length;
	}

	/**
	 * Set the value of a field identified by its {@link CaptureFields} constant.
	 * @param field The field
	 * @param value The value as returned by the index
	 */
	public void set(CaptureFields field, String value) {
		switch (field) {
		case TIMESTAMP: timestamp = value; break;
		case ORIGINAL: original = value; break;
		case STATUSCODE: statusCode = value; break;
		case MIMETYPE: mimeType = value; break;
		case LENGTH: length = value; break;
		}
	}

	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append("Timestamp: ");
		sb.append(timestamp);
		sb.append("\nOriginal: ");
		sb.append(original);
		sb.append("\nStatusCode: ");
		sb.append(statusCode);
		sb.append("\nMimeType: ");
		sb.append(mimeType);
		sb.append("\nLength: ");
		sb.append(length);

		return sb.toString();
	}
}
