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
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import is.landsbokasafn.snapshotfinder.CaptureRow;
import is.landsbokasafn.snapshotfinder.DateWindow;
import junit.framework.TestCase;

public class CdxCaptureSourceTest extends TestCase {
	private static final String CDX_BODY = 
			"[[\"timestamp\",\"original\",\"statuscode\",\"mimetype\",\"length\"],"
			+ "[\"20191110000000\",\"a.com/x\",\"200\",\"text/html\",\"6000\"]]";

	private HttpServer server;
	private CdxCaptureSource source;
	private volatile int status = 200;
	private volatile String body = CDX_BODY;
	private volatile String lastQuery;
	private volatile String lastUserAgent;

	private final CaptureQuery query = CaptureQuery.forDomain("a.com", 
			DateWindow.around(LocalDate.of(2019, 11, 15), 90), 10);

	@Override
	protected void setUp() throws Exception {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/cdx/search/cdx", new HttpHandler() {
			@Override
			public void handle(HttpExchange exchange) throws IOException {
				lastQuery = URLDecoder.decode(exchange.getRequestURI().getRawQuery(), "UTF-8");
				lastUserAgent = exchange.getRequestHeaders().getFirst("User-Agent");
				byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
				exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
				OutputStream out = exchange.getResponseBody();
				out.write(bytes);
				out.close();
			}
		});
		server.start();
		source = new CdxCaptureSource("http://127.0.0.1:" + server.getAddress().getPort() + "/cdx/search/cdx",
				"SnapshotFinderTest/1.0", 5000, 2);
	}

	@Override
	protected void tearDown() throws Exception {
		source.close();
		server.stop(0);
	}

	public void testQueryReturnsRows() throws Exception {
		List<CaptureRow> rows = source.query(query);
		assertEquals(1, rows.size());
		assertEquals("a.com/x", rows.get(0).getOriginal());
		assertTrue(lastQuery, lastQuery.contains("url=a.com/*"));
		assertTrue(lastQuery, lastQuery.contains("from=20190817"));
		assertTrue(lastQuery, lastQuery.contains("to=20200213"));
		assertTrue(lastQuery, lastQuery.contains("output=json"));
		assertTrue(lastQuery, lastQuery.contains("filter=statuscode:200"));
		assertTrue(lastQuery, lastQuery.contains("filter=mimetype:text/html"));
		assertTrue(lastQuery, lastQuery.contains("limit=10"));
		assertEquals("SnapshotFinderTest/1.0", lastUserAgent);
	}

	public void testErrorStatusFails() {
		status = 503;
		try {
			source.query(query);
			fail("Expected QueryFailedException");
		} catch (QueryFailedException e) {
			assertTrue(e.getMessage(), e.getMessage().contains("503"));
		}
	}

	public void testEmptyBodyFails() {
		body = "";
		try {
			source.query(query);
			fail("Expected QueryFailedException");
		} catch (QueryFailedException e) {
			assertSame(query, e.getQuery());
		}
	}

	public void testUnreachableServerFails() {
		CdxCaptureSource unreachable = new CdxCaptureSource("http://127.0.0.1:1/cdx", "x", 1000, 1);
		try {
			unreachable.query(query);
			fail("Expected QueryFailedException");
		} catch (QueryFailedException e) {
			assertNotNull(e.getCause());
		} finally {
			unreachable.close();
		}
	}
}
