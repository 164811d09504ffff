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

import java.time.Duration;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import io.github.resilience4j.core.EventConsumer;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import io.vavr.CheckedFunction0;
import is.landsbokasafn.snapshotfinder.CaptureRow;

/**
 * Wraps another {@link CaptureSource}, repeating failed queries. A query only waits after it has failed, so
 * queries that succeed on the first attempt are never delayed.
 */
public class RetryingCaptureSource implements CaptureSource {
	private static final Log log = LogFactory.getLog(RetryingCaptureSource.class);

	private final CaptureSource delegate;
	private final int retries;
	private final long retryDelayMs;
	private final Retry retry;

	/**
	 * @param delegate The source doing the actual work
	 * @param retries How many times a failed query is repeated. 0 means the query is tried once.
	 * @param retryDelayMs Wait after a failed attempt before the next one
	 */
	public RetryingCaptureSource(CaptureSource delegate, int retries, long retryDelayMs) {
		if (retries < 0) {
			throw new IllegalArgumentException("Retries can not be negative: " + retries);
		}
		if (retryDelayMs < 0) {
			throw new IllegalArgumentException("Retry delay can not be negative: " + retryDelayMs);
		}
		this.delegate = delegate;
		this.retries = retries;
		this.retryDelayMs = retryDelayMs;

		RetryConfig config = RetryConfig.custom()
				.maxAttempts(retries + 1)
				.waitDuration(Duration.ofMillis(retryDelayMs))
				.retryExceptions(QueryFailedException.class)
				.build();
		this.retry = Retry.of("cdx", config);
		this.retry.getEventPublisher().onRetry(new EventConsumer<RetryOnRetryEvent>() {
			@Override
			public void consumeEvent(RetryOnRetryEvent event) {
				log.warn("Retrying (" + event.getNumberOfRetryAttempts() + "/" + RetryingCaptureSource.this.retries
						+ ") in " + event.getWaitInterval().toMillis() + " ms after: "
						+ event.getLastThrowable().getMessage());
			}
		});
	}

	@Override
	public List<CaptureRow> query(final CaptureQuery query) throws QueryFailedException {
		CheckedFunction0<List<CaptureRow>> attempt = Retry.decorateCheckedSupplier(retry,
				new CheckedFunction0<List<CaptureRow>>() {
					@Override
					public List<CaptureRow> apply() throws QueryFailedException {
						return delegate.query(query);
					}
				});
		try {
			return attempt.apply();
		} catch (QueryFailedException e) {
			throw e;
		} catch (RuntimeException e) {
			throw e;
		} catch (Error e) {
			throw e;
		} catch (Throwable t) {
			throw new QueryFailedException(query, "retry failed: " + t.getMessage(), t);
		}
	}

	public CaptureSource getDelegate() {
		return delegate;
	}

	public int getRetries() {
		return retries;
	}

	/**
	 * @return The underlying retry, for its metrics
	 */
	public Retry getRetry() {
		return retry;
	}

	@Override
	public String getInfo() {
		return delegate.getInfo() + " Retries: " + retries + " (wait " + retryDelayMs + " ms after a failure)\n";
	}
}
