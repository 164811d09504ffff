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

import static is.landsbokasafn.snapshotfinder.SnapshotFinderConstants.*;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.cli.Option;
import org.apache.commons.io.IOUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.log4j.PropertyConfigurator;

import is.landsbokasafn.snapshotfinder.EmptyWindowResultException;
import is.landsbokasafn.snapshotfinder.InvalidDateFormatException;
import is.landsbokasafn.snapshotfinder.MasterListEntry;
import is.landsbokasafn.snapshotfinder.SnapshotFinderException;
import is.landsbokasafn.snapshotfinder.Timestamps;
import is.landsbokasafn.snapshotfinder.cdx.BurstPacer;
import is.landsbokasafn.snapshotfinder.cdx.CaptureSource;
import is.landsbokasafn.snapshotfinder.cdx.CdxCaptureSource;
import is.landsbokasafn.snapshotfinder.cdx.FixedIntervalPacer;
import is.landsbokasafn.snapshotfinder.cdx.Pacer;
import is.landsbokasafn.snapshotfinder.cdx.QueryFailedException;
import is.landsbokasafn.snapshotfinder.cdx.RetryingCaptureSource;

/**
 * This class handles loading configuration files, parsing command line arguments and setting up the capture
 * source before resolving the snapshots of a domain.
 */
public class SnapshotFinderLauncher {
	private static final Log log = LogFactory.getLog(SnapshotFinderLauncher.class);

	static final String ENDPOINT_CONF_KEY = "snapshotfinder.cdx.endpoint";
	static final String ARCHIVE_BASE_CONF_KEY = "snapshotfinder.archive.base";
	static final String WINDOW_CONF_KEY = "snapshotfinder.window.days";
	static final String PARALLEL_CONF_KEY = "snapshotfinder.parallel";
	static final String STRATEGY_CONF_KEY = "snapshotfinder.strategy";
	static final String THRESHOLD_CONF_KEY = "snapshotfinder.sequential.threshold";
	static final String DELAY_CONF_KEY = "snapshotfinder.sequential.delay.ms";
	static final String BURST_CONF_KEY = "snapshotfinder.sequential.burst";
	static final String DOMAIN_LIMIT_CONF_KEY = "snapshotfinder.limit.domain";
	static final String BATCH_LIMIT_CONF_KEY = "snapshotfinder.limit.batch";
	static final String TIMEOUT_CONF_KEY = "snapshotfinder.timeout.ms";
	static final String BATCH_TIMEOUT_CONF_KEY = "snapshotfinder.batch.timeout.ms";
	static final String RETRIES_CONF_KEY = "snapshotfinder.retries";
	static final String RETRY_DELAY_CONF_KEY = "snapshotfinder.retry.delay.ms";
	static final String USER_AGENT_CONF_KEY = "snapshotfinder.useragent";
	static final String VERBOSE_CONF_KEY = "snapshotfinder.verbose";

	private final PrintStream out;
	private final PrintStream err;

	// Default values for all settings
	String endpoint = DEFAULT_CDX_ENDPOINT;
	String archiveBase = DEFAULT_ARCHIVE_BASE;
	int windowDays = DEFAULT_WINDOW_DAYS;
	int parallelism = DEFAULT_PARALLELISM;
	ResolutionStrategy strategy = ResolutionStrategy.AUTO;
	int sequentialThreshold = DEFAULT_SEQUENTIAL_THRESHOLD;
	long sequentialDelayMs = DEFAULT_SEQUENTIAL_DELAY_MS;
	int sequentialBurst = 0;
	int domainRowLimit = DEFAULT_DOMAIN_ROW_LIMIT;
	int batchRowLimit = DEFAULT_BATCH_ROW_LIMIT;
	int timeoutMs = DEFAULT_QUERY_TIMEOUT_MS;
	long batchTimeoutMs = DEFAULT_BATCH_TIMEOUT_MS;
	int retries = 0;
	long retryDelayMs = 1000L;
	String userAgent = DEFAULT_USER_AGENT;
	boolean verbose = false;
	long minimumSize = 0;
	File directory = new File(".");
	File outputFile = null;

	public SnapshotFinderLauncher(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	private static void loadConfiguration() {
		// Load properties file, either from snapshotfinder.home/conf or
		// path specified via -Dsnapshotfinder.config JVM option
		String configFilename = System.getProperty("snapshotfinder.config");
		boolean explicit = true;
		if (configFilename == null || configFilename.isEmpty()) {
			explicit = false;
			configFilename = System.getProperty("snapshotfinder.home", ".") + File.separator + "conf"
					+ File.separator + "snapshotfinder.properties";
		}
		File configFile = new File(configFilename);
		if (configFile.exists() == false) {
			if (explicit) {
				System.err.println("Unable to find configuration file " + configFilename);
				System.exit(1);
			}
			// No configuration, built in defaults and the log4j.properties on the classpath apply
			return;
		}

		// Load log4j config, assumes same path as config file
		File log4jconfig = new File(configFile.getAbsoluteFile().getParentFile(), "snapshotfinder-log4j.properties");
		if (log4jconfig.exists()) {
			PropertyConfigurator.configure(log4jconfig.getPath());
		}

		try {
			loadProperties(configFile);
		} catch (IOException e) {
			System.err.println("Unable to read configuration file " + configFilename);
			e.printStackTrace();
			System.exit(1);
		}
	}

	/**
	 * Copy properties from a config file, read as UTF-8, to System properties.
	 */
	static void loadProperties(File configFile) throws IOException {
		Reader reader = null;
		try {
			reader = new InputStreamReader(new FileInputStream(configFile), StandardCharsets.UTF_8);
			System.getProperties().load(reader);
		} finally {
			IOUtils.closeQuietly(reader);
		}
	}

	/**
	 * Override the defaults with any settings found in System properties.
	 * @throws IllegalArgumentException If a setting has a malformed value
	 */
	void readConfiguration() {
		endpoint = readStringConfig(ENDPOINT_CONF_KEY, endpoint);
		archiveBase = readStringConfig(ARCHIVE_BASE_CONF_KEY, archiveBase);
		windowDays = readIntConfig(WINDOW_CONF_KEY, windowDays);
		parallelism = readIntConfig(PARALLEL_CONF_KEY, parallelism);
		strategy = ResolutionStrategy.forName(readStringConfig(STRATEGY_CONF_KEY, strategy.name()));
		sequentialThreshold = readIntConfig(THRESHOLD_CONF_KEY, sequentialThreshold);
		sequentialDelayMs = readLongConfig(DELAY_CONF_KEY, sequentialDelayMs);
		sequentialBurst = readIntConfig(BURST_CONF_KEY, sequentialBurst);
		domainRowLimit = readIntConfig(DOMAIN_LIMIT_CONF_KEY, domainRowLimit);
		batchRowLimit = readIntConfig(BATCH_LIMIT_CONF_KEY, batchRowLimit);
		timeoutMs = readIntConfig(TIMEOUT_CONF_KEY, timeoutMs);
		batchTimeoutMs = readLongConfig(BATCH_TIMEOUT_CONF_KEY, batchTimeoutMs);
		retries = readIntConfig(RETRIES_CONF_KEY, retries);
		retryDelayMs = readLongConfig(RETRY_DELAY_CONF_KEY, retryDelayMs);
		userAgent = readStringConfig(USER_AGENT_CONF_KEY, userAgent);
		verbose = readBooleanConfig(VERBOSE_CONF_KEY, verbose);
	}

	private static boolean readBooleanConfig(String propertyName, boolean fallback) {
		String prop = System.getProperty(propertyName);
		if (prop==null) {
			return fallback;
		}
		return prop.trim().equalsIgnoreCase("true");
	}

	private static String readStringConfig(String propertyName, String fallback) {
		String prop = System.getProperty(propertyName);
		if (prop==null) {
			return fallback;
		}
		return prop.trim();
	}

	private static int readIntConfig(String propertyName, int fallback) {
		String prop = System.getProperty(propertyName);
		if (prop==null) {
			return fallback;
		}
		try {
			return Integer.parseInt(prop.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Configuration " + propertyName + " must be a number, was " + prop, e);
		}
	}

	private static long readLongConfig(String propertyName, long fallback) {
		String prop = System.getProperty(propertyName);
		if (prop==null) {
			return fallback;
		}
		try {
			return Long.parseLong(prop.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Configuration " + propertyName + " must be a number, was " + prop, e);
		}
	}

	/**
	 * Set up the capture source from the configuration. Wrapped for retries if any are configured.
	 * @return The capture source
	 */
	protected CaptureSource createCaptureSource() {
		CaptureSource source = new CdxCaptureSource(endpoint, userAgent, timeoutMs, parallelism);
		if (retries > 0) {
			source = new RetryingCaptureSource(source, retries, retryDelayMs);
		}
		return source;
	}

	/**
	 * @return Pacing for the per URL strategy. A burst limit switches from a fixed interval to burst pacing.
	 */
	Pacer createSequentialPacer() {
		if (sequentialBurst > 0) {
			double rps = sequentialDelayMs > 0 ? 1000.0 / sequentialDelayMs : 1000.0;
			return new BurstPacer(rps, sequentialBurst);
		}
		return new FixedIntervalPacer(sequentialDelayMs);
	}

	SnapshotResolver createResolver(CaptureSource source) {
		SnapshotResolver resolver = new SnapshotResolver(source);
		resolver.setStrategy(strategy);
		resolver.setParallelism(parallelism);
		resolver.setWindowDays(windowDays);
		resolver.setArchiveBase(archiveBase);
		resolver.setDomainRowLimit(domainRowLimit);
		resolver.setBatchRowLimit(batchRowLimit);
		resolver.setBatchTimeoutMs(batchTimeoutMs);
		resolver.setSequentialThreshold(sequentialThreshold);
		resolver.setSequentialPacer(createSequentialPacer());
		return resolver;
	}

	/**
	 * Resolve snapshots for a domain and write them to the result file.
	 * @param domain The domain
	 * @param targetDate Target date, YYYYMMDD
	 * @return The exit status, 0 on success (including when no snapshots are found), 1 on any fatal error
	 */
	public int run(String domain, String targetDate) {
		try {
			// Fail on a bad date before touching the master list or the network
			Timestamps.parseTargetDate(targetDate);

			MasterListReader reader = new MasterListReader();
			reader.setMinimumSize(minimumSize);
			List<MasterListEntry> masterList = reader.read(directory, domain);

			File output = outputFile != null ? outputFile : new File(directory, snapshotsFilename(domain, targetDate));
			if (verbose) {
				out.println("Resolving: " + domain + " at " + targetDate);
				out.println(" - Master list: " + masterList.size() + " URLs" +
						(minimumSize > 0 ? " (at least " + minimumSize + " bytes)" : ""));
				out.println(" - Strategy: " + strategy + ", parallelism " + parallelism);
				out.println(" - Window: +/- " + windowDays + " days");
				out.println(" - Archive: " + endpoint);
				out.println("Target: " + output);
			}

			CaptureSource source = createCaptureSource();
			ResolutionResult result;
			try {
				result = createResolver(source).resolve(domain, targetDate, masterList);
			} finally {
				closeSource(source);
			}

			SnapshotRanker.serialize(result.getSnapshots(), output);
			if (verbose) {
				out.print(new ResolutionReport(result).report());
			}
			if (result.isEmpty()) {
				out.println("No snapshots found for " + domain + " around " + targetDate);
			} else {
				out.println("Wrote " + result.getSnapshots().size() + " snapshots to " + output);
			}
			return 0;
		} catch (InvalidDateFormatException e) {
			err.println("Invalid target date '" + e.getDate() + "'. Use YYYYMMDD, e.g. 20191115.");
		} catch (EmptyWindowResultException e) {
			err.println(e.getMessage() + " or the " + ResolutionStrategy.PER_URL + " strategy.");
		} catch (SnapshotFinderException e) {
			// Missing or unreadable master list
			err.println(e.getMessage() + ".");
		} catch (QueryFailedException e) {
			log.error("Query failed", e);
			err.println("Query to the archive failed: " + e.getMessage()
					+ ". Check network connectivity or try again later.");
		} catch (IOException e) {
			log.error("Unable to write results", e);
			err.println("Unable to write results: " + e.getMessage());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			err.println("Interrupted before all snapshots were resolved.");
		}
		return 1;
	}

	private void closeSource(CaptureSource source) {
		if (source instanceof CdxCaptureSource) {
			((CdxCaptureSource) source).close();
		} else if (source instanceof RetryingCaptureSource) {
			closeSource(((RetryingCaptureSource) source).getDelegate());
		}
	}

	public static void main(String[] args) throws Exception {
		loadConfiguration();

		SnapshotFinderLauncher launcher = new SnapshotFinderLauncher(System.out, System.err);

		// Parse command line options
		CommandLineParser clp = new CommandLineParser(args, new PrintWriter(System.out));
		Option[] opts = clp.getCommandLineOptions();
		try {
			launcher.readConfiguration();
			for (int i=0 ; i<opts.length ; i++) {
				Option opt = opts[i];
				switch(opt.getId()) {
				case 'h' : clp.usage(0); break;
				case 'p' : launcher.parallelism = Integer.parseInt(opt.getValue()); break;
				case 's' : launcher.strategy = ResolutionStrategy.forName(opt.getValue()); break;
				case 'm' : launcher.minimumSize = Long.parseLong(opt.getValue()); break;
				case 'd' : launcher.directory = new File(opt.getValue()); break;
				case 'o' : launcher.outputFile = new File(opt.getValue()); break;
				case 'v' : launcher.verbose = true; break;
				}
			}
		} catch (NumberFormatException e) {
			clp.usage("Not a number: " + e.getMessage(), 1);
		} catch (IllegalArgumentException e) {
			clp.usage(e.getMessage(), 1);
		}
		if (launcher.parallelism < 1) {
			clp.usage("Parallelism must be at least 1", 1);
		}

		List<String> cargs = clp.getCommandLineArguments();
		if (cargs.size() != 2) {
			// Should be exactly two arguments. Domain and target date!
			clp.usage(1);
		}

		System.exit(launcher.run(cargs.get(0), cargs.get(1)));
	}
}
