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

import java.io.PrintWriter;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;
import org.apache.commons.cli.UnrecognizedOptionException;


/**
 * Parses the SnapshotFinder command line and prints its usage message.
 */
public class CommandLineParser {
    private static final String USAGE = "Usage: ";
    private static final String NAME = "SnapshotFinder";
    private Options options = null;
    private CommandLine commandLine = null;
    private PrintWriter out = null;

    /**
     * Block default construction.
     *
     */
    @SuppressWarnings("unused")
	private CommandLineParser() {
        super();
    }

    /**
     * Constructor.
     *
     * @param args Command-line arguments to process.
     * @param out PrintStream to write on.
     *
     * @throws ParseException Failed parse of command line.
     */
    public CommandLineParser(String [] args, PrintWriter out)
    throws ParseException {
        super();

        this.out = out;

        this.options = new Options();
        this.options.addOption(new Option("h","help", false,
                "Prints this message and exits."));

        Option opt = new Option("p","parallel", true,
                "Number of batches queried at the same time. Default: 8");
        opt.setArgName("n");
        this.options.addOption(opt);

        opt = new Option("s","strategy", true,
                "How captures are looked up: single-query, parallel-batches, " +
                "per-url or auto. Default: auto (per-url for master lists " +
                "of fewer than 50 URLs)");
        opt.setArgName("name");
        this.options.addOption(opt);

        opt = new Option("m","min-size", true,
                "Skip master list URLs whose recorded size is below this " +
                "many bytes.");
        opt.setArgName("bytes");
        this.options.addOption(opt);

        opt = new Option("d","dir", true,
                "Working directory holding the master list. Results are " +
                "written here unless --output is given. Default: current " +
                "directory");
        opt.setArgName("directory");
        this.options.addOption(opt);

        opt = new Option("o","output", true,
                "Write the snapshots to this file instead of " +
                "<domain>_snapshots_<targetDate>.json");
        opt.setArgName("file");
        this.options.addOption(opt);

        this.options.addOption(new Option("v","verbose", false,
                "Make the program print settings and a run report to standard out."));

        PosixParser parser = new PosixParser();
        try {
            this.commandLine = parser.parse(this.options, args, false);
        } catch (UnrecognizedOptionException e) {
            usage(e.getMessage(), 1);
        }
    }

    /**
     * Print usage then exit.
     *
     * @param exitCode The exit code to return
     */
    public void usage(int exitCode) {
        usage(null, exitCode);
    }

    /**
     * Print message then usage then exit.
     *
     * The JVM exits inside in this method.
     *
     * @param message Message to print before we do usage.
     * @param exitCode Exit code to use in call to System.exit.
     */
    public void usage(String message, int exitCode) {
        printUsage(message);
        // Close printwriter so stream gets flushed.
        this.out.close();
        System.exit(exitCode);
    }

    /**
     * Print an optional message followed by the options and arguments.
     *
     * @param message Message to print first, may be null.
     */
    void printUsage(String message) {
        if (message != null) {
            this.out.println(message);
        }
        HelpFormatter formatter = new SnapshotHelpFormatter();
        formatter.printHelp(this.out, 80, NAME, "Options:", this.options,
            1, 2, "Arguments:", false);
        this.out.println(" domain                     The domain to resolve, e.g. example.com. Its master");
        this.out.println("                            list, <domain>_master_list.json, must exist in the");
        this.out.println("                            working directory.");
        this.out.println(" targetDate                 Date to find the closest snapshots to, as YYYYMMDD.");
        this.out.flush();
    }

    /**
     * @return Options passed on the command line.
     */
    public Option [] getCommandLineOptions() {
        return this.commandLine.getOptions();
    }

    /**
     * @return Arguments passed on the command line.
     */
	public List<String> getCommandLineArguments() {
        return this.commandLine.getArgList();
    }

    /**
     * @return Command line.
     */
    public CommandLine getCommandLine() {
        return this.commandLine;
    }


    /**
     * Override so can customize usage output.
     */
    public class SnapshotHelpFormatter extends HelpFormatter {
        public SnapshotHelpFormatter() {
            super();
        }

        public void printUsage(PrintWriter pw, int width, String cmdLineSyntax) {
            out.println(USAGE + NAME + " --help");
            out.println(USAGE + NAME + " [options] domain targetDate");
        }

        public void printUsage(PrintWriter pw, int width,
            String app, Options options) {
            this.printUsage(pw, width, app);
        }
    }
}
