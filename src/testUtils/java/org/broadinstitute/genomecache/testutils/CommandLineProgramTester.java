package org.broadinstitute.genomecache.testutils;

import htsjdk.samtools.util.Log;
import org.broadinstitute.genomecache.Main;
import org.broadinstitute.genomecache.cmdline.StandardArgumentDefinitions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Utility interface for CommandLine Program testing.
 */
public interface CommandLineProgramTester {

    /**
     * Returns the name for the tested tool.
     */
    String getTestedToolName();

    /**
     * Given the arguments of the tested tool, builds the arguments for calling it through Main:
     * the tool name first, followed by the arguments with the default verbosity injected.
     */
    default String[] makeCommandLineArgs(final List<String> args) {
        return makeCommandLineArgs(args, getTestedToolName());
    }

    default String[] makeCommandLineArgs(final List<String> args, final String toolname) {
        final List<String> curatedArgs = injectDefaultVerbosity(args);
        final String[] commandLineArgs = new String[curatedArgs.size() + 1];
        commandLineArgs[0] = toolname;
        int i = 1;
        for (final String arg : curatedArgs) {
            commandLineArgs[i++] = arg;
        }
        return commandLineArgs;
    }

    /**
     * Look for a --verbosity argument; if not found, supply a value that minimizes the amount of logging output.
     */
    default List<String> injectDefaultVerbosity(final List<String> args) {
        for (String arg : args) {
            if (arg.equalsIgnoreCase("--" + StandardArgumentDefinitions.VERBOSITY_NAME) || arg.equalsIgnoreCase("-" + StandardArgumentDefinitions.VERBOSITY_NAME)) {
                return args;
            }
        }
        final List<String> argsWithVerbosity = new ArrayList<>(args);
        argsWithVerbosity.add("--" + StandardArgumentDefinitions.VERBOSITY_NAME);
        argsWithVerbosity.add(Log.LogLevel.ERROR.name());
        argsWithVerbosity.add("--" + StandardArgumentDefinitions.QUIET_NAME);
        argsWithVerbosity.add("true");
        return argsWithVerbosity;
    }

    /**
     * Runs the tested tool through {@link Main} with the command line built by {@link #makeCommandLineArgs(List)}.
     */
    default Object runCommandLine(final List<String> args) {
        return new Main().instanceMain(makeCommandLineArgs(args));
    }

    default Object runCommandLine(final List<String> args, final String toolName) {
        return new Main().instanceMain(makeCommandLineArgs(args, toolName));
    }

    default Object runCommandLine(final String[] args) {
        return runCommandLine(Arrays.asList(args));
    }

    default Object runCommandLine(final ArgumentsBuilder args) {
        return runCommandLine(args.getArgsList());
    }
}
