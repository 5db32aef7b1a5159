package org.broadinstitute.genomecache;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.genomecache.cmdline.CommandLineProgram;
import org.broadinstitute.genomecache.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genomecache.exceptions.EntryFailedException;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.config.ConfigFactory;
import org.broadinstitute.genomecache.utils.runtime.RuntimeUtils;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Entry point of the genome-cache command line. The first argument names the tool to run; the tools are the
 * {@link CommandLineProgram}s in the {@code tools} package plus whatever {@link #getClassList()} adds.
 */
public class Main {

    static {
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value when an unrecoverable {@link UserException} occurs.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "GENOME_CACHE_STACKTRACE_ON_USER_EXCEPTION";
    private static final String TOOLS_PACKAGE = "org.broadinstitute.genomecache.tools";
    private static final String COMMAND_LINE_NAME = "genome-cache";

    /**
     * edit distance above which no tool is suggested for a mistyped name
     */
    private static final int SUGGESTION_DISTANCE_LIMIT = 7;

    /**
     * Extra tools to offer next to the ones found in the tools package.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.emptyList();
    }

    /**
     * Runs the tool named by {@code args[0]} with the remaining arguments.
     *
     * This method is not intended to be used outside of the toolkit and tests.
     *
     * @return the tool's result, or null if only the usage was printed
     */
    public Object instanceMain(final String[] args) {
        return run(extractCommandLineProgram(args), args);
    }

    private CommandLineProgram extractCommandLineProgram(final String[] args) {
        // the configuration must be in place before any tool is instantiated
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.CONFIG_FILE_OPTION);

        final Map<String, Class<?>> tools = findTools();
        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, tools);
            return null;
        }
        final Class<?> clazz = tools.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, tools);
            throw new UserException(getSuggestedAlternateCommand(tools.values(), args[0]));
        }
        try {
            return (CommandLineProgram) clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new RuntimeException(e);
        }
    }

    private static Object run(final CommandLineProgram program, final String[] rawArgs) {
        if (program == null) {
            return null;
        }
        return program.instanceMain(Arrays.copyOfRange(rawArgs, 1, rawArgs.length));
    }

    /**
     * The entry point from the command line. Exits with 0 on success and with one of the exit values above otherwise.
     *
     * Note: this is the only method that is allowed to call System.exit (because tools may be run from test harness etc)
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = extractCommandLineProgram(args);
            final Object result = run(program, args);
            if (result != null) {
                System.out.println("Tool returned:\n" + result);
            }
        } catch (final CommandLineException e) {
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e) {
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final EntryFailedException e) {
            // a genome that could not be prepared because of its own inputs counts as a user error
            if (e.isUserError()) {
                handleUserException(e);
                System.exit(USER_EXCEPTION_EXIT_VALUE);
            }
            e.printStackTrace();
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e) {
            e.printStackTrace();
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    private static void handleUserException(final Exception e) {
        final PrintStream err = System.err;
        err.println("***********************************************************************");
        err.println();
        err.println("A USER ERROR has occurred: " + e.getMessage());
        err.println();
        err.println("***********************************************************************");
        if ("true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) {
            e.printStackTrace();
        } else {
            err.println(String.format("Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY, STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    /**
     * @return every runnable tool keyed by simple class name, in name order
     */
    private Map<String, Class<?>> findTools() {
        final ClassFinder classFinder = new ClassFinder();
        classFinder.find(TOOLS_PACKAGE, CommandLineProgram.class);
        final Set<Class<?>> candidates = classFinder.getClasses();
        candidates.addAll(getClassList());

        final Map<String, Class<?>> tools = new TreeMap<>();
        for (final Class<?> clazz : candidates) {
            if (!RuntimeUtils.canMakeInstances(clazz)) {
                continue;
            }
            if (clazz.getAnnotation(CommandLineProgramProperties.class) == null) {
                throw new RuntimeException("The class '" + clazz.getSimpleName() + "' is missing the required CommandLineProgramProperties annotation.");
            }
            if (tools.put(clazz.getSimpleName(), clazz) != null) {
                throw new RuntimeException("Simple class name collision: " + clazz.getName());
            }
        }
        return tools;
    }

    private static void printUsage(final PrintStream destinationStream, final Map<String, Class<?>> tools) {
        final StringBuilder builder = new StringBuilder();
        builder.append(String.format("USAGE: %s <program name> [-h]%n%nAvailable Programs:%n", COMMAND_LINE_NAME));
        for (final Map.Entry<String, Class<?>> tool : tools.entrySet()) {
            final CommandLineProgramProperties properties = tool.getValue().getAnnotation(CommandLineProgramProperties.class);
            if (!properties.omitFromCommandLine()) {
                builder.append(String.format("    %-30s%s%n", tool.getKey(), properties.oneLineSummary()));
            }
        }
        destinationStream.println(builder);
    }

    /**
     * Builds the error message for an unknown tool name, naming the closest tools when one is near enough.
     * A name that starts a tool's name counts as an exact match for it.
     */
    public String getSuggestedAlternateCommand(final Collection<Class<?>> classes, final String command) {
        int bestDistance = Integer.MAX_VALUE;
        final List<String> closest = new ArrayList<>();
        for (final Class<?> clazz : classes) {
            final String name = clazz.getSimpleName();
            final int distance = name.startsWith(command) ? 0 : StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            if (distance < bestDistance) {
                bestDistance = distance;
                closest.clear();
            }
            if (distance == bestDistance) {
                closest.add(name);
            }
        }

        final StringBuilder message = new StringBuilder(String.format("'%s' is not a valid command.", command));
        if (bestDistance < SUGGESTION_DISTANCE_LIMIT && closest.size() < classes.size()) {
            message.append(System.lineSeparator()).append("Did you mean ").append(String.join(" or ", closest)).append('?');
        }
        return message.toString();
    }
}
