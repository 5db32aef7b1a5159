package org.broadinstitute.genomecache.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.utils.LoggingUtils;
import org.broadinstitute.genomecache.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * Path variables named in {@link Config.Sources} annotations are resolved before a configuration is created, so
 * an unset variable falls through to the next source instead of being read as a literal path.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance;

    static {
        instance = new ConfigFactory();
    }

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    /**
     * A regex to use to look for variables in the Sources annotation
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set each variable for configuration file paths when the variable
     * has not been set in either Java System properties or environment properties.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    /**
     * For each of the given {@code filenameProperties} not defined as a system or environment property, sets it in the
     * {@link org.aeonbits.owner.ConfigFactory} to a path that holds nothing.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        final Properties systemProperties = System.getProperties();
        final Map<String, String> environmentProperties = System.getenv();

        for (final String property : filenameProperties) {
            if ( environmentProperties.containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + environmentProperties.get(property));
            }
            else if ( systemProperties.containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + systemProperties.get(property));
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties (probably from the command-line): " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property));
            }
            else {
                logger.debug("Config path variable not found: " + property + " - setting value to " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * @return the variables used in the {@link Config.Sources} of the given {@code configClass}
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {
        final List<String> configPathVariableNames = new ArrayList<>();
        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);
        if ( annotation != null ) {
            for (final String val : annotation.value()) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }

    /**
     * Quick way to get the genome cache configuration.
     */
    public GenomeCacheConfig getGenomeCacheConfig() {
        return getOrCreate( GenomeCacheConfig.class );
    }

    /**
     * Creates a new, uncached {@link Config} instance from the specified interface.
     *
     * @param clazz   the interface extending from {@link Config} that you want to instantiate.
     * @param imports additional variables to be used to resolve the properties.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Gets from the cache or creates an instance of the given class using the given imports.
     *
     * @param clazz     the interface extending from {@link Config} that you want to instantiate.
     * @param imports   additional variables to be used to resolve the properties.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if ( !alreadyResolvedPathVariables.contains(clazz) ) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
            alreadyResolvedPathVariables.add(clazz);
        }
    }

    /**
     * Get the configuration file name from the given arguments.
     *
     * NOTE: Does NOT validate that the resulting string is a valid configuration file.
     *
     * @param args Command-line arguments passed to this program.
     * @param configFileOption The command-line option indicating that the config file is next
     * @return The name of the configuration file for this program or {@code null}.
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        for ( int i = 0 ; i < args.length ; ++i ) {
            if (args[i].equals(configFileOption)) {
                if ( ((i+1) < args.length) && (!args[i+1].startsWith("-")) ) {
                    return args[i+1];
                }
                throw new UserException.BadInput("Configuration file not given after config file option specified: " + configFileOption);
            }
        }
        return null;
    }

    /**
     * Get the configuration filename from the command-line (if it exists) and create the {@link GenomeCacheConfig} for it.
     * This must run before any tool is instantiated because argument defaults read the configuration.
     * @param argList The list of arguments from which to read the config file.
     * @param configFileOption The command-line option specifying the main configuration file.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] argList,
                                                                         final String configFileOption) {
        Utils.nonNull(argList);
        Utils.nonNull(configFileOption);

        final String configFileName = getConfigFilenameFromArgs( argList, configFileOption );
        if ( configFileName != null ){
            org.aeonbits.owner.ConfigFactory.setProperty( GenomeCacheConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
        }
        getOrCreate(GenomeCacheConfig.class);
    }

    /**
     * Logs all the parameters in the given {@link Config} object at the given {@link Log.LogLevel}
     */
    public static <T extends Config> void logConfigFields(final T config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final Map.Entry<String, Object> entry : getConfigMap(config).entrySet() ) {
            logger.log(level, "\t" + entry.getKey() + " = " + entry.getValue());
        }
    }

    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap( final T config ) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        // Only interfaces that extend the OWNER Config interface carry our properties.
        for ( final Class<?> classInterface : config.getClass().getInterfaces() ) {
            if ( !Config.class.isAssignableFrom(classInterface) ) {
                continue;
            }
            for (final Method propertyMethod : classInterface.getDeclaredMethods()) {
                final Config.Key key = propertyMethod.getAnnotation(Config.Key.class);
                if (key == null) {
                    continue;
                }
                try {
                    configMap.put(key.value(), propertyMethod.invoke(config));
                } catch (final IllegalAccessException | InvocationTargetException ex) {
                    throw new GenomeCacheException("Could not invoke the config getter: " +
                            config.getClass().getSimpleName() + "." + propertyMethod.getName(), ex);
                }
            }
        }
        return configMap;
    }
}
