package org.broadinstitute.genomecache.testutils;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.genomecache.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.utils.Utils;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for command line argument lists with convenience methods for the standard genome cache arguments
 * such as the cache root, genome key, output and interval.
 *
 * Use this only in test code.
 */
public final class ArgumentsBuilder {
    private final List<String> args= new ArrayList<>();

    public ArgumentsBuilder(){}

    /**
     * Add a string to the arguments list, split on whitespace.
     *
     * NOTE: In general this method should be avoided in favor of other methods that handle adding dashes.
     */
    public ArgumentsBuilder addRaw(String arg){
        args.addAll(Arrays.asList(StringUtils.split(arg.trim())));
        return this;
    }

    /**
     * add an argument with a given value to this builder.
     *
     * This is the fundamental add method that others invoke.  It adds dashes to the argument name.
     */
    public ArgumentsBuilder add(final String argumentName, final String argumentValue) {
        Utils.nonNull(argumentValue);
        Utils.nonNull(argumentName);
        args.add("--" + argumentName);
        args.add(argumentValue);
        return this;
    }

    public ArgumentsBuilder add(final String argumentName, final File file){
        Utils.nonNull(file);
        return add(argumentName, file.getAbsolutePath());
    }

    public ArgumentsBuilder add(final String argumentName, final Path path){
        Utils.nonNull(path);
        return add(argumentName, path.toAbsolutePath().toString());
    }

    public ArgumentsBuilder add(final String argumentName, final Number value){
        Utils.nonNull(value);
        return add(argumentName, value.toString());
    }

    public ArgumentsBuilder add(final String argumentName, final Enum<?> enummerationValue){
        Utils.nonNull(enummerationValue);
        return add(argumentName, enummerationValue.name());
    }

    public ArgumentsBuilder addFlag(final String argumentName) {
        args.add("--" + argumentName);
        return this;
    }

    public ArgumentsBuilder addCacheRoot(final Path cacheRoot) {
        return add(StandardArgumentDefinitions.CACHE_ROOT_LONG_NAME, cacheRoot);
    }

    public ArgumentsBuilder addGenomeKey(final GenomeKey key) {
        return add(StandardArgumentDefinitions.PROVIDER_LONG_NAME, key.getProvider())
                .add(StandardArgumentDefinitions.SPECIES_LONG_NAME, key.getSpecies())
                .add(StandardArgumentDefinitions.ASSEMBLY_LONG_NAME, key.getAssembly());
    }

    public ArgumentsBuilder addOutput(final Path output) {
        return add(StandardArgumentDefinitions.OUTPUT_LONG_NAME, output);
    }

    public ArgumentsBuilder addInterval(final String interval){
        return add(StandardArgumentDefinitions.INTERVAL_LONG_NAME, interval);
    }

    /**
     * @return the arguments as a list of strings
     */
    public List<String> getArgsList(){
        return new ArrayList<>(args);
    }

    public String[] getArgsArray(){
        return args.toArray(new String[0]);
    }

    @Override
    public String toString(){
        return String.join(" ", args);
    }
}
