package org.broadinstitute.genomecache.inventory;

import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.utils.Utils;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The natural key of a genome: (provider, species, assembly). Each part becomes a directory name in
 * the cache and publish trees, so it must be a single, non-special path segment.
 */
public final class GenomeKey implements Comparable<GenomeKey> {

    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9._+\\-]+");

    private final String provider;
    private final String species;
    private final String assembly;

    public GenomeKey(final String provider, final String species, final String assembly) {
        this.provider = checkSegment("provider", provider);
        this.species = checkSegment("species", species);
        this.assembly = checkSegment("assembly", assembly);
    }

    private static String checkSegment(final String name, final String value) {
        Utils.nonNull(value, () -> name + " must not be null");
        if (!SAFE_SEGMENT.matcher(value).matches() || value.equals(".") || value.equals("..")) {
            throw new UserException.BadInput(String.format("%s '%s' must be a non-empty name made of letters, digits, '.', '_', '+' or '-'", name, value));
        }
        return value;
    }

    public String getProvider() {
        return provider;
    }

    public String getSpecies() {
        return species;
    }

    public String getAssembly() {
        return assembly;
    }

    /**
     * @return {@code root/provider/species/assembly}
     */
    public Path resolveUnder(final Path root) {
        return root.resolve(provider).resolve(species).resolve(assembly);
    }

    @Override
    public int compareTo(final GenomeKey other) {
        int result = provider.compareTo(other.provider);
        if (result == 0) {
            result = species.compareTo(other.species);
        }
        if (result == 0) {
            result = assembly.compareTo(other.assembly);
        }
        return result;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final GenomeKey that = (GenomeKey) o;
        return provider.equals(that.provider) && species.equals(that.species) && assembly.equals(that.assembly);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, species, assembly);
    }

    @Override
    public String toString() {
        return provider + "/" + species + "/" + assembly;
    }
}
