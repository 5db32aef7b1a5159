package org.broadinstitute.genomecache.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Reads a catalog of genomes from a YAML ({@code .yaml}/{@code .yml}) or JSON file.
 *
 * The file is either a list of records or an object with a {@code sources} list. Each record has
 * {@code provider}, {@code species}, {@code assembly}, {@code sequence_url} (or {@code fasta_url}) and an optional
 * {@code annotation_url} (or {@code anno_url}, {@code gff3_url}, {@code gff_url}). Unknown fields are ignored.
 *
 * Loading is all or nothing: a record missing a required field, or two records with the same key, rejects the
 * whole file with a {@link UserException.MalformedCatalog} that names the record.
 */
public final class CatalogLoader {
    private static final Logger logger = LogManager.getLogger(CatalogLoader.class);

    public static final String SOURCES_FIELD = "sources";

    private static final String[] PROVIDER = {"provider"};
    private static final String[] SPECIES = {"species"};
    private static final String[] ASSEMBLY = {"assembly"};
    private static final String[] SEQUENCE_URL = {"sequence_url", "fasta_url"};
    private static final String[] ANNOTATION_URL = {"annotation_url", "anno_url", "gff3_url", "gff_url"};

    private CatalogLoader() {}

    public static List<CatalogEntry> load(final Path catalogFile) {
        Utils.nonNull(catalogFile);
        if (!Files.isReadable(catalogFile)) {
            throw new UserException.CouldNotReadInputFile(catalogFile, "the catalog file does not exist or is not readable");
        }
        final JsonNode root;
        try {
            root = mapperFor(catalogFile).readTree(catalogFile.toFile());
        } catch (final IOException e) {
            throw new UserException.MalformedCatalog(catalogFile, "cannot be parsed: " + e.getMessage(), e);
        }
        final List<CatalogEntry> entries = parse(catalogFile, root);
        logger.info(String.format("Loaded %d catalog entries from %s", entries.size(), catalogFile));
        return entries;
    }

    static ObjectMapper mapperFor(final Path catalogFile) {
        final String name = catalogFile.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? new YAMLMapper() : new JsonMapper();
    }

    static List<CatalogEntry> parse(final Path catalogFile, final JsonNode root) {
        final JsonNode records;
        if (root == null || root.isMissingNode() || root.isNull()) {
            return Collections.emptyList();
        } else if (root.isArray()) {
            records = root;
        } else if (root.isObject() && root.has(SOURCES_FIELD)) {
            records = root.get(SOURCES_FIELD);
            if (!records.isArray()) {
                throw new UserException.MalformedCatalog(catalogFile, "'" + SOURCES_FIELD + "' must be a list of records");
            }
        } else {
            throw new UserException.MalformedCatalog(catalogFile, "expected a list of records or an object with a '" + SOURCES_FIELD + "' list");
        }

        final List<CatalogEntry> entries = new ArrayList<>(records.size());
        final Map<GenomeKey, Integer> seen = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            final JsonNode record = records.get(i);
            if (!record.isObject()) {
                throw new UserException.MalformedCatalog(catalogFile, "record #" + (i + 1) + " is not a mapping");
            }
            final CatalogEntry entry = toEntry(catalogFile, i, record);
            final Integer previous = seen.putIfAbsent(entry.getKey(), i);
            if (previous != null) {
                throw new UserException.MalformedCatalog(catalogFile, String.format("records #%d and #%d both describe %s",
                        previous + 1, i + 1, entry.getKey()));
            }
            entries.add(entry);
        }
        return Collections.unmodifiableList(entries);
    }

    private static CatalogEntry toEntry(final Path catalogFile, final int index, final JsonNode record) {
        final String provider = text(record, PROVIDER);
        final String species = text(record, SPECIES);
        final String assembly = text(record, ASSEMBLY);
        final String sequenceUrl = text(record, SEQUENCE_URL);
        final String annotationUrl = text(record, ANNOTATION_URL);

        final List<String> missing = new ArrayList<>();
        if (provider == null) missing.add(PROVIDER[0]);
        if (species == null) missing.add(SPECIES[0]);
        if (assembly == null) missing.add(ASSEMBLY[0]);
        if (sequenceUrl == null) missing.add(SEQUENCE_URL[0]);
        if (!missing.isEmpty()) {
            throw new UserException.MalformedCatalog(catalogFile, String.format("record #%d %s is missing required field(s) %s",
                    index + 1, describe(provider, species, assembly), String.join(", ", missing)));
        }
        try {
            return new CatalogEntry(provider, species, assembly, sequenceUrl, annotationUrl);
        } catch (final UserException.BadInput e) {
            throw new UserException.MalformedCatalog(catalogFile, "record #" + (index + 1) + " is invalid: " + e.getMessage(), e);
        }
    }

    private static String text(final JsonNode record, final String[] names) {
        for (final String name : names) {
            final JsonNode value = record.get(name);
            if (value != null && !value.isNull() && value.isValueNode()) {
                final String s = value.asText().trim();
                if (!s.isEmpty()) {
                    return s;
                }
            }
        }
        return null;
    }

    private static String describe(final String provider, final String species, final String assembly) {
        final StringJoiner joiner = new StringJoiner(", ", "(", ")");
        if (provider != null) joiner.add("provider=" + provider);
        if (species != null) joiner.add("species=" + species);
        if (assembly != null) joiner.add("assembly=" + assembly);
        return joiner.length() > 2 ? joiner.toString() : "";
    }
}
