package org.broadinstitute.genomecache.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String OUTPUT_LONG_NAME = "output";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String CATALOG_LONG_NAME = "catalog";
    public static final String CACHE_ROOT_LONG_NAME = "cache-root";
    public static final String PUBLISH_ROOT_LONG_NAME = "publish-root";
    public static final String INVENTORY_DB_LONG_NAME = "inventory-db";
    public static final String INDEXER_BACKEND_LONG_NAME = "indexer-backend";
    public static final String PROVIDER_LONG_NAME = "provider";
    public static final String SPECIES_LONG_NAME = "species";
    public static final String ASSEMBLY_LONG_NAME = "assembly";
    public static final String SEQUENCE_URL_LONG_NAME = "sequence-url";
    public static final String ANNOTATION_URL_LONG_NAME = "annotation-url";
    public static final String INTERVAL_LONG_NAME = "interval";
    public static final String FORMAT_LONG_NAME = "format";

    public static final String OUTPUT_SHORT_NAME = "O";
    public static final String CATALOG_SHORT_NAME = "C";
    public static final String INTERVAL_SHORT_NAME = "L";

    /**
     * The option specifying a main configuration file.
     * This is used in {@link org.broadinstitute.genomecache.Main} to control which config file is loaded.
     */
    public static final String CONFIG_FILE_OPTION = "config-file";

    public static final String TMP_DIR_NAME = "tmp-dir";
    public static final String QUIET_NAME = "QUIET";
}
