package com.quakesieve.cli;

/**
 * File format of the two output catalogs.
 *
 * @since 1.0.0
 */
public enum OutputFormat {

    /** Comma-separated values with a header row. */
    CSV,

    /** A JSON array of flat objects. */
    JSON;

    /**
     * @return a writer for this format
     */
    public CatalogWriter newWriter() {
        return switch (this) {
            case CSV -> new CsvCatalogWriter();
            case JSON -> new JsonCatalogWriter();
        };
    }
}
