/**
 *
 */
package org.theseed.xlsx;

import org.apache.poi.ss.SpreadsheetVersion;

/**
 * This object contains the construction-time options for a workbook.  It is built using a {@link Builder};
 * the defaults are modern limits, software compression and single-threaded worksheet generation.
 *
 * @author Bruce Parrello
 *
 */
public class WorkbookOptions {

    // FIELDS
    /** compression strategy */
    private final Compression compression;
    /** spreadsheet version governing the limits */
    private final SpreadsheetVersion version;
    /** number of threads for generating worksheet XML */
    private final int worksheetThreads;
    /** number of threads for parallel compression */
    private final int compressionThreads;

    /** default options */
    public static final WorkbookOptions DEFAULT = builder().build();

    private WorkbookOptions(Builder builder) {
        this.compression = builder.compression;
        this.version = builder.version;
        this.worksheetThreads = builder.worksheetThreads;
        this.compressionThreads = builder.compressionThreads;
    }

    /**
     * @return a builder for workbook options
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the compression strategy
     */
    public Compression getCompression() {
        return this.compression;
    }

    /**
     * @return the spreadsheet version
     */
    public SpreadsheetVersion getVersion() {
        return this.version;
    }

    /**
     * @return the number of worksheet-generation threads
     */
    public int getWorksheetThreads() {
        return this.worksheetThreads;
    }

    /**
     * @return the number of compression threads
     */
    public int getCompressionThreads() {
        return this.compressionThreads;
    }

    /**
     * Builder for workbook options.
     */
    public static class Builder {

        private Compression compression;
        private SpreadsheetVersion version;
        private int worksheetThreads;
        private int compressionThreads;

        protected Builder() {
            this.compression = Compression.SOFTWARE;
            this.version = SpreadsheetVersion.EXCEL2007;
            this.worksheetThreads = 1;
            this.compressionThreads = Runtime.getRuntime().availableProcessors();
        }

        public Builder setCompression(Compression compression) {
            this.compression = compression;
            return this;
        }

        /**
         * Specify the spreadsheet version whose limits apply.  EXCEL97 gives the legacy row, column and style
         * limits.
         *
         * @param version	spreadsheet version
         */
        public Builder setVersion(SpreadsheetVersion version) {
            this.version = version;
            return this;
        }

        public Builder setWorksheetThreads(int threads) {
            if (threads < 1)
                throw new IllegalArgumentException("Thread count must be at least 1.");
            this.worksheetThreads = threads;
            return this;
        }

        public Builder setCompressionThreads(int threads) {
            if (threads < 1)
                throw new IllegalArgumentException("Thread count must be at least 1.");
            this.compressionThreads = threads;
            return this;
        }

        public WorkbookOptions build() {
            return new WorkbookOptions(this);
        }

    }

}
