/**
 *
 */
package org.theseed.xlsx.packaging;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xlsx.Compression;

/**
 * This object writes a fully-generated set of package parts to an output stream as a zip archive, using the
 * archive writer that matches the requested compression strategy.
 *
 * @author Bruce Parrello
 *
 */
public class Packager {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(Packager.class);
    /** compression strategy */
    private final Compression compression;
    /** archive writer for the strategy */
    private final ArchiveWriter archiver;

    /**
     * Construct a packager.
     *
     * @param compression	compression strategy
     * @param threads		number of threads for parallel compression
     */
    public Packager(Compression compression, int threads) {
        this.compression = compression;
        switch (compression) {
        case NATIVE_ACCELERATED -> this.archiver = new ParallelArchiveWriter(threads);
        default -> this.archiver = new SequentialArchiveWriter();
        }
    }

    /**
     * Write the parts to an output stream.  The stream is not closed.
     *
     * @param parts		parts to write, in archive order
     * @param out		target output stream
     *
     * @throws IOException
     */
    public void write(List<PackagePart> parts, OutputStream out) throws IOException {
        long total = 0;
        for (PackagePart part : parts)
            total += part.getData().length;
        log.info("Writing {} package parts ({} bytes uncompressed) with {} compression.", parts.size(), total,
                this.compression);
        this.archiver.write(parts, out);
        out.flush();
    }

}
