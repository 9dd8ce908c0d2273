/**
 *
 */
package org.theseed.xlsx.packaging;

import java.io.IOException;
import java.io.OutputStream;

import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;

/**
 * This is a zip output stream that can be abandoned part-way through.  Aborting closes the underlying stream
 * without writing the central directory, so a failed archive is never mistaken for a complete one.
 *
 * @author Bruce Parrello
 *
 */
public class AbortableZipOutputStream extends ZipArchiveOutputStream {

    /**
     * Construct a zip output stream on an output stream.
     *
     * @param out	target output stream
     */
    public AbortableZipOutputStream(OutputStream out) {
        super(out);
    }

    /**
     * Abandon the archive.  No central directory is written.
     *
     * @throws IOException
     */
    public void abort() throws IOException {
        this.destroy();
    }

}
