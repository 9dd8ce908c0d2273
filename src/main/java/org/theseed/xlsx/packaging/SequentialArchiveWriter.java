/**
 *
 */
package org.theseed.xlsx.packaging;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.io.output.CloseShieldOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This archive writer deflates the parts one after another through a single streaming zip encoder.
 *
 * @author Bruce Parrello
 *
 */
public class SequentialArchiveWriter implements ArchiveWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SequentialArchiveWriter.class);

    @Override
    public void write(List<PackagePart> parts, OutputStream out) throws IOException {
        AbortableZipOutputStream zipStream = new AbortableZipOutputStream(CloseShieldOutputStream.wrap(out));
        try {
            for (PackagePart part : parts) {
                ZipArchiveEntry entry = ArchiveWriter.createEntry(part);
                entry.setSize(part.getData().length);
                zipStream.putArchiveEntry(entry);
                zipStream.write(part.getData());
                zipStream.closeArchiveEntry();
                log.debug("Compressed {}.", part);
            }
            zipStream.finish();
            zipStream.close();
        } catch (IOException e) {
            try {
                zipStream.abort();
            } catch (IOException e2) {
                e.addSuppressed(e2);
            }
            throw e;
        }
    }

}
