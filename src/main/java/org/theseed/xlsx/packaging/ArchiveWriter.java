/**
 *
 */
package org.theseed.xlsx.packaging;

import java.io.IOException;
import java.io.OutputStream;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.zip.ZipEntry;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;

/**
 * This interface describes an object that writes a list of package parts to a zip archive.  Implementations
 * must write the parts in list order, stamp every entry with the same fixed time, and leave the output
 * stream open.
 *
 * @author Bruce Parrello
 *
 */
public interface ArchiveWriter {

    /** timestamp used for every entry (the start of the DOS epoch) */
    public static final long ENTRY_TIME = LocalDateTime.of(1980, 1, 1, 0, 0).atZone(ZoneId.systemDefault())
            .toInstant().toEpochMilli();

    /**
     * Write the parts to an archive.  If the write fails, the archive is abandoned without its central
     * directory.
     *
     * @param parts		parts to write, in order
     * @param out		output stream for the archive (not closed)
     *
     * @throws IOException
     */
    public void write(List<PackagePart> parts, OutputStream out) throws IOException;

    /**
     * @return a deflated archive entry for a part
     *
     * @param part		part for which an entry is desired
     */
    public static ZipArchiveEntry createEntry(PackagePart part) {
        ZipArchiveEntry retVal = new ZipArchiveEntry(part.getName());
        retVal.setMethod(ZipEntry.DEFLATED);
        retVal.setTime(ENTRY_TIME);
        return retVal;
    }

}
