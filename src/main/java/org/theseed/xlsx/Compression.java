/**
 *
 */
package org.theseed.xlsx;

/**
 * This enum selects how the parts of a workbook are deflated into the output archive.  Both choices produce
 * the same decompressed content.
 *
 * @author Bruce Parrello
 *
 */
public enum Compression {
    /** stream the parts through a single deflater, one after another */
    SOFTWARE,
    /** deflate the parts concurrently on a thread pool and gather them in order */
    NATIVE_ACCELERATED;
}
