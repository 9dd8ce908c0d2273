/**
 *
 */
package org.theseed.xlsx.packaging;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.commons.compress.archivers.zip.ParallelScatterZipCreator;
import org.apache.commons.io.output.CloseShieldOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This archive writer deflates the parts concurrently on a thread pool and then gathers the compressed
 * entries into the archive in submission order.  A new pool is created for each archive, because the
 * gatherer shuts its pool down when it finishes.
 *
 * @author Bruce Parrello
 *
 */
public class ParallelArchiveWriter implements ArchiveWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ParallelArchiveWriter.class);
    /** number of compression threads */
    private final int threads;

    /**
     * Construct a parallel archive writer.
     *
     * @param threads	number of compression threads to use
     */
    public ParallelArchiveWriter(int threads) {
        this.threads = threads;
    }

    @Override
    public void write(List<PackagePart> parts, OutputStream out) throws IOException {
        ExecutorService pool = Executors.newFixedThreadPool(this.threads);
        AbortableZipOutputStream zipStream = null;
        try {
            ParallelScatterZipCreator creator = new ParallelScatterZipCreator(pool);
            for (PackagePart part : parts)
                creator.addArchiveEntry(ArchiveWriter.createEntry(part), () -> new ByteArrayInputStream(part.getData()));
            zipStream = new AbortableZipOutputStream(CloseShieldOutputStream.wrap(out));
            creator.writeTo(zipStream);
            log.debug("Parallel compression statistics: {}.", creator.getStatisticsMessage());
            zipStream.finish();
            zipStream.close();
        } catch (IOException e) {
            abandon(zipStream, e);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException failure = new InterruptedIOException("Interrupted while compressing the workbook.");
            failure.initCause(e);
            abandon(zipStream, failure);
            throw failure;
        } catch (ExecutionException e) {
            IOException failure = new IOException("Error compressing the workbook: " + e.getCause().getMessage(), e.getCause());
            abandon(zipStream, failure);
            throw failure;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Abandon a partially-written archive.
     *
     * @param zipStream		archive stream to abandon, or NULL if it was never opened
     * @param failure		exception that caused the abandonment
     */
    private static void abandon(AbortableZipOutputStream zipStream, IOException failure) {
        if (zipStream != null) {
            try {
                zipStream.abort();
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
    }

}
