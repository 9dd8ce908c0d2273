/**
 *
 */
package org.theseed.xlsx.packaging;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipMethod;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.Test;
import org.theseed.xlsx.Compression;

/**
 * Tests for zip packaging.
 *
 * @author Bruce Parrello
 *
 */
public class TestPackager {

    /**
     * @return a list of test parts
     */
    private static List<PackagePart> testParts() {
        List<PackagePart> retVal = new ArrayList<PackagePart>();
        retVal.add(new PackagePart("[Content_Types].xml", "<Types/>".getBytes(StandardCharsets.UTF_8)));
        retVal.add(new PackagePart("_rels/.rels", "<Relationships/>".getBytes(StandardCharsets.UTF_8)));
        StringBuilder big = new StringBuilder();
        for (int i = 0; i < 500; i++)
            big.append("<row r=\"").append(i + 1).append("\"/>");
        retVal.add(new PackagePart("xl/worksheets/sheet1.xml", big.toString().getBytes(StandardCharsets.UTF_8)));
        retVal.add(new PackagePart("xl/workbook.xml", "<workbook/>".getBytes(StandardCharsets.UTF_8)));
        return retVal;
    }

    /**
     * @return the entries of an archive, in archive order
     *
     * @param archive	bytes of the archive
     *
     * @throws IOException
     */
    private static Map<String, String> readEntries(byte[] archive) throws IOException {
        Map<String, String> retVal = new LinkedHashMap<String, String>();
        try (ZipArchiveInputStream zipStream = new ZipArchiveInputStream(new ByteArrayInputStream(archive))) {
            ZipArchiveEntry entry = zipStream.getNextZipEntry();
            while (entry != null) {
                assertThat(entry.getName(), entry.getMethod(), equalTo(ZipMethod.DEFLATED.getCode()));
                retVal.put(entry.getName(), IOUtils.toString(zipStream, StandardCharsets.UTF_8));
                entry = zipStream.getNextZipEntry();
            }
        }
        return retVal;
    }

    @Test
    public void testSequential() throws IOException {
        List<PackagePart> parts = testParts();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new Packager(Compression.SOFTWARE, 1).write(parts, out);
        Map<String, String> entries = readEntries(out.toByteArray());
        assertThat(entries.keySet(), contains("[Content_Types].xml", "_rels/.rels", "xl/worksheets/sheet1.xml",
                "xl/workbook.xml"));
        assertThat(entries.get("xl/workbook.xml"), equalTo("<workbook/>"));
        // The same parts always produce the same archive.
        ByteArrayOutputStream out2 = new ByteArrayOutputStream();
        new Packager(Compression.SOFTWARE, 1).write(parts, out2);
        assertThat(out2.toByteArray(), equalTo(out.toByteArray()));
    }

    @Test
    public void testParallel() throws IOException {
        List<PackagePart> parts = testParts();
        ByteArrayOutputStream seq = new ByteArrayOutputStream();
        new Packager(Compression.SOFTWARE, 1).write(parts, seq);
        ByteArrayOutputStream par = new ByteArrayOutputStream();
        new Packager(Compression.NATIVE_ACCELERATED, 3).write(parts, par);
        Map<String, String> seqEntries = readEntries(seq.toByteArray());
        Map<String, String> parEntries = readEntries(par.toByteArray());
        assertThat(new ArrayList<String>(parEntries.keySet()), equalTo(new ArrayList<String>(seqEntries.keySet())));
        assertThat(parEntries, equalTo(seqEntries));
    }

    @Test
    public void testStreamLeftOpen() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        OutputStream out = new OutputStream() {
            private boolean closed = false;

            @Override
            public void write(int b) throws IOException {
                if (this.closed)
                    throw new IOException("Stream closed.");
                buffer.write(b);
            }

            @Override
            public void close() {
                this.closed = true;
            }
        };
        new Packager(Compression.SOFTWARE, 1).write(testParts(), out);
        // The caller still owns the stream.
        out.write('x');
        assertThat(buffer.size(), greaterThan(1));
    }

    @Test
    public void testFailure() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Disk full.");
            }
        };
        assertThrows(IOException.class, () -> new Packager(Compression.SOFTWARE, 1).write(testParts(), broken));
        assertThrows(IOException.class, () -> new Packager(Compression.NATIVE_ACCELERATED, 2).write(testParts(), broken));
    }

    /**
     * This is an output stream that fails once, after a fixed number of bytes, and then records
     * everything written to it afterward.
     */
    private static class FailingSink extends OutputStream {

        /** bytes recorded */
        private final ByteArrayOutputStream buffer;
        /** number of bytes to accept before failing */
        private final int limit;
        /** TRUE if the failure has been thrown */
        private boolean failed;

        /**
         * Construct a failing sink.
         *
         * @param limit		number of bytes to accept before failing
         */
        public FailingSink(int limit) {
            this.buffer = new ByteArrayOutputStream();
            this.limit = limit;
            this.failed = false;
        }

        @Override
        public void write(int b) throws IOException {
            if (! this.failed && this.buffer.size() >= this.limit) {
                this.failed = true;
                throw new IOException("Disk full.");
            }
            this.buffer.write(b);
        }

        /**
         * @return TRUE if the recorded bytes contain an end-of-central-directory signature
         */
        public boolean hasDirectory() {
            byte[] data = this.buffer.toByteArray();
            boolean retVal = false;
            for (int i = 0; ! retVal && i + 3 < data.length; i++)
                retVal = (data[i] == 'P' && data[i+1] == 'K' && data[i+2] == 5 && data[i+3] == 6);
            return retVal;
        }

        /**
         * @return TRUE if the failure was thrown
         */
        public boolean isFailed() {
            return this.failed;
        }

    }

    @Test
    public void testFailureMidArchive() {
        // A large part that compresses poorly, so the failure lands after the first entry.
        Random rand = new Random(42);
        StringBuilder noise = new StringBuilder();
        for (int i = 0; i < 20000; i++)
            noise.append(Integer.toHexString(rand.nextInt(16)));
        List<PackagePart> parts = new ArrayList<PackagePart>();
        parts.add(new PackagePart("[Content_Types].xml", "<Types/>".getBytes(StandardCharsets.UTF_8)));
        parts.add(new PackagePart("xl/worksheets/sheet1.xml", noise.toString().getBytes(StandardCharsets.UTF_8)));
        parts.add(new PackagePart("xl/workbook.xml", "<workbook/>".getBytes(StandardCharsets.UTF_8)));
        for (Compression compression : Compression.values()) {
            FailingSink sink = new FailingSink(200);
            assertThrows(IOException.class, () -> new Packager(compression, 2).write(parts, sink),
                    compression.toString());
            assertThat(compression.toString(), sink.isFailed(), equalTo(true));
            // An abandoned archive must not look complete.
            assertThat(compression.toString(), sink.hasDirectory(), equalTo(false));
        }
    }

}
