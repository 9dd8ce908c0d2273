/**
 *
 */
package org.theseed.xlsx;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.poi.ss.SpreadsheetVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xlsx.format.Format;
import org.theseed.xlsx.format.FormatRegistry;
import org.theseed.xlsx.packaging.PackagePart;
import org.theseed.xlsx.packaging.Packager;
import org.theseed.xlsx.strings.SharedStringTable;

/**
 * This object manages a workbook being built for output.  It owns the worksheets, the format registry, the
 * shared string table, the defined names and the document properties.  The worksheets are populated by the
 * client, and then the workbook is written with one of the {@link #finalizeAndWrite(OutputStream)} methods.
 *
 * Writing the workbook freezes it.  After that, any attempt to add sheets, formats, strings or names throws an
 * IllegalStateException, but the workbook can be written again, and the output will be identical.
 *
 * A workbook created with {@link #create(File)} is written to its file when it is closed, so it can be used
 * in a try-with-resources block.
 *
 * @author Bruce Parrello
 *
 */
public class Workbook implements AutoCloseable {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(Workbook.class);
    /** construction options */
    private final WorkbookOptions options;
    /** worksheets in tab order */
    private final List<Worksheet> sheets;
    /** format registry */
    private final FormatRegistry formats;
    /** shared string table */
    private final SharedStringTable strings;
    /** user-defined names */
    private final List<DefinedName> names;
    /** document metadata */
    private DocProperties properties;
    /** TRUE if the workbook should recommend read-only opening */
    private boolean readOnlyRecommended;
    /** TRUE once the workbook has been written */
    private boolean frozen;
    /** file to which the workbook is written on close, or NULL if none */
    private File outFile;

    /** maximum length of a sheet name */
    public static final int MAX_SHEET_NAME = 31;
    /** characters forbidden in a sheet name */
    private static final String BAD_SHEET_CHARS = "[]:*?/\\";

    /**
     * Create an empty workbook with the default options.
     */
    public Workbook() {
        this(WorkbookOptions.DEFAULT);
    }

    /**
     * Create an empty workbook.
     *
     * @param options	construction options
     */
    public Workbook(WorkbookOptions options) {
        this.options = options;
        SpreadsheetVersion version = options.getVersion();
        this.sheets = new ArrayList<Worksheet>();
        this.formats = new FormatRegistry(version.getMaxCellStyles());
        this.strings = new SharedStringTable(version.getMaxTextLength());
        this.names = new ArrayList<DefinedName>();
        this.properties = new DocProperties();
        this.readOnlyRecommended = false;
        this.frozen = false;
        this.outFile = null;
    }

    /**
     * Create a workbook that will be written to a file when it is closed.
     *
     * @param outFile	output file
     *
     * @return the new workbook
     */
    public static Workbook create(File outFile) {
        return create(outFile, WorkbookOptions.DEFAULT);
    }

    /**
     * Create a workbook that will be written to a file when it is closed.
     *
     * @param outFile	output file
     * @param options	construction options
     *
     * @return the new workbook
     */
    public static Workbook create(File outFile, WorkbookOptions options) {
        Workbook retVal = new Workbook(options);
        retVal.outFile = outFile;
        return retVal;
    }

    /**
     * @return the construction options
     */
    public WorkbookOptions getOptions() {
        return this.options;
    }

    /**
     * Add a worksheet with a default name of the form "SheetN".
     *
     * @return the new worksheet
     *
     * @throws XlsxException
     */
    public Worksheet addWorksheet() throws XlsxException {
        return this.addWorksheet("Sheet" + (this.sheets.size() + 1));
    }

    /**
     * Add a worksheet.
     *
     * @param name		name for the worksheet
     *
     * @return the new worksheet
     *
     * @throws XlsxNameException		if the name is not valid
     * @throws XlsxConflictException	if another sheet already has the name
     */
    public Worksheet addWorksheet(String name) throws XlsxException {
        this.checkMutable();
        checkSheetName(name);
        for (Worksheet sheet : this.sheets) {
            if (sheet.getName().equalsIgnoreCase(name))
                throw new XlsxConflictException("Worksheet name \"" + name + "\" is already in use.");
        }
        Worksheet retVal = new Worksheet(name, this.formats, this.strings, this.options.getVersion());
        this.sheets.add(retVal);
        log.debug("Added worksheet {}.", name);
        return retVal;
    }

    /**
     * Verify that a sheet name is acceptable to the file format.
     *
     * @param name		proposed sheet name
     *
     * @throws XlsxNameException
     */
    public static void checkSheetName(String name) throws XlsxNameException {
        if (name == null || name.isEmpty())
            throw new XlsxNameException(name, "Worksheet name cannot be empty.");
        if (name.codePointCount(0, name.length()) > MAX_SHEET_NAME)
            throw new XlsxNameException(name, "Worksheet name \"" + name + "\" is longer than " + MAX_SHEET_NAME + " characters.");
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (BAD_SHEET_CHARS.indexOf(c) >= 0)
                throw new XlsxNameException(name, "Worksheet name \"" + name + "\" cannot contain any of " + BAD_SHEET_CHARS + ".");
            if (Character.isISOControl(c))
                throw new XlsxNameException(name, "Worksheet name \"" + name + "\" cannot contain control characters.");
        }
        if (name.startsWith("'") || name.endsWith("'"))
            throw new XlsxNameException(name, "Worksheet name \"" + name + "\" cannot start or end with an apostrophe.");
    }

    /**
     * @return the worksheets, in tab order
     */
    public List<Worksheet> getWorksheets() {
        return Collections.unmodifiableList(this.sheets);
    }

    /**
     * @return the worksheet with the specified name (case-insensitive), or NULL if there is none
     *
     * @param name	name of the desired worksheet
     */
    public Worksheet getWorksheet(String name) {
        Worksheet retVal = null;
        for (int i = 0; retVal == null && i < this.sheets.size(); i++) {
            if (this.sheets.get(i).getName().equalsIgnoreCase(name))
                retVal = this.sheets.get(i);
        }
        return retVal;
    }

    /**
     * Register a format with the workbook.  Cells set with an equal format receive the same style.
     *
     * @param format	format to register
     *
     * @return the style ID for the format
     *
     * @throws XlsxLimitException
     */
    public int registerFormat(Format format) throws XlsxLimitException {
        return this.formats.register(format);
    }

    /**
     * Add a string to the shared string table.
     *
     * @param text		text to add
     *
     * @return the index of the text in the table
     *
     * @throws XlsxLimitException
     */
    public int internString(String text) throws XlsxLimitException {
        return this.strings.intern(text);
    }

    /**
     * @return the format registry
     */
    public FormatRegistry getFormats() {
        return this.formats;
    }

    /**
     * @return the shared string table
     */
    public SharedStringTable getStrings() {
        return this.strings;
    }

    /**
     * Define a name.  A name prefixed with a sheet name and an exclamation point is local to that sheet;
     * the sheet must exist by the time the workbook is written.
     *
     * @param name		name to define, optionally with a sheet prefix
     * @param formula	formula the name refers to, such as "=Sheet1!$A$1:$B$5"
     *
     * @throws XlsxException
     */
    public void defineName(String name, String formula) throws XlsxException {
        this.checkMutable();
        this.names.add(DefinedName.parse(name, formula));
    }

    /**
     * @return the document properties
     */
    public DocProperties getProperties() {
        return this.properties;
    }

    /**
     * Specify the document properties.
     *
     * @param properties	new document metadata
     */
    public void setProperties(DocProperties properties) {
        this.checkMutable();
        this.properties = properties;
    }

    /**
     * Ask spreadsheet applications to suggest opening the workbook read-only.  The user can
     * still choose to edit it.
     */
    public void setReadOnlyRecommended() {
        this.checkMutable();
        this.readOnlyRecommended = true;
    }

    /**
     * @return TRUE if the workbook recommends read-only opening
     */
    public boolean isReadOnlyRecommended() {
        return this.readOnlyRecommended;
    }

    /**
     * Assemble the workbook and write it to an output stream.  The stream is not closed.
     *
     * @param out	output stream to receive the archive
     *
     * @throws XlsxException
     * @throws IOException
     */
    public void finalizeAndWrite(OutputStream out) throws XlsxException, IOException {
        List<PackagePart> parts = this.assemble();
        Packager packager = new Packager(this.options.getCompression(), this.options.getCompressionThreads());
        packager.write(parts, out);
    }

    /**
     * Assemble the workbook and write it to a file.  If the write fails, the file is deleted.
     *
     * @param file		output file
     *
     * @throws XlsxException
     * @throws IOException
     */
    public void finalizeAndWrite(File file) throws XlsxException, IOException {
        List<PackagePart> parts = this.assemble();
        Packager packager = new Packager(this.options.getCompression(), this.options.getCompressionThreads());
        try (OutputStream out = FileUtils.openOutputStream(file)) {
            packager.write(parts, out);
        } catch (IOException e) {
            FileUtils.deleteQuietly(file);
            throw e;
        }
        log.info("Workbook written to {}.", file);
    }

    /**
     * Assemble the workbook and return the archive in memory.
     *
     * @return the bytes of the archive
     *
     * @throws XlsxException
     * @throws IOException
     */
    public byte[] toByteArray() throws XlsxException, IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(65536);
        this.finalizeAndWrite(buffer);
        return buffer.toByteArray();
    }

    /**
     * Freeze the workbook and produce its package parts.
     *
     * @return the list of parts, in archive order
     *
     * @throws XlsxException
     * @throws IOException
     */
    private List<PackagePart> assemble() throws XlsxException, IOException {
        WorkbookAssembler assembler = new WorkbookAssembler(this.sheets, this.formats, this.strings, this.names,
                this.properties, this.readOnlyRecommended, this.options.getWorksheetThreads());
        try {
            return assembler.assemble();
        } finally {
            // The assembler freezes the shared tables once validation passes.
            this.frozen = this.formats.isFrozen();
        }
    }

    /**
     * Insure the workbook can be modified.
     */
    private void checkMutable() {
        if (this.frozen)
            throw new IllegalStateException("Workbook cannot be modified after it is written.");
    }

    /**
     * @return TRUE if the workbook has been written and can no longer be modified
     */
    public boolean isFrozen() {
        return this.frozen;
    }

    @Override
    public void close() {
        if (this.outFile != null) {
            // Here we write out the Excel file, de-checking any IO exception that occurs.
            try {
                this.finalizeAndWrite(this.outFile);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (XlsxException e) {
                throw new IllegalStateException("Could not assemble workbook for " + this.outFile + ": "
                        + e.getMessage(), e);
            }
        }
    }

}
