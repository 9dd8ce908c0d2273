/**
 *
 */
package org.theseed.xlsx;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xlsx.format.FormatRegistry;
import org.theseed.xlsx.format.StylesWriter;
import org.theseed.xlsx.packaging.ContentTypes;
import org.theseed.xlsx.packaging.DocPropsWriter;
import org.theseed.xlsx.packaging.PackagePart;
import org.theseed.xlsx.packaging.Relationships;
import org.theseed.xlsx.strings.SharedStringTable;
import org.theseed.xlsx.strings.SharedStringsWriter;
import org.theseed.xlsx.utils.CellUtils;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * This object turns a populated workbook into the complete list of package parts.  It freezes the shared
 * tables, resolves every cross-reference (sheet IDs, relationship IDs, defined-name sheet indices), and
 * generates the XML for each part.  All XML is generated before anything is written to the output, so a
 * failure here leaves the output untouched.
 *
 * @author Bruce Parrello
 *
 */
public class WorkbookAssembler {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(WorkbookAssembler.class);
    /** worksheets in tab order */
    private final List<Worksheet> sheets;
    /** format registry */
    private final FormatRegistry formats;
    /** shared string table */
    private final SharedStringTable strings;
    /** user-defined names */
    private final List<DefinedName> userNames;
    /** document metadata */
    private final DocProperties properties;
    /** TRUE if read-only opening is recommended */
    private final boolean readOnlyRecommended;
    /** number of worksheet-generation threads */
    private final int threads;

    /** package part names */
    public static final String CONTENT_TYPES_PART = "[Content_Types].xml";
    public static final String PACKAGE_RELS_PART = "_rels/.rels";
    public static final String APP_PART = "docProps/app.xml";
    public static final String CORE_PART = "docProps/core.xml";
    public static final String WORKBOOK_RELS_PART = "xl/_rels/workbook.xml.rels";
    public static final String WORKBOOK_PART = "xl/workbook.xml";
    public static final String STYLES_PART = "xl/styles.xml";
    public static final String SHARED_STRINGS_PART = "xl/sharedStrings.xml";

    /**
     * Construct an assembler for a workbook's contents.
     *
     * @param sheets		worksheets in tab order
     * @param formats		format registry
     * @param strings		shared string table
     * @param userNames		user-defined names
     * @param properties	document metadata
     * @param readOnly		TRUE if read-only opening is recommended
     * @param threads		number of worksheet-generation threads
     */
    public WorkbookAssembler(List<Worksheet> sheets, FormatRegistry formats, SharedStringTable strings,
            List<DefinedName> userNames, DocProperties properties, boolean readOnly, int threads) {
        this.sheets = sheets;
        this.formats = formats;
        this.strings = strings;
        this.userNames = userNames;
        this.properties = properties;
        this.readOnlyRecommended = readOnly;
        this.threads = threads;
    }

    /**
     * @return the archive path for the worksheet with the specified index
     *
     * @param idx	zero-based worksheet index
     */
    public static String worksheetPart(int idx) {
        return "xl/worksheets/sheet" + (idx + 1) + ".xml";
    }

    /**
     * Freeze the shared tables and produce the package parts in archive order.
     *
     * @return the list of package parts
     *
     * @throws XlsxException
     * @throws IOException
     */
    public List<PackagePart> assemble() throws XlsxException, IOException {
        if (this.sheets.isEmpty())
            throw new XlsxException("A workbook must contain at least one worksheet.");
        // Resolve the active sheet and the first visible sheet.
        int firstSheet = -1;
        int activeTab = -1;
        for (int i = 0; i < this.sheets.size(); i++) {
            Worksheet sheet = this.sheets.get(i);
            if (! sheet.isHidden() && firstSheet < 0)
                firstSheet = i;
            if (sheet.isActive())
                activeTab = i;
        }
        if (firstSheet < 0)
            throw new XlsxException("A workbook must have at least one visible worksheet.");
        if (activeTab < 0)
            activeTab = firstSheet;
        log.debug("Active tab is {}, first visible sheet is {}.", activeTab, firstSheet);
        List<DefinedName> names = this.collectNames();
        // Everything that can be rejected has been checked, so the model is frozen.
        this.formats.freeze();
        this.strings.freeze();
        for (Worksheet sheet : this.sheets)
            sheet.freeze();
        // Build the relationship graphs.
        Relationships packageRels = new Relationships();
        packageRels.add(Relationships.OFFICE_DOCUMENT, WORKBOOK_PART);
        packageRels.add(Relationships.CORE_PROPERTIES, CORE_PART);
        packageRels.add(Relationships.EXTENDED_PROPERTIES, APP_PART);
        boolean hasStrings = ! this.strings.isEmpty();
        Relationships workbookRels = new Relationships();
        for (int i = 0; i < this.sheets.size(); i++)
            workbookRels.add(Relationships.WORKSHEET, "worksheets/sheet" + (i + 1) + ".xml");
        workbookRels.add(Relationships.STYLES, "styles.xml");
        if (hasStrings)
            workbookRels.add(Relationships.SHARED_STRINGS, "sharedStrings.xml");
        // Build the content types.
        ContentTypes types = new ContentTypes();
        types.addOverride(APP_PART, ContentTypes.APP);
        types.addOverride(CORE_PART, ContentTypes.CORE);
        types.addOverride(STYLES_PART, ContentTypes.STYLES);
        types.addOverride(WORKBOOK_PART, ContentTypes.WORKBOOK);
        for (int i = 0; i < this.sheets.size(); i++)
            types.addOverride(worksheetPart(i), ContentTypes.WORKSHEET);
        if (hasStrings)
            types.addOverride(SHARED_STRINGS_PART, ContentTypes.SHARED_STRINGS);
        // Generate the parts.
        List<String> sheetNames = new ArrayList<String>(this.sheets.size());
        for (Worksheet sheet : this.sheets)
            sheetNames.add(sheet.getName());
        List<String> rangeTitles = new ArrayList<String>();
        for (DefinedName name : names) {
            String title = name.getAppTitle();
            if (title != null)
                rangeTitles.add(title);
        }
        DocPropsWriter docProps = new DocPropsWriter(this.properties, sheetNames, rangeTitles,
                this.readOnlyRecommended);
        List<PackagePart> retVal = new ArrayList<PackagePart>(this.sheets.size() + 8);
        retVal.add(new PackagePart(CONTENT_TYPES_PART, XmlWriter.toBytes(types)));
        retVal.add(new PackagePart(PACKAGE_RELS_PART, XmlWriter.toBytes(packageRels)));
        retVal.add(new PackagePart(APP_PART, XmlWriter.toBytes(docProps::writeApp)));
        retVal.add(new PackagePart(CORE_PART, XmlWriter.toBytes(docProps::writeCore)));
        retVal.add(new PackagePart(WORKBOOK_RELS_PART, XmlWriter.toBytes(workbookRels)));
        retVal.add(new PackagePart(WORKBOOK_PART, XmlWriter.toBytes(new WorkbookWriter(this.sheets, activeTab,
                firstSheet, names, this.readOnlyRecommended))));
        retVal.add(new PackagePart(STYLES_PART, XmlWriter.toBytes(new StylesWriter(this.formats))));
        retVal.addAll(this.generateWorksheets(activeTab));
        if (hasStrings) {
            long refCount = 0;
            for (Worksheet sheet : this.sheets)
                refCount += sheet.countStringCells();
            retVal.add(new PackagePart(SHARED_STRINGS_PART, XmlWriter.toBytes(new SharedStringsWriter(this.strings, refCount))));
        }
        return retVal;
    }

    /**
     * Collect the user-defined and built-in names, resolve their sheet indices, and sort them.
     *
     * @return the sorted list of defined names
     *
     * @throws XlsxNameException
     */
    private List<DefinedName> collectNames() throws XlsxNameException {
        Map<String, Integer> sheetMap = new HashMap<String, Integer>();
        for (int i = 0; i < this.sheets.size(); i++)
            sheetMap.put(this.sheets.get(i).getName().toLowerCase(), i);
        List<DefinedName> retVal = new ArrayList<DefinedName>(this.userNames);
        for (DefinedName name : this.userNames) {
            if (! name.isGlobal()) {
                Integer idx = sheetMap.get(name.getSheetName().toLowerCase());
                if (idx == null)
                    throw new XlsxNameException(name.getSheetName(), "Unknown worksheet \"" + name.getSheetName()
                            + "\" in defined name \"" + name.getName() + "\".");
                name.setLocalSheetId(idx);
            }
        }
        for (int i = 0; i < this.sheets.size(); i++) {
            Worksheet sheet = this.sheets.get(i);
            String sheetName = sheet.getName();
            String prefix = CellUtils.quoteSheetName(sheetName) + "!";
            CellRange filter = sheet.getAutofilter();
            if (filter != null)
                retVal.add(DefinedName.builtin(DefinedName.FILTER_DATABASE, sheetName, i,
                        prefix + filter.getAbsoluteRef(), true));
            PageSetup setup = sheet.getPageSettings();
            CellRange printArea = setup.getPrintArea();
            if (printArea != null)
                retVal.add(DefinedName.builtin(DefinedName.PRINT_AREA, sheetName, i,
                        prefix + printArea.getAbsoluteRef(), false));
            if (setup.hasRepeatRows())
                retVal.add(DefinedName.builtin(DefinedName.PRINT_TITLES, sheetName, i,
                        prefix + "$" + (setup.getRepeatFirstRow() + 1) + ":$" + (setup.getRepeatLastRow() + 1), false));
        }
        retVal.sort(DefinedName.ORDER);
        return retVal;
    }

    /**
     * Generate the worksheet parts, on a thread pool if more than one thread was requested.  The parts are
     * always returned in sheet order.
     *
     * @param activeTab		index of the active sheet
     *
     * @return the worksheet parts
     *
     * @throws IOException
     */
    private List<PackagePart> generateWorksheets(int activeTab) throws IOException {
        final int n = this.sheets.size();
        List<PackagePart> retVal = new ArrayList<PackagePart>(n);
        if (this.threads <= 1 || n == 1) {
            for (int i = 0; i < n; i++)
                retVal.add(this.generateWorksheet(i, activeTab));
        } else {
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(this.threads, n));
            try {
                List<Future<PackagePart>> futures = new ArrayList<Future<PackagePart>>(n);
                for (int i = 0; i < n; i++) {
                    final int idx = i;
                    futures.add(pool.submit(() -> this.generateWorksheet(idx, activeTab)));
                }
                for (Future<PackagePart> future : futures)
                    retVal.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while generating worksheets.", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof IOException)
                    throw (IOException) cause;
                throw new IOException("Error generating worksheet: " + cause.getMessage(), cause);
            } finally {
                pool.shutdownNow();
            }
        }
        return retVal;
    }

    /**
     * @return the package part for a single worksheet
     *
     * @param idx			index of the worksheet
     * @param activeTab		index of the active sheet
     *
     * @throws IOException
     */
    private PackagePart generateWorksheet(int idx, int activeTab) throws IOException {
        Worksheet sheet = this.sheets.get(idx);
        byte[] data = XmlWriter.toBytes(new WorksheetWriter(sheet, idx == activeTab));
        log.debug("Generated {} bytes of XML for sheet {}.", data.length, sheet.getName());
        return new PackagePart(worksheetPart(idx), data);
    }

}
