/**
 *
 */
package org.theseed.xlsx.format;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.poi.ss.usermodel.BuiltinFormats;
import org.theseed.xlsx.XlsxLimitException;

/**
 * This object deduplicates cell formats into the style tables of a workbook.  Each format is broken into its
 * font, fill, border and number-format components, each of which is stored once in its own catalog, and the
 * combination is stored once as a cell-style record.  The index of that record is the style ID stored in
 * the cells.
 *
 * The catalogs start with the entries that spreadsheet readers expect at fixed positions:  the default font,
 * the "none" and "gray125" fills, the empty border, and the default style record.  These are emitted even if
 * no cell uses them.  When two formats are equal, the first registration owns the slot and later ones are
 * aliased to it.
 *
 * @author Bruce Parrello
 *
 */
public class FormatRegistry {

    // FIELDS
    /** font catalog */
    private final Catalog<Font> fonts;
    /** fill catalog */
    private final Catalog<Fill> fills;
    /** border catalog */
    private final Catalog<Border> borders;
    /** custom number format catalog */
    private final Catalog<String> numFormats;
    /** cell style record catalog */
    private final Catalog<XfRecord> xfRecords;
    /** cache of formats already registered */
    private final Map<Format, Integer> formatCache;
    /** maximum number of cell style records */
    private final int maxStyles;
    /** TRUE if the registry is frozen */
    private boolean frozen;

    /** first ID available for custom number formats */
    public static final int FIRST_CUSTOM_NUM_FORMAT = 164;

    /**
     * Construct a new format registry.
     *
     * @param maxStyles		maximum number of distinct cell styles permitted
     */
    public FormatRegistry(int maxStyles) {
        this.fonts = new Catalog<Font>();
        this.fills = new Catalog<Fill>();
        this.borders = new Catalog<Border>();
        this.numFormats = new Catalog<String>();
        this.xfRecords = new Catalog<XfRecord>();
        this.formatCache = new HashMap<Format, Integer>();
        this.maxStyles = maxStyles;
        this.frozen = false;
        // Set up the mandatory entries.
        this.fonts.add(Font.DEFAULT);
        this.fills.add(Fill.NONE);
        this.fills.add(Fill.GRAY_125);
        this.borders.add(Border.NONE);
        this.xfRecords.add(XfRecord.DEFAULT);
        this.formatCache.put(Format.DEFAULT, 0);
    }

    /**
     * Register a format and return its style ID.  A NULL format is the default format.
     *
     * @param format	format to register
     *
     * @return the style ID for the format
     *
     * @throws XlsxLimitException	if the format would exceed the maximum number of styles
     */
    public int register(Format format) throws XlsxLimitException {
        int retVal = 0;
        if (format != null) {
            Integer cached = this.formatCache.get(format);
            if (cached != null)
                retVal = cached;
            else {
                if (this.frozen)
                    throw new IllegalStateException("Format registry is frozen.");
                retVal = this.registerNew(format);
                this.formatCache.put(format, retVal);
            }
        }
        return retVal;
    }

    /**
     * Register a format that has not been seen before.  The component IDs are computed tentatively first, so
     * that nothing is added to any catalog if the style limit would be exceeded.
     *
     * @param format	format to register
     *
     * @return the style ID for the format
     *
     * @throws XlsxLimitException
     */
    private int registerNew(Format format) throws XlsxLimitException {
        int fontId = tentativeIndex(this.fonts, format.getFont(), 0);
        int fillId = tentativeIndex(this.fills, format.getFill(), 0);
        int borderId = tentativeIndex(this.borders, format.getBorder(), 0);
        String numFormat = format.getNumberFormat();
        int numFmtId = BuiltinFormats.getBuiltinFormat(numFormat);
        if (numFmtId < 0)
            numFmtId = tentativeIndex(this.numFormats, numFormat, FIRST_CUSTOM_NUM_FORMAT);
        XfRecord record = new XfRecord(numFmtId, fontId, fillId, borderId, format.getAlignment(),
                format.isLocked(), format.isHidden(), format.isQuotePrefix());
        int retVal = this.xfRecords.indexOf(record);
        if (retVal < 0) {
            if (this.xfRecords.size() >= this.maxStyles)
                throw new XlsxLimitException("Workbook cannot have more than " + this.maxStyles + " distinct cell formats.");
            // Now it is safe to commit the components.
            this.fonts.add(format.getFont());
            this.fills.add(format.getFill());
            this.borders.add(format.getBorder());
            if (numFmtId >= FIRST_CUSTOM_NUM_FORMAT)
                this.numFormats.add(numFormat);
            retVal = this.xfRecords.add(record);
        }
        return retVal;
    }

    /**
     * @return the index an item has or would have in a catalog
     *
     * @param catalog	catalog of interest
     * @param item		item to look for
     * @param base		index offset for the catalog
     */
    private static <T> int tentativeIndex(Catalog<T> catalog, T item, int base) {
        int retVal = catalog.indexOf(item);
        if (retVal < 0)
            retVal = catalog.size();
        return retVal + base;
    }

    /**
     * @return the number of distinct cell styles
     */
    public int size() {
        return this.xfRecords.size();
    }

    /**
     * @return the style record with the specified ID
     *
     * @param styleId	style ID of interest
     */
    public XfRecord getRecord(int styleId) {
        return this.xfRecords.get(styleId);
    }

    /**
     * @return the fonts in index order
     */
    public List<Font> getFonts() {
        return this.fonts.getItems();
    }

    /**
     * @return the fills in index order
     */
    public List<Fill> getFills() {
        return this.fills.getItems();
    }

    /**
     * @return the borders in index order
     */
    public List<Border> getBorders() {
        return this.borders.getItems();
    }

    /**
     * @return the custom number formats in index order (the first has ID {@link #FIRST_CUSTOM_NUM_FORMAT})
     */
    public List<String> getNumFormats() {
        return this.numFormats.getItems();
    }

    /**
     * @return the cell style records in style-ID order
     */
    public List<XfRecord> getRecords() {
        return this.xfRecords.getItems();
    }

    /**
     * @return the maximum number of distinct cell styles
     */
    public int getMaxStyles() {
        return this.maxStyles;
    }

    /**
     * Freeze the registry.  Formats already registered can still be looked up.
     */
    public void freeze() {
        this.frozen = true;
    }

    /**
     * @return TRUE if the registry is frozen
     */
    public boolean isFrozen() {
        return this.frozen;
    }

}
