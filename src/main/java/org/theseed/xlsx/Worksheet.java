/**
 *
 */
package org.theseed.xlsx;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.FormulaError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.xlsx.format.Color;
import org.theseed.xlsx.format.Format;
import org.theseed.xlsx.format.FormatRegistry;
import org.theseed.xlsx.strings.SharedStringTable;
import org.theseed.xlsx.utils.CellUtils;

/**
 * This object represents a single worksheet in a workbook.  Cells are stored sparsely, in a map of rows each
 * containing a map of cells, so a sheet with a few values spread over millions of addressable cells costs
 * only the values themselves.  Text is interned into the workbook's shared string table and formats are
 * registered into the workbook's format registry at the moment a cell is set, so the cells hold only
 * indices.
 *
 * Worksheets are created by {@link Workbook#addWorksheet(String)}.  Once the workbook has been written, the
 * worksheet is frozen and any attempt to modify it throws an IllegalStateException.
 *
 * @author Bruce Parrello
 *
 */
public class Worksheet {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(Worksheet.class);
    /** worksheet name */
    private final String name;
    /** format registry for the parent workbook */
    private final FormatRegistry formats;
    /** shared string table for the parent workbook */
    private final SharedStringTable strings;
    /** spreadsheet version governing the limits */
    private final SpreadsheetVersion version;
    /** map of row indices to rows */
    private final NavigableMap<Integer, RowInfo> rows;
    /** map of column indices to column properties */
    private final NavigableMap<Integer, ColumnInfo> columns;
    /** list of merged ranges */
    private final List<CellRange> merges;
    /** number of frozen rows at the top */
    private int frozenRows;
    /** number of frozen columns at the left */
    private int frozenCols;
    /** autofilter range, or NULL if none */
    private CellRange autofilter;
    /** print settings */
    private final PageSetup pageSetup;
    /** TRUE if the sheet tab is hidden */
    private boolean hidden;
    /** TRUE if this is the active sheet */
    private boolean active;
    /** zoom percentage */
    private int zoom;
    /** TRUE if gridlines are displayed */
    private boolean gridlines;
    /** tab color */
    private Color tabColor;
    /** TRUE once the sheet can no longer be modified */
    private boolean frozen;

    /** default zoom percentage */
    public static final int DEFAULT_ZOOM = 100;
    /** maximum column width */
    public static final double MAX_WIDTH = 255.0;
    /** maximum row height */
    public static final double MAX_HEIGHT = 409.0;

    /**
     * Create a new, empty worksheet.
     *
     * @param name		worksheet name (already validated)
     * @param formats	format registry of the parent workbook
     * @param strings	shared string table of the parent workbook
     * @param version	spreadsheet version governing the limits
     */
    protected Worksheet(String name, FormatRegistry formats, SharedStringTable strings, SpreadsheetVersion version) {
        this.name = name;
        this.formats = formats;
        this.strings = strings;
        this.version = version;
        this.rows = new TreeMap<Integer, RowInfo>();
        this.columns = new TreeMap<Integer, ColumnInfo>();
        this.merges = new ArrayList<CellRange>();
        this.pageSetup = new PageSetup();
        this.zoom = DEFAULT_ZOOM;
        this.gridlines = true;
        this.tabColor = Color.DEFAULT;
        this.frozen = false;
    }

    /**
     * @return the name of this worksheet
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the spreadsheet version governing this sheet's limits
     */
    public SpreadsheetVersion getVersion() {
        return this.version;
    }

    // CELL OPERATIONS

    /**
     * Store a number in a cell.
     *
     * @param row		row index
     * @param col		column index
     * @param value		value to store (must be finite)
     * @param format	cell format, or NULL for the default
     *
     * @throws XlsxException
     */
    public void setNumber(int row, int col, double value, Format format) throws XlsxException {
        this.checkCell(row, col);
        if (! Double.isFinite(value))
            throw new XlsxRangeException("Cannot store non-finite number " + value + " in cell "
                    + CellUtils.cellName(row, col) + ".");
        int styleId = this.formats.register(format);
        this.store(row, col, Cell.number(value, styleId));
    }

    /**
     * Store a string in a cell.
     *
     * @param row		row index
     * @param col		column index
     * @param value		text to store
     * @param format	cell format, or NULL for the default
     *
     * @throws XlsxException
     */
    public void setString(int row, int col, String value, Format format) throws XlsxException {
        this.checkCell(row, col);
        int styleId = this.formats.register(format);
        int idx = this.strings.intern(value);
        this.store(row, col, Cell.string(idx, styleId));
    }

    /**
     * Store a boolean value in a cell.
     *
     * @param row		row index
     * @param col		column index
     * @param value		value to store
     * @param format	cell format, or NULL for the default
     *
     * @throws XlsxException
     */
    public void setBoolean(int row, int col, boolean value, Format format) throws XlsxException {
        this.checkCell(row, col);
        int styleId = this.formats.register(format);
        this.store(row, col, Cell.bool(value, styleId));
    }

    /**
     * Store a formula in a cell, with the default cached result.
     *
     * @param row		row index
     * @param col		column index
     * @param formula	formula text, with or without the leading equal sign
     * @param format	cell format, or NULL for the default
     *
     * @throws XlsxException
     */
    public void setFormula(int row, int col, String formula, Format format) throws XlsxException {
        this.setFormula(row, col, formula, null, format);
    }

    /**
     * Store a formula in a cell.  The formula is never evaluated; the cached result is what a reader
     * displays until it recalculates.
     *
     * @param row		row index
     * @param col		column index
     * @param formula	formula text, with or without the leading equal sign
     * @param result	cached result, or NULL for the default of 0
     * @param format	cell format, or NULL for the default
     *
     * @throws XlsxException
     */
    public void setFormula(int row, int col, String formula, String result, Format format) throws XlsxException {
        this.checkCell(row, col);
        String text = (formula.startsWith("=") ? formula.substring(1) : formula);
        if (text.isEmpty())
            throw new XlsxException("Formula in cell " + CellUtils.cellName(row, col) + " is empty.");
        if (! CellUtils.isBalanced(text))
            throw new XlsxException("Formula \"" + formula + "\" has unbalanced quotes.");
        int styleId = this.formats.register(format);
        this.store(row, col, Cell.formula(text, result, styleId));
    }

    /**
     * Store a blank, formatted cell.
     *
     * @param row		row index
     * @param col		column index
     * @param format	cell format, or NULL for the default
     *
     * @throws XlsxException
     */
    public void setBlank(int row, int col, Format format) throws XlsxException {
        this.checkCell(row, col);
        int styleId = this.formats.register(format);
        this.store(row, col, Cell.blank(styleId));
    }

    /**
     * Store an error value in a cell.
     *
     * @param row		row index
     * @param col		column index
     * @param error		error value
     * @param format	cell format, or NULL for the default
     *
     * @throws XlsxException
     */
    public void setError(int row, int col, FormulaError error, Format format) throws XlsxException {
        this.checkCell(row, col);
        if (error.getCode() < 0)
            throw new XlsxRangeException("Error value " + error + " cannot be stored in a cell.");
        int styleId = this.formats.register(format);
        this.store(row, col, Cell.error(error, styleId));
    }

    /**
     * Store a value of any supported type in a cell.  Numbers, strings, booleans and formula errors are
     * stored as the corresponding cell type, and NULL produces a blank cell.
     *
     * @param row		row index
     * @param col		column index
     * @param value		value to store
     * @param format	cell format, or NULL for the default
     *
     * @throws XlsxException
     */
    public void setCell(int row, int col, Object value, Format format) throws XlsxException {
        if (value == null)
            this.setBlank(row, col, format);
        else if (value instanceof Number)
            this.setNumber(row, col, ((Number) value).doubleValue(), format);
        else if (value instanceof String)
            this.setString(row, col, (String) value, format);
        else if (value instanceof Boolean)
            this.setBoolean(row, col, (Boolean) value, format);
        else if (value instanceof FormulaError)
            this.setError(row, col, (FormulaError) value, format);
        else
            throw new IllegalArgumentException("Unsupported cell value type " + value.getClass().getName() + ".");
    }

    /**
     * @return the cell at the specified position, or NULL if there is none
     *
     * @param row	row index
     * @param col	column index
     */
    public Cell getCell(int row, int col) {
        Cell retVal = null;
        RowInfo rowInfo = this.rows.get(row);
        if (rowInfo != null)
            retVal = rowInfo.getCell(col);
        return retVal;
    }

    /**
     * Merge a range of cells.  The first cell receives the value, and the rest become blank cells with the
     * same format.
     *
     * @param firstRow	first row index
     * @param firstCol	first column index
     * @param lastRow	last row index
     * @param lastCol	last column index
     * @param value		value for the first cell (see {@link #setCell})
     * @param format	format for all of the cells
     *
     * @throws XlsxException
     */
    public void mergeRange(int firstRow, int firstCol, int lastRow, int lastCol, Object value, Format format)
            throws XlsxException {
        this.checkCell(firstRow, firstCol);
        this.checkCell(lastRow, lastCol);
        if (firstRow > lastRow || firstCol > lastCol)
            throw new XlsxRangeException("Merge range corners " + CellUtils.cellName(firstRow, firstCol) + " and "
                    + CellUtils.cellName(lastRow, lastCol) + " are out of order.");
        CellRange range = new CellRange(firstRow, firstCol, lastRow, lastCol);
        if (range.size() < 2)
            throw new XlsxRangeException("Cannot merge the single cell " + range + ".");
        for (CellRange other : this.merges) {
            if (range.overlaps(other))
                throw new XlsxConflictException("Merge range " + range + " overlaps merged range " + other + ".");
        }
        this.setCell(firstRow, firstCol, value, format);
        int styleId = this.formats.register(format);
        Cell blank = Cell.blank(styleId);
        for (int r = firstRow; r <= lastRow; r++) {
            for (int c = firstCol; c <= lastCol; c++) {
                if (r != firstRow || c != firstCol)
                    this.store(r, c, blank);
            }
        }
        this.merges.add(range);
    }

    // ROW AND COLUMN OPERATIONS

    /**
     * Specify the height of a row.
     *
     * @param row		row index
     * @param height	height in points
     *
     * @throws XlsxRangeException
     */
    public void setRowHeight(int row, double height) throws XlsxRangeException {
        this.checkRow(row);
        if (! Double.isFinite(height) || height < 0.0 || height > MAX_HEIGHT)
            throw new XlsxRangeException("Row height " + height + " must be between 0 and " + MAX_HEIGHT + ".");
        this.getRow(row).setHeight(height);
    }

    /**
     * Specify a format for an entire row.
     *
     * @param row		row index
     * @param format	format for the row
     *
     * @throws XlsxException
     */
    public void setRowFormat(int row, Format format) throws XlsxException {
        this.checkRow(row);
        int styleId = this.formats.register(format);
        this.getRow(row).setStyleId(styleId);
    }

    /**
     * Hide or show a row.
     *
     * @param row		row index
     * @param hidden	TRUE to hide the row
     *
     * @throws XlsxRangeException
     */
    public void setRowHidden(int row, boolean hidden) throws XlsxRangeException {
        this.checkRow(row);
        this.getRow(row).setHidden(hidden);
    }

    /**
     * Specify the width of a column.
     *
     * @param col		column index
     * @param width		width in characters
     *
     * @throws XlsxRangeException
     */
    public void setColumnWidth(int col, double width) throws XlsxRangeException {
        this.checkColumn(col);
        checkWidth(width);
        this.columns.put(col, this.getColumn(col).withWidth(width));
    }

    /**
     * Specify a default format for a column.
     *
     * @param col		column index
     * @param format	format for the column
     *
     * @throws XlsxException
     */
    public void setColumnFormat(int col, Format format) throws XlsxException {
        this.checkColumn(col);
        int styleId = this.formats.register(format);
        this.columns.put(col, this.getColumn(col).withStyleId(styleId));
    }

    /**
     * Hide or show a column.
     *
     * @param col		column index
     * @param hidden	TRUE to hide the column
     *
     * @throws XlsxRangeException
     */
    public void setColumnHidden(int col, boolean hidden) throws XlsxRangeException {
        this.checkColumn(col);
        this.columns.put(col, this.getColumn(col).withHidden(hidden));
    }

    /**
     * Specify the width and format of a range of columns.
     *
     * @param firstCol	first column index
     * @param lastCol	last column index
     * @param width		width in characters
     * @param format	format for the columns, or NULL for the default
     *
     * @throws XlsxException
     */
    public void setColumnRange(int firstCol, int lastCol, double width, Format format) throws XlsxException {
        this.checkColumn(firstCol);
        this.checkColumn(lastCol);
        if (firstCol > lastCol)
            throw new XlsxRangeException("Column range " + firstCol + " to " + lastCol + " is out of order.");
        checkWidth(width);
        int styleId = this.formats.register(format);
        for (int c = firstCol; c <= lastCol; c++)
            this.columns.put(c, this.getColumn(c).withWidth(width).withStyleId(styleId));
    }

    /**
     * @return the properties of a column
     *
     * @param col	column index
     */
    public ColumnInfo getColumn(int col) {
        return this.columns.getOrDefault(col, ColumnInfo.DEFAULT);
    }

    /**
     * Verify a column width.
     *
     * @param width		proposed width
     *
     * @throws XlsxRangeException
     */
    private static void checkWidth(double width) throws XlsxRangeException {
        if (! Double.isFinite(width) || width < 0.0 || width > MAX_WIDTH)
            throw new XlsxRangeException("Column width " + width + " must be between 0 and " + MAX_WIDTH + ".");
    }

    // LAYOUT OPERATIONS

    /**
     * Freeze the rows above and the columns to the left of a cell, so they stay visible when scrolling.
     *
     * @param row	number of rows to freeze
     * @param col	number of columns to freeze
     *
     * @throws XlsxRangeException
     */
    public void freezePanes(int row, int col) throws XlsxRangeException {
        this.checkCell(row, col);
        this.frozenRows = row;
        this.frozenCols = col;
    }

    /**
     * Put an autofilter on a range of cells.  The first row of the range holds the column headings.
     *
     * @param firstRow	first row index
     * @param firstCol	first column index
     * @param lastRow	last row index
     * @param lastCol	last column index
     *
     * @throws XlsxRangeException
     */
    public void setAutofilter(int firstRow, int firstCol, int lastRow, int lastCol) throws XlsxRangeException {
        this.autofilter = this.checkRange(firstRow, firstCol, lastRow, lastCol);
    }

    /**
     * Specify the region of the sheet to print.
     *
     * @param firstRow	first row index
     * @param firstCol	first column index
     * @param lastRow	last row index
     * @param lastCol	last column index
     *
     * @throws XlsxRangeException
     */
    public void setPrintArea(int firstRow, int firstCol, int lastRow, int lastCol) throws XlsxRangeException {
        this.pageSetup.setPrintArea(this.checkRange(firstRow, firstCol, lastRow, lastCol));
    }

    /**
     * Specify rows to repeat at the top of each printed page.
     *
     * @param firstRow	first row index
     * @param lastRow	last row index
     *
     * @throws XlsxRangeException
     */
    public void setRepeatRows(int firstRow, int lastRow) throws XlsxRangeException {
        this.checkRow(firstRow);
        this.checkRow(lastRow);
        if (firstRow > lastRow)
            throw new XlsxRangeException("Repeat rows " + firstRow + " to " + lastRow + " are out of order.");
        this.pageSetup.setRepeatRows(firstRow, lastRow);
    }

    /**
     * Hide or show the worksheet tab.  A hidden sheet cannot be the active sheet.
     *
     * @param hidden	TRUE to hide the sheet
     */
    public void setHidden(boolean hidden) {
        this.checkMutable();
        this.hidden = hidden;
        if (hidden)
            this.active = false;
    }

    /**
     * Make this the sheet displayed when the workbook is opened.  An active sheet is always visible.
     */
    public void setActive() {
        this.checkMutable();
        this.active = true;
        this.hidden = false;
    }

    /**
     * Specify the zoom percentage.
     *
     * @param zoom		zoom percentage, from 10 to 400
     *
     * @throws XlsxRangeException
     */
    public void setZoom(int zoom) throws XlsxRangeException {
        this.checkMutable();
        if (zoom < 10 || zoom > 400)
            throw new XlsxRangeException("Zoom " + zoom + " must be between 10 and 400.");
        this.zoom = zoom;
    }

    /**
     * Show or hide the screen gridlines.
     *
     * @param visible	TRUE to display gridlines
     */
    public void setGridlinesVisible(boolean visible) {
        this.checkMutable();
        this.gridlines = visible;
    }

    /**
     * Specify the color of the sheet tab.
     *
     * @param color		tab color
     */
    public void setTabColor(Color color) {
        this.checkMutable();
        this.tabColor = (color == null ? Color.DEFAULT : color);
    }

    /**
     * @return the print settings for this sheet
     *
     * The returned object may be modified freely until the workbook is written.
     */
    public PageSetup getPageSetup() {
        this.checkMutable();
        return this.pageSetup;
    }

    // INTERNAL METHODS

    /**
     * Store a cell.
     *
     * @param row	row index
     * @param col	column index
     * @param cell	cell to store
     */
    private void store(int row, int col, Cell cell) {
        this.getRow(row).putCell(col, cell);
    }

    /**
     * @return the row descriptor for a row, creating it if necessary
     *
     * @param row	row index
     */
    private RowInfo getRow(int row) {
        return this.rows.computeIfAbsent(row, x -> new RowInfo());
    }

    /**
     * Verify that a cell position is valid and that the sheet can be modified.
     *
     * @param row	row index
     * @param col	column index
     *
     * @throws XlsxRangeException
     */
    private void checkCell(int row, int col) throws XlsxRangeException {
        this.checkRow(row);
        this.checkColumn(col);
    }

    /**
     * Verify that a row index is valid and that the sheet can be modified.
     *
     * @param row	row index
     *
     * @throws XlsxRangeException
     */
    private void checkRow(int row) throws XlsxRangeException {
        this.checkMutable();
        if (row < 0 || row >= this.version.getMaxRows())
            throw new XlsxRangeException("Row index " + row + " is outside the range 0 to "
                    + this.version.getLastRowIndex() + ".");
    }

    /**
     * Verify that a column index is valid and that the sheet can be modified.
     *
     * @param col	column index
     *
     * @throws XlsxRangeException
     */
    private void checkColumn(int col) throws XlsxRangeException {
        this.checkMutable();
        if (col < 0 || col >= this.version.getMaxColumns())
            throw new XlsxRangeException("Column index " + col + " is outside the range 0 to "
                    + this.version.getLastColumnIndex() + ".");
    }

    /**
     * @return a validated cell range
     *
     * @param firstRow	first row index
     * @param firstCol	first column index
     * @param lastRow	last row index
     * @param lastCol	last column index
     *
     * @throws XlsxRangeException
     */
    private CellRange checkRange(int firstRow, int firstCol, int lastRow, int lastCol) throws XlsxRangeException {
        this.checkCell(firstRow, firstCol);
        this.checkCell(lastRow, lastCol);
        if (firstRow > lastRow || firstCol > lastCol)
            throw new XlsxRangeException("Range corners " + CellUtils.cellName(firstRow, firstCol) + " and "
                    + CellUtils.cellName(lastRow, lastCol) + " are out of order.");
        return new CellRange(firstRow, firstCol, lastRow, lastCol);
    }

    /**
     * Insure the sheet can be modified.
     */
    private void checkMutable() {
        if (this.frozen)
            throw new IllegalStateException("Worksheet \"" + this.name + "\" cannot be modified after the workbook is written.");
    }

    /**
     * Freeze this sheet so that it can no longer be modified.
     */
    protected void freeze() {
        this.frozen = true;
    }

    // ACCESSORS USED FOR OUTPUT

    /**
     * @return the rows of the sheet, in index order
     */
    public NavigableMap<Integer, RowInfo> getRows() {
        return Collections.unmodifiableNavigableMap(this.rows);
    }

    /**
     * @return the column properties of the sheet, in index order
     */
    public NavigableMap<Integer, ColumnInfo> getColumns() {
        return Collections.unmodifiableNavigableMap(this.columns);
    }

    /**
     * @return the merged ranges, in the order they were created
     */
    public List<CellRange> getMerges() {
        return Collections.unmodifiableList(this.merges);
    }

    /**
     * @return the number of frozen rows
     */
    public int getFrozenRows() {
        return this.frozenRows;
    }

    /**
     * @return the number of frozen columns
     */
    public int getFrozenCols() {
        return this.frozenCols;
    }

    /**
     * @return the autofilter range, or NULL if there is none
     */
    public CellRange getAutofilter() {
        return this.autofilter;
    }

    /**
     * @return the print settings, without the modification check
     */
    protected PageSetup getPageSettings() {
        return this.pageSetup;
    }

    public boolean isHidden() {
        return this.hidden;
    }

    public boolean isActive() {
        return this.active;
    }

    public int getZoom() {
        return this.zoom;
    }

    public boolean isGridlinesVisible() {
        return this.gridlines;
    }

    public Color getTabColor() {
        return this.tabColor;
    }

    /**
     * @return TRUE if the sheet is frozen
     */
    public boolean isFrozen() {
        return this.frozen;
    }

    /**
     * @return the number of string cells in this sheet
     */
    public long countStringCells() {
        long retVal = 0;
        for (RowInfo row : this.rows.values()) {
            for (Cell cell : row.getCells().values()) {
                if (cell.getType() == CellType.STRING)
                    retVal++;
            }
        }
        return retVal;
    }

    /**
     * @return the range covering every stored cell, or NULL if the sheet is empty
     */
    public CellRange getDimension() {
        CellRange retVal = null;
        if (! this.rows.isEmpty()) {
            int minCol = Integer.MAX_VALUE;
            int maxCol = -1;
            for (Map.Entry<Integer, RowInfo> rowEntry : this.rows.entrySet()) {
                NavigableMap<Integer, Cell> cells = rowEntry.getValue().getCells();
                if (! cells.isEmpty()) {
                    minCol = Math.min(minCol, cells.firstKey());
                    maxCol = Math.max(maxCol, cells.lastKey());
                }
            }
            if (maxCol < 0) {
                minCol = 0;
                maxCol = 0;
            }
            retVal = new CellRange(this.rows.firstKey(), minCol, this.rows.lastKey(), maxCol);
        }
        log.debug("Dimension of sheet {} is {}.", this.name, retVal);
        return retVal;
    }

}
