/**
 *
 */
package org.theseed.xlsx;

import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * This object holds a single worksheet row:  its sparse map of cells and its optional height, format and
 * visibility.
 *
 * @author Bruce Parrello
 *
 */
public class RowInfo {

    // FIELDS
    /** cells in the row, keyed by column index */
    private final NavigableMap<Integer, Cell> cells;
    /** row height in points, or a negative number for the default */
    private double height;
    /** style ID for the row, or 0 if none */
    private int styleId;
    /** TRUE if the row is hidden */
    private boolean hidden;

    /**
     * Create an empty row.
     */
    public RowInfo() {
        this.cells = new TreeMap<Integer, Cell>();
        this.height = -1.0;
        this.styleId = 0;
        this.hidden = false;
    }

    /**
     * @return the cells of the row, in column order
     */
    public NavigableMap<Integer, Cell> getCells() {
        return this.cells;
    }

    /**
     * Store a cell in this row.
     *
     * @param col		column index
     * @param cell		cell to store
     */
    protected void putCell(int col, Cell cell) {
        this.cells.put(col, cell);
    }

    /**
     * @return the cell in the specified column, or NULL if there is none
     *
     * @param col	column index
     */
    public Cell getCell(int col) {
        return this.cells.get(col);
    }

    /**
     * @return the row height, or a negative number if the default is used
     */
    public double getHeight() {
        return this.height;
    }

    /**
     * @return TRUE if the row has a custom height
     */
    public boolean hasHeight() {
        return this.height >= 0.0;
    }

    protected void setHeight(double height) {
        this.height = height;
    }

    /**
     * @return the row style ID (0 if the row has no format)
     */
    public int getStyleId() {
        return this.styleId;
    }

    protected void setStyleId(int styleId) {
        this.styleId = styleId;
    }

    /**
     * @return TRUE if the row is hidden
     */
    public boolean isHidden() {
        return this.hidden;
    }

    protected void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

}
