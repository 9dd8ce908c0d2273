/**
 *
 */
package org.theseed.xlsx;

import java.util.Objects;

import org.theseed.xlsx.utils.CellUtils;

/**
 * This is an immutable rectangular block of cells, identified by its zero-based corner coordinates.
 *
 * @author Bruce Parrello
 *
 */
public final class CellRange {

    // FIELDS
    /** first row index */
    private final int firstRow;
    /** first column index */
    private final int firstCol;
    /** last row index */
    private final int lastRow;
    /** last column index */
    private final int lastCol;

    /**
     * Create a cell range.  The bounds must already be in order.
     *
     * @param firstRow	first row index
     * @param firstCol	first column index
     * @param lastRow	last row index
     * @param lastCol	last column index
     */
    public CellRange(int firstRow, int firstCol, int lastRow, int lastCol) {
        this.firstRow = firstRow;
        this.firstCol = firstCol;
        this.lastRow = lastRow;
        this.lastCol = lastCol;
    }

    public int getFirstRow() {
        return this.firstRow;
    }

    public int getFirstCol() {
        return this.firstCol;
    }

    public int getLastRow() {
        return this.lastRow;
    }

    public int getLastCol() {
        return this.lastCol;
    }

    /**
     * @return the number of cells in the range
     */
    public long size() {
        return (long) (this.lastRow - this.firstRow + 1) * (this.lastCol - this.firstCol + 1);
    }

    /**
     * @return TRUE if this range shares at least one cell with another range
     *
     * @param other		other range to check
     */
    public boolean overlaps(CellRange other) {
        return this.firstRow <= other.lastRow && other.firstRow <= this.lastRow
                && this.firstCol <= other.lastCol && other.firstCol <= this.lastCol;
    }

    /**
     * @return TRUE if the specified cell is inside this range
     *
     * @param row	row index
     * @param col	column index
     */
    public boolean contains(int row, int col) {
        return row >= this.firstRow && row <= this.lastRow && col >= this.firstCol && col <= this.lastCol;
    }

    /**
     * @return the A1-style reference for this range
     */
    public String getRef() {
        return CellUtils.rangeName(this.firstRow, this.firstCol, this.lastRow, this.lastCol);
    }

    /**
     * @return the absolute reference for this range
     */
    public String getAbsoluteRef() {
        return CellUtils.absoluteRangeName(this.firstRow, this.firstCol, this.lastRow, this.lastCol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.firstRow, this.firstCol, this.lastRow, this.lastCol);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof CellRange))
            return false;
        CellRange other = (CellRange) obj;
        return this.firstRow == other.firstRow && this.firstCol == other.firstCol && this.lastRow == other.lastRow
                && this.lastCol == other.lastCol;
    }

    @Override
    public String toString() {
        return this.getRef();
    }

}
