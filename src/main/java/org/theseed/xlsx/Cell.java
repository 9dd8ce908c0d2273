/**
 *
 */
package org.theseed.xlsx;

import org.apache.poi.ss.usermodel.FormulaError;

/**
 * This is an immutable worksheet cell.  The cell knows its value and its style ID, but not its position:  the
 * worksheet stores cells in a sparse row/column map.  The numeric slot holds the number for NUMBER cells, the
 * shared-string index for STRING cells, and 1 or 0 for BOOLEAN cells.  The text slot holds the formula for
 * FORMULA cells and the error string for ERROR cells.
 *
 * @author Bruce Parrello
 *
 */
public final class Cell {

    // FIELDS
    /** value type */
    private final CellType type;
    /** style ID */
    private final int styleId;
    /** numeric value */
    private final double number;
    /** text value */
    private final String text;
    /** cached formula result */
    private final String result;

    /** default cached result for a formula */
    public static final String DEFAULT_RESULT = "0";

    private Cell(CellType type, int styleId, double number, String text, String result) {
        this.type = type;
        this.styleId = styleId;
        this.number = number;
        this.text = text;
        this.result = result;
    }

    /**
     * @return a number cell
     *
     * @param value		numeric value
     * @param styleId	style ID
     */
    public static Cell number(double value, int styleId) {
        return new Cell(CellType.NUMBER, styleId, value, null, null);
    }

    /**
     * @return a string cell
     *
     * @param stringIdx		index of the text in the shared string table
     * @param styleId		style ID
     */
    public static Cell string(int stringIdx, int styleId) {
        return new Cell(CellType.STRING, styleId, stringIdx, null, null);
    }

    /**
     * @return a boolean cell
     *
     * @param value		boolean value
     * @param styleId	style ID
     */
    public static Cell bool(boolean value, int styleId) {
        return new Cell(CellType.BOOLEAN, styleId, (value ? 1.0 : 0.0), null, null);
    }

    /**
     * @return a formula cell
     *
     * @param formula	formula text, without the leading equal sign
     * @param result	cached result, or NULL for the default
     * @param styleId	style ID
     */
    public static Cell formula(String formula, String result, int styleId) {
        return new Cell(CellType.FORMULA, styleId, 0.0, formula, (result == null ? DEFAULT_RESULT : result));
    }

    /**
     * @return a blank cell
     *
     * @param styleId	style ID
     */
    public static Cell blank(int styleId) {
        return new Cell(CellType.BLANK, styleId, 0.0, null, null);
    }

    /**
     * @return an error cell
     *
     * @param error		error value
     * @param styleId	style ID
     */
    public static Cell error(FormulaError error, int styleId) {
        return new Cell(CellType.ERROR, styleId, 0.0, error.getString(), null);
    }

    /**
     * @return the value type
     */
    public CellType getType() {
        return this.type;
    }

    /**
     * @return the style ID
     */
    public int getStyleId() {
        return this.styleId;
    }

    /**
     * @return the numeric value of a NUMBER cell
     */
    public double getNumber() {
        return this.number;
    }

    /**
     * @return the shared-string index of a STRING cell
     */
    public int getStringIndex() {
        return (int) this.number;
    }

    /**
     * @return the value of a BOOLEAN cell
     */
    public boolean getBoolean() {
        return this.number != 0.0;
    }

    /**
     * @return the formula text of a FORMULA cell
     */
    public String getFormula() {
        return (this.type == CellType.FORMULA ? this.text : null);
    }

    /**
     * @return the cached result of a FORMULA cell
     */
    public String getResult() {
        return this.result;
    }

    /**
     * @return the error value of an ERROR cell
     */
    public FormulaError getError() {
        return (this.type == CellType.ERROR ? FormulaError.forString(this.text) : null);
    }

}
