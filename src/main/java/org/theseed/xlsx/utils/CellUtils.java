/**
 *
 */
package org.theseed.xlsx.utils;

import org.apache.poi.ss.formula.SheetNameFormatter;
import org.apache.poi.ss.util.CellReference;

/**
 * This class contains static utilities for converting between zero-based cell coordinates and the A1-style
 * references used in the XML, and for formatting numbers the way the file format expects them.
 *
 * @author Bruce Parrello
 *
 */
public class CellUtils {

    /** largest magnitude for which an integral double is written without an exponent */
    private static final double MAX_PLAIN_INTEGER = 1e15;

    private CellUtils() { }

    /**
     * @return the letter name of a column
     *
     * @param col	zero-based column index
     */
    public static String columnName(int col) {
        return CellReference.convertNumToColString(col);
    }

    /**
     * @return the A1-style reference for a cell
     *
     * @param row	zero-based row index
     * @param col	zero-based column index
     */
    public static String cellName(int row, int col) {
        return columnName(col) + (row + 1);
    }

    /**
     * @return the absolute reference (e.g. $B$3) for a cell
     *
     * @param row	zero-based row index
     * @param col	zero-based column index
     */
    public static String absoluteCellName(int row, int col) {
        return "$" + columnName(col) + "$" + (row + 1);
    }

    /**
     * @return the A1-style reference for a range, or for a single cell if the range has only one
     *
     * @param firstRow	first row index
     * @param firstCol	first column index
     * @param lastRow	last row index
     * @param lastCol	last column index
     */
    public static String rangeName(int firstRow, int firstCol, int lastRow, int lastCol) {
        String retVal = cellName(firstRow, firstCol);
        if (firstRow != lastRow || firstCol != lastCol)
            retVal += ":" + cellName(lastRow, lastCol);
        return retVal;
    }

    /**
     * @return the absolute reference for a range, or for a single cell if the range has only one
     *
     * @param firstRow	first row index
     * @param firstCol	first column index
     * @param lastRow	last row index
     * @param lastCol	last column index
     */
    public static String absoluteRangeName(int firstRow, int firstCol, int lastRow, int lastCol) {
        String retVal = absoluteCellName(firstRow, firstCol);
        if (firstRow != lastRow || firstCol != lastCol)
            retVal += ":" + absoluteCellName(lastRow, lastCol);
        return retVal;
    }

    /**
     * @return a sheet name, quoted if it needs to be quoted in a formula
     *
     * @param sheetName		sheet name to quote
     */
    public static String quoteSheetName(String sheetName) {
        return SheetNameFormatter.format(sheetName);
    }

    /**
     * @return the unquoted form of a possibly-quoted sheet name
     *
     * @param sheetName		sheet name from a formula
     */
    public static String unquoteSheetName(String sheetName) {
        String retVal = sheetName;
        if (sheetName.length() >= 2 && sheetName.startsWith("'") && sheetName.endsWith("'"))
            retVal = sheetName.substring(1, sheetName.length() - 1).replace("''", "'");
        return retVal;
    }

    /**
     * Format a number for the XML.  Integral values are written without a decimal point; other values use the
     * shortest representation that reads back to the same double.
     *
     * @param value		number to format
     *
     * @return the string representation
     */
    public static String formatNumber(double value) {
        String retVal;
        if (value == Math.rint(value) && Math.abs(value) < MAX_PLAIN_INTEGER)
            retVal = Long.toString((long) value);
        else
            retVal = Double.toString(value);
        return retVal;
    }

    /**
     * @return TRUE if the double-quote and apostrophe quoting in a formula is balanced
     *
     * @param formula	formula text to check
     */
    public static boolean isBalanced(String formula) {
        boolean inString = false;
        boolean inName = false;
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (c == '"' && ! inName)
                inString = ! inString;
            else if (c == '\'' && ! inString)
                inName = ! inName;
        }
        return ! inString && ! inName;
    }

}
