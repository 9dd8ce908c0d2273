/**
 *
 */
package org.theseed.xlsx;

/**
 * This enum describes the kinds of value a worksheet cell can hold.
 *
 * @author Bruce Parrello
 *
 */
public enum CellType {
    /** floating-point number */
    NUMBER,
    /** text, stored as an index into the shared string table */
    STRING,
    /** TRUE or FALSE */
    BOOLEAN,
    /** formula text with a cached result */
    FORMULA,
    /** no value, format only */
    BLANK,
    /** error value such as #DIV/0! */
    ERROR;
}
