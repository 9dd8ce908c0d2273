/**
 *
 */
package org.theseed.xlsx.strings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.theseed.xlsx.XlsxLimitException;

/**
 * This object deduplicates the text of every string cell in a workbook.  Each distinct string is assigned
 * an index in order of first occurrence, and the worksheets store the index instead of the text.  The
 * order of the table is part of the contract with the worksheet XML, so entries are never reordered or
 * removed.
 *
 * The table is owned by a single workbook.  Once the workbook begins serialization the table is frozen,
 * after which new strings are refused.
 *
 * @author Bruce Parrello
 *
 */
public class SharedStringTable {

    // FIELDS
    /** strings in index order */
    private final List<String> strings;
    /** map of strings to indices */
    private final Map<String, Integer> indices;
    /** maximum permissible string length */
    private final int maxLength;
    /** TRUE if the table is frozen */
    private boolean frozen;

    /**
     * Construct an empty string table.
     *
     * @param maxLength		maximum number of characters permitted in a single string
     */
    public SharedStringTable(int maxLength) {
        this.strings = new ArrayList<String>();
        this.indices = new HashMap<String, Integer>();
        this.maxLength = maxLength;
        this.frozen = false;
    }

    /**
     * Find or add a string.
     *
     * @param text		string to intern
     *
     * @return the index of the string in the table
     *
     * @throws XlsxLimitException	if the string is too long for a cell
     */
    public int intern(String text) throws XlsxLimitException {
        if (text == null)
            throw new IllegalArgumentException("Cannot intern a null string.");
        Integer retVal = this.indices.get(text);
        if (retVal == null) {
            if (this.frozen)
                throw new IllegalStateException("Shared string table is frozen.");
            if (text.length() > this.maxLength)
                throw new XlsxLimitException("String of length " + text.length() + " exceeds the cell text limit of "
                        + this.maxLength + " characters.");
            if (this.strings.size() == Integer.MAX_VALUE)
                throw new XlsxLimitException("Shared string table is full.");
            retVal = this.strings.size();
            this.strings.add(text);
            this.indices.put(text, retVal);
        }
        return retVal;
    }

    /**
     * @return the index of a string, or -1 if it is not in the table
     *
     * @param text		string to find
     */
    public int indexOf(String text) {
        Integer retVal = this.indices.get(text);
        return (retVal == null ? -1 : retVal);
    }

    /**
     * @return the string with the specified index
     *
     * @param idx	index of the desired string
     */
    public String get(int idx) {
        return this.strings.get(idx);
    }

    /**
     * @return the number of distinct strings in the table
     */
    public int size() {
        return this.strings.size();
    }

    /**
     * @return TRUE if the table is empty
     */
    public boolean isEmpty() {
        return this.strings.isEmpty();
    }

    /**
     * @return an unmodifiable view of the strings in index order
     */
    public List<String> getStrings() {
        return Collections.unmodifiableList(this.strings);
    }

    /**
     * Freeze the table.  Lookups of known strings remain possible.
     */
    public void freeze() {
        this.frozen = true;
    }

    /**
     * @return TRUE if the table is frozen
     */
    public boolean isFrozen() {
        return this.frozen;
    }

}
