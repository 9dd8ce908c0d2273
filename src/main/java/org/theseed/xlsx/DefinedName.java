/**
 *
 */
package org.theseed.xlsx;

import java.util.Comparator;

import org.apache.commons.lang3.StringUtils;
import org.theseed.xlsx.utils.CellUtils;

/**
 * This object represents a defined name in a workbook.  A name is either global or local to a single sheet;
 * a local name is specified by prefixing it with the sheet name and an exclamation point, as in
 * <code>Sheet1!Sales</code>.  The sheet index of a local name is resolved when the workbook is assembled.
 *
 * Built-in names such as print areas and autofilter ranges are created by the assembler; they are local
 * names with the reserved <code>_xlnm.</code> prefix.
 *
 * @author Bruce Parrello
 *
 */
public class DefinedName {

    // FIELDS
    /** name (without any sheet prefix) */
    private final String name;
    /** unquoted sheet name for a local name, or NULL for a global name */
    private final String sheetName;
    /** formula the name refers to, without the leading equal sign */
    private final String formula;
    /** TRUE if the name is hidden */
    private final boolean hidden;
    /** resolved sheet index for a local name, or -1 */
    private int localSheetId;

    /** characters forbidden in a defined name */
    private static final String BAD_NAME_CHARS = " ,/*[]:\"'";
    /** prefix for built-in names */
    public static final String BUILTIN_PREFIX = "_xlnm.";
    /** built-in name for an autofilter range */
    public static final String FILTER_DATABASE = BUILTIN_PREFIX + "_FilterDatabase";
    /** built-in name for a print area */
    public static final String PRINT_AREA = BUILTIN_PREFIX + "Print_Area";
    /** built-in name for repeated print rows */
    public static final String PRINT_TITLES = BUILTIN_PREFIX + "Print_Titles";

    /** ordering in which the names appear in the workbook */
    public static final Comparator<DefinedName> ORDER = Comparator.comparing(DefinedName::getSortName)
            .thenComparing(DefinedName::getFormula);

    private DefinedName(String name, String sheetName, String formula, boolean hidden, int localSheetId) {
        this.name = name;
        this.sheetName = sheetName;
        this.formula = formula;
        this.hidden = hidden;
        this.localSheetId = localSheetId;
    }

    /**
     * Create a user-defined name.
     *
     * @param fullName	name, optionally prefixed with a sheet name and an exclamation point
     * @param formula	formula the name refers to, with or without the leading equal sign
     *
     * @return the validated defined name
     *
     * @throws XlsxException
     */
    public static DefinedName parse(String fullName, String formula) throws XlsxException {
        String sheet = null;
        String name = fullName;
        int bang = fullName.lastIndexOf('!');
        if (bang >= 0) {
            sheet = CellUtils.unquoteSheetName(fullName.substring(0, bang));
            name = fullName.substring(bang + 1);
            if (sheet.isEmpty())
                throw new XlsxNameException(fullName, "Defined name \"" + fullName + "\" has an empty sheet name.");
        }
        if (name.isEmpty())
            throw new XlsxNameException(fullName, "Defined name cannot be empty.");
        char first = name.charAt(0);
        if (! Character.isLetter(first) && first != '_' && first != '\\')
            throw new XlsxNameException(name, "Defined name \"" + name + "\" must start with a letter, an underscore or a backslash.");
        if (StringUtils.containsAny(name, BAD_NAME_CHARS))
            throw new XlsxNameException(name, "Defined name \"" + name + "\" cannot contain spaces or any of ,/*[]:\"'.");
        String text = StringUtils.removeStart(formula, "=");
        if (text.isEmpty())
            throw new XlsxException("Defined name \"" + name + "\" has an empty formula.");
        if (! CellUtils.isBalanced(text))
            throw new XlsxException("Formula \"" + formula + "\" for defined name \"" + name + "\" has unbalanced quotes.");
        return new DefinedName(name, sheet, text, false, -1);
    }

    /**
     * Create a built-in name for a sheet.
     *
     * @param name			built-in name
     * @param sheetName		name of the sheet
     * @param sheetIdx		index of the sheet
     * @param formula		formula the name refers to
     * @param hidden		TRUE if the name is hidden
     *
     * @return the built-in name
     */
    public static DefinedName builtin(String name, String sheetName, int sheetIdx, String formula, boolean hidden) {
        return new DefinedName(name, sheetName, formula, hidden, sheetIdx);
    }

    /**
     * @return the name, without any sheet prefix
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the sheet name for a local name, or NULL for a global name
     */
    public String getSheetName() {
        return this.sheetName;
    }

    /**
     * @return TRUE if this is a global name
     */
    public boolean isGlobal() {
        return this.sheetName == null;
    }

    /**
     * @return the formula the name refers to
     */
    public String getFormula() {
        return this.formula;
    }

    /**
     * @return TRUE if the name is hidden
     */
    public boolean isHidden() {
        return this.hidden;
    }

    /**
     * @return the index of the sheet for a local name, or -1 for a global name
     */
    public int getLocalSheetId() {
        return this.localSheetId;
    }

    /**
     * Specify the resolved sheet index for a local name.
     *
     * @param localSheetId	index of the owning sheet
     */
    protected void setLocalSheetId(int localSheetId) {
        this.localSheetId = localSheetId;
    }

    /**
     * @return the key used to sort the names
     */
    public String getSortName() {
        String retVal = StringUtils.removeStart(this.name, BUILTIN_PREFIX).toLowerCase();
        if (this.sheetName != null)
            retVal += "::" + this.sheetName.toLowerCase();
        return retVal;
    }

    /**
     * @return the title used for this name in the extended properties, or NULL if it has none
     */
    public String getAppTitle() {
        String retVal = null;
        if (this.sheetName != null && ! this.name.equals(FILTER_DATABASE)) {
            String localName = StringUtils.removeStart(this.name, BUILTIN_PREFIX);
            retVal = CellUtils.quoteSheetName(this.sheetName) + "!" + localName;
        }
        return retVal;
    }

    @Override
    public String toString() {
        return (this.sheetName == null ? this.name : this.sheetName + "!" + this.name);
    }

}
