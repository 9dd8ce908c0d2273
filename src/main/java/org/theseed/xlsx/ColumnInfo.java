/**
 *
 */
package org.theseed.xlsx;

import java.util.Objects;

/**
 * This is an immutable set of column properties:  width, format and visibility.  Adjacent columns with equal
 * properties are written as a single column run.
 *
 * @author Bruce Parrello
 *
 */
public final class ColumnInfo {

    // FIELDS
    /** column width in characters, or a negative number for the default */
    private final double width;
    /** style ID, or 0 for none */
    private final int styleId;
    /** TRUE if the column is hidden */
    private final boolean hidden;

    /** width used for columns that have properties but no explicit width */
    public static final double DEFAULT_WIDTH = 9.140625;
    /** column with all default properties */
    public static final ColumnInfo DEFAULT = new ColumnInfo(-1.0, 0, false);

    /**
     * Create a column descriptor.
     *
     * @param width		width in characters, or a negative number for the default
     * @param styleId	style ID
     * @param hidden	TRUE if the column is hidden
     */
    public ColumnInfo(double width, int styleId, boolean hidden) {
        this.width = width;
        this.styleId = styleId;
        this.hidden = hidden;
    }

    /**
     * @return the column width, or a negative number for the default
     */
    public double getWidth() {
        return this.width;
    }

    /**
     * @return TRUE if the column has an explicit width
     */
    public boolean hasWidth() {
        return this.width >= 0.0;
    }

    /**
     * @return the style ID
     */
    public int getStyleId() {
        return this.styleId;
    }

    /**
     * @return TRUE if the column is hidden
     */
    public boolean isHidden() {
        return this.hidden;
    }

    /**
     * @return a copy of this descriptor with a different width
     *
     * @param newWidth	new width
     */
    public ColumnInfo withWidth(double newWidth) {
        return new ColumnInfo(newWidth, this.styleId, this.hidden);
    }

    /**
     * @return a copy of this descriptor with a different style
     *
     * @param newStyle	new style ID
     */
    public ColumnInfo withStyleId(int newStyle) {
        return new ColumnInfo(this.width, newStyle, this.hidden);
    }

    /**
     * @return a copy of this descriptor with a different visibility
     *
     * @param newHidden	TRUE to hide the column
     */
    public ColumnInfo withHidden(boolean newHidden) {
        return new ColumnInfo(this.width, this.styleId, newHidden);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.width, this.styleId, this.hidden);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof ColumnInfo))
            return false;
        ColumnInfo other = (ColumnInfo) obj;
        return Double.compare(this.width, other.width) == 0 && this.styleId == other.styleId
                && this.hidden == other.hidden;
    }

}
