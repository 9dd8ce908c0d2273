/**
 *
 */
package org.theseed.xlsx.format;

import java.util.Objects;

import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;

/**
 * This is an immutable cell-alignment descriptor.  An alignment with every property at its default value is
 * represented by {@link #DEFAULT}, so that a format with an explicit default alignment is identical to one
 * with no alignment at all.
 *
 * @author Bruce Parrello
 *
 */
public final class Alignment {

    // FIELDS
    /** horizontal alignment */
    private final HorizontalAlignment horizontal;
    /** vertical alignment */
    private final VerticalAlignment vertical;
    /** TRUE to wrap text */
    private final boolean wrap;
    /** indent level */
    private final int indent;
    /** text rotation, in the file-format encoding */
    private final int rotation;
    /** TRUE to shrink text to fit */
    private final boolean shrink;

    /** stacked-text rotation code */
    public static final int STACKED = 255;
    /** the default alignment */
    public static final Alignment DEFAULT = new Alignment(HorizontalAlignment.GENERAL, VerticalAlignment.BOTTOM,
            false, 0, 0, false);

    private Alignment(HorizontalAlignment horizontal, VerticalAlignment vertical, boolean wrap, int indent,
            int rotation, boolean shrink) {
        this.horizontal = horizontal;
        this.vertical = vertical;
        this.wrap = wrap;
        this.indent = indent;
        this.rotation = rotation;
        this.shrink = shrink;
    }

    /**
     * Create a canonical alignment descriptor.
     *
     * @param horizontal	horizontal alignment, or NULL for general
     * @param vertical		vertical alignment, or NULL for bottom
     * @param wrap			TRUE to wrap text
     * @param indent		indent level (0 to 250)
     * @param angle			text rotation angle in degrees (-90 to 90), or 270 for stacked text
     * @param shrink		TRUE to shrink text to fit
     *
     * @return the canonical alignment
     */
    public static Alignment of(HorizontalAlignment horizontal, VerticalAlignment vertical, boolean wrap,
            int indent, int angle, boolean shrink) {
        if (indent < 0 || indent > 250)
            throw new IllegalArgumentException("Indent level " + indent + " is outside the range 0 to 250.");
        int rotation;
        if (angle == 270)
            rotation = STACKED;
        else if (angle >= 0 && angle <= 90)
            rotation = angle;
        else if (angle < 0 && angle >= -90)
            rotation = 90 - angle;
        else
            throw new IllegalArgumentException("Rotation angle " + angle + " must be between -90 and 90, or 270.");
        HorizontalAlignment h = (horizontal == null ? HorizontalAlignment.GENERAL : horizontal);
        VerticalAlignment v = (vertical == null ? VerticalAlignment.BOTTOM : vertical);
        Alignment retVal = new Alignment(h, v, wrap, indent, rotation, shrink);
        if (retVal.equals(DEFAULT))
            retVal = DEFAULT;
        return retVal;
    }

    /**
     * @return the horizontal alignment
     */
    public HorizontalAlignment getHorizontal() {
        return this.horizontal;
    }

    /**
     * @return the vertical alignment
     */
    public VerticalAlignment getVertical() {
        return this.vertical;
    }

    /**
     * @return TRUE if text wraps
     */
    public boolean isWrap() {
        return this.wrap;
    }

    /**
     * @return the indent level
     */
    public int getIndent() {
        return this.indent;
    }

    /**
     * @return the encoded text rotation (0-90 up, 91-180 down, 255 stacked)
     */
    public int getRotation() {
        return this.rotation;
    }

    /**
     * @return TRUE if text shrinks to fit
     */
    public boolean isShrink() {
        return this.shrink;
    }

    /**
     * @return TRUE if this is the default alignment
     */
    public boolean isDefault() {
        return this.equals(DEFAULT);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.horizontal, this.vertical, this.wrap, this.indent, this.rotation, this.shrink);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Alignment))
            return false;
        Alignment other = (Alignment) obj;
        return this.horizontal == other.horizontal && this.vertical == other.vertical && this.wrap == other.wrap
                && this.indent == other.indent && this.rotation == other.rotation && this.shrink == other.shrink;
    }

}
