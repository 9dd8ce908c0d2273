/**
 *
 */
package org.theseed.xlsx.format;

import java.util.Objects;

import org.apache.poi.ss.usermodel.FillPatternType;

/**
 * This is an immutable cell-fill descriptor.  Fills are canonicalized on construction:  a fill that specifies
 * colors without a pattern is treated as a solid fill, and a solid fill always paints with its foreground
 * color, which is how the spreadsheet applications interpret it.
 *
 * @author Bruce Parrello
 *
 */
public final class Fill {

    // FIELDS
    /** fill pattern */
    private final FillPatternType pattern;
    /** foreground (pattern) color */
    private final Color foreground;
    /** background color */
    private final Color background;

    /** the empty fill, which is always the first fill in a style sheet */
    public static final Fill NONE = new Fill(FillPatternType.NO_FILL, Color.DEFAULT, Color.DEFAULT);
    /** the gray-125 fill, which is always the second fill in a style sheet */
    public static final Fill GRAY_125 = new Fill(FillPatternType.LESS_DOTS, Color.DEFAULT, Color.DEFAULT);

    private Fill(FillPatternType pattern, Color foreground, Color background) {
        this.pattern = pattern;
        this.foreground = foreground;
        this.background = background;
    }

    /**
     * Create a canonical fill descriptor.
     *
     * @param pattern		fill pattern, or NULL for none
     * @param foreground	foreground color, or NULL for the default
     * @param background	background color, or NULL for the default
     *
     * @return the canonical fill
     */
    public static Fill of(FillPatternType pattern, Color foreground, Color background) {
        FillPatternType p = (pattern == null ? FillPatternType.NO_FILL : pattern);
        Color fg = (foreground == null ? Color.DEFAULT : foreground);
        Color bg = (background == null ? Color.DEFAULT : background);
        if (p == FillPatternType.NO_FILL || p == FillPatternType.SOLID_FOREGROUND) {
            if (! fg.isDefault() && ! bg.isDefault() && p == FillPatternType.SOLID_FOREGROUND) {
                // A solid fill with both colors is painted with the foreground, which the user probably meant
                // to be the background.
                Color temp = fg;
                fg = bg;
                bg = temp;
            } else if (fg.isDefault() && ! bg.isDefault()) {
                // A lone background color means the user wanted a solid fill of that color.
                fg = bg;
                bg = Color.DEFAULT;
                p = FillPatternType.SOLID_FOREGROUND;
            } else if (! fg.isDefault() && bg.isDefault())
                p = FillPatternType.SOLID_FOREGROUND;
        }
        Fill retVal;
        if (p == FillPatternType.NO_FILL && fg.isDefault() && bg.isDefault())
            retVal = NONE;
        else
            retVal = new Fill(p, fg, bg);
        return retVal;
    }

    /**
     * @return the fill pattern
     */
    public FillPatternType getPattern() {
        return this.pattern;
    }

    /**
     * @return the foreground color
     */
    public Color getForeground() {
        return this.foreground;
    }

    /**
     * @return the background color
     */
    public Color getBackground() {
        return this.background;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.pattern, this.foreground, this.background);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Fill))
            return false;
        Fill other = (Fill) obj;
        return this.pattern == other.pattern && this.foreground.equals(other.foreground)
                && this.background.equals(other.background);
    }

}
