/**
 *
 */
package org.theseed.xlsx.format;

import java.util.Objects;

import org.apache.poi.ss.usermodel.FontUnderline;

/**
 * This is an immutable font descriptor.  Fonts are deduplicated into their own catalog in the style sheet,
 * so many formats can share one font entry.
 *
 * @author Bruce Parrello
 *
 */
public final class Font {

    // FIELDS
    /** font name */
    private final String name;
    /** point size */
    private final double size;
    /** font family number */
    private final int family;
    /** TRUE for bold */
    private final boolean bold;
    /** TRUE for italic */
    private final boolean italic;
    /** TRUE for strike-through */
    private final boolean strikeout;
    /** underline type */
    private final FontUnderline underline;
    /** font color */
    private final Color color;

    /** default font name */
    public static final String DEFAULT_NAME = "Calibri";
    /** default font size */
    public static final double DEFAULT_SIZE = 11.0;
    /** default font family */
    public static final int DEFAULT_FAMILY = 2;
    /** the default font */
    public static final Font DEFAULT = new Font(DEFAULT_NAME, DEFAULT_SIZE, DEFAULT_FAMILY, false, false, false,
            FontUnderline.NONE, Color.DEFAULT);

    /**
     * Construct a font descriptor.
     *
     * @param name			font name
     * @param size			point size
     * @param family		font family number
     * @param bold			TRUE for bold
     * @param italic		TRUE for italic
     * @param strikeout		TRUE for strike-through
     * @param underline		underline type
     * @param color			font color
     */
    public Font(String name, double size, int family, boolean bold, boolean italic, boolean strikeout,
            FontUnderline underline, Color color) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Font name cannot be blank.");
        if (! (size >= 1.0 && size <= 409.0))
            throw new IllegalArgumentException("Font size " + size + " is outside the range 1 to 409.");
        this.name = name;
        this.size = size;
        this.family = family;
        this.bold = bold;
        this.italic = italic;
        this.strikeout = strikeout;
        this.underline = (underline == null ? FontUnderline.NONE : underline);
        this.color = (color == null ? Color.DEFAULT : color);
    }

    /**
     * @return the font name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the point size
     */
    public double getSize() {
        return this.size;
    }

    /**
     * @return the font family number
     */
    public int getFamily() {
        return this.family;
    }

    /**
     * @return TRUE for a bold font
     */
    public boolean isBold() {
        return this.bold;
    }

    /**
     * @return TRUE for an italic font
     */
    public boolean isItalic() {
        return this.italic;
    }

    /**
     * @return TRUE for a strike-through font
     */
    public boolean isStrikeout() {
        return this.strikeout;
    }

    /**
     * @return the underline type
     */
    public FontUnderline getUnderline() {
        return this.underline;
    }

    /**
     * @return the font color
     */
    public Color getColor() {
        return this.color;
    }

    /**
     * @return TRUE if this font uses the workbook's minor font scheme
     */
    public boolean isSchemeFont() {
        return this.name.equals(DEFAULT_NAME);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.size, this.family, this.bold, this.italic, this.strikeout,
                this.underline, this.color);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Font))
            return false;
        Font other = (Font) obj;
        return this.name.equals(other.name) && Double.compare(this.size, other.size) == 0
                && this.family == other.family && this.bold == other.bold && this.italic == other.italic
                && this.strikeout == other.strikeout && this.underline == other.underline
                && this.color.equals(other.color);
    }

}
