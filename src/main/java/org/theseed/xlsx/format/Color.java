/**
 *
 */
package org.theseed.xlsx.format;

import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * This is an immutable color descriptor.  A color is either the default (automatic) color, an RGB color,
 * or one of the legacy indexed palette colors.
 *
 * @author Bruce Parrello
 *
 */
public final class Color {

    /**
     * This enum describes the color types.
     */
    public static enum Type {
        DEFAULT, RGB, INDEXED;
    }

    // FIELDS
    /** color type */
    private final Type type;
    /** color value (RGB or palette index) */
    private final int value;

    /** the default color */
    public static final Color DEFAULT = new Color(Type.DEFAULT, 0);
    /** black */
    public static final Color BLACK = rgb(0x000000);
    /** white */
    public static final Color WHITE = rgb(0xFFFFFF);
    /** red */
    public static final Color RED = rgb(0xFF0000);
    /** green */
    public static final Color GREEN = rgb(0x00FF00);
    /** blue */
    public static final Color BLUE = rgb(0x0000FF);
    /** yellow */
    public static final Color YELLOW = rgb(0xFFFF00);

    private Color(Type type, int value) {
        this.type = type;
        this.value = value;
    }

    /**
     * @return an RGB color
     *
     * @param rgb	color value, in the form 0xRRGGBB
     */
    public static Color rgb(int rgb) {
        if (rgb < 0 || rgb > 0xFFFFFF)
            throw new IllegalArgumentException("RGB color value " + Integer.toHexString(rgb) + " is out of range.");
        return new Color(Type.RGB, rgb);
    }

    /**
     * @return a palette color
     *
     * @param color		indexed color from the legacy palette
     */
    public static Color indexed(IndexedColors color) {
        return new Color(Type.INDEXED, color.getIndex());
    }

    /**
     * @return TRUE if this is the default color
     */
    public boolean isDefault() {
        return this.type == Type.DEFAULT;
    }

    /**
     * @return the color type
     */
    public Type getType() {
        return this.type;
    }

    /**
     * @return the RGB value or palette index
     */
    public int getValue() {
        return this.value;
    }

    /**
     * @return the ARGB hex string for an RGB color
     */
    public String toArgb() {
        return String.format("FF%06X", this.value);
    }

    /**
     * Compute the XML attributes for this color.  The default color is written as the automatic color.
     *
     * @return a list of attributes for a color element
     */
    public List<Pair<String, String>> toAttributes() {
        List<Pair<String, String>> retVal;
        switch (this.type) {
        case RGB -> retVal = List.of(XmlWriter.attr("rgb", this.toArgb()));
        case INDEXED -> retVal = List.of(XmlWriter.attr("indexed", this.value));
        default -> retVal = List.of(XmlWriter.attr("auto", 1));
        }
        return retVal;
    }

    @Override
    public int hashCode() {
        return this.type.hashCode() * 31 + this.value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Color))
            return false;
        Color other = (Color) obj;
        return this.type == other.type && this.value == other.value;
    }

    @Override
    public String toString() {
        String retVal;
        switch (this.type) {
        case RGB -> retVal = "#" + String.format("%06X", this.value);
        case INDEXED -> retVal = "indexed(" + this.value + ")";
        default -> retVal = "default";
        }
        return retVal;
    }

}
