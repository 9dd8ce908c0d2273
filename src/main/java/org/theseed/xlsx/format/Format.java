/**
 *
 */
package org.theseed.xlsx.format;

import java.util.Objects;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.BuiltinFormats;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.FontUnderline;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;

/**
 * This is an immutable cell format.  It combines a font, a fill, a border, an alignment, a number format and
 * the protection flags.  Formats are built with a {@link Builder}; every component is canonicalized when the
 * format is built, so two formats that look the same to a spreadsheet reader are always equal.  Because
 * formats cannot change after they are built, registering a format captures its state permanently.
 *
 * @author Bruce Parrello
 *
 */
public final class Format {

    // FIELDS
    /** font descriptor */
    private final Font font;
    /** fill descriptor */
    private final Fill fill;
    /** border descriptor */
    private final Border border;
    /** alignment descriptor */
    private final Alignment alignment;
    /** number format string */
    private final String numberFormat;
    /** TRUE if the cell is locked when the sheet is protected */
    private final boolean locked;
    /** TRUE if the formula is hidden when the sheet is protected */
    private final boolean hidden;
    /** TRUE to treat the cell content as text */
    private final boolean quotePrefix;

    /** name of the general number format */
    public static final String GENERAL = "General";
    /** the default format */
    public static final Format DEFAULT = builder().build();

    private Format(Builder builder) {
        this.font = new Font(builder.fontName, builder.fontSize, builder.fontFamily, builder.bold, builder.italic,
                builder.strikeout, builder.underline, builder.fontColor);
        this.fill = Fill.of(builder.pattern, builder.foreground, builder.background);
        this.border = Border.of(Border.Edge.of(builder.leftStyle, builder.leftColor),
                Border.Edge.of(builder.rightStyle, builder.rightColor),
                Border.Edge.of(builder.topStyle, builder.topColor),
                Border.Edge.of(builder.bottomStyle, builder.bottomColor),
                Border.Edge.of(builder.diagonalStyle, builder.diagonalColor), builder.diagonal);
        this.alignment = Alignment.of(builder.horizontal, builder.vertical, builder.wrap, builder.indent,
                builder.rotation, builder.shrink);
        this.numberFormat = builder.numberFormat;
        this.locked = builder.locked;
        this.hidden = builder.hidden;
        this.quotePrefix = builder.quotePrefix;
    }

    /**
     * @return a builder for a new format, initialized to the default format
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialized from this format
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * @return the font descriptor
     */
    public Font getFont() {
        return this.font;
    }

    /**
     * @return the fill descriptor
     */
    public Fill getFill() {
        return this.fill;
    }

    /**
     * @return the border descriptor
     */
    public Border getBorder() {
        return this.border;
    }

    /**
     * @return the alignment descriptor
     */
    public Alignment getAlignment() {
        return this.alignment;
    }

    /**
     * @return the number format string
     */
    public String getNumberFormat() {
        return this.numberFormat;
    }

    /**
     * @return TRUE if the cell is locked when the sheet is protected
     */
    public boolean isLocked() {
        return this.locked;
    }

    /**
     * @return TRUE if the formula is hidden when the sheet is protected
     */
    public boolean isHidden() {
        return this.hidden;
    }

    /**
     * @return TRUE if the cell content is treated as text
     */
    public boolean isQuotePrefix() {
        return this.quotePrefix;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.font, this.fill, this.border, this.alignment, this.numberFormat, this.locked,
                this.hidden, this.quotePrefix);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Format))
            return false;
        Format other = (Format) obj;
        return this.font.equals(other.font) && this.fill.equals(other.fill) && this.border.equals(other.border)
                && this.alignment.equals(other.alignment) && this.numberFormat.equals(other.numberFormat)
                && this.locked == other.locked && this.hidden == other.hidden
                && this.quotePrefix == other.quotePrefix;
    }

    /**
     * This class is used to build a format.  The setters return the builder so they can be chained.
     */
    public static class Builder {

        private String fontName;
        private double fontSize;
        private int fontFamily;
        private boolean bold;
        private boolean italic;
        private boolean strikeout;
        private FontUnderline underline;
        private Color fontColor;
        private FillPatternType pattern;
        private Color foreground;
        private Color background;
        private BorderStyle leftStyle;
        private Color leftColor;
        private BorderStyle rightStyle;
        private Color rightColor;
        private BorderStyle topStyle;
        private Color topColor;
        private BorderStyle bottomStyle;
        private Color bottomColor;
        private BorderStyle diagonalStyle;
        private Color diagonalColor;
        private Border.Diagonal diagonal;
        private HorizontalAlignment horizontal;
        private VerticalAlignment vertical;
        private boolean wrap;
        private int indent;
        private int rotation;
        private boolean shrink;
        private String numberFormat;
        private boolean locked;
        private boolean hidden;
        private boolean quotePrefix;

        /**
         * Create a builder for the default format.
         */
        protected Builder() {
            this.fontName = Font.DEFAULT_NAME;
            this.fontSize = Font.DEFAULT_SIZE;
            this.fontFamily = Font.DEFAULT_FAMILY;
            this.underline = FontUnderline.NONE;
            this.fontColor = Color.DEFAULT;
            this.pattern = FillPatternType.NO_FILL;
            this.foreground = Color.DEFAULT;
            this.background = Color.DEFAULT;
            this.leftStyle = BorderStyle.NONE;
            this.rightStyle = BorderStyle.NONE;
            this.topStyle = BorderStyle.NONE;
            this.bottomStyle = BorderStyle.NONE;
            this.diagonalStyle = BorderStyle.NONE;
            this.leftColor = Color.DEFAULT;
            this.rightColor = Color.DEFAULT;
            this.topColor = Color.DEFAULT;
            this.bottomColor = Color.DEFAULT;
            this.diagonalColor = Color.DEFAULT;
            this.diagonal = Border.Diagonal.NONE;
            this.horizontal = HorizontalAlignment.GENERAL;
            this.vertical = VerticalAlignment.BOTTOM;
            this.numberFormat = GENERAL;
            this.locked = true;
        }

        /**
         * Create a builder that copies an existing format.
         *
         * @param format	format to copy
         */
        protected Builder(Format format) {
            Font f = format.font;
            this.fontName = f.getName();
            this.fontSize = f.getSize();
            this.fontFamily = f.getFamily();
            this.bold = f.isBold();
            this.italic = f.isItalic();
            this.strikeout = f.isStrikeout();
            this.underline = f.getUnderline();
            this.fontColor = f.getColor();
            this.pattern = format.fill.getPattern();
            this.foreground = format.fill.getForeground();
            this.background = format.fill.getBackground();
            Border b = format.border;
            this.leftStyle = b.getLeft().getStyle();
            this.leftColor = b.getLeft().getColor();
            this.rightStyle = b.getRight().getStyle();
            this.rightColor = b.getRight().getColor();
            this.topStyle = b.getTop().getStyle();
            this.topColor = b.getTop().getColor();
            this.bottomStyle = b.getBottom().getStyle();
            this.bottomColor = b.getBottom().getColor();
            this.diagonalStyle = b.getDiagonal().getStyle();
            this.diagonalColor = b.getDiagonal().getColor();
            this.diagonal = b.getDirection();
            Alignment a = format.alignment;
            this.horizontal = a.getHorizontal();
            this.vertical = a.getVertical();
            this.wrap = a.isWrap();
            this.indent = a.getIndent();
            int r = a.getRotation();
            this.rotation = (r == Alignment.STACKED ? 270 : (r > 90 ? 90 - r : r));
            this.shrink = a.isShrink();
            this.numberFormat = format.numberFormat;
            this.locked = format.locked;
            this.hidden = format.hidden;
            this.quotePrefix = format.quotePrefix;
        }

        public Builder setFontName(String name) {
            this.fontName = name;
            return this;
        }

        public Builder setFontSize(double size) {
            this.fontSize = size;
            return this;
        }

        public Builder setFontFamily(int family) {
            this.fontFamily = family;
            return this;
        }

        public Builder setBold() {
            this.bold = true;
            return this;
        }

        public Builder setItalic() {
            this.italic = true;
            return this;
        }

        public Builder setStrikeout() {
            this.strikeout = true;
            return this;
        }

        public Builder setUnderline(FontUnderline underline) {
            this.underline = underline;
            return this;
        }

        public Builder setFontColor(Color color) {
            this.fontColor = color;
            return this;
        }

        public Builder setFillPattern(FillPatternType pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder setFillForegroundColor(Color color) {
            this.foreground = color;
            return this;
        }

        public Builder setFillBackgroundColor(Color color) {
            this.background = color;
            return this;
        }

        /**
         * Set the same line style on all four edges.
         *
         * @param style		line style
         */
        public Builder setBorder(BorderStyle style) {
            this.leftStyle = style;
            this.rightStyle = style;
            this.topStyle = style;
            this.bottomStyle = style;
            return this;
        }

        /**
         * Set the same line color on all four edges.
         *
         * @param color		line color
         */
        public Builder setBorderColor(Color color) {
            this.leftColor = color;
            this.rightColor = color;
            this.topColor = color;
            this.bottomColor = color;
            return this;
        }

        public Builder setBorderLeft(BorderStyle style, Color color) {
            this.leftStyle = style;
            this.leftColor = color;
            return this;
        }

        public Builder setBorderRight(BorderStyle style, Color color) {
            this.rightStyle = style;
            this.rightColor = color;
            return this;
        }

        public Builder setBorderTop(BorderStyle style, Color color) {
            this.topStyle = style;
            this.topColor = color;
            return this;
        }

        public Builder setBorderBottom(BorderStyle style, Color color) {
            this.bottomStyle = style;
            this.bottomColor = color;
            return this;
        }

        public Builder setBorderDiagonal(BorderStyle style, Color color, Border.Diagonal direction) {
            this.diagonalStyle = style;
            this.diagonalColor = color;
            this.diagonal = direction;
            return this;
        }

        public Builder setAlignment(HorizontalAlignment alignment) {
            this.horizontal = alignment;
            return this;
        }

        public Builder setVerticalAlignment(VerticalAlignment alignment) {
            this.vertical = alignment;
            return this;
        }

        public Builder setWrapText() {
            this.wrap = true;
            return this;
        }

        public Builder setIndent(int indent) {
            this.indent = indent;
            return this;
        }

        /**
         * Specify the text rotation.
         *
         * @param angle		angle in degrees, from -90 to 90, or 270 for stacked text
         */
        public Builder setRotation(int angle) {
            this.rotation = angle;
            return this;
        }

        public Builder setShrinkToFit() {
            this.shrink = true;
            return this;
        }

        /**
         * Specify the number format string.
         *
         * @param format	number format, such as "0.00" (NULL or empty for general)
         */
        public Builder setNumberFormat(String format) {
            if (format == null || format.isEmpty() || format.equalsIgnoreCase(GENERAL))
                this.numberFormat = GENERAL;
            else
                this.numberFormat = format;
            return this;
        }

        /**
         * Specify one of the built-in number formats by index.
         *
         * @param index		built-in format index
         */
        public Builder setNumberFormatIndex(int index) {
            String format = BuiltinFormats.getBuiltinFormat(index);
            if (format == null)
                throw new IllegalArgumentException("There is no built-in number format with index " + index + ".");
            return this.setNumberFormat(format);
        }

        public Builder setLocked(boolean locked) {
            this.locked = locked;
            return this;
        }

        public Builder setHidden(boolean hidden) {
            this.hidden = hidden;
            return this;
        }

        public Builder setQuotePrefix() {
            this.quotePrefix = true;
            return this;
        }

        /**
         * @return the format described by this builder
         */
        public Format build() {
            return new Format(this);
        }

    }

}
