/**
 *
 */
package org.theseed.xlsx.format;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.FontUnderline;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.theseed.xlsx.utils.CellUtils;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * This object writes the style-sheet part of the package from a frozen format registry.
 *
 * @author Bruce Parrello
 *
 */
public class StylesWriter implements XmlWriter.Body {

    // FIELDS
    /** registry to write */
    private final FormatRegistry registry;

    /** pattern type names, indexed by POI fill pattern code */
    private static final String[] PATTERN_NAMES = new String[] { "none", "solid", "mediumGray", "darkGray",
            "lightGray", "darkHorizontal", "darkVertical", "darkDown", "darkUp", "darkGrid", "darkTrellis",
            "lightHorizontal", "lightVertical", "lightDown", "lightUp", "lightGrid", "lightTrellis", "gray125",
            "gray0625" };

    /**
     * Construct a style-sheet writer.
     *
     * @param registry	format registry to write
     */
    public StylesWriter(FormatRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void write(XmlWriter writer) throws IOException {
        writer.startTag("styleSheet", List.of(XmlWriter.attr("xmlns", "http://schemas.openxmlformats.org/spreadsheetml/2006/main")));
        this.writeNumFormats(writer);
        this.writeFonts(writer);
        this.writeFills(writer);
        this.writeBorders(writer);
        // There is only one master style.
        writer.startTag("cellStyleXfs", List.of(XmlWriter.attr("count", 1)));
        writer.emptyTag("xf", List.of(XmlWriter.attr("numFmtId", 0), XmlWriter.attr("fontId", 0),
                XmlWriter.attr("fillId", 0), XmlWriter.attr("borderId", 0)));
        writer.endTag("cellStyleXfs");
        this.writeCellXfs(writer);
        writer.startTag("cellStyles", List.of(XmlWriter.attr("count", 1)));
        writer.emptyTag("cellStyle", List.of(XmlWriter.attr("name", "Normal"), XmlWriter.attr("xfId", 0),
                XmlWriter.attr("builtinId", 0)));
        writer.endTag("cellStyles");
        writer.emptyTag("dxfs", List.of(XmlWriter.attr("count", 0)));
        writer.emptyTag("tableStyles", List.of(XmlWriter.attr("count", 0),
                XmlWriter.attr("defaultTableStyle", "TableStyleMedium9"),
                XmlWriter.attr("defaultPivotStyle", "PivotStyleLight16")));
        writer.endTag("styleSheet");
    }

    /**
     * Write the custom number formats.  The element is omitted if there are none.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    private void writeNumFormats(XmlWriter writer) throws IOException {
        List<String> formats = this.registry.getNumFormats();
        if (! formats.isEmpty()) {
            writer.startTag("numFmts", List.of(XmlWriter.attr("count", formats.size())));
            int id = FormatRegistry.FIRST_CUSTOM_NUM_FORMAT;
            for (String format : formats) {
                writer.emptyTag("numFmt", List.of(XmlWriter.attr("numFmtId", id), XmlWriter.attr("formatCode", format)));
                id++;
            }
            writer.endTag("numFmts");
        }
    }

    /**
     * Write the font catalog.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    private void writeFonts(XmlWriter writer) throws IOException {
        List<Font> fonts = this.registry.getFonts();
        writer.startTag("fonts", List.of(XmlWriter.attr("count", fonts.size())));
        for (Font font : fonts) {
            writer.startTag("font");
            if (font.isBold())
                writer.emptyTag("b");
            if (font.isItalic())
                writer.emptyTag("i");
            if (font.isStrikeout())
                writer.emptyTag("strike");
            FontUnderline underline = font.getUnderline();
            if (underline == FontUnderline.SINGLE)
                writer.emptyTag("u");
            else if (underline != FontUnderline.NONE)
                writer.emptyTag("u", List.of(XmlWriter.attr("val", underlineName(underline))));
            writer.emptyTag("sz", List.of(XmlWriter.attr("val", CellUtils.formatNumber(font.getSize()))));
            if (font.getColor().isDefault())
                writer.emptyTag("color", List.of(XmlWriter.attr("theme", 1)));
            else
                writer.emptyTag("color", font.getColor().toAttributes());
            writer.emptyTag("name", List.of(XmlWriter.attr("val", font.getName())));
            writer.emptyTag("family", List.of(XmlWriter.attr("val", font.getFamily())));
            if (font.isSchemeFont())
                writer.emptyTag("scheme", List.of(XmlWriter.attr("val", "minor")));
            writer.endTag("font");
        }
        writer.endTag("fonts");
    }

    /**
     * @return the file-format name of an underline type
     *
     * @param underline		underline type
     */
    private static String underlineName(FontUnderline underline) {
        String retVal;
        switch (underline) {
        case DOUBLE -> retVal = "double";
        case SINGLE_ACCOUNTING -> retVal = "singleAccounting";
        case DOUBLE_ACCOUNTING -> retVal = "doubleAccounting";
        default -> retVal = "single";
        }
        return retVal;
    }

    /**
     * Write the fill catalog.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    private void writeFills(XmlWriter writer) throws IOException {
        List<Fill> fills = this.registry.getFills();
        writer.startTag("fills", List.of(XmlWriter.attr("count", fills.size())));
        for (Fill fill : fills) {
            writer.startTag("fill");
            FillPatternType pattern = fill.getPattern();
            var patternAttr = List.of(XmlWriter.attr("patternType", PATTERN_NAMES[pattern.getCode()]));
            if (pattern == FillPatternType.NO_FILL || pattern == FillPatternType.LESS_DOTS
                    && fill.getForeground().isDefault() && fill.getBackground().isDefault())
                writer.emptyTag("patternFill", patternAttr);
            else {
                writer.startTag("patternFill", patternAttr);
                if (! fill.getForeground().isDefault())
                    writer.emptyTag("fgColor", fill.getForeground().toAttributes());
                if (fill.getBackground().isDefault())
                    writer.emptyTag("bgColor", List.of(XmlWriter.attr("indexed", 64)));
                else
                    writer.emptyTag("bgColor", fill.getBackground().toAttributes());
                writer.endTag("patternFill");
            }
            writer.endTag("fill");
        }
        writer.endTag("fills");
    }

    /**
     * Write the border catalog.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    private void writeBorders(XmlWriter writer) throws IOException {
        List<Border> borders = this.registry.getBorders();
        writer.startTag("borders", List.of(XmlWriter.attr("count", borders.size())));
        for (Border border : borders) {
            List<Pair<String, String>> attributes = new ArrayList<>(2);
            switch (border.getDirection()) {
            case UP -> attributes.add(XmlWriter.attr("diagonalUp", 1));
            case DOWN -> attributes.add(XmlWriter.attr("diagonalDown", 1));
            case BOTH -> {
                attributes.add(XmlWriter.attr("diagonalUp", 1));
                attributes.add(XmlWriter.attr("diagonalDown", 1));
            }
            default -> { }
            }
            writer.startTag("border", attributes);
            writeEdge(writer, "left", border.getLeft());
            writeEdge(writer, "right", border.getRight());
            writeEdge(writer, "top", border.getTop());
            writeEdge(writer, "bottom", border.getBottom());
            writeEdge(writer, "diagonal", border.getDiagonal());
            writer.endTag("border");
        }
        writer.endTag("borders");
    }

    /**
     * Write a single border edge.
     *
     * @param writer	output writer
     * @param tag		element name for the edge
     * @param edge		edge descriptor
     *
     * @throws IOException
     */
    private static void writeEdge(XmlWriter writer, String tag, Border.Edge edge) throws IOException {
        if (edge.isNone())
            writer.emptyTag(tag);
        else {
            writer.startTag(tag, List.of(XmlWriter.attr("style", borderStyleName(edge.getStyle()))));
            writer.emptyTag("color", edge.getColor().toAttributes());
            writer.endTag(tag);
        }
    }

    /**
     * @return the file-format name of a border line style
     *
     * @param style		line style
     */
    private static String borderStyleName(BorderStyle style) {
        String retVal;
        switch (style) {
        case THIN -> retVal = "thin";
        case MEDIUM -> retVal = "medium";
        case DASHED -> retVal = "dashed";
        case DOTTED -> retVal = "dotted";
        case THICK -> retVal = "thick";
        case DOUBLE -> retVal = "double";
        case HAIR -> retVal = "hair";
        case MEDIUM_DASHED -> retVal = "mediumDashed";
        case DASH_DOT -> retVal = "dashDot";
        case MEDIUM_DASH_DOT -> retVal = "mediumDashDot";
        case DASH_DOT_DOT -> retVal = "dashDotDot";
        case MEDIUM_DASH_DOT_DOT -> retVal = "mediumDashDotDot";
        case SLANTED_DASH_DOT -> retVal = "slantDashDot";
        default -> retVal = "none";
        }
        return retVal;
    }

    /**
     * Write the cell style records.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    private void writeCellXfs(XmlWriter writer) throws IOException {
        List<XfRecord> records = this.registry.getRecords();
        writer.startTag("cellXfs", List.of(XmlWriter.attr("count", records.size())));
        for (XfRecord record : records) {
            List<Pair<String, String>> attributes = new ArrayList<>(12);
            attributes.add(XmlWriter.attr("numFmtId", record.getNumFmtId()));
            attributes.add(XmlWriter.attr("fontId", record.getFontId()));
            attributes.add(XmlWriter.attr("fillId", record.getFillId()));
            attributes.add(XmlWriter.attr("borderId", record.getBorderId()));
            attributes.add(XmlWriter.attr("xfId", 0));
            if (record.isQuotePrefix())
                attributes.add(XmlWriter.attr("quotePrefix", 1));
            if (record.getNumFmtId() > 0)
                attributes.add(XmlWriter.attr("applyNumberFormat", 1));
            if (record.getFontId() > 0)
                attributes.add(XmlWriter.attr("applyFont", 1));
            if (record.getFillId() > 0)
                attributes.add(XmlWriter.attr("applyFill", 1));
            if (record.getBorderId() > 0)
                attributes.add(XmlWriter.attr("applyBorder", 1));
            Alignment alignment = record.getAlignment();
            if (! alignment.isDefault())
                attributes.add(XmlWriter.attr("applyAlignment", 1));
            if (record.hasProtection())
                attributes.add(XmlWriter.attr("applyProtection", 1));
            if (alignment.isDefault() && ! record.hasProtection())
                writer.emptyTag("xf", attributes);
            else {
                writer.startTag("xf", attributes);
                if (! alignment.isDefault())
                    writeAlignment(writer, alignment);
                if (record.hasProtection()) {
                    List<Pair<String, String>> protection = new ArrayList<>(2);
                    if (! record.isLocked())
                        protection.add(XmlWriter.attr("locked", 0));
                    if (record.isHidden())
                        protection.add(XmlWriter.attr("hidden", 1));
                    writer.emptyTag("protection", protection);
                }
                writer.endTag("xf");
            }
        }
        writer.endTag("cellXfs");
    }

    /**
     * Write an alignment element.
     *
     * @param writer		output writer
     * @param alignment		alignment descriptor
     *
     * @throws IOException
     */
    private static void writeAlignment(XmlWriter writer, Alignment alignment) throws IOException {
        List<Pair<String, String>> attributes = new ArrayList<>(6);
        HorizontalAlignment h = alignment.getHorizontal();
        if (h != HorizontalAlignment.GENERAL)
            attributes.add(XmlWriter.attr("horizontal", horizontalName(h)));
        VerticalAlignment v = alignment.getVertical();
        if (v != VerticalAlignment.BOTTOM)
            attributes.add(XmlWriter.attr("vertical", verticalName(v)));
        if (alignment.getRotation() != 0)
            attributes.add(XmlWriter.attr("textRotation", alignment.getRotation()));
        if (alignment.isWrap())
            attributes.add(XmlWriter.attr("wrapText", 1));
        if (alignment.getIndent() != 0)
            attributes.add(XmlWriter.attr("indent", alignment.getIndent()));
        if (alignment.isShrink())
            attributes.add(XmlWriter.attr("shrinkToFit", 1));
        writer.emptyTag("alignment", attributes);
    }

    /**
     * @return the file-format name of a horizontal alignment
     *
     * @param h		horizontal alignment
     */
    private static String horizontalName(HorizontalAlignment h) {
        String retVal;
        switch (h) {
        case LEFT -> retVal = "left";
        case CENTER -> retVal = "center";
        case RIGHT -> retVal = "right";
        case FILL -> retVal = "fill";
        case JUSTIFY -> retVal = "justify";
        case CENTER_SELECTION -> retVal = "centerContinuous";
        case DISTRIBUTED -> retVal = "distributed";
        default -> retVal = "general";
        }
        return retVal;
    }

    /**
     * @return the file-format name of a vertical alignment
     *
     * @param v		vertical alignment
     */
    private static String verticalName(VerticalAlignment v) {
        String retVal;
        switch (v) {
        case TOP -> retVal = "top";
        case CENTER -> retVal = "center";
        case JUSTIFY -> retVal = "justify";
        case DISTRIBUTED -> retVal = "distributed";
        default -> retVal = "bottom";
        }
        return retVal;
    }

}
