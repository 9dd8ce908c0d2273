/**
 *
 */
package org.theseed.xlsx;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.poi.ss.usermodel.FormulaError;
import org.theseed.xlsx.utils.CellUtils;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * This object writes the XML part for a single frozen worksheet.  The elements are written in the order the
 * schema requires, and optional elements are omitted when the sheet does not use them.
 *
 * @author Bruce Parrello
 *
 */
public class WorksheetWriter implements XmlWriter.Body {

    // FIELDS
    /** worksheet to write */
    private final Worksheet sheet;
    /** TRUE if this is the selected tab */
    private final boolean selected;

    /** default row height in points */
    private static final String DEFAULT_ROW_HEIGHT = "15";

    /**
     * Construct a writer for a worksheet.
     *
     * @param sheet			worksheet to write
     * @param selected		TRUE if the sheet is the active tab
     */
    public WorksheetWriter(Worksheet sheet, boolean selected) {
        this.sheet = sheet;
        this.selected = selected;
    }

    @Override
    public void write(XmlWriter writer) throws IOException {
        writer.startTag("worksheet", List.of(XmlWriter.attr("xmlns", "http://schemas.openxmlformats.org/spreadsheetml/2006/main"),
                XmlWriter.attr("xmlns:r", "http://schemas.openxmlformats.org/officeDocument/2006/relationships")));
        PageSetup setup = this.sheet.getPageSettings();
        this.writeSheetPr(writer, setup);
        CellRange dimension = this.sheet.getDimension();
        writer.emptyTag("dimension", List.of(XmlWriter.attr("ref", (dimension == null ? "A1" : dimension.getRef()))));
        this.writeSheetViews(writer);
        writer.emptyTag("sheetFormatPr", List.of(XmlWriter.attr("defaultRowHeight", DEFAULT_ROW_HEIGHT)));
        this.writeCols(writer);
        this.writeSheetData(writer);
        CellRange filter = this.sheet.getAutofilter();
        if (filter != null)
            writer.emptyTag("autoFilter", List.of(XmlWriter.attr("ref", filter.getRef())));
        this.writeMergeCells(writer);
        this.writePageElements(writer, setup);
        writer.endTag("worksheet");
    }

    /**
     * Write the sheet properties, if there are any.
     *
     * @param writer	output writer
     * @param setup		page setup for the sheet
     *
     * @throws IOException
     */
    private void writeSheetPr(XmlWriter writer, PageSetup setup) throws IOException {
        boolean hasColor = ! this.sheet.getTabColor().isDefault();
        if (hasColor || setup.isFitToPage()) {
            writer.startTag("sheetPr");
            if (hasColor)
                writer.emptyTag("tabColor", this.sheet.getTabColor().toAttributes());
            if (setup.isFitToPage())
                writer.emptyTag("pageSetUpPr", List.of(XmlWriter.attr("fitToPage", 1)));
            writer.endTag("sheetPr");
        }
    }

    /**
     * Write the sheet view, including any frozen panes.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    private void writeSheetViews(XmlWriter writer) throws IOException {
        writer.startTag("sheetViews");
        List<Pair<String, String>> attributes = new ArrayList<>(5);
        if (! this.sheet.isGridlinesVisible())
            attributes.add(XmlWriter.attr("showGridLines", 0));
        if (this.selected)
            attributes.add(XmlWriter.attr("tabSelected", 1));
        int zoom = this.sheet.getZoom();
        if (zoom != Worksheet.DEFAULT_ZOOM) {
            attributes.add(XmlWriter.attr("zoomScale", zoom));
            attributes.add(XmlWriter.attr("zoomScaleNormal", zoom));
        }
        attributes.add(XmlWriter.attr("workbookViewId", 0));
        int rows = this.sheet.getFrozenRows();
        int cols = this.sheet.getFrozenCols();
        if (rows == 0 && cols == 0)
            writer.emptyTag("sheetView", attributes);
        else {
            writer.startTag("sheetView", attributes);
            String topLeft = CellUtils.cellName(rows, cols);
            if (rows > 0 && cols > 0) {
                writer.emptyTag("pane", List.of(XmlWriter.attr("xSplit", cols), XmlWriter.attr("ySplit", rows),
                        XmlWriter.attr("topLeftCell", topLeft), XmlWriter.attr("activePane", "bottomRight"),
                        XmlWriter.attr("state", "frozen")));
                String topRight = CellUtils.cellName(0, cols);
                String bottomLeft = CellUtils.cellName(rows, 0);
                writer.emptyTag("selection", List.of(XmlWriter.attr("pane", "topRight"),
                        XmlWriter.attr("activeCell", topRight), XmlWriter.attr("sqref", topRight)));
                writer.emptyTag("selection", List.of(XmlWriter.attr("pane", "bottomLeft"),
                        XmlWriter.attr("activeCell", bottomLeft), XmlWriter.attr("sqref", bottomLeft)));
                writer.emptyTag("selection", List.of(XmlWriter.attr("pane", "bottomRight")));
            } else if (rows > 0) {
                writer.emptyTag("pane", List.of(XmlWriter.attr("ySplit", rows), XmlWriter.attr("topLeftCell", topLeft),
                        XmlWriter.attr("activePane", "bottomLeft"), XmlWriter.attr("state", "frozen")));
                writer.emptyTag("selection", List.of(XmlWriter.attr("pane", "bottomLeft")));
            } else {
                writer.emptyTag("pane", List.of(XmlWriter.attr("xSplit", cols), XmlWriter.attr("topLeftCell", topLeft),
                        XmlWriter.attr("activePane", "topRight"), XmlWriter.attr("state", "frozen")));
                writer.emptyTag("selection", List.of(XmlWriter.attr("pane", "topRight")));
            }
            writer.endTag("sheetView");
        }
        writer.endTag("sheetViews");
    }

    /**
     * Write the column properties.  Adjacent columns with identical properties are combined into a single
     * run.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    private void writeCols(XmlWriter writer) throws IOException {
        var columns = this.sheet.getColumns();
        if (! columns.isEmpty()) {
            writer.startTag("cols");
            int runStart = -1;
            int runEnd = -1;
            ColumnInfo runInfo = null;
            for (Map.Entry<Integer, ColumnInfo> entry : columns.entrySet()) {
                int col = entry.getKey();
                ColumnInfo info = entry.getValue();
                if (runInfo != null && col == runEnd + 1 && info.equals(runInfo))
                    runEnd = col;
                else {
                    if (runInfo != null)
                        writeCol(writer, runStart, runEnd, runInfo);
                    runStart = col;
                    runEnd = col;
                    runInfo = info;
                }
            }
            writeCol(writer, runStart, runEnd, runInfo);
            writer.endTag("cols");
        }
    }

    /**
     * Write a single column run.
     *
     * @param writer	output writer
     * @param first		first column index
     * @param last		last column index
     * @param info		properties of the columns in the run
     *
     * @throws IOException
     */
    private static void writeCol(XmlWriter writer, int first, int last, ColumnInfo info) throws IOException {
        List<Pair<String, String>> attributes = new ArrayList<>(6);
        attributes.add(XmlWriter.attr("min", first + 1));
        attributes.add(XmlWriter.attr("max", last + 1));
        double width = (info.hasWidth() ? info.getWidth() : ColumnInfo.DEFAULT_WIDTH);
        attributes.add(XmlWriter.attr("width", CellUtils.formatNumber(width)));
        if (info.getStyleId() != 0)
            attributes.add(XmlWriter.attr("style", info.getStyleId()));
        if (info.isHidden())
            attributes.add(XmlWriter.attr("hidden", 1));
        if (info.hasWidth())
            attributes.add(XmlWriter.attr("customWidth", 1));
        writer.emptyTag("col", attributes);
    }

    /**
     * Write the cell data.  Rows are written in ascending order, each with its cells in ascending order.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    private void writeSheetData(XmlWriter writer) throws IOException {
        var rows = this.sheet.getRows();
        if (rows.isEmpty())
            writer.emptyTag("sheetData");
        else {
            writer.startTag("sheetData");
            for (Map.Entry<Integer, RowInfo> rowEntry : rows.entrySet()) {
                int r = rowEntry.getKey();
                RowInfo row = rowEntry.getValue();
                List<Pair<String, String>> attributes = new ArrayList<>(6);
                attributes.add(XmlWriter.attr("r", r + 1));
                if (row.getStyleId() != 0) {
                    attributes.add(XmlWriter.attr("s", row.getStyleId()));
                    attributes.add(XmlWriter.attr("customFormat", 1));
                }
                if (row.hasHeight()) {
                    attributes.add(XmlWriter.attr("ht", CellUtils.formatNumber(row.getHeight())));
                    attributes.add(XmlWriter.attr("customHeight", 1));
                }
                if (row.isHidden())
                    attributes.add(XmlWriter.attr("hidden", 1));
                var cells = row.getCells();
                if (cells.isEmpty())
                    writer.emptyTag("row", attributes);
                else {
                    writer.startTag("row", attributes);
                    for (Map.Entry<Integer, Cell> cellEntry : cells.entrySet())
                        writeCell(writer, CellUtils.cellName(r, cellEntry.getKey()), cellEntry.getValue());
                    writer.endTag("row");
                }
            }
            writer.endTag("sheetData");
        }
    }

    /**
     * Write a single cell.
     *
     * @param writer	output writer
     * @param ref		cell reference
     * @param cell		cell to write
     *
     * @throws IOException
     */
    private static void writeCell(XmlWriter writer, String ref, Cell cell) throws IOException {
        List<Pair<String, String>> attributes = new ArrayList<>(3);
        attributes.add(XmlWriter.attr("r", ref));
        if (cell.getStyleId() != 0)
            attributes.add(XmlWriter.attr("s", cell.getStyleId()));
        switch (cell.getType()) {
        case NUMBER -> {
            writer.startTag("c", attributes);
            writer.dataElement("v", CellUtils.formatNumber(cell.getNumber()));
            writer.endTag("c");
        }
        case STRING -> {
            attributes.add(XmlWriter.attr("t", "s"));
            writer.startTag("c", attributes);
            writer.dataElement("v", Integer.toString(cell.getStringIndex()));
            writer.endTag("c");
        }
        case BOOLEAN -> {
            attributes.add(XmlWriter.attr("t", "b"));
            writer.startTag("c", attributes);
            writer.dataElement("v", (cell.getBoolean() ? "1" : "0"));
            writer.endTag("c");
        }
        case FORMULA -> writeFormula(writer, attributes, cell);
        case ERROR -> {
            attributes.add(XmlWriter.attr("t", "e"));
            writer.startTag("c", attributes);
            writer.dataElement("v", cell.getError().getString());
            writer.endTag("c");
        }
        default -> writer.emptyTag("c", attributes);
        }
    }

    /**
     * Write a formula cell.  The type of the cached result determines the cell type attribute.
     *
     * @param writer		output writer
     * @param attributes	cell attributes computed so far
     * @param cell			cell to write
     *
     * @throws IOException
     */
    private static void writeFormula(XmlWriter writer, List<Pair<String, String>> attributes, Cell cell)
            throws IOException {
        String result = cell.getResult();
        String value = result;
        if (result.equalsIgnoreCase("TRUE") || result.equalsIgnoreCase("FALSE")) {
            attributes.add(XmlWriter.attr("t", "b"));
            value = (result.equalsIgnoreCase("TRUE") ? "1" : "0");
        } else if (isError(result))
            attributes.add(XmlWriter.attr("t", "e"));
        else if (! isNumeric(result))
            attributes.add(XmlWriter.attr("t", "str"));
        writer.startTag("c", attributes);
        writer.dataElement("f", cell.getFormula());
        writer.dataElement("v", value);
        writer.endTag("c");
    }

    /**
     * @return TRUE if a cached result is an error value
     *
     * @param result	result string to check
     */
    private static boolean isError(String result) {
        boolean retVal = false;
        if (result.startsWith("#")) {
            try {
                FormulaError.forString(result);
                retVal = true;
            } catch (IllegalArgumentException e) {
                // Not a recognized error string, so it is plain text.
                retVal = false;
            }
        }
        return retVal;
    }

    /**
     * @return TRUE if a cached result is a plain number
     *
     * @param result	result string to check
     */
    private static boolean isNumeric(String result) {
        boolean retVal;
        try {
            new BigDecimal(result);
            retVal = true;
        } catch (NumberFormatException e) {
            retVal = false;
        }
        return retVal;
    }

    /**
     * Write the merged ranges.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    private void writeMergeCells(XmlWriter writer) throws IOException {
        List<CellRange> merges = this.sheet.getMerges();
        if (! merges.isEmpty()) {
            writer.startTag("mergeCells", List.of(XmlWriter.attr("count", merges.size())));
            for (CellRange merge : merges)
                writer.emptyTag("mergeCell", List.of(XmlWriter.attr("ref", merge.getRef())));
            writer.endTag("mergeCells");
        }
    }

    /**
     * Write the print options, margins, page setup and header/footer.
     *
     * @param writer	output writer
     * @param setup		page setup for the sheet
     *
     * @throws IOException
     */
    private void writePageElements(XmlWriter writer, PageSetup setup) throws IOException {
        if (setup.hasPrintOptions()) {
            List<Pair<String, String>> attributes = new ArrayList<>(3);
            if (setup.isCenterHorizontally())
                attributes.add(XmlWriter.attr("horizontalCentered", 1));
            if (setup.isCenterVertically())
                attributes.add(XmlWriter.attr("verticalCentered", 1));
            if (setup.isPrintGridlines())
                attributes.add(XmlWriter.attr("gridLines", 1));
            writer.emptyTag("printOptions", attributes);
        }
        writer.emptyTag("pageMargins", List.of(
                XmlWriter.attr("left", CellUtils.formatNumber(setup.getLeftMargin())),
                XmlWriter.attr("right", CellUtils.formatNumber(setup.getRightMargin())),
                XmlWriter.attr("top", CellUtils.formatNumber(setup.getTopMargin())),
                XmlWriter.attr("bottom", CellUtils.formatNumber(setup.getBottomMargin())),
                XmlWriter.attr("header", CellUtils.formatNumber(setup.getHeaderMargin())),
                XmlWriter.attr("footer", CellUtils.formatNumber(setup.getFooterMargin()))));
        if (setup.isCustomized()) {
            List<Pair<String, String>> attributes = new ArrayList<>(4);
            if (setup.getPaperSize() != 0)
                attributes.add(XmlWriter.attr("paperSize", setup.getPaperSize()));
            if (setup.isFitToPage()) {
                if (setup.getFitWidth() != 1)
                    attributes.add(XmlWriter.attr("fitToWidth", setup.getFitWidth()));
                if (setup.getFitHeight() != 1)
                    attributes.add(XmlWriter.attr("fitToHeight", setup.getFitHeight()));
            }
            attributes.add(XmlWriter.attr("orientation", (setup.isLandscape() ? "landscape" : "portrait")));
            writer.emptyTag("pageSetup", attributes);
        }
        if (setup.hasHeaderFooter()) {
            writer.startTag("headerFooter");
            if (! setup.getHeader().isEmpty())
                writer.dataElement("oddHeader", setup.getHeader());
            if (! setup.getFooter().isEmpty())
                writer.dataElement("oddFooter", setup.getFooter());
            writer.endTag("headerFooter");
        }
    }

}
