/**
 *
 */
package org.theseed.xlsx;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.FormulaError;
import org.junit.jupiter.api.Test;
import org.theseed.xlsx.format.Color;
import org.theseed.xlsx.format.Format;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * Tests for the worksheet model and its XML.
 *
 * @author Bruce Parrello
 *
 */
public class TestWorksheet {

    /**
     * @return the worksheet XML for a sheet
     *
     * @param sheet		sheet to write
     * @param selected	TRUE if the sheet is the active tab
     */
    private static String sheetXml(Worksheet sheet, boolean selected) throws IOException {
        return new String(XmlWriter.toBytes(new WorksheetWriter(sheet, selected)), StandardCharsets.UTF_8);
    }

    @Test
    public void testCellLimits() throws XlsxException {
        Workbook modern = new Workbook();
        Worksheet sheet = modern.addWorksheet();
        int maxRows = SpreadsheetVersion.EXCEL2007.getMaxRows();
        int maxCols = SpreadsheetVersion.EXCEL2007.getMaxColumns();
        sheet.setNumber(maxRows - 1, maxCols - 1, 1.0, null);
        assertThrows(XlsxRangeException.class, () -> sheet.setNumber(maxRows, 0, 1.0, null));
        assertThrows(XlsxRangeException.class, () -> sheet.setNumber(0, maxCols, 1.0, null));
        assertThrows(XlsxRangeException.class, () -> sheet.setString(-1, 0, "x", null));
        Workbook old = new Workbook(WorkbookOptions.builder().setVersion(SpreadsheetVersion.EXCEL97).build());
        Worksheet oldSheet = old.addWorksheet();
        assertThrows(XlsxRangeException.class, () -> oldSheet.setNumber(65536, 0, 1.0, null));
        assertThrows(XlsxRangeException.class, () -> oldSheet.setNumber(0, 256, 1.0, null));
        oldSheet.setNumber(65535, 255, 1.0, null);
        assertThat(oldSheet.getDimension().getRef(), equalTo("IV65536"));
    }

    @Test
    public void testCellTypes() throws XlsxException {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.addWorksheet("Data");
        sheet.setCell(0, 0, "A", null);
        sheet.setCell(0, 1, "B", null);
        sheet.setCell(0, 2, "A", null);
        assertThat(sheet.getCell(0, 0).getStringIndex(), equalTo(0));
        assertThat(sheet.getCell(0, 1).getStringIndex(), equalTo(1));
        assertThat(sheet.getCell(0, 2).getStringIndex(), equalTo(0));
        sheet.setCell(1, 0, 42, null);
        sheet.setCell(1, 1, Boolean.TRUE, null);
        sheet.setCell(1, 2, FormulaError.DIV0, null);
        sheet.setCell(1, 3, null, null);
        assertThat(sheet.getCell(1, 0).getType(), equalTo(CellType.NUMBER));
        assertThat(sheet.getCell(1, 0).getNumber(), equalTo(42.0));
        assertThat(sheet.getCell(1, 1).getBoolean(), equalTo(true));
        assertThat(sheet.getCell(1, 2).getError(), equalTo(FormulaError.DIV0));
        assertThat(sheet.getCell(1, 3).getType(), equalTo(CellType.BLANK));
        assertThat(sheet.getCell(5, 5), nullValue());
        assertThrows(IllegalArgumentException.class, () -> sheet.setCell(2, 0, new Object(), null));
        assertThrows(XlsxRangeException.class, () -> sheet.setNumber(2, 0, Double.NaN, null));
        assertThrows(XlsxRangeException.class, () -> sheet.setNumber(2, 0, Double.POSITIVE_INFINITY, null));
        // The last write to a cell wins.
        sheet.setNumber(0, 0, 3.5, null);
        assertThat(sheet.getCell(0, 0).getType(), equalTo(CellType.NUMBER));
        assertThat(sheet.countStringCells(), equalTo(2L));
    }

    @Test
    public void testFormulas() throws XlsxException, IOException {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.addWorksheet();
        sheet.setFormula(0, 0, "=SUM(B1:B3)", null);
        assertThat(sheet.getCell(0, 0).getFormula(), equalTo("SUM(B1:B3)"));
        assertThat(sheet.getCell(0, 0).getResult(), equalTo("0"));
        sheet.setFormula(0, 1, "IF(A1>0,\"yes\",\"no\")", "yes", null);
        sheet.setFormula(0, 2, "A1>0", "TRUE", null);
        sheet.setFormula(0, 3, "1/0", "#DIV/0!", null);
        assertThrows(XlsxException.class, () -> sheet.setFormula(1, 0, "=", null));
        assertThrows(XlsxException.class, () -> sheet.setFormula(1, 0, "=\"abc", null));
        assertThrows(XlsxException.class, () -> sheet.setFormula(1, 0, "'My Sheet!A1", null));
        sheet.setFormula(1, 0, "'Bob''s Data'!A1&\"it's\"", null);
        // Only plain decimal text is a numeric result.
        sheet.setFormula(2, 0, "B1&\"d\"", "2d", null);
        sheet.setFormula(2, 1, "B1&\"p3\"", "0x1p3", null);
        sheet.setFormula(2, 2, "B1*2", "-1.5E3", null);
        String xml = sheetXml(sheet, true);
        assertThat(xml, containsString("<c r=\"A1\"><f>SUM(B1:B3)</f><v>0</v></c>"));
        assertThat(xml, containsString("<c r=\"B1\" t=\"str\"><f>IF(A1&gt;0,\"yes\",\"no\")</f><v>yes</v></c>"));
        assertThat(xml, containsString("<c r=\"C1\" t=\"b\"><f>A1&gt;0</f><v>1</v></c>"));
        assertThat(xml, containsString("<c r=\"D1\" t=\"e\"><f>1/0</f><v>#DIV/0!</v></c>"));
        assertThat(xml, containsString("<c r=\"A3\" t=\"str\"><f>B1&amp;\"d\"</f><v>2d</v></c>"));
        assertThat(xml, containsString("<c r=\"B3\" t=\"str\"><f>B1&amp;\"p3\"</f><v>0x1p3</v></c>"));
        assertThat(xml, containsString("<c r=\"C3\"><f>B1*2</f><v>-1.5E3</v></c>"));
    }

    @Test
    public void testMerges() throws XlsxException, IOException {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.addWorksheet();
        Format bold = Format.builder().setBold().build();
        sheet.mergeRange(0, 0, 1, 1, "Title", bold);
        assertThrows(XlsxConflictException.class, () -> sheet.mergeRange(1, 1, 2, 2, "Other", null));
        assertThrows(XlsxRangeException.class, () -> sheet.mergeRange(3, 3, 3, 3, "One", null));
        assertThrows(XlsxRangeException.class, () -> sheet.mergeRange(4, 4, 3, 3, "Back", null));
        // A failed merge leaves the cells alone.
        assertThat(sheet.getCell(2, 2), nullValue());
        sheet.mergeRange(1, 2, 1, 3, 12.0, null);
        assertThat(sheet.getMerges().size(), equalTo(2));
        int boldId = workbook.registerFormat(bold);
        assertThat(sheet.getCell(0, 0).getType(), equalTo(CellType.STRING));
        assertThat(sheet.getCell(1, 1).getType(), equalTo(CellType.BLANK));
        assertThat(sheet.getCell(1, 1).getStyleId(), equalTo(boldId));
        String xml = sheetXml(sheet, true);
        assertThat(xml, containsString("<mergeCells count=\"2\"><mergeCell ref=\"A1:B2\"/><mergeCell ref=\"C2:D2\"/></mergeCells>"));
        assertThat(xml, containsString("<c r=\"B2\" s=\"" + boldId + "\"/>"));
    }

    @Test
    public void testColumns() throws XlsxException, IOException {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.addWorksheet();
        sheet.setColumnRange(0, 999, 12.5, null);
        String xml = sheetXml(sheet, true);
        assertThat(xml, containsString("<cols><col min=\"1\" max=\"1000\" width=\"12.5\" customWidth=\"1\"/></cols>"));
        sheet.setColumnHidden(1000, true);
        sheet.setColumnWidth(5, 20);
        xml = sheetXml(sheet, true);
        assertThat(xml, containsString("<cols><col min=\"1\" max=\"5\" width=\"12.5\" customWidth=\"1\"/>"
                + "<col min=\"6\" max=\"6\" width=\"20\" customWidth=\"1\"/>"
                + "<col min=\"7\" max=\"1000\" width=\"12.5\" customWidth=\"1\"/>"
                + "<col min=\"1001\" max=\"1001\" width=\"9.140625\" hidden=\"1\"/></cols>"));
        assertThrows(XlsxRangeException.class, () -> sheet.setColumnWidth(0, 256));
        assertThrows(XlsxRangeException.class, () -> sheet.setColumnRange(5, 4, 10, null));
        assertThat(sheet.getColumn(2000), sameInstance(ColumnInfo.DEFAULT));
    }

    @Test
    public void testRows() throws XlsxException, IOException {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.addWorksheet();
        Format italic = Format.builder().setItalic().build();
        sheet.setRowHeight(2, 30);
        sheet.setRowFormat(4, italic);
        sheet.setRowHidden(6, true);
        assertThrows(XlsxRangeException.class, () -> sheet.setRowHeight(1, 410));
        String xml = sheetXml(sheet, false);
        int italicId = workbook.registerFormat(italic);
        assertThat(xml, containsString("<row r=\"3\" ht=\"30\" customHeight=\"1\"/>"));
        assertThat(xml, containsString("<row r=\"5\" s=\"" + italicId + "\" customFormat=\"1\"/>"));
        assertThat(xml, containsString("<row r=\"7\" hidden=\"1\"/>"));
        assertThat(xml, containsString("<dimension ref=\"A3:A7\"/>"));
        assertThat(xml, not(containsString("tabSelected")));
    }

    @Test
    public void testEmptySheet() throws XlsxException, IOException {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.addWorksheet();
        assertThat(sheet.getDimension(), nullValue());
        String xml = sheetXml(sheet, true);
        assertThat(xml, containsString("<dimension ref=\"A1\"/>"));
        assertThat(xml, containsString("<sheetData/>"));
        assertThat(xml, containsString("tabSelected=\"1\""));
        assertThat(xml, not(containsString("<cols>")));
        assertThat(xml, not(containsString("<mergeCells")));
    }

    @Test
    public void testLayout() throws XlsxException, IOException {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.addWorksheet();
        sheet.setString(0, 0, "Name", null);
        sheet.setString(0, 1, "Value", null);
        sheet.freezePanes(1, 0);
        sheet.setAutofilter(0, 0, 10, 1);
        sheet.setZoom(150);
        sheet.setGridlinesVisible(false);
        sheet.setTabColor(Color.GREEN);
        assertThrows(XlsxRangeException.class, () -> sheet.setZoom(5));
        assertThrows(XlsxRangeException.class, () -> sheet.setAutofilter(3, 0, 2, 1));
        String xml = sheetXml(sheet, true);
        assertThat(xml, containsString("<sheetPr><tabColor rgb=\"FF00FF00\"/></sheetPr>"));
        assertThat(xml, containsString("showGridLines=\"0\""));
        assertThat(xml, containsString("zoomScale=\"150\""));
        assertThat(xml, containsString("<pane ySplit=\"1\" topLeftCell=\"A2\" activePane=\"bottomLeft\" state=\"frozen\"/>"));
        assertThat(xml, containsString("<autoFilter ref=\"A1:B11\"/>"));
    }

    @Test
    public void testVisibility() throws XlsxException {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.addWorksheet();
        sheet.setActive();
        assertThat(sheet.isActive(), equalTo(true));
        sheet.setHidden(true);
        assertThat(sheet.isHidden(), equalTo(true));
        assertThat(sheet.isActive(), equalTo(false));
        sheet.setActive();
        assertThat(sheet.isHidden(), equalTo(false));
    }

    @Test
    public void testPageSetup() throws XlsxException, IOException {
        Workbook workbook = new Workbook();
        Worksheet sheet = workbook.addWorksheet();
        PageSetup setup = sheet.getPageSetup();
        assertThat(setup.isCustomized(), equalTo(false));
        setup.setLandscape(true);
        setup.setPaperSize(9);
        setup.setFitToPages(1, 0);
        setup.setHeader("&CQuarterly Report");
        setup.setCenterHorizontally(true);
        assertThrows(XlsxLimitException.class, () -> setup.setFooter("x".repeat(256)));
        assertThrows(XlsxRangeException.class, () -> setup.setPaperSize(200));
        String xml = sheetXml(sheet, true);
        assertThat(xml, containsString("<pageSetUpPr fitToPage=\"1\"/>"));
        assertThat(xml, containsString("<printOptions horizontalCentered=\"1\"/>"));
        assertThat(xml, containsString("<pageMargins left=\"0.7\" right=\"0.7\" top=\"0.75\" bottom=\"0.75\" header=\"0.3\" footer=\"0.3\"/>"));
        assertThat(xml, containsString("<pageSetup paperSize=\"9\" fitToHeight=\"0\" orientation=\"landscape\"/>"));
        assertThat(xml, containsString("<headerFooter><oddHeader>&amp;CQuarterly Report</oddHeader></headerFooter>"));
    }

}
