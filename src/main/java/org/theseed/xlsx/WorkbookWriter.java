/**
 *
 */
package org.theseed.xlsx;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * This object writes the workbook part:  the list of sheets, the window settings and the defined names.
 *
 * @author Bruce Parrello
 *
 */
public class WorkbookWriter implements XmlWriter.Body {

    // FIELDS
    /** worksheets in tab order */
    private final List<Worksheet> sheets;
    /** index of the active sheet */
    private final int activeTab;
    /** index of the first visible sheet */
    private final int firstSheet;
    /** defined names, already sorted and resolved */
    private final List<DefinedName> names;
    /** TRUE if read-only opening is recommended */
    private final boolean readOnlyRecommended;

    /**
     * Construct a workbook-part writer.
     *
     * @param sheets		worksheets in tab order
     * @param activeTab		index of the active sheet
     * @param firstSheet	index of the first visible sheet
     * @param names			sorted list of defined names
     * @param readOnly		TRUE to recommend read-only opening
     */
    public WorkbookWriter(List<Worksheet> sheets, int activeTab, int firstSheet, List<DefinedName> names,
            boolean readOnly) {
        this.sheets = sheets;
        this.activeTab = activeTab;
        this.firstSheet = firstSheet;
        this.names = names;
        this.readOnlyRecommended = readOnly;
    }

    @Override
    public void write(XmlWriter writer) throws IOException {
        writer.startTag("workbook", List.of(XmlWriter.attr("xmlns", "http://schemas.openxmlformats.org/spreadsheetml/2006/main"),
                XmlWriter.attr("xmlns:r", "http://schemas.openxmlformats.org/officeDocument/2006/relationships")));
        writer.emptyTag("fileVersion", List.of(XmlWriter.attr("appName", "xl"), XmlWriter.attr("lastEdited", 4),
                XmlWriter.attr("lowestEdited", 4), XmlWriter.attr("rupBuild", 4505)));
        if (this.readOnlyRecommended)
            writer.emptyTag("fileSharing", List.of(XmlWriter.attr("readOnlyRecommended", 1)));
        writer.emptyTag("workbookPr", List.of(XmlWriter.attr("defaultThemeVersion", 124226)));
        writer.startTag("bookViews");
        List<Pair<String, String>> viewAttributes = new ArrayList<>(6);
        viewAttributes.add(XmlWriter.attr("xWindow", 240));
        viewAttributes.add(XmlWriter.attr("yWindow", 15));
        viewAttributes.add(XmlWriter.attr("windowWidth", 16095));
        viewAttributes.add(XmlWriter.attr("windowHeight", 9660));
        if (this.firstSheet > 0)
            viewAttributes.add(XmlWriter.attr("firstSheet", this.firstSheet));
        if (this.activeTab > 0)
            viewAttributes.add(XmlWriter.attr("activeTab", this.activeTab));
        writer.emptyTag("workbookView", viewAttributes);
        writer.endTag("bookViews");
        writer.startTag("sheets");
        int sheetId = 1;
        for (Worksheet sheet : this.sheets) {
            List<Pair<String, String>> attributes = new ArrayList<>(4);
            attributes.add(XmlWriter.attr("name", sheet.getName()));
            attributes.add(XmlWriter.attr("sheetId", sheetId));
            if (sheet.isHidden())
                attributes.add(XmlWriter.attr("state", "hidden"));
            attributes.add(XmlWriter.attr("r:id", "rId" + sheetId));
            writer.emptyTag("sheet", attributes);
            sheetId++;
        }
        writer.endTag("sheets");
        if (! this.names.isEmpty()) {
            writer.startTag("definedNames");
            for (DefinedName name : this.names) {
                List<Pair<String, String>> attributes = new ArrayList<>(3);
                attributes.add(XmlWriter.attr("name", name.getName()));
                if (! name.isGlobal())
                    attributes.add(XmlWriter.attr("localSheetId", name.getLocalSheetId()));
                if (name.isHidden())
                    attributes.add(XmlWriter.attr("hidden", 1));
                writer.dataElement("definedName", name.getFormula(), attributes);
            }
            writer.endTag("definedNames");
        }
        writer.emptyTag("calcPr", List.of(XmlWriter.attr("calcId", 124519), XmlWriter.attr("fullCalcOnLoad", 1)));
        writer.endTag("workbook");
    }

}
