/**
 *
 */
package org.theseed.xlsx.strings;

import java.io.IOException;
import java.util.List;

import org.theseed.xlsx.xml.XmlEscaper;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * This object writes the shared-strings part of the package.
 *
 * @author Bruce Parrello
 *
 */
public class SharedStringsWriter implements XmlWriter.Body {

    // FIELDS
    /** string table to write */
    private final SharedStringTable table;
    /** total number of string cells referring to the table */
    private final long refCount;

    /**
     * Construct a writer for a string table.
     *
     * @param table			string table to write
     * @param refCount		number of string cells in the workbook
     */
    public SharedStringsWriter(SharedStringTable table, long refCount) {
        this.table = table;
        this.refCount = refCount;
    }

    @Override
    public void write(XmlWriter writer) throws IOException {
        writer.startTag("sst", List.of(XmlWriter.attr("xmlns", "http://schemas.openxmlformats.org/spreadsheetml/2006/main"),
                XmlWriter.attr("count", this.refCount), XmlWriter.attr("uniqueCount", this.table.size())));
        for (String text : this.table.getStrings()) {
            writer.startTag("si");
            if (XmlEscaper.needsPreserve(text))
                writer.startTag("t", List.of(XmlWriter.attr("xml:space", "preserve")));
            else
                writer.startTag("t");
            writer.characters(XmlEscaper.protectOoxmlEscapes(text));
            writer.endTag("t");
            writer.endTag("si");
        }
        writer.endTag("sst");
    }

}
