/**
 *
 */
package org.theseed.xlsx.packaging;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * This object builds the content-type part, which maps file extensions and individual parts to their MIME
 * types.  Entries are written in the order they were added.
 *
 * @author Bruce Parrello
 *
 */
public class ContentTypes implements XmlWriter.Body {

    // FIELDS
    /** default entries, as extension/type pairs */
    private final List<Pair<String, String>> defaults;
    /** override entries, as part-name/type pairs */
    private final List<Pair<String, String>> overrides;

    /** base for the spreadsheet content types */
    private static final String SHEET_BASE = "application/vnd.openxmlformats-officedocument.spreadsheetml.";
    public static final String RELATIONSHIPS = "application/vnd.openxmlformats-package.relationships+xml";
    public static final String XML = "application/xml";
    public static final String APP = "application/vnd.openxmlformats-officedocument.extended-properties+xml";
    public static final String CORE = "application/vnd.openxmlformats-package.core-properties+xml";
    public static final String STYLES = SHEET_BASE + "styles+xml";
    public static final String WORKBOOK = SHEET_BASE + "sheet.main+xml";
    public static final String WORKSHEET = SHEET_BASE + "worksheet+xml";
    public static final String SHARED_STRINGS = SHEET_BASE + "sharedStrings+xml";

    /**
     * Create a content-type part with the standard defaults for a workbook.
     */
    public ContentTypes() {
        this.defaults = new ArrayList<Pair<String, String>>();
        this.overrides = new ArrayList<Pair<String, String>>();
        this.addDefault("rels", RELATIONSHIPS);
        this.addDefault("xml", XML);
    }

    /**
     * Add a default content type for an extension.
     *
     * @param extension		file extension
     * @param type			content type
     */
    public void addDefault(String extension, String type) {
        this.defaults.add(Pair.of(extension, type));
    }

    /**
     * Add a content type for a specific part.
     *
     * @param partName		archive path of the part (without a leading slash)
     * @param type			content type
     */
    public void addOverride(String partName, String type) {
        this.overrides.add(Pair.of("/" + partName, type));
    }

    @Override
    public void write(XmlWriter writer) throws IOException {
        writer.startTag("Types", List.of(XmlWriter.attr("xmlns", "http://schemas.openxmlformats.org/package/2006/content-types")));
        for (Pair<String, String> entry : this.defaults)
            writer.emptyTag("Default", List.of(XmlWriter.attr("Extension", entry.getLeft()),
                    XmlWriter.attr("ContentType", entry.getRight())));
        for (Pair<String, String> entry : this.overrides)
            writer.emptyTag("Override", List.of(XmlWriter.attr("PartName", entry.getLeft()),
                    XmlWriter.attr("ContentType", entry.getRight())));
        writer.endTag("Types");
    }

}
