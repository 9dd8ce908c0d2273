/**
 *
 */
package org.theseed.xlsx.packaging;

import java.io.IOException;
import java.time.format.DateTimeFormatter;
import java.util.List;

import org.theseed.xlsx.DocProperties;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * This object writes the two document-property parts:  the core properties (title, author, dates) and the
 * extended properties (application, sheet titles, company).
 *
 * @author Bruce Parrello
 *
 */
public class DocPropsWriter {

    // FIELDS
    /** document metadata */
    private final DocProperties properties;
    /** worksheet names, in tab order */
    private final List<String> sheetNames;
    /** titles of the sheet-local named ranges */
    private final List<String> rangeTitles;
    /** document security level */
    private final int docSecurity;

    /** security level that recommends read-only opening */
    private static final int READ_ONLY_RECOMMENDED = 2;

    /**
     * Construct a document-property writer.
     *
     * @param properties	document metadata
     * @param sheetNames	names of the worksheets, in tab order
     * @param rangeTitles	titles of the named ranges to list
     * @param readOnly		TRUE if read-only opening is recommended
     */
    public DocPropsWriter(DocProperties properties, List<String> sheetNames, List<String> rangeTitles,
            boolean readOnly) {
        this.properties = properties;
        this.sheetNames = sheetNames;
        this.rangeTitles = rangeTitles;
        this.docSecurity = (readOnly ? READ_ONLY_RECOMMENDED : 0);
    }

    /**
     * Write the core properties.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    public void writeCore(XmlWriter writer) throws IOException {
        writer.startTag("cp:coreProperties", List.of(
                XmlWriter.attr("xmlns:cp", "http://schemas.openxmlformats.org/package/2006/metadata/core-properties"),
                XmlWriter.attr("xmlns:dc", "http://purl.org/dc/elements/1.1/"),
                XmlWriter.attr("xmlns:dcterms", "http://purl.org/dc/terms/"),
                XmlWriter.attr("xmlns:dcmitype", "http://purl.org/dc/dcmitype/"),
                XmlWriter.attr("xmlns:xsi", "http://www.w3.org/2001/XMLSchema-instance")));
        optional(writer, "dc:title", this.properties.getTitle());
        optional(writer, "dc:subject", this.properties.getSubject());
        writer.dataElement("dc:creator", this.properties.getAuthor());
        optional(writer, "cp:keywords", this.properties.getKeywords());
        optional(writer, "dc:description", this.properties.getComment());
        writer.dataElement("cp:lastModifiedBy", this.properties.getAuthor());
        String timestamp = DateTimeFormatter.ISO_INSTANT.format(this.properties.getCreated());
        var dateType = List.of(XmlWriter.attr("xsi:type", "dcterms:W3CDTF"));
        writer.dataElement("dcterms:created", timestamp, dateType);
        writer.dataElement("dcterms:modified", timestamp, dateType);
        optional(writer, "cp:category", this.properties.getCategory());
        optional(writer, "cp:contentStatus", this.properties.getStatus());
        writer.endTag("cp:coreProperties");
    }

    /**
     * Write the extended properties.
     *
     * @param writer	output writer
     *
     * @throws IOException
     */
    public void writeApp(XmlWriter writer) throws IOException {
        writer.startTag("Properties", List.of(
                XmlWriter.attr("xmlns", "http://schemas.openxmlformats.org/officeDocument/2006/extended-properties"),
                XmlWriter.attr("xmlns:vt", "http://schemas.openxmlformats.org/officeDocument/2006/docPropsVTypes")));
        writer.dataElement("Application", "Microsoft Excel");
        writer.dataElement("DocSecurity", Integer.toString(this.docSecurity));
        writer.dataElement("ScaleCrop", "false");
        // The heading pairs count the titles in each group.
        int groups = (this.rangeTitles.isEmpty() ? 1 : 2);
        writer.startTag("HeadingPairs");
        writer.startTag("vt:vector", List.of(XmlWriter.attr("size", groups * 2), XmlWriter.attr("baseType", "variant")));
        writeHeadingPair(writer, "Worksheets", this.sheetNames.size());
        if (! this.rangeTitles.isEmpty())
            writeHeadingPair(writer, "Named Ranges", this.rangeTitles.size());
        writer.endTag("vt:vector");
        writer.endTag("HeadingPairs");
        writer.startTag("TitlesOfParts");
        int titleCount = this.sheetNames.size() + this.rangeTitles.size();
        writer.startTag("vt:vector", List.of(XmlWriter.attr("size", titleCount), XmlWriter.attr("baseType", "lpstr")));
        for (String name : this.sheetNames)
            writer.dataElement("vt:lpstr", name);
        for (String title : this.rangeTitles)
            writer.dataElement("vt:lpstr", title);
        writer.endTag("vt:vector");
        writer.endTag("TitlesOfParts");
        optional(writer, "Manager", this.properties.getManager());
        writer.dataElement("Company", this.properties.getCompany());
        writer.dataElement("LinksUpToDate", "false");
        writer.dataElement("SharedDoc", "false");
        writer.dataElement("HyperlinksChanged", "false");
        writer.dataElement("AppVersion", "12.0000");
        writer.endTag("Properties");
    }

    /**
     * Write one heading pair.
     *
     * @param writer	output writer
     * @param heading	group heading
     * @param count		number of titles in the group
     *
     * @throws IOException
     */
    private static void writeHeadingPair(XmlWriter writer, String heading, int count) throws IOException {
        writer.startTag("vt:variant");
        writer.dataElement("vt:lpstr", heading);
        writer.endTag("vt:variant");
        writer.startTag("vt:variant");
        writer.dataElement("vt:i4", Integer.toString(count));
        writer.endTag("vt:variant");
    }

    /**
     * Write an element only if its value is nonempty.
     *
     * @param writer	output writer
     * @param tag		element name
     * @param value		element value
     *
     * @throws IOException
     */
    private static void optional(XmlWriter writer, String tag, String value) throws IOException {
        if (! value.isEmpty())
            writer.dataElement(tag, value);
    }

}
