/**
 *
 */
package org.theseed.xlsx.packaging;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * Tests for the content-type and relationship parts.
 *
 * @author Bruce Parrello
 *
 */
public class TestContentTypes {

    @Test
    public void testContentTypes() throws IOException {
        ContentTypes types = new ContentTypes();
        types.addOverride("xl/workbook.xml", ContentTypes.WORKBOOK);
        types.addOverride("xl/worksheets/sheet1.xml", ContentTypes.WORKSHEET);
        String xml = new String(XmlWriter.toBytes(types), StandardCharsets.UTF_8);
        assertThat(xml, startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n"
                + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"));
        assertThat(xml, containsString("<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>"
                + "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"));
        assertThat(xml, containsString("<Override PartName=\"/xl/workbook.xml\" "
                + "ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.sheet.main+xml\"/>"
                + "<Override PartName=\"/xl/worksheets/sheet1.xml\" "
                + "ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.worksheet+xml\"/>"));
        assertThat(xml, endsWith("</Types>"));
    }

    @Test
    public void testRelationships() throws IOException {
        Relationships rels = new Relationships();
        assertThat(rels.add(Relationships.WORKSHEET, "worksheets/sheet1.xml"), equalTo("rId1"));
        assertThat(rels.add(Relationships.WORKSHEET, "worksheets/sheet2.xml"), equalTo("rId2"));
        assertThat(rels.add(Relationships.STYLES, "styles.xml"), equalTo("rId3"));
        assertThat(rels.size(), equalTo(3));
        String xml = new String(XmlWriter.toBytes(rels), StandardCharsets.UTF_8);
        assertThat(xml, containsString("<Relationship Id=\"rId2\" "
                + "Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/worksheet\" "
                + "Target=\"worksheets/sheet2.xml\"/>"));
        assertThat(xml, containsString("<Relationship Id=\"rId3\" "
                + "Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/styles\" Target=\"styles.xml\"/>"));
    }

}
