/**
 *
 */
package org.theseed.xlsx.strings;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;
import org.theseed.xlsx.XlsxLimitException;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * Tests for the shared string table and its XML part.
 *
 * @author Bruce Parrello
 *
 */
public class TestSharedStringTable {

    @Test
    public void testInterning() throws XlsxLimitException {
        SharedStringTable table = new SharedStringTable(32767);
        assertThat(table.isEmpty(), equalTo(true));
        assertThat(table.intern("A"), equalTo(0));
        assertThat(table.intern("B"), equalTo(1));
        assertThat(table.intern("A"), equalTo(0));
        assertThat(table.size(), equalTo(2));
        assertThat(table.indexOf("B"), equalTo(1));
        assertThat(table.indexOf("C"), equalTo(-1));
        assertThat(table.get(1), equalTo("B"));
        assertThat(table.getStrings(), contains("A", "B"));
        // Case matters.
        assertThat(table.intern("a"), equalTo(2));
        assertThat(table.intern(""), equalTo(3));
        assertThat(table.size(), equalTo(4));
        assertThrows(IllegalArgumentException.class, () -> table.intern(null));
    }

    @Test
    public void testLimitsAndFreezing() throws XlsxLimitException {
        SharedStringTable table = new SharedStringTable(10);
        table.intern(StringUtils.repeat('x', 10));
        assertThrows(XlsxLimitException.class, () -> table.intern(StringUtils.repeat('x', 11)));
        assertThat(table.size(), equalTo(1));
        table.intern("known");
        table.freeze();
        assertThat(table.isFrozen(), equalTo(true));
        assertThat(table.intern("known"), equalTo(1));
        assertThrows(IllegalStateException.class, () -> table.intern("unknown"));
        assertThat(table.size(), equalTo(2));
    }

    @Test
    public void testWriter() throws IOException, XlsxLimitException {
        SharedStringTable table = new SharedStringTable(32767);
        table.intern("plain");
        table.intern(" padded");
        table.intern("a&b");
        table.intern("_x0041_");
        table.intern("bell\u0007");
        String xml = new String(XmlWriter.toBytes(new SharedStringsWriter(table, 7)), StandardCharsets.UTF_8);
        assertThat(xml, containsString("<sst xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\" count=\"7\" uniqueCount=\"5\">"));
        assertThat(xml, containsString("<si><t>plain</t></si>"));
        assertThat(xml, containsString("<si><t xml:space=\"preserve\"> padded</t></si>"));
        assertThat(xml, containsString("<si><t>a&amp;b</t></si>"));
        assertThat(xml, containsString("<si><t>_x005F_x0041_</t></si>"));
        assertThat(xml, containsString("<si><t>bell_x0007_</t></si>"));
        assertThat(xml.indexOf("plain"), lessThan(xml.indexOf("padded")));
    }

}
