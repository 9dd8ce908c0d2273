/**
 *
 */
package org.theseed.xlsx.xml;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for the XML writer and the escaping rules.
 *
 * @author Bruce Parrello
 *
 */
public class TestXmlWriter {

    @Test
    public void testDataEscapes() {
        assertThat(XmlEscaper.escapeData("plain text"), equalTo("plain text"));
        assertThat(XmlEscaper.escapeData("a < b && c > \"d\""), equalTo("a &lt; b &amp;&amp; c &gt; \"d\""));
        assertThat(XmlEscaper.escapeData("line1\nline2"), equalTo("line1\nline2"));
        assertThat(XmlEscaper.escapeData("cr\rhere"), equalTo("cr&#xD;here"));
        assertThat(XmlEscaper.escapeData("tab\there"), equalTo("tab\there"));
    }

    @Test
    public void testAttributeEscapes() {
        assertThat(XmlEscaper.escapeAttribute("say \"hi\"\n"), equalTo("say &quot;hi&quot;&#xA;"));
        assertThat(XmlEscaper.escapeAttribute("R&D"), equalTo("R&amp;D"));
    }

    @Test
    public void testForbiddenCharacters() {
        assertThat(XmlEscaper.escapeData("a\u0001b"), equalTo("a_x0001_b"));
        assertThat(XmlEscaper.escapeData("\u001F"), equalTo("_x001F_"));
        assertThat(XmlEscaper.escapeData("x\uFFFEy"), equalTo("x_xFFFE_y"));
        // An unpaired surrogate is escaped, a proper pair is kept.
        assertThat(XmlEscaper.escapeData("\uD800z"), equalTo("_xD800_z"));
        String emoji = "smile \uD83D\uDE00";
        assertThat(XmlEscaper.escapeData(emoji), equalTo(emoji));
        assertThat(XmlEscaper.isForbidden('\t'), equalTo(false));
        assertThat(XmlEscaper.isForbidden('\u0000'), equalTo(true));
        assertThat(XmlEscaper.isForbidden('A'), equalTo(false));
    }

    @Test
    public void testOoxmlEscapeProtection() {
        assertThat(XmlEscaper.protectOoxmlEscapes("no escapes here"), equalTo("no escapes here"));
        assertThat(XmlEscaper.protectOoxmlEscapes("_x0041_"), equalTo("_x005F_x0041_"));
        assertThat(XmlEscaper.protectOoxmlEscapes("a_x00e9_b_xZZZZ_"), equalTo("a_x005F_x00e9_b_xZZZZ_"));
    }

    @Test
    public void testPreserve() {
        assertThat(XmlEscaper.needsPreserve(""), equalTo(false));
        assertThat(XmlEscaper.needsPreserve("abc"), equalTo(false));
        assertThat(XmlEscaper.needsPreserve(" abc"), equalTo(true));
        assertThat(XmlEscaper.needsPreserve("abc\t"), equalTo(true));
        assertThat(XmlEscaper.needsPreserve("a b"), equalTo(false));
    }

    @Test
    public void testDocument() throws IOException {
        byte[] data = XmlWriter.toBytes(w -> {
            w.startTag("root", List.of(XmlWriter.attr("b", 2), XmlWriter.attr("a", "x\"y")));
            w.emptyTag("empty");
            w.dataElement("item", "1 < 2");
            w.emptyTag("num", List.of(XmlWriter.attr("val", 1.5)));
            w.endTag("root");
        });
        String xml = new String(data, StandardCharsets.UTF_8);
        assertThat(xml, equalTo("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n"
                + "<root b=\"2\" a=\"x&quot;y\"><empty/><item>1 &lt; 2</item><num val=\"1.5\"/></root>"));
    }

}
