/**
 *
 */
package org.theseed.xlsx.format;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.FontUnderline;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.junit.jupiter.api.Test;
import org.theseed.xlsx.XlsxLimitException;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * Tests for the style-sheet part.
 *
 * @author Bruce Parrello
 *
 */
public class TestStylesWriter {

    /**
     * @return the style-sheet XML for a registry
     *
     * @param registry	registry to write
     */
    private static String stylesXml(FormatRegistry registry) throws IOException {
        return new String(XmlWriter.toBytes(new StylesWriter(registry)), StandardCharsets.UTF_8);
    }

    @Test
    public void testDefaultStyles() throws IOException {
        String xml = stylesXml(new FormatRegistry(64000));
        assertThat(xml, not(containsString("<numFmts")));
        assertThat(xml, containsString("<fonts count=\"1\"><font><sz val=\"11\"/><color theme=\"1\"/>"
                + "<name val=\"Calibri\"/><family val=\"2\"/><scheme val=\"minor\"/></font></fonts>"));
        assertThat(xml, containsString("<fills count=\"2\"><fill><patternFill patternType=\"none\"/></fill>"
                + "<fill><patternFill patternType=\"gray125\"/></fill></fills>"));
        assertThat(xml, containsString("<borders count=\"1\"><border><left/><right/><top/><bottom/><diagonal/></border></borders>"));
        assertThat(xml, containsString("<cellXfs count=\"1\"><xf numFmtId=\"0\" fontId=\"0\" fillId=\"0\" borderId=\"0\" xfId=\"0\"/></cellXfs>"));
        assertThat(xml, containsString("<cellStyles count=\"1\"><cellStyle name=\"Normal\" xfId=\"0\" builtinId=\"0\"/></cellStyles>"));
        assertThat(xml, containsString("<dxfs count=\"0\"/><tableStyles count=\"0\" defaultTableStyle=\"TableStyleMedium9\" defaultPivotStyle=\"PivotStyleLight16\"/>"));
    }

    @Test
    public void testCustomStyles() throws IOException, XlsxLimitException {
        FormatRegistry registry = new FormatRegistry(64000);
        registry.register(Format.builder().setBold().setUnderline(FontUnderline.DOUBLE).setFontColor(Color.RED)
                .setFontName("Arial").setFontSize(12.5).setNumberFormat("0.000").build());
        registry.register(Format.builder().setFillBackgroundColor(Color.YELLOW).setBorder(BorderStyle.THIN)
                .setAlignment(HorizontalAlignment.CENTER_SELECTION).setWrapText().setLocked(false)
                .setQuotePrefix().build());
        String xml = stylesXml(registry);
        assertThat(xml, containsString("<numFmts count=\"1\"><numFmt numFmtId=\"164\" formatCode=\"0.000\"/></numFmts>"));
        assertThat(xml, containsString("<font><b/><u val=\"double\"/><sz val=\"12.5\"/><color rgb=\"FFFF0000\"/>"
                + "<name val=\"Arial\"/><family val=\"2\"/></font>"));
        assertThat(xml, containsString("<fill><patternFill patternType=\"solid\"><fgColor rgb=\"FFFFFF00\"/>"
                + "<bgColor indexed=\"64\"/></patternFill></fill>"));
        assertThat(xml, containsString("<left style=\"thin\"><color auto=\"1\"/></left>"));
        assertThat(xml, containsString("<xf numFmtId=\"164\" fontId=\"1\" fillId=\"0\" borderId=\"0\" xfId=\"0\" "
                + "applyNumberFormat=\"1\" applyFont=\"1\"/>"));
        assertThat(xml, containsString("<xf numFmtId=\"0\" fontId=\"0\" fillId=\"2\" borderId=\"1\" xfId=\"0\" "
                + "quotePrefix=\"1\" applyFill=\"1\" applyBorder=\"1\" applyAlignment=\"1\" applyProtection=\"1\">"
                + "<alignment horizontal=\"centerContinuous\" wrapText=\"1\"/><protection locked=\"0\"/></xf>"));
    }

}
