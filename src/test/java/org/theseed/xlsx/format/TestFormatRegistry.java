/**
 *
 */
package org.theseed.xlsx.format;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.junit.jupiter.api.Test;
import org.theseed.xlsx.XlsxLimitException;

/**
 * Tests for format canonicalization and deduplication.
 *
 * @author Bruce Parrello
 *
 */
public class TestFormatRegistry {

    @Test
    public void testMandatoryEntries() {
        FormatRegistry registry = new FormatRegistry(64000);
        assertThat(registry.size(), equalTo(1));
        assertThat(registry.getFonts(), contains(Font.DEFAULT));
        assertThat(registry.getFills(), contains(Fill.NONE, Fill.GRAY_125));
        assertThat(registry.getBorders(), contains(Border.NONE));
        assertThat(registry.getNumFormats(), empty());
        assertThat(registry.getRecord(0), equalTo(XfRecord.DEFAULT));
    }

    @Test
    public void testIdentity() throws XlsxLimitException {
        FormatRegistry registry = new FormatRegistry(64000);
        assertThat(registry.register(null), equalTo(0));
        assertThat(registry.register(Format.DEFAULT), equalTo(0));
        // An explicitly-default alignment is the same as no alignment.
        Format explicit = Format.builder().setAlignment(HorizontalAlignment.GENERAL)
                .setVerticalAlignment(VerticalAlignment.BOTTOM).setNumberFormat("general").build();
        assertThat(explicit, equalTo(Format.DEFAULT));
        assertThat(registry.register(explicit), equalTo(0));
        Format bold1 = Format.builder().setBold().build();
        Format bold2 = Format.builder().setBold().build();
        Format italic = Format.builder().setItalic().build();
        int boldId = registry.register(bold1);
        assertThat(boldId, equalTo(1));
        assertThat(registry.register(bold2), equalTo(boldId));
        int italicId = registry.register(italic);
        assertThat(italicId, equalTo(2));
        assertThat(registry.getFonts().size(), equalTo(3));
        // Same components in a different object still map to the same ID.
        assertThat(registry.register(italic.toBuilder().build()), equalTo(italicId));
        // Two formats sharing a font share the font entry but not the style.
        Format boldRed = Format.builder().setBold().setFillForegroundColor(Color.RED).build();
        int boldRedId = registry.register(boldRed);
        assertThat(boldRedId, equalTo(3));
        assertThat(registry.getRecord(boldRedId).getFontId(), equalTo(registry.getRecord(boldId).getFontId()));
        assertThat(registry.getFonts().size(), equalTo(3));
        assertThat(registry.getFills().size(), equalTo(3));
    }

    @Test
    public void testNumberFormats() throws XlsxLimitException {
        FormatRegistry registry = new FormatRegistry(64000);
        int builtin = registry.register(Format.builder().setNumberFormat("0.00").build());
        assertThat(registry.getRecord(builtin).getNumFmtId(), equalTo(2));
        int indexed = registry.register(Format.builder().setNumberFormatIndex(2).build());
        assertThat(indexed, equalTo(builtin));
        int custom1 = registry.register(Format.builder().setNumberFormat("0.000").build());
        int custom2 = registry.register(Format.builder().setNumberFormat("#,##0.0000").build());
        int custom1b = registry.register(Format.builder().setNumberFormat("0.000").setBold().build());
        assertThat(registry.getRecord(custom1).getNumFmtId(), equalTo(FormatRegistry.FIRST_CUSTOM_NUM_FORMAT));
        assertThat(registry.getRecord(custom2).getNumFmtId(), equalTo(FormatRegistry.FIRST_CUSTOM_NUM_FORMAT + 1));
        assertThat(registry.getRecord(custom1b).getNumFmtId(), equalTo(FormatRegistry.FIRST_CUSTOM_NUM_FORMAT));
        assertThat(registry.getNumFormats(), contains("0.000", "#,##0.0000"));
        assertThrows(IllegalArgumentException.class, () -> Format.builder().setNumberFormatIndex(500));
    }

    @Test
    public void testFillCanonicalization() {
        Fill bgOnly = Fill.of(null, null, Color.YELLOW);
        assertThat(bgOnly.getPattern(), equalTo(FillPatternType.SOLID_FOREGROUND));
        assertThat(bgOnly.getForeground(), equalTo(Color.YELLOW));
        assertThat(bgOnly.getBackground(), equalTo(Color.DEFAULT));
        Fill fgOnly = Fill.of(FillPatternType.SOLID_FOREGROUND, Color.YELLOW, null);
        assertThat(fgOnly, equalTo(bgOnly));
        Fill both = Fill.of(FillPatternType.SOLID_FOREGROUND, Color.RED, Color.BLUE);
        assertThat(both.getForeground(), equalTo(Color.BLUE));
        assertThat(both.getBackground(), equalTo(Color.RED));
        Fill striped = Fill.of(FillPatternType.THIN_HORZ_BANDS, Color.RED, Color.BLUE);
        assertThat(striped.getForeground(), equalTo(Color.RED));
        assertThat(Fill.of(null, null, null), sameInstance(Fill.NONE));
    }

    @Test
    public void testBorderAndAlignment() {
        Format diag = Format.builder().setBorderDiagonal(BorderStyle.THIN, Color.DEFAULT, Border.Diagonal.NONE).build();
        assertThat(diag.getBorder(), sameInstance(Border.NONE));
        Format boxed = Format.builder().setBorder(BorderStyle.THIN).setBorderColor(Color.indexed(IndexedColors.RED)).build();
        assertThat(boxed.getBorder().getLeft().getStyle(), equalTo(BorderStyle.THIN));
        assertThat(boxed.getBorder().getDiagonal().isNone(), equalTo(true));
        Alignment down = Alignment.of(null, null, false, 0, -45, false);
        assertThat(down.getRotation(), equalTo(135));
        assertThat(Alignment.of(null, null, false, 0, 270, false).getRotation(), equalTo(Alignment.STACKED));
        assertThat(Alignment.of(null, null, false, 0, 0, false), sameInstance(Alignment.DEFAULT));
        assertThrows(IllegalArgumentException.class, () -> Alignment.of(null, null, false, 0, 100, false));
        assertThrows(IllegalArgumentException.class, () -> Alignment.of(null, null, false, 251, 0, false));
        // The builder round-trips the rotation angle.
        Format rotated = Format.builder().setRotation(-45).build();
        assertThat(rotated.toBuilder().build(), equalTo(rotated));
    }

    @Test
    public void testLimit() throws XlsxLimitException {
        FormatRegistry registry = new FormatRegistry(3);
        registry.register(Format.builder().setBold().build());
        registry.register(Format.builder().setItalic().build());
        Format extra = Format.builder().setStrikeout().setNumberFormat("0.0000").build();
        assertThrows(XlsxLimitException.class, () -> registry.register(extra));
        // Nothing was added for the failed format.
        assertThat(registry.size(), equalTo(3));
        assertThat(registry.getFonts().size(), equalTo(3));
        assertThat(registry.getNumFormats(), empty());
        // An existing format can still be registered.
        assertThat(registry.register(Format.builder().setBold().build()), equalTo(1));
    }

    @Test
    public void testFreeze() throws XlsxLimitException {
        FormatRegistry registry = new FormatRegistry(64000);
        Format bold = Format.builder().setBold().build();
        registry.register(bold);
        registry.freeze();
        assertThat(registry.isFrozen(), equalTo(true));
        assertThat(registry.register(bold), equalTo(1));
        assertThrows(IllegalStateException.class, () -> registry.register(Format.builder().setItalic().build()));
    }

}
