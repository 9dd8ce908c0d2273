/**
 *
 */
package org.theseed.xlsx.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import org.junit.jupiter.api.Test;

/**
 * Tests for the cell-coordinate utilities.
 *
 * @author Bruce Parrello
 *
 */
public class TestCellUtils {

    @Test
    public void testNames() {
        assertThat(CellUtils.columnName(0), equalTo("A"));
        assertThat(CellUtils.columnName(25), equalTo("Z"));
        assertThat(CellUtils.columnName(26), equalTo("AA"));
        assertThat(CellUtils.columnName(16383), equalTo("XFD"));
        assertThat(CellUtils.cellName(0, 0), equalTo("A1"));
        assertThat(CellUtils.cellName(9, 27), equalTo("AB10"));
        assertThat(CellUtils.absoluteCellName(2, 1), equalTo("$B$3"));
        assertThat(CellUtils.rangeName(0, 0, 4, 2), equalTo("A1:C5"));
        assertThat(CellUtils.rangeName(3, 3, 3, 3), equalTo("D4"));
        assertThat(CellUtils.absoluteRangeName(0, 0, 1, 1), equalTo("$A$1:$B$2"));
    }

    @Test
    public void testSheetQuoting() {
        assertThat(CellUtils.quoteSheetName("Sheet1"), equalTo("Sheet1"));
        assertThat(CellUtils.quoteSheetName("My Sheet"), equalTo("'My Sheet'"));
        assertThat(CellUtils.quoteSheetName("Bob's"), equalTo("'Bob''s'"));
        assertThat(CellUtils.unquoteSheetName("'Bob''s'"), equalTo("Bob's"));
        assertThat(CellUtils.unquoteSheetName("Sheet1"), equalTo("Sheet1"));
    }

    @Test
    public void testNumbers() {
        assertThat(CellUtils.formatNumber(1.0), equalTo("1"));
        assertThat(CellUtils.formatNumber(-42.0), equalTo("-42"));
        assertThat(CellUtils.formatNumber(0.1), equalTo("0.1"));
        assertThat(CellUtils.formatNumber(1.5), equalTo("1.5"));
        assertThat(CellUtils.formatNumber(1e20), equalTo("1.0E20"));
        assertThat(Double.parseDouble(CellUtils.formatNumber(Math.PI)), equalTo(Math.PI));
    }

    @Test
    public void testBalance() {
        assertThat(CellUtils.isBalanced("SUM(A1:A5)"), equalTo(true));
        assertThat(CellUtils.isBalanced("\"it's\"&A1"), equalTo(true));
        assertThat(CellUtils.isBalanced("'My Sheet'!A1"), equalTo(true));
        assertThat(CellUtils.isBalanced("\"abc"), equalTo(false));
        assertThat(CellUtils.isBalanced("'Sheet!A1"), equalTo(false));
        assertThat(CellUtils.isBalanced("\"say \"\"hi\"\"\""), equalTo(true));
    }

}
