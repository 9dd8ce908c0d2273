/**
 *
 */
package org.theseed.xlsx;

/**
 * This object holds the print settings of a worksheet.  A new object has the defaults a spreadsheet program
 * uses for a new sheet, and nothing is written for it except the page margins.
 *
 * @author Bruce Parrello
 *
 */
public class PageSetup {

    // FIELDS
    /** TRUE for landscape orientation */
    private boolean landscape;
    /** paper size code, or 0 for the printer default */
    private int paperSize;
    /** left margin in inches */
    private double leftMargin;
    /** right margin in inches */
    private double rightMargin;
    /** top margin in inches */
    private double topMargin;
    /** bottom margin in inches */
    private double bottomMargin;
    /** header margin in inches */
    private double headerMargin;
    /** footer margin in inches */
    private double footerMargin;
    /** number of pages wide to fit the print, or 0 if fitting is off */
    private int fitWidth;
    /** number of pages tall to fit the print, or 0 for as many as needed */
    private int fitHeight;
    /** TRUE if fit-to-page is on */
    private boolean fitToPage;
    /** page header text */
    private String header;
    /** page footer text */
    private String footer;
    /** TRUE to center horizontally */
    private boolean centerHorizontally;
    /** TRUE to center vertically */
    private boolean centerVertically;
    /** TRUE to print gridlines */
    private boolean printGridlines;
    /** print area, or NULL for the whole sheet */
    private CellRange printArea;
    /** first row to repeat on each page, or -1 if none */
    private int repeatFirstRow;
    /** last row to repeat on each page */
    private int repeatLastRow;

    /** maximum length of a header or footer */
    public static final int MAX_HEADER_LENGTH = 255;

    /**
     * Create the default page setup.
     */
    public PageSetup() {
        this.leftMargin = 0.7;
        this.rightMargin = 0.7;
        this.topMargin = 0.75;
        this.bottomMargin = 0.75;
        this.headerMargin = 0.3;
        this.footerMargin = 0.3;
        this.header = "";
        this.footer = "";
        this.repeatFirstRow = -1;
        this.repeatLastRow = -1;
    }

    /**
     * @return TRUE if the page setup element needs to be written
     */
    public boolean isCustomized() {
        return this.landscape || this.paperSize != 0 || this.fitToPage;
    }

    /**
     * @return TRUE if the print options element needs to be written
     */
    public boolean hasPrintOptions() {
        return this.centerHorizontally || this.centerVertically || this.printGridlines;
    }

    /**
     * @return TRUE if there is a header or footer
     */
    public boolean hasHeaderFooter() {
        return ! this.header.isEmpty() || ! this.footer.isEmpty();
    }

    public boolean isLandscape() {
        return this.landscape;
    }

    public void setLandscape(boolean landscape) {
        this.landscape = landscape;
    }

    public int getPaperSize() {
        return this.paperSize;
    }

    /**
     * Specify the paper size.
     *
     * @param paperSize		paper size code (1 = letter, 9 = A4, and so forth), or 0 for the printer default
     *
     * @throws XlsxRangeException
     */
    public void setPaperSize(int paperSize) throws XlsxRangeException {
        if (paperSize < 0 || paperSize > 118)
            throw new XlsxRangeException("Invalid paper size code " + paperSize + ".");
        this.paperSize = paperSize;
    }

    public double getLeftMargin() {
        return this.leftMargin;
    }

    public double getRightMargin() {
        return this.rightMargin;
    }

    public double getTopMargin() {
        return this.topMargin;
    }

    public double getBottomMargin() {
        return this.bottomMargin;
    }

    public double getHeaderMargin() {
        return this.headerMargin;
    }

    public double getFooterMargin() {
        return this.footerMargin;
    }

    /**
     * Specify the page margins.
     *
     * @param left		left margin in inches
     * @param right		right margin in inches
     * @param top		top margin in inches
     * @param bottom	bottom margin in inches
     * @param header	header margin in inches
     * @param footer	footer margin in inches
     *
     * @throws XlsxRangeException
     */
    public void setMargins(double left, double right, double top, double bottom, double header, double footer)
            throws XlsxRangeException {
        for (double margin : new double[] { left, right, top, bottom, header, footer }) {
            if (! Double.isFinite(margin) || margin < 0.0)
                throw new XlsxRangeException("Invalid page margin " + margin + ".");
        }
        this.leftMargin = left;
        this.rightMargin = right;
        this.topMargin = top;
        this.bottomMargin = bottom;
        this.headerMargin = header;
        this.footerMargin = footer;
    }

    public int getFitWidth() {
        return this.fitWidth;
    }

    public int getFitHeight() {
        return this.fitHeight;
    }

    public boolean isFitToPage() {
        return this.fitToPage;
    }

    /**
     * Scale the print to fit a fixed number of pages.
     *
     * @param width		number of pages wide (0 for as many as needed)
     * @param height	number of pages tall (0 for as many as needed)
     *
     * @throws XlsxRangeException
     */
    public void setFitToPages(int width, int height) throws XlsxRangeException {
        if (width < 0 || height < 0)
            throw new XlsxRangeException("Fit-to-page counts cannot be negative.");
        this.fitWidth = width;
        this.fitHeight = height;
        this.fitToPage = true;
    }

    public String getHeader() {
        return this.header;
    }

    /**
     * Specify the page header, using the spreadsheet header control codes (&amp;L, &amp;P, and so forth).
     *
     * @param header	header text
     *
     * @throws XlsxLimitException
     */
    public void setHeader(String header) throws XlsxLimitException {
        this.header = checkHeader(header);
    }

    public String getFooter() {
        return this.footer;
    }

    /**
     * Specify the page footer.
     *
     * @param footer	footer text
     *
     * @throws XlsxLimitException
     */
    public void setFooter(String footer) throws XlsxLimitException {
        this.footer = checkHeader(footer);
    }

    /**
     * @return the validated header or footer text
     *
     * @param text	proposed text (NULL is treated as empty)
     *
     * @throws XlsxLimitException
     */
    private static String checkHeader(String text) throws XlsxLimitException {
        String retVal = (text == null ? "" : text);
        if (retVal.length() > MAX_HEADER_LENGTH)
            throw new XlsxLimitException("Header and footer text cannot exceed " + MAX_HEADER_LENGTH + " characters.");
        return retVal;
    }

    public boolean isCenterHorizontally() {
        return this.centerHorizontally;
    }

    public void setCenterHorizontally(boolean centerHorizontally) {
        this.centerHorizontally = centerHorizontally;
    }

    public boolean isCenterVertically() {
        return this.centerVertically;
    }

    public void setCenterVertically(boolean centerVertically) {
        this.centerVertically = centerVertically;
    }

    public boolean isPrintGridlines() {
        return this.printGridlines;
    }

    public void setPrintGridlines(boolean printGridlines) {
        this.printGridlines = printGridlines;
    }

    /**
     * @return the print area, or NULL if the whole sheet is printed
     */
    public CellRange getPrintArea() {
        return this.printArea;
    }

    protected void setPrintArea(CellRange printArea) {
        this.printArea = printArea;
    }

    /**
     * @return TRUE if there are rows to repeat at the top of each page
     */
    public boolean hasRepeatRows() {
        return this.repeatFirstRow >= 0;
    }

    public int getRepeatFirstRow() {
        return this.repeatFirstRow;
    }

    public int getRepeatLastRow() {
        return this.repeatLastRow;
    }

    protected void setRepeatRows(int first, int last) {
        this.repeatFirstRow = first;
        this.repeatLastRow = last;
    }

}
