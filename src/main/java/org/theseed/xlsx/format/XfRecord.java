/**
 *
 */
package org.theseed.xlsx.format;

import java.util.Objects;

/**
 * This is a combined cell-style record, which refers to the font, fill, border and number-format catalogs by
 * index and carries the alignment and protection settings directly.
 *
 * @author Bruce Parrello
 *
 */
public final class XfRecord {

    // FIELDS
    private final int numFmtId;
    private final int fontId;
    private final int fillId;
    private final int borderId;
    private final Alignment alignment;
    private final boolean locked;
    private final boolean hidden;
    private final boolean quotePrefix;

    /** the record for the default format */
    public static final XfRecord DEFAULT = new XfRecord(0, 0, 0, 0, Alignment.DEFAULT, true, false, false);

    /**
     * Construct a style record.
     *
     * @param numFmtId		number format ID
     * @param fontId		font index
     * @param fillId		fill index
     * @param borderId		border index
     * @param alignment		alignment descriptor
     * @param locked		TRUE if the cell is locked
     * @param hidden		TRUE if the formula is hidden
     * @param quotePrefix	TRUE if the content is treated as text
     */
    public XfRecord(int numFmtId, int fontId, int fillId, int borderId, Alignment alignment, boolean locked,
            boolean hidden, boolean quotePrefix) {
        this.numFmtId = numFmtId;
        this.fontId = fontId;
        this.fillId = fillId;
        this.borderId = borderId;
        this.alignment = alignment;
        this.locked = locked;
        this.hidden = hidden;
        this.quotePrefix = quotePrefix;
    }

    public int getNumFmtId() {
        return this.numFmtId;
    }

    public int getFontId() {
        return this.fontId;
    }

    public int getFillId() {
        return this.fillId;
    }

    public int getBorderId() {
        return this.borderId;
    }

    public Alignment getAlignment() {
        return this.alignment;
    }

    public boolean isLocked() {
        return this.locked;
    }

    public boolean isHidden() {
        return this.hidden;
    }

    public boolean isQuotePrefix() {
        return this.quotePrefix;
    }

    /**
     * @return TRUE if the protection settings differ from the default
     */
    public boolean hasProtection() {
        return ! this.locked || this.hidden;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.numFmtId, this.fontId, this.fillId, this.borderId, this.alignment, this.locked,
                this.hidden, this.quotePrefix);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof XfRecord))
            return false;
        XfRecord other = (XfRecord) obj;
        return this.numFmtId == other.numFmtId && this.fontId == other.fontId && this.fillId == other.fillId
                && this.borderId == other.borderId && this.alignment.equals(other.alignment)
                && this.locked == other.locked && this.hidden == other.hidden
                && this.quotePrefix == other.quotePrefix;
    }

}
