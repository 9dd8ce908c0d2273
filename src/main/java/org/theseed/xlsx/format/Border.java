/**
 *
 */
package org.theseed.xlsx.format;

import java.util.Objects;

import org.apache.poi.ss.usermodel.BorderStyle;

/**
 * This is an immutable cell-border descriptor.  It describes the four edges plus the optional diagonal
 * line.  An edge with no line style never carries a color, so that equivalent borders compare equal.
 *
 * @author Bruce Parrello
 *
 */
public final class Border {

    /**
     * This enum describes the diagonal directions.
     */
    public static enum Diagonal {
        NONE, UP, DOWN, BOTH;
    }

    /**
     * This represents a single edge of a border.
     */
    public static final class Edge {

        /** line style */
        private final BorderStyle style;
        /** line color */
        private final Color color;

        /** an edge with no line */
        public static final Edge NONE = new Edge(BorderStyle.NONE, Color.DEFAULT);

        private Edge(BorderStyle style, Color color) {
            this.style = style;
            this.color = color;
        }

        /**
         * @return a canonical edge
         *
         * @param style		line style, or NULL for none
         * @param color		line color, or NULL for the default
         */
        public static Edge of(BorderStyle style, Color color) {
            Edge retVal;
            if (style == null || style == BorderStyle.NONE)
                retVal = NONE;
            else
                retVal = new Edge(style, (color == null ? Color.DEFAULT : color));
            return retVal;
        }

        /**
         * @return the line style
         */
        public BorderStyle getStyle() {
            return this.style;
        }

        /**
         * @return the line color
         */
        public Color getColor() {
            return this.color;
        }

        /**
         * @return TRUE if this edge has no line
         */
        public boolean isNone() {
            return this.style == BorderStyle.NONE;
        }

        @Override
        public int hashCode() {
            return this.style.hashCode() * 31 + this.color.hashCode();
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (! (obj instanceof Edge))
                return false;
            Edge other = (Edge) obj;
            return this.style == other.style && this.color.equals(other.color);
        }

    }

    // FIELDS
    /** left edge */
    private final Edge left;
    /** right edge */
    private final Edge right;
    /** top edge */
    private final Edge top;
    /** bottom edge */
    private final Edge bottom;
    /** diagonal line */
    private final Edge diagonal;
    /** diagonal direction */
    private final Diagonal direction;

    /** the empty border, which is always the first border in a style sheet */
    public static final Border NONE = new Border(Edge.NONE, Edge.NONE, Edge.NONE, Edge.NONE, Edge.NONE, Diagonal.NONE);

    private Border(Edge left, Edge right, Edge top, Edge bottom, Edge diagonal, Diagonal direction) {
        this.left = left;
        this.right = right;
        this.top = top;
        this.bottom = bottom;
        this.diagonal = diagonal;
        this.direction = direction;
    }

    /**
     * Create a canonical border descriptor.
     *
     * @param left			left edge
     * @param right			right edge
     * @param top			top edge
     * @param bottom		bottom edge
     * @param diagonal		diagonal line
     * @param direction		diagonal direction
     *
     * @return the canonical border
     */
    public static Border of(Edge left, Edge right, Edge top, Edge bottom, Edge diagonal, Diagonal direction) {
        Edge diag = diagonal;
        Diagonal dir = (direction == null ? Diagonal.NONE : direction);
        // A diagonal needs both a line and a direction.
        if (diag.isNone() || dir == Diagonal.NONE) {
            diag = Edge.NONE;
            dir = Diagonal.NONE;
        }
        Border retVal;
        if (left.isNone() && right.isNone() && top.isNone() && bottom.isNone() && diag.isNone())
            retVal = NONE;
        else
            retVal = new Border(left, right, top, bottom, diag, dir);
        return retVal;
    }

    /**
     * @return the left edge
     */
    public Edge getLeft() {
        return this.left;
    }

    /**
     * @return the right edge
     */
    public Edge getRight() {
        return this.right;
    }

    /**
     * @return the top edge
     */
    public Edge getTop() {
        return this.top;
    }

    /**
     * @return the bottom edge
     */
    public Edge getBottom() {
        return this.bottom;
    }

    /**
     * @return the diagonal line
     */
    public Edge getDiagonal() {
        return this.diagonal;
    }

    /**
     * @return the diagonal direction
     */
    public Diagonal getDirection() {
        return this.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.left, this.right, this.top, this.bottom, this.diagonal, this.direction);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (! (obj instanceof Border))
            return false;
        Border other = (Border) obj;
        return this.left.equals(other.left) && this.right.equals(other.right) && this.top.equals(other.top)
                && this.bottom.equals(other.bottom) && this.diagonal.equals(other.diagonal)
                && this.direction == other.direction;
    }

}
