/**
 *
 */
package org.theseed.xlsx;

/**
 * This exception is thrown when a catalog or a text value grows past a hard ceiling imposed by the file
 * format, such as the maximum number of distinct cell styles.
 *
 * @author Bruce Parrello
 *
 */
public class XlsxLimitException extends XlsxException {

    /** serialization object version */
    private static final long serialVersionUID = 3395188813386101452L;

    public XlsxLimitException(String message) {
        super(message);
    }

}
