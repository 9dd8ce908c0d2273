/**
 *
 */
package org.theseed.xlsx;

/**
 * This exception is thrown when a coordinate, a range shape, or a value falls outside the limits of the
 * active spreadsheet version.
 *
 * @author Bruce Parrello
 *
 */
public class XlsxRangeException extends XlsxException {

    /** serialization object version */
    private static final long serialVersionUID = -2179563460925121127L;

    public XlsxRangeException(String message) {
        super(message);
    }

}
