/**
 *
 */
package org.theseed.xlsx;

/**
 * This is the base exception for errors detected while building or assembling a workbook.  Errors found
 * while the model is being mutated are thrown at the point of mutation and leave the model unchanged,
 * so the caller can recover and keep authoring.
 *
 * @author Bruce Parrello
 *
 */
public class XlsxException extends Exception {

    /** serialization object version */
    private static final long serialVersionUID = 6618425540212736918L;

    /**
     * Create a workbook exception.
     *
     * @param message	error message
     */
    public XlsxException(String message) {
        super(message);
    }

    /**
     * Create a workbook exception with an underlying cause.
     *
     * @param message	error message
     * @param cause		underlying exception
     */
    public XlsxException(String message, Throwable cause) {
        super(message, cause);
    }

}
