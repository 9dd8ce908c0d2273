/**
 *
 */
package org.theseed.xlsx;

/**
 * This exception is thrown when a new object collides with an existing one:  an overlapping merged range
 * or a duplicate worksheet name.
 *
 * @author Bruce Parrello
 *
 */
public class XlsxConflictException extends XlsxException {

    /** serialization object version */
    private static final long serialVersionUID = 4017360871929548871L;

    public XlsxConflictException(String message) {
        super(message);
    }

}
