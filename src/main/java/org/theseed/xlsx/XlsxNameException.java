/**
 *
 */
package org.theseed.xlsx;

/**
 * This exception is thrown when a worksheet name or defined name is not acceptable to the file format.
 *
 * @author Bruce Parrello
 *
 */
public class XlsxNameException extends XlsxException {

    /** serialization object version */
    private static final long serialVersionUID = -7407994196812262395L;
    /** offending name */
    private final String name;

    /**
     * Create a name exception.
     *
     * @param name		offending name
     * @param message	description of the problem
     */
    public XlsxNameException(String name, String message) {
        super(message);
        this.name = name;
    }

    /**
     * @return the name that was rejected
     */
    public String getName() {
        return this.name;
    }

}
