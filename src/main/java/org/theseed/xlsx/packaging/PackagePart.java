/**
 *
 */
package org.theseed.xlsx.packaging;

/**
 * This object is a single fully-generated part of the package:  its name inside the archive and its bytes.
 *
 * @author Bruce Parrello
 *
 */
public class PackagePart {

    // FIELDS
    /** part name (archive path, without a leading slash) */
    private final String name;
    /** part content */
    private final byte[] data;

    /**
     * Construct a package part.
     *
     * @param name		archive path of the part
     * @param data		content of the part
     */
    public PackagePart(String name, byte[] data) {
        this.name = name;
        this.data = data;
    }

    /**
     * @return the archive path of the part
     */
    public String getName() {
        return this.name;
    }

    /**
     * @return the content of the part
     */
    public byte[] getData() {
        return this.data;
    }

    @Override
    public String toString() {
        return this.name + " (" + this.data.length + " bytes)";
    }

}
