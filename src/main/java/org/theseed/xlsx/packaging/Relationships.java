/**
 *
 */
package org.theseed.xlsx.packaging;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.theseed.xlsx.xml.XmlWriter;

/**
 * This object builds a relationship part.  Relationship IDs are assigned sequentially, starting with
 * <code>rId1</code>, in the order the relationships are added.
 *
 * @author Bruce Parrello
 *
 */
public class Relationships implements XmlWriter.Body {

    // FIELDS
    /** list of relationships, as type/target pairs */
    private final List<Pair<String, String>> relationships;

    /** base URI for document relationship types */
    public static final String DOCUMENT_BASE = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    /** office document relationship type */
    public static final String OFFICE_DOCUMENT = DOCUMENT_BASE + "/officeDocument";
    /** core properties relationship type */
    public static final String CORE_PROPERTIES = "http://schemas.openxmlformats.org/package/2006/relationships/metadata/core-properties";
    /** extended properties relationship type */
    public static final String EXTENDED_PROPERTIES = DOCUMENT_BASE + "/extended-properties";
    /** worksheet relationship type */
    public static final String WORKSHEET = DOCUMENT_BASE + "/worksheet";
    /** styles relationship type */
    public static final String STYLES = DOCUMENT_BASE + "/styles";
    /** shared strings relationship type */
    public static final String SHARED_STRINGS = DOCUMENT_BASE + "/sharedStrings";

    /**
     * Create an empty relationship part.
     */
    public Relationships() {
        this.relationships = new ArrayList<Pair<String, String>>();
    }

    /**
     * Add a relationship.
     *
     * @param type		relationship type URI
     * @param target	target part, relative to the source
     *
     * @return the ID assigned to the relationship
     */
    public String add(String type, String target) {
        this.relationships.add(Pair.of(type, target));
        return "rId" + this.relationships.size();
    }

    /**
     * @return the number of relationships
     */
    public int size() {
        return this.relationships.size();
    }

    @Override
    public void write(XmlWriter writer) throws IOException {
        writer.startTag("Relationships", List.of(XmlWriter.attr("xmlns", "http://schemas.openxmlformats.org/package/2006/relationships")));
        int id = 1;
        for (Pair<String, String> relationship : this.relationships) {
            writer.emptyTag("Relationship", List.of(XmlWriter.attr("Id", "rId" + id),
                    XmlWriter.attr("Type", relationship.getLeft()), XmlWriter.attr("Target", relationship.getRight())));
            id++;
        }
        writer.endTag("Relationships");
    }

}
