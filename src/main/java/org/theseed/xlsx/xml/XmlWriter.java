/**
 *
 */
package org.theseed.xlsx.xml;

import java.io.BufferedWriter;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;

/**
 * This object writes a single XML document to a UTF-8 byte stream.  It knows nothing about spreadsheets:  it
 * simply guarantees that every tag, attribute and text node it produces is well-formed.  Attributes are passed
 * as ordered lists of name/value pairs, so the output order is always the order given by the caller.
 *
 * @author Bruce Parrello
 *
 */
public class XmlWriter implements Closeable {

    // FIELDS
    /** output writer */
    private final Writer out;
    /** empty attribute list */
    private static final List<Pair<String, String>> NO_ATTRIBUTES = Collections.emptyList();

    /**
     * Create an XML writer for an output stream.
     *
     * @param stream	target output stream
     */
    public XmlWriter(OutputStream stream) {
        this.out = new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8), 65536);
    }

    /**
     * Create an attribute pair.
     *
     * @param name		attribute name
     * @param value		attribute value (converted to a string)
     *
     * @return a name/value pair for an attribute list
     */
    public static Pair<String, String> attr(String name, Object value) {
        return Pair.of(name, String.valueOf(value));
    }

    /**
     * Write the standard XML declaration, followed by a new-line.
     *
     * @throws IOException
     */
    public void declaration() throws IOException {
        this.out.write("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n");
    }

    /**
     * Write an opening tag with no attributes.
     *
     * @param tag		element name
     *
     * @throws IOException
     */
    public void startTag(String tag) throws IOException {
        this.startTag(tag, NO_ATTRIBUTES);
    }

    /**
     * Write an opening tag.
     *
     * @param tag			element name
     * @param attributes	list of attribute name/value pairs
     *
     * @throws IOException
     */
    public void startTag(String tag, List<Pair<String, String>> attributes) throws IOException {
        this.out.write('<');
        this.out.write(tag);
        this.writeAttributes(attributes);
        this.out.write('>');
    }

    /**
     * Write a closing tag.
     *
     * @param tag		element name
     *
     * @throws IOException
     */
    public void endTag(String tag) throws IOException {
        this.out.write("</");
        this.out.write(tag);
        this.out.write('>');
    }

    /**
     * Write a self-closing tag with no attributes.
     *
     * @param tag		element name
     *
     * @throws IOException
     */
    public void emptyTag(String tag) throws IOException {
        this.emptyTag(tag, NO_ATTRIBUTES);
    }

    /**
     * Write a self-closing tag.
     *
     * @param tag			element name
     * @param attributes	list of attribute name/value pairs
     *
     * @throws IOException
     */
    public void emptyTag(String tag, List<Pair<String, String>> attributes) throws IOException {
        this.out.write('<');
        this.out.write(tag);
        this.writeAttributes(attributes);
        this.out.write("/>");
    }

    /**
     * Write an element containing only text.
     *
     * @param tag		element name
     * @param data		text content
     *
     * @throws IOException
     */
    public void dataElement(String tag, String data) throws IOException {
        this.dataElement(tag, data, NO_ATTRIBUTES);
    }

    /**
     * Write an element containing only text.
     *
     * @param tag			element name
     * @param data			text content
     * @param attributes	list of attribute name/value pairs
     *
     * @throws IOException
     */
    public void dataElement(String tag, String data, List<Pair<String, String>> attributes) throws IOException {
        this.startTag(tag, attributes);
        this.characters(data);
        this.endTag(tag);
    }

    /**
     * Write escaped text content.
     *
     * @param data		text to write
     *
     * @throws IOException
     */
    public void characters(String data) throws IOException {
        this.out.write(XmlEscaper.escapeData(data));
    }

    /**
     * Write the attributes for a tag.
     *
     * @param attributes	list of attribute name/value pairs
     *
     * @throws IOException
     */
    private void writeAttributes(List<Pair<String, String>> attributes) throws IOException {
        for (Pair<String, String> attribute : attributes) {
            this.out.write(' ');
            this.out.write(attribute.getKey());
            this.out.write("=\"");
            this.out.write(XmlEscaper.escapeAttribute(attribute.getValue()));
            this.out.write('"');
        }
    }

    /**
     * Flush buffered output to the underlying stream.
     *
     * @throws IOException
     */
    public void flush() throws IOException {
        this.out.flush();
    }

    @Override
    public void close() throws IOException {
        this.out.close();
    }

    /**
     * This interface describes an object that writes the content of one XML document.
     */
    @FunctionalInterface
    public interface Body {

        /**
         * Write the document.
         *
         * @param writer	XML writer to use
         *
         * @throws IOException
         */
        void write(XmlWriter writer) throws IOException;

    }

    /**
     * Produce an XML document in memory.
     *
     * @param body		object that writes the document content
     *
     * @return the UTF-8 bytes of the document
     *
     * @throws IOException
     */
    public static byte[] toBytes(Body body) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(4096);
        try (XmlWriter writer = new XmlWriter(buffer)) {
            writer.declaration();
            body.write(writer);
        }
        return buffer.toByteArray();
    }

}
