/**
 *
 */
package org.theseed.xlsx.xml;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * This class contains the static escaping methods used to make arbitrary text safe inside XML.  Characters
 * that XML 1.0 cannot represent at all are written using the OOXML "_xHHHH_" escape, which readers decode
 * back to the original character, so no text is ever lost.
 *
 * @author Bruce Parrello
 *
 */
public class XmlEscaper {

    /** pattern for an OOXML character escape that already appears in user text */
    private static final Pattern OOXML_ESCAPE = Pattern.compile("_x[0-9a-fA-F]{4}_");

    private XmlEscaper() { }

    /**
     * Escape text for use as element content.
     *
     * @param text		text to escape
     *
     * @return the escaped text
     */
    public static String escapeData(String text) {
        return escape(text, false);
    }

    /**
     * Escape text for use as an attribute value.  In addition to the element-content escapes, quotes and
     * newlines are converted to character references.
     *
     * @param text		text to escape
     *
     * @return the escaped text
     */
    public static String escapeAttribute(String text) {
        return escape(text, true);
    }

    /**
     * Escape a string, choosing the escapes based on its target context.
     *
     * @param text		text to escape
     * @param attr		TRUE if the text is an attribute value
     *
     * @return the escaped text
     */
    private static String escape(String text, boolean attr) {
        // Find the first character needing work.  Most strings need none.
        final int n = text.length();
        int i = 0;
        while (i < n && ! needsEscape(text, i, attr)) i++;
        if (i >= n)
            return text;
        StringBuilder retVal = new StringBuilder(n + 16);
        retVal.append(text, 0, i);
        while (i < n) {
            char c = text.charAt(i);
            switch (c) {
            case '&' -> retVal.append("&amp;");
            case '<' -> retVal.append("&lt;");
            case '>' -> retVal.append("&gt;");
            case '"' -> retVal.append(attr ? "&quot;" : "\"");
            case '\n' -> retVal.append(attr ? "&#xA;" : "\n");
            case '\r' -> retVal.append("&#xD;");
            default -> {
                if (Character.isHighSurrogate(c) && i + 1 < n && Character.isLowSurrogate(text.charAt(i + 1))) {
                    // A proper surrogate pair is legal.
                    retVal.append(c).append(text.charAt(i + 1));
                    i++;
                } else if (isForbidden(c))
                    appendCharEscape(retVal, c);
                else
                    retVal.append(c);
            }
            }
            i++;
        }
        return retVal.toString();
    }

    /**
     * @return TRUE if the character at the specified position needs to be escaped
     *
     * @param text		source text
     * @param i			position of character to check
     * @param attr		TRUE if the text is an attribute value
     */
    private static boolean needsEscape(String text, int i, boolean attr) {
        char c = text.charAt(i);
        boolean retVal;
        switch (c) {
        case '&', '<', '>', '\r' -> retVal = true;
        case '"', '\n' -> retVal = attr;
        default -> {
            if (Character.isHighSurrogate(c))
                retVal = true;
            else
                retVal = isForbidden(c);
        }
        }
        return retVal;
    }

    /**
     * @return TRUE if the character can never appear in an XML 1.0 document, even as a character reference
     *
     * @param c		character to check
     */
    public static boolean isForbidden(char c) {
        boolean retVal;
        if (c < 0x20)
            retVal = (c != '\t' && c != '\n' && c != '\r');
        else
            retVal = (Character.isSurrogate(c) || c == '\uFFFE' || c == '\uFFFF');
        return retVal;
    }

    /**
     * Append the OOXML escape for a single character.
     *
     * @param buffer	output buffer
     * @param c			character to escape
     */
    private static void appendCharEscape(StringBuilder buffer, char c) {
        buffer.append(String.format("_x%04X_", (int) c));
    }

    /**
     * Prepare cell text for storage in an OOXML string item.  Literal text that looks like an OOXML character
     * escape is protected by escaping its leading underscore, so that the reader does not decode it.  The
     * result must still be passed through {@link #escapeData(String)}, which handles forbidden characters.
     *
     * @param text		cell text
     *
     * @return the protected text
     */
    public static String protectOoxmlEscapes(String text) {
        String retVal = text;
        if (text.indexOf("_x") >= 0) {
            Matcher m = OOXML_ESCAPE.matcher(text);
            if (m.find())
                retVal = m.replaceAll("_x005F$0");
        }
        return retVal;
    }

    /**
     * @return TRUE if the text has leading or trailing whitespace that requires "xml:space" preservation
     *
     * @param text		text to check
     */
    public static boolean needsPreserve(String text) {
        boolean retVal = false;
        if (! text.isEmpty()) {
            retVal = Character.isWhitespace(text.charAt(0)) || Character.isWhitespace(text.charAt(text.length() - 1));
        }
        return retVal;
    }

}
