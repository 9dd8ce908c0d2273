/**
 *
 */
package org.theseed.xlsx;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * This object contains the document metadata written to the core and extended property parts.  The creation
 * time defaults to the moment the object is built, truncated to whole seconds, so a workbook written twice
 * produces the same metadata both times.
 *
 * @author Bruce Parrello
 *
 */
public class DocProperties {

    // FIELDS
    private String title;
    private String subject;
    private String author;
    private String manager;
    private String company;
    private String category;
    private String keywords;
    private String comment;
    private String status;
    /** creation timestamp */
    private Instant created;

    /**
     * Create a property set with no metadata and the current time as the creation time.
     */
    public DocProperties() {
        this.title = "";
        this.subject = "";
        this.author = "";
        this.manager = "";
        this.company = "";
        this.category = "";
        this.keywords = "";
        this.comment = "";
        this.status = "";
        this.created = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    }

    public String getTitle() {
        return this.title;
    }

    public DocProperties setTitle(String title) {
        this.title = clean(title);
        return this;
    }

    public String getSubject() {
        return this.subject;
    }

    public DocProperties setSubject(String subject) {
        this.subject = clean(subject);
        return this;
    }

    public String getAuthor() {
        return this.author;
    }

    public DocProperties setAuthor(String author) {
        this.author = clean(author);
        return this;
    }

    public String getManager() {
        return this.manager;
    }

    public DocProperties setManager(String manager) {
        this.manager = clean(manager);
        return this;
    }

    public String getCompany() {
        return this.company;
    }

    public DocProperties setCompany(String company) {
        this.company = clean(company);
        return this;
    }

    public String getCategory() {
        return this.category;
    }

    public DocProperties setCategory(String category) {
        this.category = clean(category);
        return this;
    }

    public String getKeywords() {
        return this.keywords;
    }

    public DocProperties setKeywords(String keywords) {
        this.keywords = clean(keywords);
        return this;
    }

    public String getComment() {
        return this.comment;
    }

    public DocProperties setComment(String comment) {
        this.comment = clean(comment);
        return this;
    }

    public String getStatus() {
        return this.status;
    }

    public DocProperties setStatus(String status) {
        this.status = clean(status);
        return this;
    }

    /**
     * @return the creation time
     */
    public Instant getCreated() {
        return this.created;
    }

    /**
     * Specify the creation time.  It is truncated to whole seconds.
     *
     * @param created	creation time
     */
    public DocProperties setCreated(Instant created) {
        this.created = created.truncatedTo(ChronoUnit.SECONDS);
        return this;
    }

    /**
     * @return a property value with NULL converted to an empty string
     *
     * @param value		incoming value
     */
    private static String clean(String value) {
        return (value == null ? "" : value);
    }

}
