/**
 *
 */
package org.theseed.xlsx.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * This is an ordered, deduplicated list of style components.  Each distinct item gets the next index when it
 * is first added, and later additions of an equal item return the original index.
 *
 * @param <T>	type of item in the catalog
 *
 * @author Bruce Parrello
 *
 */
public class Catalog<T> {

    // FIELDS
    /** items in index order */
    private final List<T> items;
    /** map of items to indices */
    private final Map<T, Integer> indices;

    /**
     * Construct an empty catalog.
     */
    public Catalog() {
        this.items = new ArrayList<T>();
        this.indices = new HashMap<T, Integer>();
    }

    /**
     * @return the index of an item, or -1 if it is not in the catalog
     *
     * @param item	item to find
     */
    public int indexOf(T item) {
        Integer retVal = this.indices.get(item);
        return (retVal == null ? -1 : retVal);
    }

    /**
     * Find or add an item.
     *
     * @param item	item to add
     *
     * @return the index of the item
     */
    public int add(T item) {
        Integer retVal = this.indices.get(item);
        if (retVal == null) {
            retVal = this.items.size();
            this.items.add(item);
            this.indices.put(item, retVal);
        }
        return retVal;
    }

    /**
     * @return the item at the specified index
     *
     * @param idx	index of desired item
     */
    public T get(int idx) {
        return this.items.get(idx);
    }

    /**
     * @return the number of items in the catalog
     */
    public int size() {
        return this.items.size();
    }

    /**
     * @return an unmodifiable view of the items in index order
     */
    public List<T> getItems() {
        return Collections.unmodifiableList(this.items);
    }

}
