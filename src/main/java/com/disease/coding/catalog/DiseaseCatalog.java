package com.disease.coding.catalog;

import com.disease.coding.core.model.CatalogEntry;
import com.disease.coding.core.model.CodeEntry;
import com.disease.coding.core.model.CodeEntryUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Store of canonical disease names and their coding pairs.
 *
 * <p>Implementations are shared by concurrent callers. Once {@link #update} or
 * {@link #delete} returns, every later {@link #get} and {@link #names} call observes
 * the change. An update is atomic: readers see either the old entry or the new one.</p>
 *
 * <p>There is no creation operation; entries only come from the initial seed.</p>
 */
public interface DiseaseCatalog {

    /**
     * Looks up an entry by exact, case-sensitive name.
     *
     * @param name the canonical name
     * @return the entry, or empty if the name is not in the catalog
     */
    Optional<CodeEntry> get(String name);

    /**
     * Returns a snapshot of the canonical names, in catalog order.
     */
    List<String> names();

    /**
     * Returns a snapshot of all names with their entries, in catalog order.
     */
    List<CatalogEntry> entries();

    /**
     * Overwrites the supplied fields of an existing entry. Omitted fields keep their value.
     *
     * @param name   the canonical name
     * @param update the fields to overwrite
     * @return the entry after the update
     * @throws DiseaseNotFoundException if the name is not in the catalog, including null or blank names
     */
    CodeEntry update(String name, CodeEntryUpdate update);

    /**
     * Removes an entry.
     *
     * @param name the canonical name
     * @return the removed entry
     * @throws DiseaseNotFoundException if the name is not in the catalog, including null or blank names
     */
    CodeEntry delete(String name);

    /**
     * Returns the number of entries.
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
