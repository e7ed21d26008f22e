package org.waabox.completist.catalog;

/**
 * One hit of a title search.
 *
 * @param id    the catalog id, never null
 * @param title the title, may be null
 * @param year  the release or first air year, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogSearchResult(String id, String title, Integer year) {
}
