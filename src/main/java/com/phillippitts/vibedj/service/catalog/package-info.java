/**
 * Track catalog access and shortlist sampling.
 *
 * <p>{@link com.phillippitts.vibedj.service.catalog.CatalogIndex} finds the tracks nearest to
 * a slider target. Two backends exist: an indexed one that prefilters in SQL and applies
 * weight overrides, and a full scan. {@link com.phillippitts.vibedj.service.catalog.ShortlistSampler}
 * turns nearest matches plus a weighted base pool into the songs offered to the recommender,
 * excluding recently played tracks. Catalog failures degrade to an empty shortlist.
 */
package com.phillippitts.vibedj.service.catalog;
