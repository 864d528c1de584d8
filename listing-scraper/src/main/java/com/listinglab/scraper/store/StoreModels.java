package com.listinglab.scraper.store;

/**
 * Entity names of the listing schema in the store.
 */
public final class StoreModels {

    public static final String LISTING = "real_estate.listing";
    public static final String PHOTO = "real_estate.photo";
    public static final String PHOTO_TAG = "real_estate.photo.tag";
    public static final String TAX_HISTORY = "real_estate.tax_history";
    public static final String ESTIMATE = "real_estate.estimate";
    public static final String POPULARITY = "real_estate.popularity";
    public static final String FEATURE = "real_estate.feature";
    public static final String TAG = "real_estate.tag";
    public static final String SCHOOL = "real_estate.school";

    /** Foreign key every child row carries back to its listing. */
    public static final String PARENT_FIELD = "property_id";

    private StoreModels() {
    }
}
