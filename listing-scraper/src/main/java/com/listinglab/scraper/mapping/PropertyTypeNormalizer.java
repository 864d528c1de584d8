package com.listinglab.scraper.mapping;

import com.listinglab.scraper.model.PropertyType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a listing's style text (e.g. "Condo/Townhome", "SINGLE_FAMILY") onto {@link PropertyType}.
 * Exact match first, then the first table key contained in the text, then single family.
 */
public final class PropertyTypeNormalizer {

    private static final Map<String, PropertyType> STYLE_TABLE = new LinkedHashMap<>();

    static {
        STYLE_TABLE.put("single_family", PropertyType.SINGLE_FAMILY);
        STYLE_TABLE.put("single family", PropertyType.SINGLE_FAMILY);
        STYLE_TABLE.put("singlefamily", PropertyType.SINGLE_FAMILY);
        STYLE_TABLE.put("single-family", PropertyType.SINGLE_FAMILY);
        STYLE_TABLE.put("multi_family", PropertyType.MULTI_FAMILY);
        STYLE_TABLE.put("multi family", PropertyType.MULTI_FAMILY);
        STYLE_TABLE.put("multifamily", PropertyType.MULTI_FAMILY);
        STYLE_TABLE.put("multi-family", PropertyType.MULTI_FAMILY);
        STYLE_TABLE.put("condo", PropertyType.CONDOS);
        STYLE_TABLE.put("condos", PropertyType.CONDOS);
        STYLE_TABLE.put("condominium", PropertyType.CONDOS);
        STYLE_TABLE.put("condo/townhome", PropertyType.CONDO_TOWNHOME);
        STYLE_TABLE.put("condo_townhome", PropertyType.CONDO_TOWNHOME);
        STYLE_TABLE.put("condo/townhouse", PropertyType.CONDO_TOWNHOME);
        STYLE_TABLE.put("townhome", PropertyType.TOWNHOMES);
        STYLE_TABLE.put("townhouse", PropertyType.TOWNHOMES);
        STYLE_TABLE.put("townhomes", PropertyType.TOWNHOMES);
        STYLE_TABLE.put("townhouses", PropertyType.TOWNHOMES);
        STYLE_TABLE.put("duplex", PropertyType.DUPLEX_TRIPLEX);
        STYLE_TABLE.put("triplex", PropertyType.DUPLEX_TRIPLEX);
        STYLE_TABLE.put("duplex/triplex", PropertyType.DUPLEX_TRIPLEX);
        STYLE_TABLE.put("duplex_triplex", PropertyType.DUPLEX_TRIPLEX);
        STYLE_TABLE.put("farm", PropertyType.FARM);
        STYLE_TABLE.put("ranch", PropertyType.FARM);
        STYLE_TABLE.put("land", PropertyType.LAND);
        STYLE_TABLE.put("lot", PropertyType.LAND);
        STYLE_TABLE.put("mobile", PropertyType.MOBILE);
        STYLE_TABLE.put("mobile home", PropertyType.MOBILE);
        STYLE_TABLE.put("manufactured", PropertyType.MOBILE);
    }

    public static final PropertyType DEFAULT = PropertyType.SINGLE_FAMILY;

    private PropertyTypeNormalizer() {
    }

    public static PropertyType normalize(String style) {
        return LookupTables.resolve(STYLE_TABLE, style, DEFAULT);
    }
}
