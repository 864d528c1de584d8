package com.listinglab.scraper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Normalised listing row, serialised with snake_case names straight into the
 * store's field names.
 *
 * Matching notes:
 *  - propertyId, mls, url and address are the keys the reconciler tries, in that order
 *  - string fields default to "" rather than null so an update clears stale values
 *  - date fields are already in the store's "yyyy-MM-dd HH:mm:ss" format
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CanonicalListing {

    // ── Identity ────────────────────────────────────────────────────────────
    private String propertyId;
    private String mls;
    private String mlsId;
    private String mlsStatusRaw;
    private String url;

    // ── Address ─────────────────────────────────────────────────────────────
    /** Formatted single address; the last-resort matching key. */
    private String address;
    private String street;
    private String streetNumber;
    private String streetDirection;
    private String streetName;
    private String streetSuffix;
    private String addressFullLine;
    private String unit;
    private String city;
    private String state;
    private String zipCode;
    private String county;
    private String neighborhoods;

    // ── Location ────────────────────────────────────────────────────────────
    private Double latitude;
    private Double longitude;
    private String fipsCode;
    private String parcelNumber;

    // ── Price ───────────────────────────────────────────────────────────────
    private Double price;
    private Double listPriceMin;
    private Double listPriceMax;
    private Double soldPrice;
    private Double lastSoldPrice;
    private Double estimatedMonthlyRental;
    private Double hoaFee;

    // ── Description ─────────────────────────────────────────────────────────
    private PropertyType propertyType;
    private String listingDescription;
    private String descriptionTitle;
    private Integer bedrooms;
    private Integer bathsFull;
    private Integer bathsHalf;
    private Integer sqft;
    private Integer lotSqft;
    private Double stories;
    private Integer garage;
    private Integer yearBuilt;
    private String parking;

    // ── Status and dates ────────────────────────────────────────────────────
    private MarketStatus marketStatus;
    private String listingDate;
    private String pendingDate;
    private String soldDate;
    private Integer daysOnMls;

    // ── Advertisers ─────────────────────────────────────────────────────────
    private String agentName;
    private String agentPhone;
    private String agentEmail;
    private String agentUuid;
    private String agentStateLicense;
    private String brokerName;
    private String brokerUuid;
    private String officeName;
    private String officeUuid;
    private String officeEmail;

    // ── Tax record ──────────────────────────────────────────────────────────
    private String taxRecordApn;
    private String taxRecordClId;
    private String taxRecordLastUpdateDate;
    private String taxRecordPublicRecordId;
    private String taxRecordTaxParcelId;

    // ── Flags ───────────────────────────────────────────────────────────────
    private Boolean isComingSoon;
    private Boolean isContingent;
    private Boolean isForeclosure;
    private Boolean isNewConstruction;
    private Boolean isNewListing;
    private Boolean isPending;
    private Boolean isPriceReduced;

    // ── Serialised blocks ───────────────────────────────────────────────────
    private String terms;
    private String petPolicy;
    private String openHouses;
    private String units;
    private String currentEstimates;
    private String estimates;

    /** JSON list of tag api-names; the linked tag rows are written separately. */
    private String propertyTags;
}
