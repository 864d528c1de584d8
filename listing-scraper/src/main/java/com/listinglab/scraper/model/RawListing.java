package com.listinglab.scraper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw DTO matching the scraping provider's listing JSON.
 * Kept separate from the canonical model to isolate provider coupling.
 *
 * Every field is optional. Nested objects and lists start out empty and an
 * explicit JSON null leaves them empty, so code reading a RawListing never has
 * to null-check a nested structure.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawListing {

    // ── Identity ────────────────────────────────────────────────────────────
    @JsonProperty("property_id")
    private String propertyId;

    @JsonProperty("listing_id")
    private String listingId;

    private String mls;

    @JsonProperty("mls_id")
    private String mlsId;

    @JsonProperty("mls_status")
    private String mlsStatus;

    private String status;

    @JsonProperty("property_url")
    private String propertyUrl;

    // ── Location ────────────────────────────────────────────────────────────
    @JsonSetter(nulls = Nulls.SKIP)
    private Address address = new Address();

    private String county;

    @JsonProperty("fips_code")
    private String fipsCode;

    @JsonProperty("parcel_number")
    private String parcelNumber;

    private Double latitude;

    private Double longitude;

    /** Free-form; stored as serialized text. */
    private JsonNode neighborhoods;

    // ── Description ─────────────────────────────────────────────────────────
    @JsonSetter(nulls = Nulls.SKIP)
    private Description description = new Description();

    // ── Prices and dates ────────────────────────────────────────────────────
    @JsonProperty("list_price")
    private Double listPrice;

    @JsonProperty("list_price_min")
    private Double listPriceMin;

    @JsonProperty("list_price_max")
    private Double listPriceMax;

    @JsonProperty("sold_price")
    private Double soldPrice;

    @JsonProperty("last_sold_price")
    private Double lastSoldPrice;

    @JsonProperty("estimated_monthly_rental")
    private Double estimatedMonthlyRental;

    @JsonProperty("hoa_fee")
    private Double hoaFee;

    @JsonProperty("list_date")
    private String listDate;

    @JsonProperty("pending_date")
    private String pendingDate;

    @JsonProperty("last_sold_date")
    private String lastSoldDate;

    @JsonProperty("days_on_mls")
    private Integer daysOnMls;

    // ── People ──────────────────────────────────────────────────────────────
    @JsonSetter(nulls = Nulls.SKIP)
    private Advertisers advertisers = new Advertisers();

    // ── Public record ───────────────────────────────────────────────────────
    @JsonProperty("tax_record")
    @JsonSetter(nulls = Nulls.SKIP)
    private TaxRecord taxRecord = new TaxRecord();

    @JsonSetter(nulls = Nulls.SKIP)
    private Flags flags = new Flags();

    private String terms;

    // ── Loosely structured blocks, stored as serialized text ────────────────
    private JsonNode parking;

    @JsonProperty("pet_policy")
    private JsonNode petPolicy;

    @JsonProperty("open_houses")
    private JsonNode openHouses;

    private JsonNode units;

    @JsonProperty("current_estimates")
    private JsonNode currentEstimates;

    /** Serialized as a whole; {@code current_values} also feeds the estimate rows. */
    private JsonNode estimates;

    // ── Sub-collections ─────────────────────────────────────────────────────
    /** Items are objects, bare URL strings or {@code [href, tags]} arrays. */
    @JsonSetter(nulls = Nulls.SKIP)
    private List<JsonNode> photos = new ArrayList<>();

    @JsonSetter(nulls = Nulls.SKIP)
    private Popularity popularity = new Popularity();

    @JsonProperty("tax_history")
    @JsonSetter(nulls = Nulls.SKIP)
    private List<TaxHistoryEntry> taxHistory = new ArrayList<>();

    @JsonSetter(nulls = Nulls.SKIP)
    private List<FeatureDetail> details = new ArrayList<>();

    @JsonSetter(nulls = Nulls.SKIP)
    private List<String> tags = new ArrayList<>();

    @JsonProperty("nearby_schools")
    @JsonSetter(nulls = Nulls.SKIP)
    private List<String> nearbySchools = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Address {
        private String street;
        private String unit;
        private String city;
        private String state;
        private String zip;

        @JsonProperty("formatted_address")
        private String formattedAddress;

        @JsonProperty("full_line")
        private String fullLine;

        @JsonProperty("street_number")
        private String streetNumber;

        @JsonProperty("street_direction")
        private String streetDirection;

        @JsonProperty("street_name")
        private String streetName;

        @JsonProperty("street_suffix")
        private String streetSuffix;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Description {
        private String style;
        private String name;
        private String text;
        private Integer beds;

        @JsonProperty("baths_full")
        private Integer bathsFull;

        @JsonProperty("baths_half")
        private Integer bathsHalf;

        private Integer sqft;

        @JsonProperty("lot_sqft")
        private Integer lotSqft;

        @JsonProperty("year_built")
        private Integer yearBuilt;

        private Double stories;
        private Integer garage;

        /** Detail-size image URLs, index-aligned with {@link RawListing#getPhotos()}. */
        @JsonProperty("alt_photos")
        @JsonSetter(nulls = Nulls.SKIP)
        private List<String> altPhotos = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Advertisers {
        @JsonSetter(nulls = Nulls.SKIP)
        private Advertiser agent = new Advertiser();

        @JsonSetter(nulls = Nulls.SKIP)
        private Advertiser broker = new Advertiser();

        @JsonSetter(nulls = Nulls.SKIP)
        private Advertiser office = new Advertiser();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Advertiser {
        private String uuid;
        private String name;
        private String email;

        @JsonProperty("state_license")
        private String stateLicense;

        @JsonSetter(nulls = Nulls.SKIP)
        private List<Phone> phones = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Phone {
        private String number;
        private String type;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TaxRecord {
        private String apn;

        @JsonProperty("cl_id")
        private String clId;

        @JsonProperty("last_update_date")
        private String lastUpdateDate;

        @JsonProperty("public_record_id")
        private String publicRecordId;

        @JsonProperty("tax_parcel_id")
        private String taxParcelId;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Flags {
        @JsonProperty("is_coming_soon")
        private Boolean isComingSoon;

        @JsonProperty("is_contingent")
        private Boolean isContingent;

        @JsonProperty("is_foreclosure")
        private Boolean isForeclosure;

        @JsonProperty("is_new_construction")
        private Boolean isNewConstruction;

        @JsonProperty("is_new_listing")
        private Boolean isNewListing;

        @JsonProperty("is_pending")
        private Boolean isPending;

        @JsonProperty("is_price_reduced")
        private Boolean isPriceReduced;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Popularity {
        @JsonSetter(nulls = Nulls.SKIP)
        private List<PopularityPeriod> periods = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PopularityPeriod {
        @JsonProperty("last_n_days")
        private Integer lastNDays;

        @JsonProperty("views_total")
        private Integer viewsTotal;

        @JsonProperty("clicks_total")
        private Integer clicksTotal;

        @JsonProperty("saves_total")
        private Integer savesTotal;

        @JsonProperty("shares_total")
        private Integer sharesTotal;

        @JsonProperty("leads_total")
        private Integer leadsTotal;

        @JsonProperty("dwell_time_mean")
        private Double dwellTimeMean;

        @JsonProperty("dwell_time_median")
        private Double dwellTimeMedian;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TaxHistoryEntry {
        private Integer year;
        private Double tax;

        @JsonProperty("assessed_year")
        private Integer assessedYear;

        private Double value;
        private Assessment assessment;
        private Double appraisal;
        private Double market;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Assessment {
        private Double total;
        private Double building;
        private Double land;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CurrentEstimate {
        private String date;
        private Double estimate;

        @JsonProperty("estimate_high")
        private Double estimateHigh;

        @JsonProperty("estimate_low")
        private Double estimateLow;

        @JsonProperty("is_best_home_value")
        private Boolean isBestHomeValue;

        @JsonSetter(nulls = Nulls.SKIP)
        private EstimateSource source = new EstimateSource();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EstimateSource {
        private String name;
        private String type;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FeatureDetail {
        private String category;

        @JsonProperty("parent_category")
        private String parentCategory;

        @JsonSetter(nulls = Nulls.SKIP)
        private List<String> text = new ArrayList<>();
    }
}
