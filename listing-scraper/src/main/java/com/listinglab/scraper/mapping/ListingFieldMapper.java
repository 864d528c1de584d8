package com.listinglab.scraper.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.listinglab.scraper.model.CanonicalListing;
import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.model.MappedListing;
import com.listinglab.scraper.model.RawListing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a raw provider listing to the canonical listing row and its sub-collection payloads.
 *
 * No I/O: everything that needs the store (tags, schools, child rows) is carried
 * in {@link ListingChildren} and written after the listing id is known.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ListingFieldMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> VALUE_MAP = new TypeReference<>() {
    };
    private static final TypeReference<List<RawListing.CurrentEstimate>> ESTIMATE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final StoreValueScrubber scrubber;

    public MappedListing map(RawListing raw) {
        RawListing.Address address = raw.getAddress();
        RawListing.Description desc = raw.getDescription();
        RawListing.Advertiser agent = raw.getAdvertisers().getAgent();
        RawListing.Advertiser broker = raw.getAdvertisers().getBroker();
        RawListing.Advertiser office = raw.getAdvertisers().getOffice();
        RawListing.TaxRecord taxRecord = raw.getTaxRecord();
        RawListing.Flags flags = raw.getFlags();

        CanonicalListing listing = CanonicalListing.builder()
                .propertyId(text(raw.getPropertyId()))
                .mls(text(raw.getMls()))
                .mlsId(text(raw.getMlsId()))
                .mlsStatusRaw(text(raw.getMlsStatus()))
                .url(text(raw.getPropertyUrl()))

                .address(formatAddress(address))
                .street(text(address.getStreet()))
                .streetNumber(text(address.getStreetNumber()))
                .streetDirection(text(address.getStreetDirection()))
                .streetName(text(address.getStreetName()))
                .streetSuffix(text(address.getStreetSuffix()))
                .addressFullLine(text(address.getFullLine()))
                .unit(text(address.getUnit()))
                .city(text(address.getCity()))
                .state(text(address.getState()))
                .zipCode(text(address.getZip()))
                .county(text(raw.getCounty()))
                .neighborhoods(serializeBlob("neighborhoods", raw.getNeighborhoods()))

                .latitude(orZero(raw.getLatitude()))
                .longitude(orZero(raw.getLongitude()))
                .fipsCode(text(raw.getFipsCode()))
                .parcelNumber(text(raw.getParcelNumber()))

                .price(orZero(raw.getListPrice()))
                .listPriceMin(orZero(raw.getListPriceMin()))
                .listPriceMax(orZero(raw.getListPriceMax()))
                .soldPrice(orZero(raw.getSoldPrice()))
                .lastSoldPrice(orZero(raw.getLastSoldPrice()))
                .estimatedMonthlyRental(orZero(raw.getEstimatedMonthlyRental()))
                .hoaFee(orZero(raw.getHoaFee()))

                .propertyType(PropertyTypeNormalizer.normalize(desc.getStyle()))
                .listingDescription(text(desc.getText()))
                .descriptionTitle(text(desc.getName()))
                .bedrooms(orZero(desc.getBeds()))
                .bathsFull(orZero(desc.getBathsFull()))
                .bathsHalf(orZero(desc.getBathsHalf()))
                .sqft(orZero(desc.getSqft()))
                .lotSqft(orZero(desc.getLotSqft()))
                .stories(orZero(desc.getStories()))
                .garage(orZero(desc.getGarage()))
                .yearBuilt(orZero(desc.getYearBuilt()))
                .parking(serializeBlob("parking", raw.getParking()))

                .marketStatus(MarketStatusNormalizer.normalize(raw.getStatus()))
                .listingDate(DateTimes.toStoreDateTime(raw.getListDate()))
                .pendingDate(DateTimes.toStoreDateTime(raw.getPendingDate()))
                .soldDate(DateTimes.toStoreDateTime(raw.getLastSoldDate()))
                .daysOnMls(orZero(raw.getDaysOnMls()))

                .agentName(text(agent.getName()))
                .agentPhone(firstPhone(agent.getPhones()))
                .agentEmail(text(agent.getEmail()))
                .agentUuid(text(agent.getUuid()))
                .agentStateLicense(text(agent.getStateLicense()))
                .brokerName(text(broker.getName()))
                .brokerUuid(text(broker.getUuid()))
                .officeName(text(office.getName()))
                .officeUuid(text(office.getUuid()))
                .officeEmail(text(office.getEmail()))

                .taxRecordApn(text(taxRecord.getApn()))
                .taxRecordClId(text(taxRecord.getClId()))
                .taxRecordLastUpdateDate(DateTimes.toStoreDateTime(taxRecord.getLastUpdateDate()))
                .taxRecordPublicRecordId(text(taxRecord.getPublicRecordId()))
                .taxRecordTaxParcelId(text(taxRecord.getTaxParcelId()))

                .isComingSoon(isTrue(flags.getIsComingSoon()))
                .isContingent(isTrue(flags.getIsContingent()))
                .isForeclosure(isTrue(flags.getIsForeclosure()))
                .isNewConstruction(isTrue(flags.getIsNewConstruction()))
                .isNewListing(isTrue(flags.getIsNewListing()))
                .isPending(isTrue(flags.getIsPending()))
                .isPriceReduced(isTrue(flags.getIsPriceReduced()))

                .terms(text(raw.getTerms()))
                .petPolicy(serializeBlob("pet_policy", raw.getPetPolicy()))
                .openHouses(serializeBlob("open_houses", raw.getOpenHouses()))
                .units(serializeBlob("units", raw.getUnits()))
                .currentEstimates(serializeBlob("current_estimates", raw.getCurrentEstimates()))
                .estimates(serializeBlob("estimates", raw.getEstimates()))
                .propertyTags(raw.getTags().isEmpty() ? null : toJson("property_tags", raw.getTags()))
                .build();

        ListingChildren children = ListingChildren.builder()
                .photos(raw.getPhotos())
                .altPhotos(desc.getAltPhotos())
                .taxHistory(raw.getTaxHistory())
                .estimates(currentEstimates(raw.getEstimates()))
                .popularityPeriods(raw.getPopularity().getPeriods())
                .features(raw.getDetails())
                .tags(raw.getTags())
                .nearbySchools(raw.getNearbySchools())
                .build();

        log.debug("Mapped listing property_id={} mls={} address={}",
                listing.getPropertyId(), listing.getMls(), listing.getAddress());
        return new MappedListing(listing, children);
    }

    /**
     * Field map as sent to the store, after the scrub pass.
     */
    public Map<String, Object> toStoreValues(CanonicalListing listing) {
        Map<String, Object> values = objectMapper.convertValue(listing, VALUE_MAP);
        return scrubber.scrub(values);
    }

    /**
     * The provider's formatted address if it has one, otherwise
     * "street\nunit\ncity, state zip" from whichever parts exist.
     */
    static String formatAddress(RawListing.Address address) {
        if (hasText(address.getFormattedAddress())) {
            return address.getFormattedAddress();
        }

        List<String> lines = new ArrayList<>();
        if (hasText(address.getStreet())) {
            lines.add(address.getStreet());
        }
        if (hasText(address.getUnit())) {
            lines.add(address.getUnit());
        }

        StringBuilder cityStateZip = new StringBuilder();
        if (hasText(address.getCity())) {
            cityStateZip.append(address.getCity());
        }
        if (hasText(address.getState())) {
            cityStateZip.append(cityStateZip.length() > 0 ? ", " : "").append(address.getState());
        }
        if (hasText(address.getZip())) {
            cityStateZip.append(cityStateZip.length() > 0 ? " " : "").append(address.getZip());
        }
        if (cityStateZip.length() > 0) {
            lines.add(cityStateZip.toString());
        }

        return String.join("\n", lines);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private List<RawListing.CurrentEstimate> currentEstimates(JsonNode estimates) {
        if (estimates == null || !estimates.path("current_values").isArray()) {
            return List.of();
        }
        try {
            return objectMapper.convertValue(estimates.get("current_values"), ESTIMATE_LIST);
        } catch (IllegalArgumentException e) {
            log.warn("Could not read estimates.current_values: {}", e.getMessage());
            return List.of();
        }
    }

    private String serializeBlob(String field, JsonNode blob) {
        if (blob == null || blob.isNull() || blob.isMissingNode()
                || (blob.isContainerNode() && blob.isEmpty())
                || (blob.isTextual() && blob.asText().isEmpty())) {
            return "";
        }
        return toJson(field, DateTimes.normalizeTree(blob));
    }

    private String toJson(String field, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise {} for storage: {}", field, e.getMessage());
            return "";
        }
    }

    private static String firstPhone(List<RawListing.Phone> phones) {
        if (phones.isEmpty() || phones.get(0) == null) {
            return "";
        }
        return text(phones.get(0).getNumber());
    }

    private static String text(String val) {
        return val == null ? "" : val;
    }

    private static boolean hasText(String val) {
        return val != null && !val.isBlank();
    }

    private static double orZero(Double val) {
        return val == null ? 0.0 : val;
    }

    private static int orZero(Integer val) {
        return val == null ? 0 : val;
    }

    private static boolean isTrue(Boolean val) {
        return Boolean.TRUE.equals(val);
    }
}
