package com.listinglab.scraper.upsert;

import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.store.StoreClient;
import com.listinglab.scraper.store.StoreCommands;
import com.listinglab.scraper.store.StoreModels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Links the listing to its tag rows, replacing whatever links it had.
 */
@Component
@Order(60)
@Slf4j
@RequiredArgsConstructor
public class ListingTagLinker implements ListingChildUpserter {

    static final String TAG_TYPE = "listing";

    private final StoreClient storeClient;
    private final TagResolver tagResolver;

    @Override
    public String name() {
        return "listing tags";
    }

    @Override
    public void upsert(long listingId, ListingChildren children) {
        if (children.getTags().isEmpty()) {
            return;
        }
        List<Long> tagIds = tagResolver.resolve(StoreModels.TAG, "api_name", children.getTags(), ListingTagLinker::newTag);
        if (storeClient.write(StoreModels.LISTING, List.of(listingId),
                Map.of("listing_tag_ids", StoreCommands.replaceLinks(tagIds)))) {
            log.info("Linked {} tags to listing {}", tagIds.size(), listingId);
        } else {
            log.warn("Store refused tag links for listing {}", listingId);
        }
    }

    private static Map<String, Object> newTag(String apiName) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", displayName(apiName));
        values.put("api_name", apiName);
        values.put("tag_type", TAG_TYPE);
        return values;
    }

    /** {@code community_gym} becomes {@code Community Gym}. */
    static String displayName(String apiName) {
        return Arrays.stream(apiName.split("_"))
                .filter(token -> !token.isEmpty())
                .map(token -> token.substring(0, 1).toUpperCase(Locale.ROOT) + token.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
