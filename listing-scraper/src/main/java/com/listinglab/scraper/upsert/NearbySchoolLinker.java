package com.listinglab.scraper.upsert;

import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.store.StoreClient;
import com.listinglab.scraper.store.StoreCommands;
import com.listinglab.scraper.store.StoreModels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@Order(70)
@Slf4j
@RequiredArgsConstructor
public class NearbySchoolLinker implements ListingChildUpserter {

    private final StoreClient storeClient;
    private final TagResolver tagResolver;

    @Override
    public String name() {
        return "nearby schools";
    }

    @Override
    public void upsert(long listingId, ListingChildren children) {
        if (children.getNearbySchools().isEmpty()) {
            return;
        }
        List<Long> schoolIds = tagResolver.resolve(StoreModels.SCHOOL, "name", children.getNearbySchools());
        if (storeClient.write(StoreModels.LISTING, List.of(listingId),
                Map.of("nearby_school_ids", StoreCommands.replaceLinks(schoolIds)))) {
            log.info("Linked {} nearby schools to listing {}", schoolIds.size(), listingId);
        } else {
            log.warn("Store refused school links for listing {}", listingId);
        }
    }
}
