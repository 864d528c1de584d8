package com.listinglab.scraper.upsert;

import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.store.InMemoryStoreClient;
import com.listinglab.scraper.store.StoreCommands;
import com.listinglab.scraper.store.StoreModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class ListingTagLinkerTest {

    private InMemoryStoreClient store;
    private ListingTagLinker linker;
    private long listingId;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreClient();
        linker = new ListingTagLinker(store, new TagResolver(store));
        listingId = store.insert(StoreModels.LISTING, Map.of("mls", "M1"));
    }

    @Test
    void createsMissingTagsWithDisplayNameAndLinksThem() {
        linker.upsert(listingId, ListingChildren.builder().tags(List.of("community_gym", "garage_1_or_more")).build());

        Map<Long, Map<String, Object>> tags = store.rows(StoreModels.TAG);
        assertThat(tags.values())
                .extracting(row -> row.get("name"))
                .containsExactly("Community Gym", "Garage 1 Or More");
        assertThat(tags.values()).allSatisfy(row -> assertThat(row).containsEntry("tag_type", "listing"));
        assertThat(store.row(StoreModels.LISTING, listingId))
                .containsEntry("listing_tag_ids", StoreCommands.replaceLinks(new ArrayList<>(tags.keySet())));
    }

    @Test
    void reusesExistingTagsOnRepeatRuns() {
        long existing = store.insert(StoreModels.TAG, Map.of("name", "Pool", "api_name", "pool"));
        ListingChildren children = ListingChildren.builder().tags(List.of("pool", "pool", "view")).build();

        linker.upsert(listingId, children);
        linker.upsert(listingId, children);

        assertThat(store.rows(StoreModels.TAG)).hasSize(2);
        assertThat(store.count(StoreModels.TAG + "/create")).isEqualTo(1);
        List<Long> ids = new ArrayList<>(store.rows(StoreModels.TAG).keySet());
        assertThat(ids.get(0)).isEqualTo(existing);
        assertThat(store.row(StoreModels.LISTING, listingId))
                .containsEntry("listing_tag_ids", StoreCommands.replaceLinks(ids));
    }

    @Test
    void refusedLinkWriteIsReportedWithoutFailing(CapturedOutput output) {
        store.refuseWrites();

        linker.upsert(listingId, ListingChildren.builder().tags(List.of("pool")).build());

        assertThat(store.rows(StoreModels.TAG)).hasSize(1);
        assertThat(store.row(StoreModels.LISTING, listingId)).doesNotContainKey("listing_tag_ids");
        assertThat(output).contains("Store refused tag links for listing " + listingId);
    }

    @Test
    void noTagsMeansNoWrite() {
        linker.upsert(listingId, ListingChildren.builder().build());

        assertThat(store.calls()).isEmpty();
    }

    @Test
    void displayNameTitleCasesTokens() {
        assertThat(ListingTagLinker.displayName("central_air")).isEqualTo("Central Air");
        assertThat(ListingTagLinker.displayName("HOA__fee")).isEqualTo("Hoa Fee");
    }
}
