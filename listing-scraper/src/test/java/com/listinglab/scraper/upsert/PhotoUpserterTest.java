package com.listinglab.scraper.upsert;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.store.InMemoryStoreClient;
import com.listinglab.scraper.store.StoreCommands;
import com.listinglab.scraper.store.StoreModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PhotoUpserterTest {

    private static final long LISTING_ID = 1L;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryStoreClient store;
    private PhotoUpserter upserter;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreClient();
        upserter = new PhotoUpserter(store, new TagResolver(store));
    }

    private ListingChildren photos(String json, String... altPhotos) throws Exception {
        List<JsonNode> items = new ArrayList<>();
        objectMapper.readTree(json).forEach(items::add);
        return ListingChildren.builder().photos(items).altPhotos(List.of(altPhotos)).build();
    }

    @Test
    void createsPhotosInArrivalOrderWithFirstAsPrimary() throws Exception {
        ListingChildren children = photos(
                "[{\"href\": \"https://img/1-s.jpg\", \"title\": \"Front\"}, \"https://img/2-s.jpg\"]",
                "https://img/1-l.jpg", "https://img/2-l.jpg");

        upserter.upsert(LISTING_ID, children);

        List<Map<String, Object>> rows = new ArrayList<>(store.rows(StoreModels.PHOTO).values());
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0))
                .containsEntry("preview_href", "https://img/1-s.jpg")
                .containsEntry("href", "https://img/1-l.jpg")
                .containsEntry("title", "Front")
                .containsEntry("sequence", 1)
                .containsEntry("is_primary", true)
                .containsEntry(StoreModels.PARENT_FIELD, LISTING_ID);
        assertThat(rows.get(1))
                .containsEntry("preview_href", "https://img/2-s.jpg")
                .containsEntry("sequence", 2)
                .containsEntry("is_primary", false);
    }

    @Test
    void existingAndRepeatedPhotosAreNotDuplicated() throws Exception {
        ListingChildren children = photos("[\"https://img/1-s.jpg\", \"https://img/1-s.jpg\", \"https://img/2-s.jpg\"]");

        upserter.upsert(LISTING_ID, children);
        upserter.upsert(LISTING_ID, children);

        assertThat(store.rows(StoreModels.PHOTO)).hasSize(2);
        assertThat(store.count(StoreModels.PHOTO + "/write")).isZero();
    }

    @Test
    void unusableItemsAreSkipped() throws Exception {
        ListingChildren children = photos("[null, 42, {\"title\": \"no url\"}, [\"https://img/3-s.jpg\", [\"kitchen\"]]]");

        upserter.upsert(LISTING_ID, children);

        assertThat(store.rows(StoreModels.PHOTO).values())
                .singleElement()
                .satisfies(row -> assertThat(row).containsEntry("preview_href", "https://img/3-s.jpg"));
    }

    @Test
    void tagsAreResolvedOnceAndLinkedToNewPhotos() throws Exception {
        ListingChildren children = photos("[{\"url\": \"https://img/1-s.jpg\", \"tags\": [{\"label\": \"kitchen\"}, {\"label\": \"kitchen\"}]},"
                + " {\"href\": \"https://img/2-s.jpg\", \"tags\": [\"kitchen\", \"view\"]}]");

        upserter.upsert(LISTING_ID, children);

        Map<Long, Map<String, Object>> tags = store.rows(StoreModels.PHOTO_TAG);
        assertThat(tags.values()).extracting(row -> row.get("name")).containsExactly("kitchen", "view");

        List<Long> tagIds = new ArrayList<>(tags.keySet());
        List<Map<String, Object>> photoRows = new ArrayList<>(store.rows(StoreModels.PHOTO).values());
        assertThat(photoRows.get(0)).containsEntry("tag_ids", StoreCommands.replaceLinks(List.of(tagIds.get(0))));
        assertThat(photoRows.get(1)).containsEntry("tag_ids", StoreCommands.replaceLinks(tagIds));
    }

    @Test
    void tagFailureDoesNotLosePhoto() throws Exception {
        store.failOn(StoreModels.PHOTO_TAG);

        upserter.upsert(LISTING_ID, photos("[{\"href\": \"https://img/1-s.jpg\", \"tags\": [{\"label\": \"pool\"}]}]"));

        assertThat(store.rows(StoreModels.PHOTO)).hasSize(1);
        assertThat(store.rows(StoreModels.PHOTO).values().iterator().next()).doesNotContainKey("tag_ids");
    }

    @Test
    void missingDetailUrlDefaultsToEmpty() throws Exception {
        upserter.upsert(LISTING_ID, photos("[\"https://img/1-s.jpg\", \"https://img/2-s.jpg\"]", "https://img/1-l.jpg"));

        List<Map<String, Object>> rows = new ArrayList<>(store.rows(StoreModels.PHOTO).values());
        assertThat(rows.get(1)).containsEntry("href", "");
    }
}
