package com.listinglab.scraper.upsert;

import com.fasterxml.jackson.databind.JsonNode;
import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.store.StoreClient;
import com.listinglab.scraper.store.StoreCommands;
import com.listinglab.scraper.store.StoreModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Listing photos keyed by preview URL. Existing photos are left untouched;
 * new ones get their detail URL, position and tags.
 *
 * Provider photo items come in three shapes:
 * <ul>
 *   <li>{@code {"href": ..., "title": ..., "tags": [{"label": ...}]}} ({@code url} accepted for {@code href})</li>
 *   <li>a bare URL string</li>
 *   <li>{@code [href, tags]}</li>
 * </ul>
 */
@Component
@Order(10)
@Slf4j
public class PhotoUpserter extends ChildCollectionUpserter<PhotoUpserter.PhotoItem> {

    private final TagResolver tagResolver;

    public PhotoUpserter(StoreClient storeClient, TagResolver tagResolver) {
        super(storeClient);
        this.tagResolver = tagResolver;
    }

    record PhotoItem(int index, String href, String detailHref, String title, List<String> tags) {
    }

    @Override
    public String name() {
        return "photos";
    }

    @Override
    protected String entity() {
        return StoreModels.PHOTO;
    }

    @Override
    protected List<String> keyFields() {
        return List.of("preview_href");
    }

    @Override
    protected boolean updatesExisting() {
        return false;
    }

    @Override
    protected List<PhotoItem> items(ListingChildren children) {
        List<JsonNode> photos = children.getPhotos();
        List<String> altPhotos = children.getAltPhotos();
        List<PhotoItem> items = new ArrayList<>(photos.size());
        for (int i = 0; i < photos.size(); i++) {
            String detailHref = i < altPhotos.size() && altPhotos.get(i) != null ? altPhotos.get(i) : "";
            parse(i, photos.get(i), detailHref).ifPresent(items::add);
        }
        return items;
    }

    @Override
    protected Optional<List<Object>> keyParts(PhotoItem item) {
        if (item.href().isBlank()) {
            log.warn("Photo {} has no URL, skipping", item.index() + 1);
            return Optional.empty();
        }
        return Optional.of(List.of(item.href()));
    }

    @Override
    protected Map<String, Object> values(long listingId, PhotoItem item) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(StoreModels.PARENT_FIELD, listingId);
        values.put("preview_href", item.href());
        values.put("href", item.detailHref());
        values.put("title", item.title());
        values.put("sequence", item.index() + 1);
        values.put("is_primary", item.index() == 0);
        return values;
    }

    @Override
    protected void afterCreate(long rowId, PhotoItem item) {
        if (item.tags().isEmpty()) {
            return;
        }
        try {
            List<Long> tagIds = tagResolver.resolve(StoreModels.PHOTO_TAG, "name", item.tags());
            if (!storeClient.write(StoreModels.PHOTO, List.of(rowId), Map.of("tag_ids", StoreCommands.replaceLinks(tagIds)))) {
                log.warn("Store refused tag links for photo {} ({})", rowId, item.href());
            }
        } catch (RuntimeException e) {
            log.error("Failed to tag photo {} ({}): {}", rowId, item.href(), e.getMessage());
        }
    }

    static Optional<PhotoItem> parse(int index, JsonNode node, String detailHref) {
        if (node == null || node.isNull()) {
            log.warn("Photo {} is null, skipping", index + 1);
            return Optional.empty();
        }
        if (node.isTextual()) {
            return Optional.of(new PhotoItem(index, node.asText(), detailHref, "", List.of()));
        }
        if (node.isObject()) {
            String href = node.hasNonNull("href") ? node.get("href").asText() : node.path("url").asText("");
            return Optional.of(new PhotoItem(index, href, detailHref, node.path("title").asText(""), labels(node.get("tags"))));
        }
        if (node.isArray() && node.size() > 0) {
            return Optional.of(new PhotoItem(index, node.get(0).asText(""), detailHref, "", labels(node.get(1))));
        }
        log.warn("Unexpected photo format at position {}: {}", index + 1, node.getNodeType());
        return Optional.empty();
    }

    /** Tag entries are either {@code {"label": ...}} objects or plain strings. */
    private static List<String> labels(JsonNode tags) {
        List<String> labels = new ArrayList<>();
        if (tags == null || !tags.isArray()) {
            return labels;
        }
        for (JsonNode tag : tags) {
            String label = tag.isObject() ? tag.path("label").asText("") : tag.asText("");
            if (!label.isBlank()) {
                labels.add(label);
            }
        }
        return labels;
    }
}
