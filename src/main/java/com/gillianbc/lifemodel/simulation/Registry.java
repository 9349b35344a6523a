package com.gillianbc.lifemodel.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owner-keyed multi-map of financial entities.
 * <p>
 * Items are keyed by the owner's {@link LifeModelAgent#getUniqueId() unique id} and keep their
 * registration order, which is the order money is drawn from them during settlement.
 *
 * @param <T> type of the registered entity
 */
public class Registry<T> {

    private final Map<Integer, List<T>> itemsByOwner = new LinkedHashMap<>();

    public void register(LifeModelAgent owner, T item) {
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(item, "item must not be null");
        itemsByOwner.computeIfAbsent(owner.getUniqueId(), id -> new ArrayList<>()).add(item);
    }

    /**
     * @return true if the item was registered to the owner and has been removed
     */
    public boolean unregister(LifeModelAgent owner, T item) {
        List<T> items = itemsByOwner.get(owner.getUniqueId());
        return items != null && items.remove(item);
    }

    public List<T> getItems(LifeModelAgent owner) {
        List<T> items = itemsByOwner.get(owner.getUniqueId());
        return items == null ? Collections.emptyList() : Collections.unmodifiableList(items);
    }

    public void clear(LifeModelAgent owner) {
        itemsByOwner.remove(owner.getUniqueId());
    }

    public void clearAll() {
        itemsByOwner.clear();
    }

    /**
     * @return every registered item, grouped by owner in first-registration order
     */
    public List<T> getAllItems() {
        List<T> all = new ArrayList<>();
        itemsByOwner.values().forEach(all::addAll);
        return all;
    }
}
