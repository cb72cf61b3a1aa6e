package org.smileyface.minespec.harvest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * One machine to harvest: its brand and model and the candidate URLs found for it.
 * URLs are trimmed and de-duplicated in submission order.
 */
public record WorkItem(String brand, String model, List<String> urls) {

    public WorkItem {
        if (brand == null || brand.isBlank()) {
            throw new IllegalArgumentException("brand must not be null/blank");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be null/blank");
        }
        brand = brand.trim();
        model = model.trim();
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String u : Objects.requireNonNullElse(urls, List.<String>of())) {
            if (u != null && !u.isBlank()) unique.add(u.trim());
        }
        urls = List.copyOf(new ArrayList<>(unique));
    }

    public String label() {
        return brand + "/" + model;
    }
}
