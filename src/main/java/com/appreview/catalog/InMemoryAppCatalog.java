package com.appreview.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link AppCatalog} holding registered app ids and their rating aggregates.
 */
public class InMemoryAppCatalog implements AppCatalog {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAppCatalog.class);

    private final ConcurrentMap<String, AppRating> apps = new ConcurrentHashMap<>();

    public void register(String appId) {
        apps.putIfAbsent(appId, AppRating.empty(appId));
    }

    @Override
    public boolean exists(String appId) {
        return appId != null && apps.containsKey(appId);
    }

    @Override
    public void updateRating(String appId, double average, int totalRatings) {
        if (!exists(appId)) {
            log.warn("catalog.rating.skipped appId={} reason=unknown_app", appId);
            return;
        }
        apps.put(appId, new AppRating(appId, average, totalRatings));
        log.debug("catalog.rating.updated appId={} average={} total={}", appId, average, totalRatings);
    }

    @Override
    public Optional<AppRating> getRating(String appId) {
        return Optional.ofNullable(apps.get(appId));
    }
}
