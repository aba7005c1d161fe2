package com.appreview.catalog;

import java.util.Optional;

/**
 * Queryable app repository keyed by app id. Storage and search live outside this project.
 */
public interface AppCatalog {

    boolean exists(String appId);

    /**
     * Stores the rating aggregate computed from the app's approved reviews.
     *
     * @param appId        the app
     * @param average      average star rating, rounded to two decimals, 0.0 when there are none
     * @param totalRatings number of approved reviews
     */
    void updateRating(String appId, double average, int totalRatings);

    Optional<AppRating> getRating(String appId);
}
