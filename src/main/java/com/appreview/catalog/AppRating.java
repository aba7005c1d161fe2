package com.appreview.catalog;

/**
 * Rating aggregate of an app over its approved reviews.
 */
public record AppRating(String appId, double average, int totalRatings) {

    public static AppRating empty(String appId) {
        return new AppRating(appId, 0.0, 0);
    }
}
