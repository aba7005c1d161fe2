package com.appreview.review;

import com.appreview.error.ValidationException;

import java.util.List;

/**
 * Author-owned part of a review: everything the author may write or edit.
 *
 * @param title   optional title
 * @param content review text, must not be blank
 * @param rating  star rating, 1 to 5
 * @param tags    ordered tags, none of them blank (copied, never null)
 */
public record ReviewContent(String title, String content, int rating, List<String> tags) {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    public ReviewContent {
        if (tags == null) {
            tags = List.of();
        } else {
            for (String tag : tags) {
                if (tag == null || tag.isBlank()) {
                    throw new ValidationException("Tags must not be null or blank");
                }
            }
            tags = List.copyOf(tags);
        }
    }

    public static ReviewContent of(String content, int rating) {
        return new ReviewContent(null, content, rating, List.of());
    }

    /**
     * Returns a copy of this content with the text replaced.
     */
    public ReviewContent withContent(String newContent) {
        return new ReviewContent(title, newContent, rating, tags);
    }
}
