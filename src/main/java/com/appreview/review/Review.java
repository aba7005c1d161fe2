package com.appreview.review;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One user's review of one app.
 *
 * <p>Instances are immutable. Status transitions produce a new instance through
 * {@link #toBuilder()}; the {@link ReviewStore} bumps {@link #getVersion()} on every
 * successful update and rejects updates made against a stale version.</p>
 */
public final class Review {

    private final String id;
    private final String appId;
    private final String authorId;
    private final String title;
    private final String content;
    private final int rating;
    private final List<String> tags;
    private final ReviewStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String reviewedBy;
    private final Instant reviewedAt;
    private final String rejectionReason;
    private final long version;

    private Review(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.appId = Objects.requireNonNull(builder.appId, "appId is required");
        this.authorId = Objects.requireNonNull(builder.authorId, "authorId is required");
        this.title = builder.title;
        this.content = Objects.requireNonNull(builder.content, "content is required");
        this.rating = builder.rating;
        this.tags = builder.tags != null ? List.copyOf(builder.tags) : List.of();
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.reviewedBy = builder.reviewedBy;
        this.reviewedAt = builder.reviewedAt;
        this.rejectionReason = builder.rejectionReason;
        this.version = builder.version;
    }

    public String getId() {
        return id;
    }

    public String getAppId() {
        return appId;
    }

    public String getAuthorId() {
        return authorId;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public int getRating() {
        return rating;
    }

    public List<String> getTags() {
        return tags;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getReviewedBy() {
        return reviewedBy;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getRejectionReason() {
        return rejectionReason;
    }

    public long getVersion() {
        return version;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    public boolean isApproved() {
        return status == ReviewStatus.APPROVED;
    }

    public boolean isAuthoredBy(String actorId) {
        return authorId.equals(actorId);
    }

    public ReviewContent getReviewContent() {
        return new ReviewContent(title, content, rating, tags);
    }

    /**
     * Returns a copy of this review in the given status, decided by {@code actorId}.
     */
    public Review transitionTo(ReviewStatus newStatus, String actorId, String reason, Instant at) {
        Builder builder = toBuilder()
                .status(newStatus)
                .updatedAt(at);
        if (newStatus == ReviewStatus.PENDING) {
            builder.reviewedBy(null).reviewedAt(null).rejectionReason(null);
        } else {
            builder.reviewedBy(actorId)
                    .reviewedAt(at)
                    .rejectionReason(newStatus == ReviewStatus.REJECTED ? reason : null);
        }
        return builder.build();
    }

    /**
     * Returns a copy carrying the new author content, back in {@link ReviewStatus#PENDING}.
     */
    public Review withContent(ReviewContent newContent, Instant at) {
        return toBuilder()
                .title(newContent.title())
                .content(newContent.content())
                .rating(newContent.rating())
                .tags(newContent.tags())
                .build()
                .transitionTo(ReviewStatus.PENDING, null, null, at);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .appId(appId)
                .authorId(authorId)
                .title(title)
                .content(content)
                .rating(rating)
                .tags(tags)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .reviewedBy(reviewedBy)
                .reviewedAt(reviewedAt)
                .rejectionReason(rejectionReason)
                .version(version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Review that = (Review) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Review{" +
                "id='" + id + '\'' +
                ", appId='" + appId + '\'' +
                ", authorId='" + authorId + '\'' +
                ", rating=" + rating +
                ", status=" + status +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String appId;
        private String authorId;
        private String title;
        private String content;
        private int rating;
        private List<String> tags;
        private ReviewStatus status;
        private Instant createdAt;
        private Instant updatedAt;
        private String reviewedBy;
        private Instant reviewedAt;
        private String rejectionReason;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder authorId(String authorId) {
            this.authorId = authorId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder rating(int rating) {
            this.rating = rating;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder reviewedBy(String reviewedBy) {
            this.reviewedBy = reviewedBy;
            return this;
        }

        public Builder reviewedAt(Instant reviewedAt) {
            this.reviewedAt = reviewedAt;
            return this;
        }

        public Builder rejectionReason(String rejectionReason) {
            this.rejectionReason = rejectionReason;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder content(ReviewContent reviewContent) {
            return title(reviewContent.title())
                    .content(reviewContent.content())
                    .rating(reviewContent.rating())
                    .tags(reviewContent.tags());
        }

        public Review build() {
            return new Review(this);
        }
    }
}
