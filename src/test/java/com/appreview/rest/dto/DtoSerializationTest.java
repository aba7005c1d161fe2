package com.appreview.rest.dto;

import com.appreview.approval.ApprovalDetails;
import com.appreview.approval.ApprovalSummary;
import com.appreview.approval.ReviewView;
import com.appreview.error.ConcurrencyConflictException;
import com.appreview.error.InvalidStateException;
import com.appreview.error.ReviewNotFoundException;
import com.appreview.error.ValidationException;
import com.appreview.review.Review;
import com.appreview.review.ReviewContent;
import com.appreview.review.ReviewStatus;
import com.appreview.review.SupervisorDecision;
import com.appreview.review.VoteDecision;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DtoSerializationTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private Review review(ReviewStatus status) {
        return Review.builder()
                .id("r-1")
                .appId("app-1")
                .authorId("alice")
                .content(new ReviewContent("Nice", "Works", 4, List.of("fast")))
                .status(status)
                .createdAt(Instant.parse("2024-03-01T12:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Pending review omits withheld decisions and unset verdict fields")
    void pendingReviewJson() throws Exception {
        ApprovalDetails details = new ApprovalDetails(new ApprovalSummary(3, 1, 0, 2, 2), false, List.of(), null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(
                ReviewResponse.from(new ReviewView(review(ReviewStatus.PENDING), details))));

        assertEquals("pending", json.get("status").asText());
        assertEquals("2024-03-01T12:00:00Z", json.get("createdAt").asText());
        assertFalse(json.has("reviewedBy"));
        assertFalse(json.has("rejectionReason"));
        JsonNode approval = json.get("approval");
        assertEquals(1, approval.get("approved").asInt());
        assertEquals(2, approval.get("requiredApprovals").asInt());
        assertFalse(approval.has("decisions"));
        assertFalse(approval.has("myDecision"));
    }

    @Test
    @DisplayName("Decided review lists individual decisions")
    void decidedReviewJson() throws Exception {
        SupervisorDecision decision = new SupervisorDecision("r-1", "sup-1", VoteDecision.REJECTED, "spam",
                Instant.parse("2024-03-02T08:00:00Z"));
        Review rejected = review(ReviewStatus.PENDING)
                .transitionTo(ReviewStatus.REJECTED, "sup-1", "spam", Instant.parse("2024-03-02T08:00:00Z"));
        ApprovalDetails details = new ApprovalDetails(new ApprovalSummary(1, 0, 1, 0, 1), true,
                List.of(decision), VoteDecision.REJECTED);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(
                ReviewResponse.from(new ReviewView(rejected, details))));

        assertEquals("rejected", json.get("status").asText());
        assertEquals("spam", json.get("rejectionReason").asText());
        assertEquals("rejected", json.get("approval").get("myDecision").asText());
        JsonNode first = json.get("approval").get("decisions").get(0);
        assertEquals("sup-1", first.get("supervisorId").asText());
        assertEquals("rejected", first.get("decision").asText());
    }

    @Test
    @DisplayName("Engine failures map to HTTP status and error labels")
    void errorMapping() {
        assertEquals(400, ErrorResponse.of(new ValidationException("bad"), "/p").status());
        assertEquals(404, ErrorResponse.of(new ReviewNotFoundException("r-1"), "/p").status());

        ErrorResponse race = ErrorResponse.of(new ConcurrencyConflictException("lost"), "/p");
        assertEquals(409, race.status());
        assertEquals("Concurrency Conflict", race.error());

        ErrorResponse state = ErrorResponse.of(new InvalidStateException("not pending", ReviewStatus.ESCALATED), "/p");
        assertEquals(409, state.status());
        assertEquals("escalated", state.details().get("currentStatus"));
    }

    @Test
    @DisplayName("Edit request keeps omitted fields")
    void editRequestOverlay() {
        ReviewContent current = new ReviewContent("Title", "Body", 3, List.of("a"));

        ReviewContent edited = new EditReviewRequest(null, "New body", null, null).applyTo(current);

        assertEquals(new ReviewContent("Title", "New body", 3, List.of("a")), edited);
    }

    @Test
    @DisplayName("Status names parse case-insensitively and reject unknown values")
    void statusNames() {
        assertEquals(VoteDecision.APPROVED, StatusNames.parseDecision("Approved"));
        assertEquals(ReviewStatus.CONFLICTED, StatusNames.parseStatus("conflict"));
        assertThrows(ValidationException.class, () -> StatusNames.parseDecision(null));
        assertThrows(ValidationException.class, () -> StatusNames.parseStatus("archived"));
    }
}
