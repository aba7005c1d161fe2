package com.appreview.approval;

import com.appreview.review.Review;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConflictNotifier} that writes a WARN line admins can alert on.
 */
public class LoggingConflictNotifier implements ConflictNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingConflictNotifier.class);

    @Override
    public void conflictDetected(Review review, ApprovalSummary summary) {
        log.warn("review.conflict.detected reviewId={} appId={} approved={} rejected={} totalSupervisors={}",
                review.getId(), review.getAppId(), summary.approved(), summary.rejected(),
                summary.totalEligibleSupervisors());
    }

    @Override
    public void reviewEscalated(Review review, String adminId, String reason) {
        log.warn("review.escalated reviewId={} appId={} adminId={} reason={}",
                review.getId(), review.getAppId(), adminId, reason);
    }
}
