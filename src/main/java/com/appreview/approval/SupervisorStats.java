package com.appreview.approval;

/**
 * Moderation statistics of one supervisor.
 */
public record SupervisorStats(
        int votesCast,
        int approvalsCast,
        int rejectionsCast,
        long pendingSystemWide
) {
}
