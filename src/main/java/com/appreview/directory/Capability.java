package com.appreview.directory;

/**
 * Externally verified capabilities an actor may present.
 * Any authenticated actor may author reviews; these add moderation rights.
 */
public enum Capability {

    /** May vote on pending reviews. */
    SUPERVISOR,

    /** May override any review status and resolve conflicts. */
    ADMIN
}
