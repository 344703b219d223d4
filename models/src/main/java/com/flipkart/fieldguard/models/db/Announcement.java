package com.flipkart.fieldguard.models.db;

import java.time.Instant;

/**
 * A public notice shown in the activity feed. Not a guarded entity, so it is visible to everyone.
 */
public record Announcement(String title, Instant postedAt) {
}
