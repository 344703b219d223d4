package com.flipkart.fieldguard.models.dto;

import com.flipkart.fieldguard.models.db.Project;

public record ProjectUpdatePayload(Project project) {
}
