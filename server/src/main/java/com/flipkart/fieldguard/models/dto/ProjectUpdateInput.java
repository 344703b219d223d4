package com.flipkart.fieldguard.models.dto;

public record ProjectUpdateInput(String name) {
}
