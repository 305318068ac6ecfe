package com.eventledger.service;

import java.util.UUID;

public record Suggestion(String name, String categoryId, UUID matchedHintId, String matchedHintName) {}
