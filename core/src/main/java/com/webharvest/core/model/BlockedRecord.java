package com.webharvest.core.model;

import java.time.Instant;

public record BlockedRecord(String url, BlockReason reason, String detail, int depth, Instant timestamp) {}
