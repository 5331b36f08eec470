package com.demo.thrift.model;

import lombok.Builder;

/** Platform-wide standing of an address across all groups. */
@Builder(toBuilder = true)
public record Reputation(
        String address,
        int trustScore,
        int totalDefaults,
        boolean blacklisted
) {}
