package com.gaslessmint.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Single metadata trait. Value is passed through as given (string or number).
 */
public record NftAttribute(
        @JsonProperty("trait_type") String traitType,
        @JsonProperty("value") Object value
) {}
