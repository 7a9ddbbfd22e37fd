package com.gaslessmint.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * NFT metadata JSON in the common marketplace layout (name, description, image, attributes, external_url).
 * Uploaded as-is; never modified by the mint workflow.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NftMetadata(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("image") String imageUri,
        @JsonProperty("attributes") List<NftAttribute> attributes,
        @JsonProperty("external_url") String externalUri
) {

    public NftMetadata {
        attributes = attributes != null ? List.copyOf(attributes) : List.of();
    }
}
