package ru.tigran.jurisdiction.compiler.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One raw row of the ISO 3166 / UN M49 dataset, exactly as the feed delivers it.
 * Numeric codes stay textual here; interpreting them is the compiler's job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JurisdictionRecord(
        @JsonProperty("name") String name,
        @JsonProperty("alpha-2") String alpha2,
        @JsonProperty("alpha-3") String alpha3,
        @JsonProperty("country-code") String countryCode,
        @JsonProperty("iso_3166-2") String iso31662,
        @JsonProperty("region") String region,
        @JsonProperty("sub-region") String subRegion,
        @JsonProperty("intermediate-region") String intermediateRegion,
        @JsonProperty("region-code") String regionCode,
        @JsonProperty("sub-region-code") String subRegionCode,
        @JsonProperty("intermediate-region-code") String intermediateRegionCode
) {
}
