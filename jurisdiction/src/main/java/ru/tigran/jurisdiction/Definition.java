package ru.tigran.jurisdiction;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.OptionalInt;

/**
 * Static information about one jurisdiction. Instances exist only in the generated table.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
final class Definition {
    private final int countryCode;
    private final String name;
    private final Alpha2 alpha2;
    private final Alpha3 alpha3;
    private final Region region;
    private final SubRegion subRegion;
    private final IntermediateRegion intermediateRegion;
    private final int regionCode;
    private final int subRegionCode;
    private final int intermediateRegionCode; // 0 when not applicable

    OptionalInt getIntermediateRegionCode() {
        return intermediateRegionCode == 0 ? OptionalInt.empty() : OptionalInt.of(intermediateRegionCode);
    }
}
