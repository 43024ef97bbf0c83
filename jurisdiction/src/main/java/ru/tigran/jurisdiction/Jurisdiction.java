package ru.tigran.jurisdiction;

import ru.tigran.jurisdiction.codec.AlphaCodec;
import ru.tigran.jurisdiction.exception.UnrecognizedCodeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * A pointer sized object identifying a country or area of the world.
 *
 * <p>The handle holds a single reference into the static definition table, so passing it around
 * costs no more than a reference and every accessor is a field read. Two handles are equal when
 * they denote the same numeric country code, however they were obtained.
 *
 * <pre>{@code
 * Jurisdiction norway = Jurisdiction.fromString("NO");
 * norway.is(Alpha3.NOR);            // true
 * norway.getSubRegion();            // SubRegion.NORTHERN_EUROPE
 * Jurisdiction.jurisdictionsIn(Region.EUROPE).contains(norway); // true
 * }</pre>
 */
public final class Jurisdiction {

    private final Definition definition;

    private Jurisdiction(Definition definition) {
        this.definition = definition;
    }

    static Jurisdiction forCountryCode(int countryCode) {
        return new Jurisdiction(DefinitionRegistry.lookup(countryCode));
    }

    /**
     * Returns the jurisdiction identified by a two letter code.
     */
    public static Jurisdiction of(Alpha2 alpha2) {
        Objects.requireNonNull(alpha2, "alpha2");
        return forCountryCode(alpha2.getCountryCode());
    }

    /**
     * Returns the jurisdiction identified by a three letter code.
     */
    public static Jurisdiction of(Alpha3 alpha3) {
        Objects.requireNonNull(alpha3, "alpha3");
        return forCountryCode(alpha3.getCountryCode());
    }

    /**
     * Parses an alpha-2 code, then an alpha-3 code. Matching is exact: no trimming, no case folding.
     *
     * @param text canonical upper-case code, e.g. "NO" or "NOR"
     * @return the matching jurisdiction
     * @throws UnrecognizedCodeException if the text is neither code
     */
    public static Jurisdiction fromString(String text) {
        return AlphaCodec.parse(text).orElseThrow(() -> new UnrecognizedCodeException(text));
    }

    /**
     * Returns every known jurisdiction in dataset order.
     */
    public static List<Jurisdiction> all() {
        List<Definition> definitions = DefinitionRegistry.definitions();
        List<Jurisdiction> result = new ArrayList<>(definitions.size());
        for (Definition d : definitions) {
            result.add(new Jurisdiction(d));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns all jurisdictions zoning to the given region.
     */
    public static List<Jurisdiction> jurisdictionsIn(Region region) {
        return resolve(region.members());
    }

    /**
     * Returns all jurisdictions zoning to the given sub-region.
     */
    public static List<Jurisdiction> jurisdictionsIn(SubRegion subRegion) {
        return resolve(subRegion.members());
    }

    /**
     * Returns all jurisdictions zoning to the given intermediate region.
     */
    public static List<Jurisdiction> jurisdictionsIn(IntermediateRegion intermediateRegion) {
        return resolve(intermediateRegion.members());
    }

    private static List<Jurisdiction> resolve(short[] countryCodes) {
        List<Jurisdiction> result = new ArrayList<>(countryCodes.length);
        for (short countryCode : countryCodes) {
            result.add(forCountryCode(countryCode));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the English name of this jurisdiction.
     */
    public String getName() {
        return definition.getName();
    }

    /**
     * Returns the ISO 3166 numeric country code.
     */
    public int getCountryCode() {
        return definition.getCountryCode();
    }

    public Alpha2 getAlpha2() {
        return definition.getAlpha2();
    }

    public Alpha3 getAlpha3() {
        return definition.getAlpha3();
    }

    /**
     * Returns the M49 region, {@link Region#UNDEFINED} for jurisdictions outside any region.
     */
    public Region getRegion() {
        return definition.getRegion();
    }

    public SubRegion getSubRegion() {
        return definition.getSubRegion();
    }

    /**
     * Returns the M49 intermediate region. Most jurisdictions have none and return
     * {@link IntermediateRegion#UNDEFINED}.
     */
    public IntermediateRegion getIntermediateRegion() {
        return definition.getIntermediateRegion();
    }

    /**
     * Returns the M49 numeric code of the region, 0 when not applicable.
     */
    public int getRegionCode() {
        return definition.getRegionCode();
    }

    /**
     * Returns the M49 numeric code of the sub-region, 0 when not applicable.
     */
    public int getSubRegionCode() {
        return definition.getSubRegionCode();
    }

    /**
     * Returns the M49 numeric code of the intermediate region, if there is one.
     */
    public OptionalInt getIntermediateRegionCode() {
        return definition.getIntermediateRegionCode();
    }

    /**
     * Whether this jurisdiction is the one identified by the given two letter code.
     */
    public boolean is(Alpha2 alpha2) {
        return definition.getAlpha2() == alpha2;
    }

    /**
     * Whether this jurisdiction is the one identified by the given three letter code.
     */
    public boolean is(Alpha3 alpha3) {
        return definition.getAlpha3() == alpha3;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Jurisdiction other)) {
            return false;
        }
        return definition.getCountryCode() == other.definition.getCountryCode();
    }

    @Override
    public int hashCode() {
        return definition.getCountryCode();
    }

    /**
     * Formats this jurisdiction as its alpha-2 code.
     */
    @Override
    public String toString() {
        return AlphaCodec.format(definition.getAlpha2());
    }
}
