package ru.tigran.jurisdiction;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Process-wide mapping from numeric country code to {@link Definition}.
 *
 * <p>The table is materialized from {@link GeneratedDefinitions} on first access. The JVM runs the
 * holder's class initializer exactly once, and every thread observes the finished table, so reads
 * afterwards need no locking. Numeric codes are dense below 1000 and index an array directly.
 */
@Slf4j
final class DefinitionRegistry {

    static final int CAPACITY = 1000;

    private DefinitionRegistry() {
    }

    /**
     * Returns the definition for a numeric country code.
     *
     * @param countryCode code taken from a generated enum
     * @return the unique definition
     * @throws IllegalStateException if the code is not part of the compiled classification
     */
    static Definition lookup(int countryCode) {
        Definition definition = countryCode >= 0 && countryCode < CAPACITY
                ? Holder.BY_COUNTRY_CODE[countryCode]
                : null;
        if (definition == null) {
            throw new IllegalStateException("Country code " + countryCode + " is not part of the compiled classification");
        }
        return definition;
    }

    /**
     * All definitions in dataset order.
     */
    static List<Definition> definitions() {
        return Holder.DEFINITIONS;
    }

    static Definition[] index(Definition[] definitions) {
        Definition[] byCountryCode = new Definition[CAPACITY];
        for (Definition definition : definitions) {
            int code = definition.getCountryCode();
            if (code < 0 || code >= CAPACITY) {
                throw new IllegalStateException("Country code " + code + " of " + definition.getName() + " is out of range");
            }
            if (byCountryCode[code] != null) {
                throw new IllegalStateException("Country code " + code + " is defined by both "
                        + byCountryCode[code].getName() + " and " + definition.getName());
            }
            byCountryCode[code] = definition;
        }
        return byCountryCode;
    }

    private static final class Holder {
        static final List<Definition> DEFINITIONS = List.of(GeneratedDefinitions.DEFINITIONS);
        static final Definition[] BY_COUNTRY_CODE = index(GeneratedDefinitions.DEFINITIONS);

        static {
            log.debug("Materialized jurisdiction registry with {} definitions", DEFINITIONS.size());
        }
    }
}
