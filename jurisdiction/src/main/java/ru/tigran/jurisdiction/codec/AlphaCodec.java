package ru.tigran.jurisdiction.codec;

import ru.tigran.jurisdiction.Alpha2;
import ru.tigran.jurisdiction.Alpha3;
import ru.tigran.jurisdiction.Jurisdiction;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Text form of the ISO 3166 alpha codes.
 *
 * The canonical text of a code is the code itself ("NO", "NOR"). Parsing accepts exactly that
 * text: no trimming, no case folding, and unknown text never maps to a default.
 */
public final class AlphaCodec {

    private static final Map<String, Alpha2> ALPHA2_BY_TEXT = index(Alpha2.values(), Alpha2::name);
    private static final Map<String, Alpha3> ALPHA3_BY_TEXT = index(Alpha3.values(), Alpha3::name);

    private AlphaCodec() {
        // Private constructor to prevent instantiation
    }

    public static String format(Alpha2 code) {
        return code.name();
    }

    public static String format(Alpha3 code) {
        return code.name();
    }

    /**
     * @param text candidate code
     * @return the alpha-2 code with exactly this text, empty otherwise
     */
    public static Optional<Alpha2> parseAlpha2(String text) {
        return text == null ? Optional.empty() : Optional.ofNullable(ALPHA2_BY_TEXT.get(text));
    }

    /**
     * @param text candidate code
     * @return the alpha-3 code with exactly this text, empty otherwise
     */
    public static Optional<Alpha3> parseAlpha3(String text) {
        return text == null ? Optional.empty() : Optional.ofNullable(ALPHA3_BY_TEXT.get(text));
    }

    /**
     * Resolves text as an alpha-2 code first, then as an alpha-3 code.
     *
     * @param text candidate code
     * @return the jurisdiction, empty if the text is neither code
     */
    public static Optional<Jurisdiction> parse(String text) {
        Optional<Alpha2> alpha2 = parseAlpha2(text);
        if (alpha2.isPresent()) {
            return alpha2.map(Jurisdiction::of);
        }
        return parseAlpha3(text).map(Jurisdiction::of);
    }

    private static <E extends Enum<E>> Map<String, E> index(E[] values, Function<E, String> text) {
        return Arrays.stream(values).collect(Collectors.toUnmodifiableMap(text, Function.identity()));
    }
}
