package org.lpreader.frontend.classifier;

import org.lpreader.frontend.token.SectionKeyword;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed keyword tables of the LP format. All lookups are case-insensitive.
 */
final class Keywords {

    private static final Map<String, SectionKeyword> SECTIONS = Map.ofEntries(
            Map.entry("min", SectionKeyword.MINIMIZE),
            Map.entry("minimize", SectionKeyword.MINIMIZE),
            Map.entry("minimise", SectionKeyword.MINIMIZE),
            Map.entry("max", SectionKeyword.MAXIMIZE),
            Map.entry("maximize", SectionKeyword.MAXIMIZE),
            Map.entry("maximise", SectionKeyword.MAXIMIZE),
            Map.entry("st", SectionKeyword.CONSTRAINTS),
            Map.entry("s.t.", SectionKeyword.CONSTRAINTS),
            Map.entry("subject to", SectionKeyword.CONSTRAINTS),
            Map.entry("such that", SectionKeyword.CONSTRAINTS),
            Map.entry("bounds", SectionKeyword.BOUNDS),
            Map.entry("bound", SectionKeyword.BOUNDS),
            Map.entry("bin", SectionKeyword.BINARY),
            Map.entry("binary", SectionKeyword.BINARY),
            Map.entry("binaries", SectionKeyword.BINARY),
            Map.entry("gen", SectionKeyword.GENERAL),
            Map.entry("general", SectionKeyword.GENERAL),
            Map.entry("generals", SectionKeyword.GENERAL),
            Map.entry("int", SectionKeyword.GENERAL),
            Map.entry("integer", SectionKeyword.GENERAL),
            Map.entry("integers", SectionKeyword.GENERAL),
            Map.entry("semi", SectionKeyword.SEMICONTINUOUS),
            Map.entry("semi-continuous", SectionKeyword.SEMICONTINUOUS),
            Map.entry("semis", SectionKeyword.SEMICONTINUOUS),
            Map.entry("sos", SectionKeyword.SOS),
            Map.entry("end", SectionKeyword.END)
    );

    private static final Set<String> FREE = Set.of("free");

    private static final Set<String> INFINITY = Set.of("inf", "infinity");

    private Keywords() {}

    static Optional<SectionKeyword> section(String text) {
        return Optional.ofNullable(SECTIONS.get(normalize(text)));
    }

    static boolean isFree(String text) {
        return FREE.contains(normalize(text));
    }

    static boolean isInfinity(String text) {
        return INFINITY.contains(normalize(text));
    }

    private static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT);
    }
}
