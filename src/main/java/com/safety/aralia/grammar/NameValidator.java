package com.safety.aralia.grammar;

import java.util.regex.Pattern;

/**
 * Identifier grammar shared by fault tree names, gate names and event names.
 *
 * <p>
 * An identifier is an ASCII letter followed by word characters, optionally
 * broken into groups by single hyphens: {@code With-Dash} and
 * {@code With__Dunder} are accepted, {@code Double--Dash},
 * {@code EndWithDash-}, {@code Peri.od} and {@code _under} are not.
 */
public final class NameValidator {

    /** Regular expression fragment of one identifier, for embedding in larger patterns. */
    public static final String NAME_SIGNATURE = "[a-zA-Z]\\w*(?:-\\w+)*";

    /** One optionally complemented identifier. */
    public static final String LITERAL_SIGNATURE = "~?" + NAME_SIGNATURE;

    /** Marker that negates an argument at the point of reference. */
    public static final String COMPLEMENT = "~";

    private static final Pattern NAME = Pattern.compile(NAME_SIGNATURE);

    private NameValidator() {
        // Utility class
    }

    /** Returns true iff the whole string is a valid identifier. */
    public static boolean isValid(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    /** Returns true if the argument token carries the complement marker. */
    public static boolean isComplement(String token) {
        return token.startsWith(COMPLEMENT);
    }

    /** Strips the complement marker, if any, from an argument token. */
    public static String bareName(String token) {
        return isComplement(token) ? token.substring(COMPLEMENT.length()) : token;
    }
}
