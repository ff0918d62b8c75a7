package com.safety.aralia.api;

/**
 * A non-fatal finding reported while a fault tree is being built.
 *
 * @param kind    What was found.
 * @param subject Name of the event or gate the warning is about.
 * @param message Human-readable description.
 */
public record ConversionWarning(Kind kind, String subject, String message) {

    public enum Kind {
        /** A referenced name was never declared; an undefined event was minted. */
        UNDEFINED_EVENT,
        /** A basic event is declared but no gate uses it. */
        ORPHAN_BASIC_EVENT,
        /** A house event is declared but no gate uses it. */
        ORPHAN_HOUSE_EVENT,
        /** Kind grouping on output swaps the two positional arguments of an IMPLY gate. */
        IMPLY_ORDER
    }

    public static ConversionWarning undefinedEvent(String name) {
        return new ConversionWarning(Kind.UNDEFINED_EVENT, name, "Unidentified event: " + name);
    }

    public static ConversionWarning orphanBasicEvent(String name) {
        return new ConversionWarning(Kind.ORPHAN_BASIC_EVENT, name, "Orphan basic event: " + name);
    }

    public static ConversionWarning orphanHouseEvent(String name) {
        return new ConversionWarning(Kind.ORPHAN_HOUSE_EVENT, name, "Orphan house event: " + name);
    }

    public static ConversionWarning implyOrder(String gateName) {
        return new ConversionWarning(Kind.IMPLY_ORDER, gateName,
                "Arguments of IMPLY gate " + gateName + " are written in a different order than declared");
    }

    @Override
    public String toString() {
        return "Warning. " + message;
    }
}
