package com.eyelevel.documentanalysis.store;

/**
 * Text cut to a character cap. {@code truncated} is the marker recorded with the text whenever content was cut.
 *
 * @param value     The text, at most {@code cap} characters long.
 * @param truncated Whether the original text exceeded the cap.
 */
public record CappedText(String value, boolean truncated) {

    public static CappedText of(final String text, final int cap) {
        if (cap <= 0) {
            throw new IllegalArgumentException("Text cap must be positive but was " + cap);
        }
        final String source = text == null ? "" : text;
        if (source.length() <= cap) {
            return new CappedText(source, false);
        }
        return new CappedText(source.substring(0, cap), true);
    }
}
