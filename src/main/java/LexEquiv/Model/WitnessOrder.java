package LexEquiv.Model;

/**
 * Which distinguishing string the equivalence check reports when several exist.
 */
public enum WitnessOrder {
    /** Shortest string; among equally short ones the smallest in class order. */
    SHORTLEX,
    /**
     * Lexicographically smallest string, as reported by re2c-based tooling. Falls back to {@link #SHORTLEX} when the
     * set of witnesses has no lexicographic minimum.
     */
    LEXICOGRAPHIC
}
