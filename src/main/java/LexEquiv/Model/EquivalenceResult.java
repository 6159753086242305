package LexEquiv.Model;

import java.util.Optional;

/**
 * Outcome of comparing two DFAs.
 *
 * @param equivalent       whether both accept the same language
 * @param witnessOnlyLeft  a string only the left DFA accepts, or {@code null} if there is none
 * @param witnessOnlyRight a string only the right DFA accepts, or {@code null} if there is none
 */
public record EquivalenceResult(boolean equivalent, String witnessOnlyLeft, String witnessOnlyRight) {

    public EquivalenceResult {
        if (equivalent != (witnessOnlyLeft == null && witnessOnlyRight == null)) {
            throw new IllegalArgumentException("Equivalent results carry no witness, others at least one");
        }
    }

    public static EquivalenceResult of(String witnessOnlyLeft, String witnessOnlyRight) {
        return new EquivalenceResult(witnessOnlyLeft == null && witnessOnlyRight == null,
                                     witnessOnlyLeft, witnessOnlyRight);
    }

    public Optional<String> onlyLeft() {
        return Optional.ofNullable(witnessOnlyLeft);
    }

    public Optional<String> onlyRight() {
        return Optional.ofNullable(witnessOnlyRight);
    }

    /**
     * The same result seen from the other side.
     */
    public EquivalenceResult swap() {
        return new EquivalenceResult(equivalent, witnessOnlyRight, witnessOnlyLeft);
    }
}
