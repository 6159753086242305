package LexEquiv.Model;

import LexEquiv.Alphabet.CharUniverse;

/**
 * Configuration of one comparison.
 *
 * @param universe     characters the inputs range over
 * @param minimize     whether to minimize both DFAs before comparing them
 * @param witnessOrder which witness to report on a mismatch
 */
public record CheckerOptions(CharUniverse universe, boolean minimize, WitnessOrder witnessOrder) {

    public CheckerOptions {
        if (universe == null || witnessOrder == null) {
            throw new IllegalArgumentException("universe and witnessOrder are required");
        }
    }

    public static CheckerOptions defaults() {
        return new CheckerOptions(CharUniverse.BYTE, true, WitnessOrder.SHORTLEX);
    }

    public CheckerOptions withUniverse(CharUniverse universe) {
        return new CheckerOptions(universe, minimize, witnessOrder);
    }

    public CheckerOptions withMinimize(boolean minimize) {
        return new CheckerOptions(universe, minimize, witnessOrder);
    }

    public CheckerOptions withWitnessOrder(WitnessOrder witnessOrder) {
        return new CheckerOptions(universe, minimize, witnessOrder);
    }
}
