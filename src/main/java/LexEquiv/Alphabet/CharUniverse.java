package LexEquiv.Alphabet;

/**
 * The set of raw characters an input may contain.
 */
public enum CharUniverse {
    /** Single bytes, 0x00 to 0xFF. */
    BYTE(0x100),
    /** UTF-16 code units of the Basic Multilingual Plane, 0x0000 to 0xFFFF. */
    BMP(0x10000);

    private final int size;

    CharUniverse(int size) {
        this.size = size;
    }

    public int size() {
        return size;
    }

    public boolean contains(int c) {
        return c >= 0 && c < size;
    }
}
