package LexEquiv.Pattern;

/**
 * Malformed rule block. Carries the offending block text and the character index of the error.
 */
public class RuleSyntaxException extends Exception {

    @java.io.Serial
    private static final long serialVersionUID = -4215046385610922473L;

    private final String description;
    private final String block;
    private final int index;

    public RuleSyntaxException(String description, String block, int index) {
        super(description + " near index " + index);
        this.description = description;
        this.block = block;
        this.index = index;
    }

    public String getDescription() {
        return description;
    }

    public String getBlock() {
        return block;
    }

    public int getIndex() {
        return index;
    }

    /**
     * One-based line and column of {@link #getIndex()} within the block, as {@code line:column}.
     */
    public String getLocation() {
        int line = 1;
        int column = 1;
        for (int i = 0; i < index && i < block.length(); i++) {
            if (block.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return line + ":" + column;
    }
}
