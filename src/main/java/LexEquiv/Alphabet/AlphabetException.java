package LexEquiv.Alphabet;

/**
 * A pattern mentions a character that the configured {@link CharUniverse} cannot represent.
 */
public class AlphabetException extends IllegalStateException {

    @java.io.Serial
    private static final long serialVersionUID = 2291850837340183551L;

    public AlphabetException(String message) {
        super(message);
    }
}
