package LexEquiv.Automaton;

/**
 * A pattern tree violates an invariant the parser normally guarantees, e.g. repetition bounds with {@code min > max}.
 */
public class ConstructionException extends IllegalStateException {

    @java.io.Serial
    private static final long serialVersionUID = -6934012875120361120L;

    public ConstructionException(String message) {
        super(message);
    }
}
