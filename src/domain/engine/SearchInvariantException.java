package domain.engine;

/**
 * Thrown when an internal invariant of the search is violated.
 *
 * <p>Indicates an engine defect (a cost below the monotonic front, a non-positive term
 * count, a value settled twice, a dangling operand reference). Never caught inside the
 * engine.
 */
public class SearchInvariantException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public SearchInvariantException(String message) {
        super(message);
    }
}
