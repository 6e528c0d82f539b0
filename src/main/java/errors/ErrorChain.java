package errors;

import java.util.Objects;

/**
 * Failure carrying a human readable context and, optionally, the cause it wraps.
 *
 * <p>Rendered as the context first, then each cause beneath a {@code \ \ \} separator line.
 * Nested chains are followed; the first cause that is not an {@code ErrorChain} ends the
 * rendering, since its message already describes whatever it wraps.</p>
 */
public class ErrorChain extends Exception {

    static final String SEPARATOR = "\n\\ \\ \\\n";

    private final String context;

    public ErrorChain(Object context) {
        super(String.valueOf(Objects.requireNonNull(context, "context")));
        this.context = String.valueOf(context);
    }

    public ErrorChain(Object context, Throwable cause) {
        super(String.valueOf(Objects.requireNonNull(context, "context")), Objects.requireNonNull(cause, "cause"));
        this.context = String.valueOf(context);
    }

    public String context() { return context; }

    public String render() {
        StringBuilder sb = new StringBuilder(context);
        Throwable cause = getCause();
        while (cause instanceof ErrorChain chain) {
            sb.append(SEPARATOR).append(chain.context());
            cause = chain.getCause();
        }
        if (cause != null) {
            sb.append(SEPARATOR).append(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
