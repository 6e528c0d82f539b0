package errors;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

// Turns empty results and failed calls into ErrorChain with a context attached.
public final class ErrorPropagation {
    private ErrorPropagation() {}

    public static <T> T onError(Optional<T> value, Object context) throws ErrorChain {
        Objects.requireNonNull(value, "value");
        if (value.isPresent()) {
            return value.get();
        }
        throw new ErrorChain(context);
    }

    // The context supplier only runs when value is empty.
    public static <T> T doOnError(Optional<T> value, Supplier<?> context) throws ErrorChain {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(context, "context");
        if (value.isPresent()) {
            return value.get();
        }
        throw new ErrorChain(context.get());
    }

    public static <T> T onError(Callable<T> action, Object context) throws ErrorChain {
        Objects.requireNonNull(action, "action");
        try {
            return action.call();
        } catch (Exception e) {
            throw new ErrorChain(context, e);
        }
    }

    public static <T> T doOnError(Callable<T> action, Supplier<?> context) throws ErrorChain {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(context, "context");
        try {
            return action.call();
        } catch (Exception e) {
            throw new ErrorChain(lazyContext(context, e), e);
        }
    }

    // A failing or null context must not hide the exception it was meant to describe.
    private static Object lazyContext(Supplier<?> context, Exception failure) {
        Object value;
        try {
            value = context.get();
        } catch (RuntimeException e) {
            e.addSuppressed(failure);
            throw e;
        }
        if (value == null) {
            NullPointerException npe = new NullPointerException("context supplier returned null");
            npe.addSuppressed(failure);
            throw npe;
        }
        return value;
    }
}
