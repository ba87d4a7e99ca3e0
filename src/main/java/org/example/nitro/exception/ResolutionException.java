package org.example.nitro.exception;

import org.example.nitro.model.PackageRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Base exception for package resolution failures.
 *
 * <p>Every subclass carries the package requests involved, so that callers can
 * swap them for user-facing forms with {@link #withDisplayableRequests} before
 * reporting.</p>
 */
public abstract class ResolutionException extends NitroException {

    protected ResolutionException(String message) {
        super(message);
    }

    protected ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns a copy of this exception with every embedded request passed
     * through {@code rewriter}, including those of wrapped resolution errors.
     */
    public abstract ResolutionException withDisplayableRequests(UnaryOperator<PackageRequest> rewriter);

    /**
     * Follows package context wrappers down to the error that actually occurred.
     */
    public ResolutionException getRootCause() {
        return this;
    }

    /**
     * Renders this error and its causes as one line, outermost first.
     */
    public String describeChain() {
        List<String> parts = new ArrayList<>();
        Throwable current = this;
        while (current != null) {
            parts.add(current.getMessage());
            current = current.getCause();
        }
        return String.join(": ", parts);
    }

    protected static List<PackageRequest> rewriteAll(List<PackageRequest> requests,
                                                     UnaryOperator<PackageRequest> rewriter) {
        List<PackageRequest> out = new ArrayList<>(requests.size());
        for (PackageRequest req : requests) {
            out.add(rewriter.apply(req));
        }
        return out;
    }
}
