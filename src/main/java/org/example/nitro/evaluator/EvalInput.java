package org.example.nitro.evaluator;

import java.util.List;

/**
 * Input handed to the evaluator for a single package.
 *
 * <p>The resolver starts from one constant input and makes a fresh copy for
 * every package it evaluates, so copying should be cheap.</p>
 *
 * @param <I> the concrete input type
 */
public interface EvalInput<I extends EvalInput<I>> {

    /**
     * Sets the content versions the package must choose from, and the ones it should prefer.
     */
    void setContentVersions(List<String> required, List<String> preferred);

    /**
     * Sets whether evaluation of this package is forced.
     */
    void setForce(boolean force);

    /**
     * Returns an independent copy of this input.
     */
    I copy();
}
