package org.example.nitro.config;

import org.example.nitro.evaluator.EvalInput;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluation input made of the instance constants plus per-package parameters.
 *
 * <p>The resolver copies one instance of this for every package it evaluates,
 * then fills in content versions and the force flag. A {@link PackageConfiguration}
 * may further set features and stability.</p>
 */
public class StandardEvalInput implements EvalInput<StandardEvalInput> {

    private final EvalConstants constants;
    private final Side side;
    private List<String> features = new ArrayList<>();
    private PackageStability stability;
    private List<String> requiredContentVersions = new ArrayList<>();
    private List<String> preferredContentVersions = new ArrayList<>();
    private boolean force;

    public StandardEvalInput(EvalConstants constants, Side side) {
        this.constants = Objects.requireNonNull(constants, "constants cannot be null");
        this.side = Objects.requireNonNull(side, "side cannot be null");
        this.stability = constants.getDefaultStability();
    }

    public EvalConstants getConstants() {
        return constants;
    }

    public Side getSide() {
        return side;
    }

    public List<String> getFeatures() {
        return features;
    }

    public void setFeatures(List<String> features) {
        this.features = features != null ? new ArrayList<>(features) : new ArrayList<>();
    }

    public PackageStability getStability() {
        return stability;
    }

    public void setStability(PackageStability stability) {
        this.stability = stability != null ? stability : constants.getDefaultStability();
    }

    public List<String> getRequiredContentVersions() {
        return requiredContentVersions;
    }

    public List<String> getPreferredContentVersions() {
        return preferredContentVersions;
    }

    @Override
    public void setContentVersions(List<String> required, List<String> preferred) {
        this.requiredContentVersions = new ArrayList<>(required);
        this.preferredContentVersions = new ArrayList<>(preferred);
    }

    public boolean isForce() {
        return force;
    }

    @Override
    public void setForce(boolean force) {
        this.force = force;
    }

    @Override
    public StandardEvalInput copy() {
        StandardEvalInput copy = new StandardEvalInput(constants, side);
        copy.features = new ArrayList<>(features);
        copy.stability = stability;
        copy.requiredContentVersions = new ArrayList<>(requiredContentVersions);
        copy.preferredContentVersions = new ArrayList<>(preferredContentVersions);
        copy.force = force;
        return copy;
    }

    @Override
    public String toString() {
        return "StandardEvalInput{" +
                "side=" + side +
                ", features=" + features +
                ", stability=" + stability +
                ", required=" + requiredContentVersions +
                ", preferred=" + preferredContentVersions +
                ", force=" + force +
                '}';
    }
}
