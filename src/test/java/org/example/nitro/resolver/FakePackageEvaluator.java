package org.example.nitro.resolver;

import org.example.nitro.config.StandardEvalInput;
import org.example.nitro.evaluator.PackageEvaluator;
import org.example.nitro.exception.EvaluationException;
import org.example.nitro.model.PackageProperties;
import org.example.nitro.model.PackageRequest;
import org.example.nitro.model.RelationsResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory evaluator for resolver tests. Packages with no registered
 * properties or relations report empty ones.
 */
class FakePackageEvaluator implements PackageEvaluator<StandardEvalInput, Void> {

    private final Map<String, PackageProperties> properties = new HashMap<>();
    private final Map<String, RelationsResult> relations = new HashMap<>();
    private final Set<String> brokenProperties = new HashSet<>();
    private final Set<String> brokenRelations = new HashSet<>();
    private UnaryOperator<PackageRequest> displayable = UnaryOperator.identity();
    private boolean failPreload;

    private final List<List<String>> preloadBatches = new ArrayList<>();
    private final Map<String, StandardEvalInput> lastInputs = new HashMap<>();
    private final List<String> evaluated = new ArrayList<>();

    FakePackageEvaluator withProperties(String id, PackageProperties props) {
        properties.put(id, props);
        return this;
    }

    FakePackageEvaluator withVersions(String id, String... versions) {
        return withProperties(id, PackageProperties.builder().contentVersions(versions).build());
    }

    FakePackageEvaluator withRelations(String id, RelationsResult result) {
        relations.put(id, result);
        return this;
    }

    FakePackageEvaluator withBrokenProperties(String id) {
        brokenProperties.add(id);
        return this;
    }

    FakePackageEvaluator withBrokenRelations(String id) {
        brokenRelations.add(id);
        return this;
    }

    FakePackageEvaluator withDisplayable(UnaryOperator<PackageRequest> rewriter) {
        this.displayable = rewriter;
        return this;
    }

    FakePackageEvaluator withFailingPreload() {
        this.failPreload = true;
        return this;
    }

    List<List<String>> getPreloadBatches() {
        return preloadBatches;
    }

    StandardEvalInput getLastInput(String id) {
        return lastInputs.get(id);
    }

    List<String> getEvaluated() {
        return evaluated;
    }

    @Override
    public void preloadPackages(List<PackageRequest> packages, Void commonInput) throws EvaluationException {
        if (failPreload) {
            throw new EvaluationException("Repository unreachable");
        }
        preloadBatches.add(packages.stream().map(PackageRequest::getId).collect(Collectors.toList()));
    }

    @Override
    public PackageProperties getPackageProperties(PackageRequest pkg, Void commonInput) throws EvaluationException {
        if (brokenProperties.contains(pkg.getId())) {
            throw new EvaluationException("Package '" + pkg.getId() + "' does not exist");
        }
        return properties.getOrDefault(pkg.getId(), PackageProperties.empty());
    }

    @Override
    public RelationsResult evalPackageRelations(PackageRequest pkg, StandardEvalInput input, Void commonInput)
            throws EvaluationException {
        evaluated.add(pkg.getId());
        lastInputs.put(pkg.getId(), input);
        if (brokenRelations.contains(pkg.getId())) {
            throw new EvaluationException("Script error in package '" + pkg.getId() + "'");
        }
        return relations.getOrDefault(pkg.getId(), RelationsResult.empty());
    }

    @Override
    public PackageRequest makeReqDisplayable(PackageRequest pkg, Void commonInput) {
        return displayable.apply(pkg);
    }
}
