package org.example.nitro.resolver;

import org.example.nitro.evaluator.ConfiguredPackage;
import org.example.nitro.evaluator.EvalInput;
import org.example.nitro.evaluator.PackageEvaluator;
import org.example.nitro.exception.ConfigurationException;
import org.example.nitro.exception.EvaluationException;
import org.example.nitro.exception.ExplicitRequireNotFulfilledException;
import org.example.nitro.exception.ExtensionNotFulfilledException;
import org.example.nitro.exception.FailedToEvaluateException;
import org.example.nitro.exception.FailedToGetPropertiesException;
import org.example.nitro.exception.FailedToPreloadException;
import org.example.nitro.exception.IncompatiblePackageException;
import org.example.nitro.exception.MiscResolutionException;
import org.example.nitro.exception.NoValidVersionsFoundException;
import org.example.nitro.exception.PackageContextException;
import org.example.nitro.exception.ResolutionException;
import org.example.nitro.model.DependencyKind;
import org.example.nitro.model.PackageOverrides;
import org.example.nitro.model.PackageProperties;
import org.example.nitro.model.PackageRequest;
import org.example.nitro.model.RecommendedPackage;
import org.example.nitro.model.RecommendedRelation;
import org.example.nitro.model.RelationsResult;
import org.example.nitro.model.RequestSource;
import org.example.nitro.model.RequiredPackage;
import org.example.nitro.model.ResolutionResult;
import org.example.nitro.model.ResolvedPackage;
import org.example.nitro.model.VersionPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of a single resolution run: the task queue, the dependency map, the
 * constraint list and the configured packages.
 *
 * <p>Created fresh by {@link PackageResolver} for every call and discarded
 * afterwards. Not thread safe; evaluator calls are made one at a time.</p>
 */
final class ResolutionState<I extends EvalInput<I>, C> {

    private static final Logger log = LoggerFactory.getLogger(ResolutionState.class);

    private final PackageEvaluator<I, C> evaluator;
    private final C commonInput;
    private final I constantInput;
    private final PackageOverrides overrides;

    private final Deque<Task> tasks = new ArrayDeque<>();
    private final Map<String, Dependency> dependencies = new LinkedHashMap<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final Map<String, ConfiguredPackage<I>> packageConfigs = new HashMap<>();

    // Keyed by bare id; a repository-qualified request shares the entry of its id
    private final Set<String> preloaded = new HashSet<>();
    // Optional packages whose evaluation failed and that are left out of the result
    private final Set<String> omitted = new HashSet<>();
    // Packages that only omitted packages asked for; recomputed after every task
    private final Set<String> orphaned = new HashSet<>();

    ResolutionState(PackageEvaluator<I, C> evaluator, C commonInput, I constantInput, PackageOverrides overrides) {
        this.evaluator = evaluator;
        this.commonInput = commonInput;
        this.constantInput = constantInput;
        this.overrides = overrides;
    }

    ResolutionResult run(List<? extends ConfiguredPackage<I>> packages) throws ResolutionException {
        List<PackageRequest> initial = new ArrayList<>();
        for (ConfiguredPackage<I> config : packages) {
            PackageRequest req = config.getPackage();
            if (!overrides.isSuppressed(req)) {
                initial.add(req);
            }
        }
        preload(initial);

        List<ConfiguredPackage<I>> sorted = new ArrayList<>(packages);
        sorted.sort(Comparator.comparing((ConfiguredPackage<I> config) -> config.getPackage()));
        for (ConfiguredPackage<I> config : sorted) {
            PackageRequest req = config.getPackage();
            packageConfigs.put(req.getId(), config);
            updateDependency(req, DependencyKind.USER_REQUIRE);
        }

        // Run every task whose package is preloaded, then preload everything left and go again
        while (!tasks.isEmpty()) {
            int skipped = 0;
            while (!tasks.isEmpty() && skipped < tasks.size()) {
                Task task = tasks.pollFirst();
                if (task instanceof Task.EvalPackage
                        && !preloaded.contains(((Task.EvalPackage) task).getDest().getId())) {
                    tasks.addLast(task);
                    skipped++;
                    continue;
                }

                resolveTask(task);
                pruneOrphans();
                checkCompats();
                skipped = 0;
            }

            if (!tasks.isEmpty()) {
                log.debug("{} queued task(s) wait on packages that are not preloaded", tasks.size());
                preloadQueued();
            }
        }

        List<RecommendedPackage> unfulfilled = checkFinalConstraints();

        List<ResolvedPackage> resolved = new ArrayList<>();
        for (Dependency dependency : dependencies.values()) {
            if (isExcluded(dependency.getPkg().getId())) {
                continue;
            }
            resolved.add(new ResolvedPackage(
                    dependency.getPkg(),
                    dependency.getKind(),
                    dependency.getRequiredContentVersions(),
                    dependency.getPreferredContentVersions()));
        }

        return new ResolutionResult(resolved, unfulfilled);
    }

    private void preload(List<PackageRequest> packages) throws ResolutionException {
        if (packages.isEmpty()) {
            return;
        }
        log.debug("Preloading {} package(s)", packages.size());
        try {
            evaluator.preloadPackages(packages, commonInput);
        } catch (EvaluationException e) {
            throw new FailedToPreloadException(packages, e);
        }
        for (PackageRequest req : packages) {
            preloaded.add(req.getId());
        }
    }

    private void preloadQueued() throws ResolutionException {
        Map<String, PackageRequest> toPreload = new LinkedHashMap<>();
        for (Task task : tasks) {
            if (task instanceof Task.EvalPackage) {
                PackageRequest dest = ((Task.EvalPackage) task).getDest();
                if (!overrides.isSuppressed(dest)) {
                    toPreload.putIfAbsent(dest.getId(), dest);
                }
            }
        }
        preload(new ArrayList<>(toPreload.values()));
    }

    private void resolveTask(Task task) throws ResolutionException {
        if (!(task instanceof Task.EvalPackage)) {
            throw new IllegalStateException("Unknown task: " + task);
        }
        PackageRequest dest = ((Task.EvalPackage) task).getDest();
        if (overrides.isSuppressed(dest)) {
            return;
        }

        log.debug("Evaluating package {}", dest.debugSources());
        try {
            resolveEvalPackage(dest);
        } catch (ResolutionException e) {
            if (isOptional(dest) || orphaned.contains(dest.getId())) {
                omitted.add(dest.getId());
                log.warn("Optional package '{}' could not be resolved and will not be installed: {}",
                        dest.getId(), e.describeChain());
                return;
            }
            throw new PackageContextException(dest, e);
        }
    }

    private void resolveEvalPackage(PackageRequest pkg) throws ResolutionException {
        checkConstraints(pkg);

        Dependency dependency = dependencies.get(pkg.getId());
        if (dependency == null) {
            dependency = new Dependency(pkg, DependencyKind.REQUIRE);
            dependencies.put(pkg.getId(), dependency);
        }
        canonicalizeVersions(dependency);

        PackageProperties properties;
        try {
            properties = evaluator.getPackageProperties(pkg, commonInput);
        } catch (EvaluationException e) {
            throw new FailedToGetPropertiesException(pkg, e);
        }

        // Each constraint narrows the output of the previous one
        List<String> available = properties.getContentVersions().orElse(List.of());
        List<String> required = new ArrayList<>(available);
        List<String> preferred = new ArrayList<>();
        for (VersionPattern constraint : dependency.getCanonicalizedConstraints()) {
            required = constraint.matches(required);
            if (constraint.getKind() == VersionPattern.Kind.PREFER && !preferred.contains(constraint.getVersion())) {
                preferred.add(constraint.getVersion());
            }
        }
        if (required.isEmpty() && !available.isEmpty()) {
            throw new NoValidVersionsFoundException(pkg, dependency.getCanonicalizedConstraints());
        }
        dependency.setContentVersions(required, preferred);

        I input = constantInput.copy();
        input.setContentVersions(required, preferred);
        input.setForce(overrides.isForced(pkg));
        ConfiguredPackage<I> config = packageConfigs.get(pkg.getId());
        if (config != null) {
            try {
                config.overrideConfiguredPackageInput(properties, input);
            } catch (ConfigurationException e) {
                throw new MiscResolutionException(
                        "Failed to apply the configuration of package '" + pkg.getId() + "'", e);
            }
        }

        RelationsResult relations;
        try {
            relations = evaluator.evalPackageRelations(pkg, input, commonInput);
        } catch (EvaluationException e) {
            throw new FailedToEvaluateException(pkg, e);
        }

        applyRelations(pkg, relations);
    }

    /**
     * Checks every relation of an evaluated package, then records them all.
     * A failed check leaves the state as it was before the package was evaluated.
     */
    private void applyRelations(PackageRequest pkg, RelationsResult relations) throws ResolutionException {
        List<Constraint> pending = new ArrayList<>();
        List<Map.Entry<PackageRequest, DependencyKind>> required = new ArrayList<>();

        for (PackageRequest conflict : sortedRequests(relations.getConflicts(), RequestSource.refused(pkg))) {
            if (isRequired(conflict)) {
                throw new IncompatiblePackageException(conflict, List.of(pkg.getId()));
            }
            pending.add(new Constraint.Refuse(conflict));
        }

        List<Map.Entry<PackageRequest, Boolean>> deps = new ArrayList<>();
        for (List<RequiredPackage> group : relations.getDeps()) {
            for (RequiredPackage dep : group) {
                PackageRequest req = PackageRequest.parse(dep.getValue(), RequestSource.dependency(pkg));
                deps.add(new AbstractMap.SimpleImmutableEntry<>(req, dep.isExplicit()));
            }
        }
        deps.sort(Map.Entry.comparingByKey());
        for (Map.Entry<PackageRequest, Boolean> dep : deps) {
            PackageRequest req = dep.getKey();
            if (dep.getValue() && !isUserRequired(req)) {
                throw new ExplicitRequireNotFulfilledException(req, pkg);
            }
            checkConstraints(req, pending);
            required.add(new AbstractMap.SimpleImmutableEntry<>(req, DependencyKind.REQUIRE));
        }

        for (PackageRequest bundled : sortedRequests(relations.getBundled(), RequestSource.bundled(pkg))) {
            checkConstraints(bundled, pending);
            required.add(new AbstractMap.SimpleImmutableEntry<>(bundled, DependencyKind.BUNDLED));
        }

        List<Map.Entry<PackageRequest, PackageRequest>> compats = new ArrayList<>();
        for (Map.Entry<String, String> compat : relations.getCompats()) {
            compats.add(new AbstractMap.SimpleImmutableEntry<>(
                    PackageRequest.parse(compat.getKey(), RequestSource.dependency(pkg)),
                    PackageRequest.parse(compat.getValue(), RequestSource.dependency(pkg))));
        }
        compats.sort(Map.Entry.<PackageRequest, PackageRequest>comparingByKey()
                .thenComparing(Map.Entry.comparingByValue()));
        for (Map.Entry<PackageRequest, PackageRequest> compat : compats) {
            if (!compatExists(compat.getKey(), compat.getValue(), pending)) {
                pending.add(new Constraint.Compat(compat.getKey(), compat.getValue()));
            }
        }

        for (PackageRequest extension : sortedRequests(relations.getExtensions(), RequestSource.dependency(pkg))) {
            pending.add(new Constraint.Extend(extension));
        }

        List<Map.Entry<PackageRequest, Boolean>> recommendations = new ArrayList<>();
        for (RecommendedRelation recommendation : relations.getRecommendations()) {
            recommendations.add(new AbstractMap.SimpleImmutableEntry<>(
                    PackageRequest.parse(recommendation.getValue(), RequestSource.dependency(pkg)),
                    recommendation.isInvert()));
        }
        recommendations.sort(Map.Entry.<PackageRequest, Boolean>comparingByKey()
                .thenComparing(Map.Entry.comparingByValue()));
        for (Map.Entry<PackageRequest, Boolean> recommendation : recommendations) {
            pending.add(new Constraint.Recommend(recommendation.getKey(), recommendation.getValue()));
        }

        constraints.addAll(pending);
        for (Map.Entry<PackageRequest, DependencyKind> dep : required) {
            updateDependency(dep.getKey(), dep.getValue());
        }
    }

    private static List<PackageRequest> sortedRequests(List<String> values, RequestSource source) {
        List<PackageRequest> out = new ArrayList<>(values.size());
        for (String value : values) {
            out.add(PackageRequest.parse(value, source));
        }
        out.sort(Comparator.naturalOrder());
        return out;
    }

    /**
     * Requires a package, or adds to the requirements of an already required one.
     * Queues an evaluation if anything about the package changed.
     */
    private void updateDependency(PackageRequest req, DependencyKind kind) {
        if (overrides.isSuppressed(req)) {
            return;
        }

        String id = req.getId();
        Dependency dependency = dependencies.get(id);
        boolean inserted = dependency == null;
        if (inserted) {
            dependency = new Dependency(req, kind);
            dependencies.put(id, dependency);
        }
        dependency.raiseKind(kind);
        Optional<PackageRequest> parent = req.getSource().getParent();
        if (parent.isPresent()) {
            dependency.addRequester(parent.get().getId());
        } else {
            dependency.markRootRequested();
        }
        if (req.getSource().isUserBundled()) {
            dependency.markUserRequested();
        }

        boolean versionAdded = dependency.addConstraint(req.getContentVersion());

        boolean reinstated = false;
        if (!inserted && omitted.contains(id) && !tracesToOptional(req)) {
            omitted.remove(id);
            reinstated = true;
        }

        if (inserted || versionAdded || reinstated) {
            tasks.addLast(new Task.EvalPackage(req));
        }
    }

    private void canonicalizeVersions(Dependency dependency) {
        for (VersionPattern pattern : new ArrayList<>(dependency.getUncanonicalizedConstraints())) {
            PackageRequest displayable = evaluator.makeReqDisplayable(
                    dependency.getPkg().withContentVersion(pattern), commonInput);
            dependency.canonicalize(pattern, displayable.getContentVersion());
        }
    }

    /**
     * Requires the compat package of every compat constraint whose check package is required.
     */
    private void checkCompats() {
        List<PackageRequest> toRequire = new ArrayList<>();
        for (Constraint constraint : constraints) {
            if (constraint instanceof Constraint.Compat && !issuedByExcluded(constraint)) {
                Constraint.Compat compat = (Constraint.Compat) constraint;
                if (isRequired(compat.getCheckPackage()) && !isRequired(compat.getCompatPackage())) {
                    toRequire.add(compat.getCompatPackage());
                }
            }
        }
        for (PackageRequest req : toRequire) {
            updateDependency(req, DependencyKind.REQUIRE);
        }
    }

    private List<RecommendedPackage> checkFinalConstraints() throws ExtensionNotFulfilledException {
        List<RecommendedPackage> unfulfilled = new ArrayList<>();
        for (Constraint constraint : constraints) {
            if (issuedByExcluded(constraint)) {
                continue;
            }
            if (constraint instanceof Constraint.Extend) {
                PackageRequest target = ((Constraint.Extend) constraint).getTarget();
                if (!isRequired(target)) {
                    Optional<PackageRequest> source = target.getSource().getSource();
                    throw new ExtensionNotFulfilledException(source.orElse(null), target);
                }
            } else if (constraint instanceof Constraint.Recommend) {
                Constraint.Recommend recommend = (Constraint.Recommend) constraint;
                boolean required = isRequired(recommend.getTarget());
                if (recommend.isInvert() == required) {
                    RecommendedPackage recommendation =
                            new RecommendedPackage(recommend.getTarget(), recommend.isInvert());
                    log.warn(recommendation.describe());
                    unfulfilled.add(recommendation);
                }
            }
        }
        return unfulfilled;
    }

    /**
     * Whether the package that issued the constraint is left out of the result.
     */
    private boolean issuedByExcluded(Constraint constraint) {
        return constraint.getIssuer()
                .map(issuer -> isExcluded(issuer.getId()))
                .orElse(false);
    }

    private void checkConstraints(PackageRequest req) throws IncompatiblePackageException {
        checkConstraints(req, List.of());
    }

    private void checkConstraints(PackageRequest req, List<Constraint> pending) throws IncompatiblePackageException {
        List<String> refusers = new ArrayList<>();
        for (Constraint constraint : constraints) {
            if (!issuedByExcluded(constraint)) {
                collectRefuser(constraint, req, refusers);
            }
        }
        for (Constraint constraint : pending) {
            collectRefuser(constraint, req, refusers);
        }
        if (!refusers.isEmpty()) {
            throw new IncompatiblePackageException(req, refusers);
        }
    }

    private static void collectRefuser(Constraint constraint, PackageRequest req, List<String> refusers) {
        if (constraint instanceof Constraint.Refuse) {
            Constraint.Refuse refuse = (Constraint.Refuse) constraint;
            if (refuse.getTarget().equals(req)) {
                refusers.add(refuse.getRefuser());
            }
        }
    }

    private boolean compatExists(PackageRequest checkPackage, PackageRequest compatPackage, List<Constraint> pending) {
        for (Constraint constraint : constraints) {
            if (constraint instanceof Constraint.Compat
                    && !issuedByExcluded(constraint)
                    && ((Constraint.Compat) constraint).sameAs(checkPackage, compatPackage)) {
                return true;
            }
        }
        for (Constraint constraint : pending) {
            if (constraint instanceof Constraint.Compat
                    && ((Constraint.Compat) constraint).sameAs(checkPackage, compatPackage)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Recomputes which packages are reachable only through omitted packages.
     * A package stays in the result while the user, or some package that stays, asks for it.
     */
    private void pruneOrphans() {
        orphaned.clear();
        if (omitted.isEmpty()) {
            return;
        }

        Set<String> live = new HashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Map.Entry<String, Dependency> entry : dependencies.entrySet()) {
                String id = entry.getKey();
                if (live.contains(id) || omitted.contains(id)) {
                    continue;
                }
                Dependency dependency = entry.getValue();
                if (dependency.isRootRequested()
                        || dependency.getRequesters().stream().anyMatch(live::contains)) {
                    live.add(id);
                    changed = true;
                }
            }
        }

        for (String id : dependencies.keySet()) {
            if (!live.contains(id) && !omitted.contains(id)) {
                orphaned.add(id);
            }
        }
        if (!orphaned.isEmpty()) {
            log.debug("Packages only required by omitted packages: {}", orphaned);
        }
    }

    private boolean isExcluded(String id) {
        return omitted.contains(id) || orphaned.contains(id);
    }

    private boolean isRequired(PackageRequest req) {
        return dependencies.containsKey(req.getId()) && !isExcluded(req.getId());
    }

    private boolean isUserRequired(PackageRequest req) {
        Dependency dependency = dependencies.get(req.getId());
        return dependency != null && dependency.isUserRequested() && !isExcluded(req.getId());
    }

    /**
     * Whether a failure while evaluating this request may be ignored.
     */
    private boolean isOptional(PackageRequest req) {
        ConfiguredPackage<I> config = packageConfigs.get(req.getId());
        if (config != null && config.isOptional()) {
            return true;
        }
        Dependency dependency = dependencies.get(req.getId());
        if (dependency != null && dependency.getKind() == DependencyKind.USER_REQUIRE) {
            return false;
        }
        return tracesToOptional(req);
    }

    /**
     * Whether the request, or any request in its provenance chain, is a configured optional package.
     */
    private boolean tracesToOptional(PackageRequest req) {
        PackageRequest current = req;
        while (current != null) {
            ConfiguredPackage<I> config = packageConfigs.get(current.getId());
            if (config != null && config.isOptional()) {
                return true;
            }
            current = current.getSource().getParent().orElse(null);
        }
        return false;
    }
}
