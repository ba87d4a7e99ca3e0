package org.example.nitro.resolver;

import org.example.nitro.model.PackageRequest;

import java.util.Objects;
import java.util.Optional;

/**
 * A global rule produced by an evaluated package. Constraints are only ever appended.
 */
interface Constraint {

    /**
     * The package whose relations produced this constraint, if any.
     */
    Optional<PackageRequest> getIssuer();

    /**
     * The target must never become required.
     */
    final class Refuse implements Constraint {
        private final PackageRequest target;

        Refuse(PackageRequest target) {
            this.target = Objects.requireNonNull(target);
        }

        PackageRequest getTarget() {
            return target;
        }

        /**
         * Id of the package that issued the refusal.
         */
        String getRefuser() {
            return getIssuer()
                    .map(PackageRequest::getId)
                    .orElse("User-refused");
        }

        @Override
        public Optional<PackageRequest> getIssuer() {
            return target.getSource().getParent();
        }
    }

    /**
     * Soft preference for the target, or against it when inverted. Checked once resolution ends.
     */
    final class Recommend implements Constraint {
        private final PackageRequest target;
        private final boolean invert;

        Recommend(PackageRequest target, boolean invert) {
            this.target = Objects.requireNonNull(target);
            this.invert = invert;
        }

        PackageRequest getTarget() {
            return target;
        }

        boolean isInvert() {
            return invert;
        }

        @Override
        public Optional<PackageRequest> getIssuer() {
            return target.getSource().getParent();
        }
    }

    /**
     * If the check package becomes required, the compat package must be required too.
     */
    final class Compat implements Constraint {
        private final PackageRequest checkPackage;
        private final PackageRequest compatPackage;

        Compat(PackageRequest checkPackage, PackageRequest compatPackage) {
            this.checkPackage = Objects.requireNonNull(checkPackage);
            this.compatPackage = Objects.requireNonNull(compatPackage);
        }

        PackageRequest getCheckPackage() {
            return checkPackage;
        }

        PackageRequest getCompatPackage() {
            return compatPackage;
        }

        boolean sameAs(PackageRequest check, PackageRequest compat) {
            return checkPackage.equals(check) && compatPackage.equals(compat);
        }

        @Override
        public Optional<PackageRequest> getIssuer() {
            return compatPackage.getSource().getParent();
        }
    }

    /**
     * The target must be required by the end of resolution.
     */
    final class Extend implements Constraint {
        private final PackageRequest target;

        Extend(PackageRequest target) {
            this.target = Objects.requireNonNull(target);
        }

        PackageRequest getTarget() {
            return target;
        }

        @Override
        public Optional<PackageRequest> getIssuer() {
            return target.getSource().getParent();
        }
    }
}
