package org.example.nitro.resolver;

import org.example.nitro.model.PackageRequest;

import java.util.Objects;

/**
 * A unit of resolver work.
 */
interface Task {

    /**
     * Evaluate a package and its relations.
     */
    final class EvalPackage implements Task {
        private final PackageRequest dest;

        EvalPackage(PackageRequest dest) {
            this.dest = Objects.requireNonNull(dest);
        }

        PackageRequest getDest() {
            return dest;
        }

        @Override
        public String toString() {
            return "EvalPackage{" + dest.getId() + '}';
        }
    }
}
