package org.example.nitro.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RecommendedPackage.
 */
class RecommendedPackageTest {

    private final PackageRequest pack = PackageRequest.any("pack", RequestSource.userRequire());

    @Test
    @DisplayName("should describe a missing recommendation with its source chain")
    void shouldDescribeMissingRecommendation() {
        PackageRequest lib = PackageRequest.any("lib", RequestSource.bundled(pack));
        RecommendedPackage rec = new RecommendedPackage(
                PackageRequest.any("sodium", RequestSource.dependency(lib)), false);

        assertThat(rec.describe())
                .isEqualTo("The package 'pack => lib' recommends the use of the package 'sodium', which is not installed");
    }

    @Test
    @DisplayName("should describe an inverted recommendation")
    void shouldDescribeInvertedRecommendation() {
        RecommendedPackage rec = new RecommendedPackage(
                PackageRequest.any("optifine", RequestSource.dependency(pack)), true);

        assertThat(rec.describe())
                .isEqualTo("The package 'pack' recommends against the use of the package 'optifine', which is installed");
        assertThat(rec).hasToString("!optifine");
    }

    @Test
    @DisplayName("should describe a recommendation without a source")
    void shouldDescribeWithoutSource() {
        RecommendedPackage rec = new RecommendedPackage(PackageRequest.any("sodium", RequestSource.repository()), false);

        assertThat(rec.describe()).startsWith("A package recommends the use of the package 'sodium'");
    }
}
