package org.example.nitro.config;

import org.example.nitro.exception.ConfigurationException;
import org.example.nitro.model.PackageOverrides;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConfigurationValidator.
 */
class ConfigurationValidatorTest {

    private ConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ConfigurationValidator();
    }

    private static List<PackageConfiguration> validPackages() {
        return Arrays.asList(
                PackageConfiguration.of("sodium"),
                PackageConfiguration.builder("modrinth:fabric-api@0.90").feature("core").build()
        );
    }

    @Nested
    @DisplayName("Package Validation")
    class PackageValidation {

        @Test
        @DisplayName("should pass for valid packages")
        void shouldPassForValidPackages() {
            List<String> errors = validator.validate(validPackages(), PackageOverrides.none());

            assertThat(errors).isEmpty();
        }

        @Test
        @DisplayName("should fail when packages are missing")
        void shouldFailWhenPackagesMissing() {
            List<String> errors = validator.validate(null, null);

            assertThat(errors).containsExactly("packages is required");
        }

        @Test
        @DisplayName("should fail for an invalid package id")
        void shouldFailForInvalidId() {
            List<String> errors = validator.validate(List.of(PackageConfiguration.of("modrinth:Bad_Id")), null);

            assertThat(errors).containsExactly("Invalid package id 'Bad_Id' in request 'modrinth:Bad_Id'");
        }

        @Test
        @DisplayName("should fail for a package configured twice")
        void shouldFailForDuplicates() {
            List<String> errors = validator.validate(List.of(
                    PackageConfiguration.of("sodium"),
                    PackageConfiguration.of("modrinth:sodium@2")), null);

            assertThat(errors).containsExactly("Package 'sodium' is configured more than once");
        }

        @Test
        @DisplayName("should fail for a blank feature")
        void shouldFailForBlankFeature() {
            List<String> errors = validator.validate(
                    List.of(PackageConfiguration.builder("sodium").feature(" ").build()), null);

            assertThat(errors).containsExactly("Package 'sodium' contains an empty feature");
        }
    }

    @Nested
    @DisplayName("Override Validation")
    class OverrideValidation {

        @Test
        @DisplayName("should fail for a package both suppressed and forced")
        void shouldFailForConflictingOverrides() {
            PackageOverrides overrides = PackageOverrides.builder()
                    .suppress("sodium")
                    .force("modrinth:sodium")
                    .build();

            List<String> errors = validator.validate(validPackages(), overrides);

            assertThat(errors).containsExactly("Package 'sodium' is both suppressed and forced");
        }

        @Test
        @DisplayName("should fail for invalid or empty entries")
        void shouldFailForInvalidEntries() {
            PackageOverrides overrides = PackageOverrides.builder()
                    .suppress("")
                    .force("No.Good")
                    .build();

            List<String> errors = validator.validate(validPackages(), overrides);

            assertThat(errors).containsExactly(
                    "suppress contains empty entry",
                    "force contains invalid package id: No.Good");
        }
    }

    @Nested
    @DisplayName("Validate Or Throw")
    class ValidateOrThrow {

        @Test
        @DisplayName("should not throw for valid configuration")
        void shouldNotThrowForValidConfiguration() {
            assertThatCode(() -> validator.validateOrThrow(validPackages(), PackageOverrides.none()))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should throw with all errors")
        void shouldThrowWithAllErrors() {
            List<PackageConfiguration> packages = List.of(
                    PackageConfiguration.of("BAD"),
                    PackageConfiguration.of("BAD"));

            assertThatThrownBy(() -> validator.validateOrThrow(packages, null))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageStartingWith("Invalid package configuration:")
                    .satisfies(e -> assertThat(((ConfigurationException) e).getValidationErrors()).hasSize(3));
        }
    }
}
