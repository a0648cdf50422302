package com.archlens.core.discovery;

import com.archlens.core.config.ProjectConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IgnoreRules}.
 */
class IgnoreRulesTest {

    @Test
    void defaults_skipBuildAndVendorFolders() {
        IgnoreRules rules = IgnoreRules.defaults();

        assertThat(rules.isIgnoredFolder("node_modules")).isTrue();
        assertThat(rules.isIgnoredFolder(".git")).isTrue();
        assertThat(rules.isIgnoredFolder("__pycache__")).isTrue();
        assertThat(rules.isIgnoredFolder("Target")).isTrue();
        assertThat(rules.isIgnoredFolder("src")).isFalse();
    }

    @Test
    void defaults_skipLockFilesAndBinaries() {
        IgnoreRules rules = IgnoreRules.defaults();

        assertThat(rules.isIgnoredFile("package-lock.json")).isTrue();
        assertThat(rules.isIgnoredFile("web/pnpm-lock.yaml")).isTrue();
        assertThat(rules.isIgnoredFile("LICENSE")).isTrue();
        assertThat(rules.isIgnoredFile("dist/bundle.js.map")).isTrue();
        assertThat(rules.isIgnoredFile("release.TAR.GZ")).isTrue();
        assertThat(rules.isIgnoredFile("src/app.ts")).isFalse();
    }

    @Test
    void from_addsConfiguredListsToDefaults() {
        // Given: A scan section with project-specific entries
        ProjectConfig.ScanConfig scan = new ProjectConfig.ScanConfig(
            List.of(), List.of("generated"), List.of("secrets.json"), List.of(".woff"), null);

        // When: Building rules
        IgnoreRules rules = IgnoreRules.from(scan);

        // Then: Both built-in and configured entries apply
        assertThat(rules.isIgnoredFolder("generated")).isTrue();
        assertThat(rules.isIgnoredFolder("node_modules")).isTrue();
        assertThat(rules.isIgnoredFile("config/secrets.json")).isTrue();
        assertThat(rules.isIgnoredFile("fonts/inter.woff")).isTrue();
        assertThat(rules.isIgnoredFile("config/app.json")).isFalse();
    }
}
