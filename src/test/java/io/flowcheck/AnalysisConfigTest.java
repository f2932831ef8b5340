package io.flowcheck;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisConfigTest {

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("flow-check.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void defaults_matchDocumentedValues() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertThat(config.getNestingThreshold()).isEqualTo(3);
        assertThat(config.getMaxCycles()).isZero();
        assertThat(config.getMaxPaths()).isZero();
        assertThat(config.getDisabledRules()).isEmpty();
        assertThat(config.isRuleEnabled("nesting-depth")).isTrue();
    }

    @Test
    void load_readsAllKeys() throws IOException {
        Path file = tempDir.resolve("copy.yaml");
        try (InputStream in = getClass().getResourceAsStream("/config/flow-check.yaml")) {
            assertThat(in).isNotNull();
            Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
        }

        AnalysisConfig config = AnalysisConfig.load(file);

        assertThat(config.getNestingThreshold()).isEqualTo(2);
        assertThat(config.getMaxCycles()).isEqualTo(100);
        assertThat(config.getMaxPaths()).isEqualTo(500);
        assertThat(config.getDisabledRules()).containsExactly("orphaned-io");
        assertThat(config.isRuleEnabled("orphaned-io")).isFalse();
    }

    @Test
    void load_missingKeysKeepDefaults() throws IOException {
        AnalysisConfig config = AnalysisConfig.load(write("maxPaths: 10\n"));

        assertThat(config.getNestingThreshold()).isEqualTo(AnalysisConfig.DEFAULT_NESTING_THRESHOLD);
        assertThat(config.getMaxPaths()).isEqualTo(10);
    }

    @Test
    void load_emptyFileGivesDefaults() throws IOException {
        assertThat(AnalysisConfig.load(write(""))).isSameAs(AnalysisConfig.defaults());
    }

    @Test
    void load_rejectsWrongTypes() throws IOException {
        Path file = write("nestingThreshold: deep\n");

        assertThatThrownBy(() -> AnalysisConfig.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("nestingThreshold");
    }

    @Test
    void load_rejectsOutOfRangeValues() throws IOException {
        Path file = write("nestingThreshold: 0\n");

        assertThatThrownBy(() -> AnalysisConfig.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("at least 1");
    }

    @Test
    void load_rejectsNonMapping() throws IOException {
        Path file = write("- just\n- a list\n");

        assertThatThrownBy(() -> AnalysisConfig.load(file)).isInstanceOf(IOException.class);
    }

    @Test
    void load_rejectsInvalidYaml() throws IOException {
        Path file = write("nestingThreshold: [1, 2\n");

        assertThatThrownBy(() -> AnalysisConfig.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid YAML");
    }

    @Test
    void withNestingThreshold_keepsOtherSettings() {
        AnalysisConfig config = AnalysisConfig.builder().maxCycles(7).disableRule("start-end").build();

        AnalysisConfig changed = config.withNestingThreshold(5);

        assertThat(changed.getNestingThreshold()).isEqualTo(5);
        assertThat(changed.getMaxCycles()).isEqualTo(7);
        assertThat(changed.getDisabledRules()).containsExactly("start-end");
    }
}
