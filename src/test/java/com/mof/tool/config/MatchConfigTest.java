package com.mof.tool.config;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class MatchConfigTest {

    @Nested
    class YamlTests {

        @Test
        void shouldLoadAllSections() throws IOException {
            MatchConfig config;
            try (InputStream in = MatchConfigTest.class.getResourceAsStream("/match-config.yaml")) {
                config = MatchConfig.fromYaml(in);
            }

            assertThat(config.getDataset().getPath()).isEqualTo("data/MOFs_UI_Tool1.xlsm");
            assertThat(config.getDataset().getSheet()).isEqualTo("Sheet2");
            assertThat(config.getDataset().getDelimiter()).isEqualTo(';');
            assertThat(config.getOutput().getFormat()).isEqualTo("json");
            assertThat(config.getOutput().getFile()).isEqualTo("out/mof_matches.csv");
            assertThat(config.getOutput().getPreviewRows()).isEqualTo(5);
            assertThat(config.getOutput().isQuiet()).isTrue();
        }

        @Test
        void shouldKeepCriteriaOrderAndTypes() throws IOException {
            MatchConfig config;
            try (InputStream in = MatchConfigTest.class.getResourceAsStream("/match-config.yaml")) {
                config = MatchConfig.fromYaml(in);
            }

            assertThat(config.getCriteria()).containsExactly(
                entry("CO2", 0.15),
                entry("MOF", " zif-8 "),
                entry("Gas Temperature (°C)", "25"),
                entry("Void Fraction", "")
            );
        }

        @Test
        void shouldUseDefaultsForEmptyDocument() {
            MatchConfig config = MatchConfig.fromYaml(new ByteArrayInputStream(new byte[0]));

            assertThat(config.getDataset().getPath()).isNull();
            assertThat(config.getDataset().getSheet()).isEqualTo("Sheet2");
            assertThat(config.getDataset().getDelimiter()).isEqualTo(',');
            assertThat(config.getOutput().getFormat()).isEqualTo("console");
            assertThat(config.getOutput().getPreviewRows()).isEqualTo(20);
            assertThat(config.getCriteria()).isEmpty();
        }

        @Test
        void shouldKeepDefaultsForEmptySections() {
            String yaml = "dataset:\ncriteria:\n  MOF: ZIF-8\noutput:\n";

            MatchConfig config = MatchConfig.fromYaml(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

            assertThat(config.getDataset().getSheet()).isEqualTo("Sheet2");
            assertThat(config.getOutput().getFormat()).isEqualTo("console");
            assertThat(config.getCriteria()).containsExactly(entry("MOF", "ZIF-8"));
        }

        @Test
        void shouldStringifyNonTextKeys(@TempDir Path tempDir) throws IOException {
            Path file = tempDir.resolve("config.yaml");
            Files.writeString(file, "criteria:\n  2020: 1\n", StandardCharsets.UTF_8);

            MatchConfig config = MatchConfig.fromYaml(file.toString());

            assertThat(config.getCriteria()).containsEntry("2020", 1);
        }
    }

    @Nested
    class DelimiterTests {

        @Test
        void shouldParseTabAliases() {
            assertThat(MatchConfig.toDelimiter("\\t")).isEqualTo('\t');
            assertThat(MatchConfig.toDelimiter("TAB")).isEqualTo('\t');
            assertThat(MatchConfig.toDelimiter(";")).isEqualTo(';');
        }

        @Test
        void shouldRejectInvalidDelimiters() {
            assertThatThrownBy(() -> MatchConfig.toDelimiter(""))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> MatchConfig.toDelimiter(";;"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldLetMergedCriteriaWin() {
        MatchConfig config = new MatchConfig();
        config.getCriteria().put("CO2", 0.15);
        config.getCriteria().put("MOF", "ZIF-8");

        config.mergeCriteria(Map.of("CO2", "0.5"));

        assertThat(config.getCriteria()).containsExactly(entry("CO2", "0.5"), entry("MOF", "ZIF-8"));
    }

    @Test
    void shouldFailForMissingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> MatchConfig.fromYaml(tempDir.resolve("missing.yaml").toString()))
            .isInstanceOf(IOException.class);
    }
}
