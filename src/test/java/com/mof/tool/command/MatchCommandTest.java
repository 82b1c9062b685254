package com.mof.tool.command;

import com.mof.tool.MofToolCli;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code match} subcommand end to end against the sample dataset.
 */
class MatchCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private String sample;

    @BeforeEach
    void setUp() throws URISyntaxException {
        out = new StringWriter();
        err = new StringWriter();
        sample = Path.of(MatchCommandTest.class.getResource("/mof-sample.csv").toURI()).toString();
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new MofToolCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Nested
    class SuccessTests {

        @Test
        void shouldPrintMatchesToConsole() {
            // Given: two criteria that three frameworks satisfy
            // When: Run match
            int exitCode = run("match", "-D", sample, "-C", "CO2=0.15", "-C", "Gas Temperature (°C)=25");

            // Then: One row per framework is reported
            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_OK);
            assertThat(out.toString())
                .contains("Found 3 matching MOF record(s).")
                .contains("HKUST-1")
                .contains("UiO-66")
                .contains("ZIF-8");
        }

        @Test
        void shouldReportNoMatches() {
            int exitCode = run("match", "-D", sample, "-C", "MOF=MIL-101");

            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_OK);
            assertThat(out.toString())
                .contains("No matching MOF records were found for the specified criteria.");
        }

        @Test
        void shouldPrintCsvWithoutBanner() {
            int exitCode = run("match", "-D", sample, "-C", "MOF=hkust-1", "--output-format", "csv");

            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_OK);
            assertThat(out.toString())
                .startsWith("MOF,KH (mmol/bar.g),W 0.1 (mmol/g)")
                .contains("HKUST-1,0.8,4.0,5.0")
                .doesNotContain("Found");
        }

        @Test
        void shouldExportResults() throws IOException {
            Path export = tempDir.resolve("results").resolve("mof_matches.csv");

            int exitCode = run("match", "-D", sample, "-C", "MOF=ZIF-8", "-o", export.toString(), "-q");

            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_OK);
            List<String> lines = Files.readAllLines(export, StandardCharsets.UTF_8);
            assertThat(lines).hasSize(2);
            assertThat(lines.get(1)).startsWith("ZIF-8,");
        }

        @Test
        void shouldReadConfigFileAndLetOptionsOverrideIt() throws IOException {
            // Given: a config asking for ZIF-8 as JSON
            Path config = tempDir.resolve("match.yaml");
            Files.writeString(config,
                "dataset:\n"
                    + "  path: '" + sample.replace("'", "''") + "'\n"
                    + "criteria:\n"
                    + "  MOF: zif-8\n"
                    + "output:\n"
                    + "  format: json\n",
                StandardCharsets.UTF_8);

            // When: the command line narrows the search further
            int exitCode = run("match", "-f", config.toString(), "-C", "CO2=0.5");

            // Then: both criteria apply
            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_OK);
            assertThat(out.toString())
                .contains("\"MOF\": \"ZIF-8\"")
                .contains("\"Gas uptake (mmol/g)\": 1.2")
                .contains("\"count\": 1");
        }
    }

    @Nested
    class ErrorTests {

        @Test
        void shouldWarnWhenNoCriteriaGiven() {
            int exitCode = run("match", "-D", sample);

            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_INVALID_INPUT);
            assertThat(out.toString())
                .contains("WARNING: Please provide at least one non-empty input before searching.");
        }

        @Test
        void shouldReportUnknownColumns() {
            int exitCode = run("match", "-D", sample, "-C", "H2O=1", "-C", "CO2=0.15");

            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_INVALID_INPUT);
            assertThat(out.toString()).contains("Column error: Missing columns in dataset: [H2O]");
        }

        @Test
        void shouldRequireDataset() {
            int exitCode = run("match", "-C", "CO2=0.15");

            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_INVALID_INPUT);
            assertThat(err.toString()).contains("no dataset given");
        }

        @Test
        void shouldFailForMissingDatasetFile() {
            int exitCode = run("match", "-D", tempDir.resolve("missing.csv").toString(), "-C", "CO2=0.15");

            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_FAILURE);
            assertThat(err.toString()).contains("Failed to read dataset");
        }

        @Test
        void shouldRejectBadDelimiter() {
            int exitCode = run("match", "-D", sample, "--delimiter", ";;", "-C", "CO2=0.15");

            assertThat(exitCode).isEqualTo(MatchCommand.EXIT_INVALID_INPUT);
            assertThat(err.toString()).contains("Delimiter must be a single character");
        }
    }
}
