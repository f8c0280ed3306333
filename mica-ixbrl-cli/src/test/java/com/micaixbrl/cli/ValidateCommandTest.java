package com.micaixbrl.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void validate_validRecord_exitsZero() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "validate", record.toString(),
            "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("Validation Summary:")
            .contains("✓ Record is valid");
    }

    @Test
    void validate_missingLei_reportsErrorAndExitsOne() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json",
            CommandTestSupport.MISSING_LEI_RECORD);

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "validate", record.toString(),
            "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out())
            .contains("✗ LEI-000 [partA.lei]")
            .contains("✗ Record is invalid");
    }

    @Test
    void validate_skipRule_dropsFinding() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json",
            CommandTestSupport.VALID_RECORD.replace("\"EXT\"", "\"ext\""));

        CommandTestSupport.Result unfiltered = CommandTestSupport.execute("-q", "validate", record.toString(),
            "-c", tempDir.resolve("absent.yaml").toString());
        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "validate", record.toString(),
            "--skip-rule", "VAL-012", "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(unfiltered.out()).contains("⚠ VAL-012");
        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).doesNotContain("VAL-012");
    }

    @Test
    void validate_json_printsMachineReadableResult() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "validate", record.toString(),
            "--json", "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("\"valid\" : true")
            .contains("\"summary\"")
            .contains("\"assertionCounts\"");
    }

    @Test
    void validate_tokenTypeOverride_appliesArtRules() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "validate", record.toString(),
            "--token-type", "ART", "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.out()).contains("EXS-ART-001");
    }

    @Test
    void validate_failOnWarningsConfigured_exitsOneForWarnings() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json",
            CommandTestSupport.VALID_RECORD.replace("https://example-labs.eu", "example-labs.eu"));
        Path config = tempDir.resolve("mica-ixbrl.yaml");
        Files.writeString(config, """
            validation:
              failOnWarnings: true
            """);

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "validate", record.toString(),
            "-c", config.toString());

        assertThat(result.out()).contains("⚠ VAL-007 [partA.website]");
        assertThat(result.exitCode()).isEqualTo(1);
    }
}
