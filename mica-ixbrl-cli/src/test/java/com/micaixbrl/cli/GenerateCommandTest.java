package com.micaixbrl.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GenerateCommand}.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void generate_validRecord_writesXhtmlDocument() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);
        Path outputDir = tempDir.resolve("out");

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "generate", record.toString(),
            "-o", outputDir.toString(), "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isZero();
        Path document = outputDir.resolve("ext-whitepaper.xhtml");
        assertThat(document).exists();
        assertThat(Files.readString(document))
            .startsWith("<?xml")
            .contains("ix:header")
            .contains("Example Labs Ltd");
        assertThat(result.out()).contains("✓ Generated ext-whitepaper.xhtml").contains("✓ Wrote");
    }

    @Test
    void generate_bothGenerators_writesTwoFiles() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);
        Path outputDir = tempDir.resolve("out");

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "generate", record.toString(),
            "-g", "xhtml", "-g", "facts-json", "-o", outputDir.toString(),
            "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(outputDir.resolve("ext-whitepaper.xhtml")).exists();
        assertThat(outputDir.resolve("ext-whitepaper-facts.json")).exists();
    }

    @Test
    void generate_stdout_printsDocumentAndKeepsStatusOnStderr() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "generate", record.toString(),
            "--stdout", "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).startsWith("<?xml").doesNotContain("✓ Generated");
        assertThat(result.err()).contains("✓ Generated ext-whitepaper.xhtml");
    }

    @Test
    void generate_stdoutWithHeaders_printsFileHeader() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "generate", record.toString(),
            "--stdout", "--headers", "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).startsWith("-".repeat(80))
            .contains("File 1/1: ext-whitepaper.xhtml (")
            .contains("<?xml");
    }

    @Test
    void generate_noOverwriteWithExistingFile_failsAndKeepsFile() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);
        Path outputDir = Files.createDirectories(tempDir.resolve("out"));
        Path existing = Files.writeString(outputDir.resolve("ext-whitepaper.xhtml"), "previous");

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "generate", record.toString(),
            "-o", outputDir.toString(), "--no-overwrite", "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Refusing to overwrite existing file");
        assertThat(existing).hasContent("previous");
    }

    @Test
    void generate_existingFileByDefault_isReplaced() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);
        Path outputDir = Files.createDirectories(tempDir.resolve("out"));
        Path existing = Files.writeString(outputDir.resolve("ext-whitepaper.xhtml"), "previous");

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "generate", record.toString(),
            "-o", outputDir.toString(), "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(Files.readString(existing)).startsWith("<?xml");
    }

    @Test
    void generate_unknownGenerator_failsWithList() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json", CommandTestSupport.VALID_RECORD);

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "generate", record.toString(),
            "-g", "pdf", "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗ Unknown generator: pdf").contains("- xhtml");
    }

    @Test
    void generate_missingLei_fails() throws IOException {
        Path record = CommandTestSupport.writeRecord(tempDir, "whitepaper.json",
            CommandTestSupport.MISSING_LEI_RECORD);

        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "generate", record.toString(),
            "-o", tempDir.resolve("out").toString(), "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗ Generation failed");
        assertThat(tempDir.resolve("out")).doesNotExist();
    }

    @Test
    void generate_missingRecord_fails() {
        CommandTestSupport.Result result = CommandTestSupport.execute("-q", "generate",
            tempDir.resolve("absent.json").toString(), "-c", tempDir.resolve("absent.yaml").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("absent.json");
    }
}
