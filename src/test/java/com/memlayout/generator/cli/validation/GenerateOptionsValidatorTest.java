package com.memlayout.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.memlayout.generator.cli.exception.OptionsValidationException;
import com.memlayout.generator.cli.model.GenerateOptions;
import com.memlayout.generator.cli.model.ValidatedGenerateOptions;
import com.memlayout.generator.model.NodeKind;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private Path project;
    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @BeforeEach
    void setUp() throws Exception {
        project = tempDir.resolve("game.json");
        Files.writeString(project, "{ \"nodes\": [] }");
    }

    @Test
    void testDefaultsToRenderAll() {
        ValidatedGenerateOptions v = validate("-p", project.toString());

        assertThat(v.isRenderAll()).isTrue();
        assertThat(v.getOutput()).isNull();
        assertThat(v.getAliasOverrides().isEmpty()).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
            "42, 42",
            "0x10, 16",
            "0XfF, 255"
    })
    void testRootIdFormats(String raw, long expected) {
        ValidatedGenerateOptions v = validate("-p", project.toString(), "--root", raw);

        assertThat(v.getRootId()).isEqualTo(expected);
        assertThat(v.isRenderAll()).isFalse();
    }

    @ParameterizedTest
    @CsvSource({ "0", "abc", "0x" })
    void testInvalidRootIdIsRejected(String raw) {
        assertThatThrownBy(() -> validate("-p", project.toString(), "--root", raw))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Root id");
    }

    @Test
    void testOnlyOneSelectorAllowed() {
        assertThatThrownBy(() -> validate("-p", project.toString(), "--root", "1", "--root-name", "Player"))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("only one");
    }

    @Test
    void testAliasesAreParsed() {
        ValidatedGenerateOptions v = validate("-p", project.toString(), "--alias", "UInt32=DWORD", "-a", "bool=BOOL");

        assertThat(v.getAliasOverrides().lookup(NodeKind.UINT32)).contains("DWORD");
        assertThat(v.getAliasOverrides().lookup(NodeKind.BOOL)).contains("BOOL");
    }

    @Test
    void testBadAliasesCollectAllErrors() {
        assertThatThrownBy(() -> validate("-p", project.toString(), "--alias", "Quaternion=Q", "--alias", "Struct=S"))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(2)
                        .anyMatch(err -> err.contains("Quaternion"))
                        .anyMatch(err -> err.contains("cannot be aliased")));
    }

    @Test
    void testMissingProjectFileIsRejected() {
        assertThatThrownBy(() -> validate("-p", tempDir.resolve("nope.json").toString()))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void testExistingOutputNeedsForce() throws Exception {
        Path out = tempDir.resolve("game.h");
        Files.writeString(out, "old");

        assertThatThrownBy(() -> validate("-p", project.toString(), "-o", out.toString()))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--force");

        ValidatedGenerateOptions v = validate("-p", project.toString(), "-o", out.toString(), "--force");
        assertThat(v.getOutput()).isEqualTo(out.toAbsolutePath().normalize());
    }

    @Test
    void testOutputDirectoryIsRejected() {
        assertThatThrownBy(() -> validate("-p", project.toString(), "-o", tempDir.toString()))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("directory");
    }

    private ValidatedGenerateOptions validate(String... args) {
        GenerateOptions options = CommandLine.populateCommand(new GenerateOptions(), args);
        return validator.validate(options);
    }
}
