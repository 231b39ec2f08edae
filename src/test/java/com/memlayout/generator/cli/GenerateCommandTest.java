package com.memlayout.generator.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.memlayout.generator.cli.model.ValidatedGenerateOptions;
import com.memlayout.generator.model.Node;
import com.memlayout.generator.model.NodeKind;
import com.memlayout.generator.model.TreeFixture;
import com.memlayout.generator.model.TypeAliases;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the generate command wiring: root selection, aliases, output and exit codes.
 */
class GenerateCommandTest {

    @TempDir
    Path tempDir;

    private Path project;
    private ByteArrayOutputStream stdout;

    @BeforeEach
    void setUp() throws Exception {
        project = tempDir.resolve("game.json");
        Files.copy(Path.of(getClass().getResource("/projects/game.json").toURI()), project);
        stdout = new ByteArrayOutputStream();
    }

    @Test
    void testRenderRootByNameToStdout() {
        int exitCode = run("-p", project.toString(), "--root-name", "Player", "--no-banner");

        assertThat(exitCode).isZero();
        assertThat(output()).startsWith("#pragma once\n\nstruct Player {\n")
                .contains("DWORD score;")
                .contains("static_assert(sizeof(Player) == 0x24, \"Size mismatch for Player\");")
                .doesNotContain("struct World {");
    }

    @Test
    void testRenderRootByHexId() {
        int exitCode = run("-p", project.toString(), "--root", "0x1", "--no-banner");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("struct World;", "struct Player {", "struct World {", "World* self;",
                "uint16_t slots[4];", "uint8_t _pad0001[0x5];",
                "static_assert(sizeof(World) == 0x55, \"Size mismatch for World\");");
    }

    @Test
    void testCommandLineAliasWinsOverProjectAlias() {
        int exitCode = run("-p", project.toString(), "--root-name", "Player", "--alias", "UInt32=u32", "--no-banner");

        assertThat(exitCode).isZero();
        assertThat(output()).contains("u32 score;").doesNotContain("DWORD");
    }

    @Test
    void testBannerDescribesRoot() {
        int exitCode = run("-p", project.toString(), "--root", "2");

        assertThat(exitCode).isZero();
        assertThat(output()).startsWith("""
                // Generated by layout-header-gen
                // Source: game.json
                // Base address: 0x140000000
                // Rendered from: world > player  (id=0x2, size=0x24)

                #pragma once
                """);
    }

    @Test
    void testRenderAllToFile() throws Exception {
        Path out = tempDir.resolve("out/game.h");

        int exitCode = run("-p", project.toString(), "--all", "-o", out.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).isEmpty();
        String written = Files.readString(out, StandardCharsets.UTF_8);
        assertThat(written).contains("// Rendered from: Full SDK export", "struct World {", "struct Player {");
    }

    @Test
    void testExistingOutputIsOverwrittenOnlyWithForce() throws Exception {
        Path out = tempDir.resolve("game.h");
        Files.writeString(out, "old");

        assertThat(run("-p", project.toString(), "-o", out.toString())).isEqualTo(1);
        assertThat(Files.readString(out)).isEqualTo("old");

        assertThat(run("-p", project.toString(), "-o", out.toString(), "--force")).isZero();
        assertThat(Files.readString(out)).contains("struct World {");
    }

    @Test
    void testDisabledGenerationPrintsNothing() {
        int exitCode = run("-p", project.toString(), "--disabled");

        assertThat(exitCode).isZero();
        assertThat(output()).isEmpty();
    }

    @Test
    void testUnknownRootFails() {
        assertThat(run("-p", project.toString(), "--root-name", "Vehicle")).isEqualTo(1);
        assertThat(run("-p", project.toString(), "--root", "3")).isEqualTo(1);
        assertThat(output()).isEmpty();
    }

    @Test
    void testMalformedProjectFails() throws Exception {
        Files.writeString(project, "{ \"nodes\": [");

        assertThat(run("-p", project.toString())).isEqualTo(1);
    }

    @Test
    void testResolveRootPrefersTypeName() {
        TreeFixture f = new TreeFixture();
        long byName = f.struct(0, 0, "Player", "");
        long byType = f.struct(0, 0x100, "other", "Player");
        f.field(byType, 0, NodeKind.INT8, "x");
        ValidatedGenerateOptions v = new ValidatedGenerateOptions(project, null, "Player", TypeAliases.empty(), null);

        Optional<Node> root = GenerateCommand.resolveRoot(f.build(), v);

        assertThat(root).map(Node::getId).contains(byType);
        assertThat(byName).isNotEqualTo(byType);
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(stdout, true, StandardCharsets.UTF_8);
        return new CommandLine(new GenerateCommand(out)).execute(args);
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }
}
