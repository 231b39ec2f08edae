package com.memlayout.generator.codegen.export;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class HeaderFileWriterTest {

    private static final String BODY = "#pragma once\n\nstruct A {\n};\n";

    private final HeaderFileWriter writer = new HeaderFileWriter();

    @Test
    void testRenderWithBanner() throws Exception {
        BannerInfo banner = BannerInfo.builder()
                .toolName("layout-header-gen")
                .source("game.json")
                .renderedFrom("world > player  (id=0x2, size=0x40)")
                .build();

        String text = writer.render(BODY, banner);

        assertThat(text).isEqualTo("""
                // Generated by layout-header-gen
                // Source: game.json
                // Rendered from: world > player  (id=0x2, size=0x40)

                """ + BODY);
    }

    @Test
    void testRenderWithBaseAddress() throws Exception {
        BannerInfo banner = BannerInfo.builder()
                .toolName("layout-header-gen")
                .source("game.json")
                .baseAddress("0x400000")
                .renderedFrom("Full SDK export")
                .build();

        String text = writer.render(BODY, banner);

        assertThat(text).startsWith("""
                // Generated by layout-header-gen
                // Source: game.json
                // Base address: 0x400000
                // Rendered from: Full SDK export

                """);
    }

    @Test
    void testRenderWithoutSourceLine() throws Exception {
        BannerInfo banner = BannerInfo.builder()
                .toolName("layout-header-gen")
                .renderedFrom("Full SDK export")
                .build();

        String text = writer.render(BODY, banner);

        assertThat(text).doesNotContain("Source:").startsWith("// Generated by layout-header-gen\n")
                .endsWith(BODY);
    }

    @Test
    void testRenderWithoutBannerIsBodyOnly() throws Exception {
        assertThat(writer.render(BODY, null)).isEqualTo(BODY);
        assertThat(writer.render("", null)).isEmpty();
    }

    @Test
    void testWriteCreatesParentDirectories(@TempDir Path tempDir) throws Exception {
        Path target = tempDir.resolve("include/sdk/game.h");

        writer.write(target, BODY, null);

        assertThat(target).exists();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo(BODY);
    }
}
