package com.memlayout.generator.cli.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--project", "-p" }, required = true, description = "Layout project file (JSON)")
	private Path projectFile;

	@Option(names = { "--root", "-r" }, description = "Id of the struct to render (decimal or 0x-prefixed hex)")
	private String rootId;

	@Option(names = { "--root-name" }, description = "Type name or node name of the struct to render")
	private String rootName;

	@Option(names = { "--all" }, description = "Render every top-level struct (default when no root is given)")
	private boolean renderAll;

	@Option(names = { "--alias",
			"-a" }, description = "Type override per kind, e.g. --alias UInt32=DWORD (repeatable, wins over project aliases)")
	private Map<String, String> aliases = new LinkedHashMap<>();

	@Option(names = { "--output", "-o" }, description = "Header file to write (defaults to standard output)")
	private Path output;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--disabled" }, description = "Disable generation; produces empty output")
	private boolean disabled;

	@Option(names = { "--no-banner" }, description = "Omit the generated-by banner comment")
	private boolean noBanner;

}
