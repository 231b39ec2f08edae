package com.memlayout.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.memlayout.generator.cli.exception.OptionsValidationException;
import com.memlayout.generator.cli.model.GenerateOptions;
import com.memlayout.generator.cli.model.ValidatedGenerateOptions;
import com.memlayout.generator.model.NodeKind;
import com.memlayout.generator.model.TypeAliases;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getProjectFile() == null) {
			errors.add("Project file is required (--project / -p).");
		} else if (!Files.isRegularFile(o.getProjectFile())) {
			errors.add("Project file does not exist or is not a file: " + o.getProjectFile());
		}

		int selectors = 0;
		if (!isBlank(o.getRootId())) {
			selectors++;
		}
		if (!isBlank(o.getRootName())) {
			selectors++;
		}
		if (o.isRenderAll()) {
			selectors++;
		}
		if (selectors > 1) {
			errors.add("Use only one of --root, --root-name and --all.");
		}

		Long rootId = null;
		if (!isBlank(o.getRootId())) {
			rootId = parseId(o.getRootId().trim()).orElse(null);
			if (rootId == null || rootId == 0) {
				errors.add("Root id must be a positive decimal or 0x-prefixed hex number. Got: " + o.getRootId());
			}
		}

		TypeAliases aliases = parseAliases(o.getAliases(), errors);

		Path output = o.getOutput() == null ? null : o.getOutput().toAbsolutePath().normalize();
		if (output != null) {
			if (Files.isDirectory(output)) {
				errors.add("Output path is a directory: " + output);
			} else if (Files.exists(output) && !o.isForce()) {
				errors.add("Output file already exists: " + output + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		String rootName = isBlank(o.getRootName()) ? null : o.getRootName().trim();
		return new ValidatedGenerateOptions(o.getProjectFile(), rootId, rootName, aliases, output);
	}

	static Optional<Long> parseId(String raw) {
		try {
			if (raw.startsWith("0x") || raw.startsWith("0X")) {
				return Optional.of(Long.parseUnsignedLong(raw.substring(2), 16));
			}
			return Optional.of(Long.parseUnsignedLong(raw));
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}

	private static TypeAliases parseAliases(Map<String, String> raw, List<String> errors) {
		if (raw == null || raw.isEmpty()) {
			return TypeAliases.empty();
		}
		Map<NodeKind, String> aliases = new EnumMap<>(NodeKind.class);
		raw.forEach((kindName, alias) -> {
			Optional<NodeKind> kind = NodeKind.fromDisplayName(kindName);
			if (kind.isEmpty()) {
				errors.add("Unknown kind in --alias: " + kindName);
			} else if (kind.get().isContainer()) {
				errors.add("Struct and Array kinds cannot be aliased: " + kindName);
			} else if (isBlank(alias)) {
				errors.add("Alias for " + kindName + " must not be blank.");
			} else {
				aliases.put(kind.get(), alias);
			}
		});
		return TypeAliases.of(aliases);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
