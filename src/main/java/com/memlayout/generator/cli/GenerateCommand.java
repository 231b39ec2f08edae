package com.memlayout.generator.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memlayout.generator.cli.exception.OptionsValidationException;
import com.memlayout.generator.cli.model.GenerateOptions;
import com.memlayout.generator.cli.model.ValidatedGenerateOptions;
import com.memlayout.generator.cli.output.GenerateResultsPrinter;
import com.memlayout.generator.cli.validation.GenerateOptionsValidator;
import com.memlayout.generator.codegen.GeneratorResult;
import com.memlayout.generator.codegen.HeaderGenerator;
import com.memlayout.generator.codegen.HeaderGenerators;
import com.memlayout.generator.codegen.export.BannerInfo;
import com.memlayout.generator.codegen.export.HeaderFileWriter;
import com.memlayout.generator.codegen.model.core.context.GeneratorConfig;
import com.memlayout.generator.codegen.model.core.context.ToolDiagnostics;
import com.memlayout.generator.codegen.util.NamingUtil;
import com.memlayout.generator.model.Node;
import com.memlayout.generator.model.NodeKind;
import com.memlayout.generator.model.NodeTree;
import com.memlayout.generator.model.TypeAliases;
import com.memlayout.generator.parser.ProjectDocument;
import com.memlayout.generator.parser.ProjectFileParser;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that renders C++ struct definitions from a layout project file.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "layout-header-gen 1.0.0",
        description = "Generates C++ struct definitions whose layout matches a reverse-engineered memory model."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final String TOOL_NAME = "layout-header-gen";

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final PrintStream stdout;

    public GenerateCommand() {
        this(new PrintStream(System.out, true, StandardCharsets.UTF_8));
    }

    GenerateCommand(PrintStream stdout) {
        this.stdout = stdout;
    }

    @Override
    public Integer call() {
        GenerateResultsPrinter printer = new GenerateResultsPrinter();
        try {
            ValidatedGenerateOptions validated = new GenerateOptionsValidator().validate(options);

            ProjectDocument document = new ProjectFileParser().parse(validated.getProjectFile());
            document.getWarnings().forEach(w -> log.warn("{}", w));

            TypeAliases aliases = document.getTypeAliases().withOverrides(validated.getAliasOverrides());
            GeneratorConfig config = GeneratorConfig.builder()
                    .enabled(!options.isDisabled())
                    .typeAliases(aliases)
                    .includeBanner(!options.isNoBanner())
                    .build();

            printer.printBanner(options, validated, aliases);

            NodeTree tree = document.getTree();
            Optional<Node> root = resolveRoot(tree, validated);
            if (!validated.isRenderAll() && root.isEmpty()) {
                log.error("No struct matches root {}", validated.getRootId() != null
                        ? validated.getRootId() : validated.getRootName());
                return 1;
            }

            HeaderGenerator generator = HeaderGenerators.forConfig(config);
            ToolDiagnostics diagnostics = new ToolDiagnostics();
            GeneratorResult result = root
                    .map(r -> generator.generateRoot(tree, r.getId(), config.getTypeAliases(), diagnostics))
                    .orElseGet(() -> generator.generateAll(tree, config.getTypeAliases(), diagnostics));
            printer.printDiagnostics(diagnostics);

            writeOutput(validated, config, document, root, result);
            printer.printSuccess(validated, result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(err -> log.error("{}", err));
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    private void writeOutput(ValidatedGenerateOptions validated, GeneratorConfig config, ProjectDocument document,
                             Optional<Node> root, GeneratorResult result) throws IOException {
        HeaderFileWriter writer = new HeaderFileWriter();
        BannerInfo banner = config.isIncludeBanner() && !result.isEmpty()
                ? bannerFor(document, root)
                : null;
        Path output = validated.getOutput();
        if (output != null) {
            writer.write(output, result.getText(), banner);
        } else {
            stdout.print(writer.render(result.getText(), banner));
            stdout.flush();
        }
    }

    private static BannerInfo bannerFor(ProjectDocument document, Optional<Node> root) {
        String renderedFrom = root
                .map(r -> String.format("%s  (id=%s, size=%s)",
                        document.getTree().breadcrumb(r.getId()),
                        NamingUtil.hex(r.getId()),
                        NamingUtil.hex(document.getTree().structSpan(r.getId()))))
                .orElse("Full SDK export");
        return BannerInfo.builder()
                .toolName(TOOL_NAME)
                .source(document.getSourcePath() == null ? null : document.getSourcePath().getFileName().toString())
                .baseAddress(NamingUtil.hex(document.getTree().getBaseAddress()))
                .renderedFrom(renderedFrom)
                .build();
    }

    /**
     * Finds the struct selected by --root or --root-name. Names match the
     * explicit type name first, then the node name.
     */
    static Optional<Node> resolveRoot(NodeTree tree, ValidatedGenerateOptions validated) {
        if (validated.getRootId() != null) {
            return tree.findById(validated.getRootId()).filter(n -> n.getKind() == NodeKind.STRUCT);
        }
        String name = validated.getRootName();
        if (name == null) {
            return Optional.empty();
        }
        Optional<Node> byType = tree.getNodes().stream()
                .filter(n -> n.getKind() == NodeKind.STRUCT && name.equals(n.getStructTypeName()))
                .findFirst();
        if (byType.isPresent()) {
            return byType;
        }
        return tree.getNodes().stream()
                .filter(n -> n.getKind() == NodeKind.STRUCT && name.equals(n.getName()))
                .findFirst();
    }
}
