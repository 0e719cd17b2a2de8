package org.pragmatica.authz.cli;

import org.pragmatica.authz.AuthzCodegen;
import org.pragmatica.authz.error.CompileError;
import org.pragmatica.authz.error.Diagnostic;
import org.pragmatica.authz.generator.GeneratorConfig;
import org.pragmatica.authz.io.ArtifactWriter;
import org.pragmatica.authz.io.SchemaSource;
import org.pragmatica.authz.model.SchemaExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line front end: reads a schema, writes the generated bindings.
 */
@Command(
    name = "authz-codegen",
    mixinStandardHelpOptions = true,
    version = "authz-codegen 0.1.0",
    description = "Generate typed Java bindings from an authorization schema",
    footer = {
        "",
        "Usage: authz-codegen [options] <schema-file> [output-dir]"
    }
)
public class AuthzCodegenCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AuthzCodegenCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Option(
        names = {"-s", "--schema"},
        description = "Path to the schema file, or a directory of " + SchemaSource.SCHEMA_EXTENSION + " files"
    )
    private Path schemaOption;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory for generated code (default: current directory)"
    )
    private Path outputOption;

    @Option(
        names = {"-p", "--package"},
        description = "Package used when the first definition has no prefix (default: ${DEFAULT-VALUE})",
        defaultValue = SchemaExtractor.DEFAULT_PACKAGE
    )
    private String defaultPackage;

    @Option(
        names = {"--no-format"},
        description = "Write template output without running the formatter"
    )
    private boolean noFormat;

    @Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "SCHEMA",
        description = "Schema path, used when --schema is not given"
    )
    private Path schemaArgument;

    @Parameters(
        index = "1",
        arity = "0..1",
        paramLabel = "OUTPUT",
        description = "Output directory, overrides --output"
    )
    private Path outputArgument;

    @Spec
    private CommandSpec spec;

    private final ArtifactWriter writer;

    public AuthzCodegenCommand() {
        this(ArtifactWriter.files());
    }

    AuthzCodegenCommand(ArtifactWriter writer) {
        this.writer = writer;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    public static CommandLine createCommandLine() {
        return createCommandLine(new AuthzCodegenCommand());
    }

    static CommandLine createCommandLine(AuthzCodegenCommand command) {
        var commandLine = new CommandLine(command);
        commandLine.setCommandName("authz-codegen");
        return commandLine;
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        var schemaPath = schemaOption != null ? schemaOption : schemaArgument;
        if (schemaPath == null) {
            err.println("Error: schema file is required");
            spec.commandLine().usage(err);
            return EXIT_USAGE;
        }
        var outputDirectory = outputArgument != null
                              ? outputArgument
                              : outputOption != null ? outputOption : Path.of(".");

        var config = GeneratorConfig.DEFAULT.withDefaultPackage(defaultPackage);
        if (noFormat) {
            config = config.unformatted();
        }

        var result = AuthzCodegen.generate(schemaPath, outputDirectory, config, writer);
        if (result.isLeft()) {
            err.print(describe(result.getLeft(), schemaPath));
            err.flush();
            return EXIT_COMPILE_FAILED;
        }

        var artifact = result.get();
        artifact.source()
                .formatWarning()
                .forEach(warning -> err.println(Diagnostic.of(warning).formatSimple(schemaPath.toString())));
        out.println("Code generation completed successfully: " + artifact.path());
        out.flush();
        return EXIT_OK;
    }

    // Located errors are shown against the schema text when it can be re-read
    private static String describe(CompileError error, Path schemaPath) {
        var diagnostic = Diagnostic.of(error);
        if (error.location().isEmpty() || !Files.isRegularFile(schemaPath)) {
            return diagnostic.format("", null);
        }
        return SchemaSource.read(schemaPath)
                           .fold(unreadable -> {
                                     log.debug("Schema not re-readable for diagnostics: {}", unreadable.message());
                                     return diagnostic.formatSimple(schemaPath.toString()) + "\n";
                                 },
                                 text -> diagnostic.format(text, schemaPath.toString()));
    }
}
