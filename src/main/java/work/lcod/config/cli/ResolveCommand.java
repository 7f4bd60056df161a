package work.lcod.config.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.config.api.ConfigResolver;
import work.lcod.config.api.ResolutionResult;
import work.lcod.config.api.ResolverOptions;
import work.lcod.config.io.ConfigLoader;
import work.lcod.config.io.ConfigWriter;
import work.lcod.config.io.DocumentFormat;
import work.lcod.config.runtime.Delimiters;

@CommandLine.Command(
    name = "lcod-config",
    description = "Resolve {{ values.* }} references of a YAML/JSON/TOML configuration document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ResolveCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        required = true,
        paramLabel = "PATH",
        description = "Configuration document (.yaml, .yml, .json or .toml)."
    )
    private Path config;

    @CommandLine.Option(
        names = "--input-format",
        description = "Override the input format detected from the file extension (yaml|json|toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String inputFormatRaw;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format (json|yaml).",
        defaultValue = "json"
    )
    private String outputFormatRaw;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Longest reference chain allowed.",
        defaultValue = "" + ResolverOptions.DEFAULT_MAX_DEPTH
    )
    private int maxDepth;

    @CommandLine.Option(
        names = "--open",
        description = "Opening expression delimiter.",
        defaultValue = "{{"
    )
    private String open;

    @CommandLine.Option(
        names = "--close",
        description = "Closing expression delimiter.",
        defaultValue = "}}"
    )
    private String close;

    @CommandLine.Option(
        names = "--no-resolve",
        description = "Print the document without resolving references."
    )
    private boolean noResolve;

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Print the dependency edges, resolution order and pass count to stderr."
    )
    private boolean verbose;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        LogLevel.from(logLevelRaw).apply();
        if (!Files.isRegularFile(config)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Configuration file not found: " + config);
        }
        var outputFormat = DocumentFormat.from(outputFormatRaw);
        if (outputFormat == DocumentFormat.TOML) {
            throw new CommandLine.ParameterException(spec.commandLine(), "TOML output is not supported; use json or yaml.");
        }
        var inputFormat = inputFormatRaw == null ? DocumentFormat.detect(config) : DocumentFormat.from(inputFormatRaw);

        var options = ResolverOptions.builder()
            .maxDepth(maxDepth)
            .delimiters(new Delimiters(open, close))
            .enabled(!noResolve)
            .build();

        var document = ConfigLoader.load(config, inputFormat);
        log.debug("Loaded {} as {}", config, inputFormat);
        ResolutionResult result = new ConfigResolver(options).resolve(document);

        if (verbose) {
            spec.commandLine().getErr().println(JSON_WRITER.writeValueAsString(result.diagnostics().toSerializableMap()));
        }
        spec.commandLine().getOut().println(ConfigWriter.write(result.tree(), outputFormat).stripTrailing());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
