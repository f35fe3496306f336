package io.jsontable.shell;

import io.jsontable.core.ConversionConfig;
import io.jsontable.core.JsonTableConverter;
import io.jsontable.core.JsonTableException;
import io.jsontable.core.Slf4jDiagnosticsSink;
import io.jsontable.core.TableMatrix;
import io.jsontable.shell.render.CsvRenderer;
import io.jsontable.shell.render.TableRenderer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "jsontable",
    description = "Render a JSON file or inline JSON as a table",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

  /** Output layouts. */
  public enum Format {
    TABLE,
    CSV
  }

  @Spec private CommandSpec spec;

  @Parameters(index = "0", arity = "0..1", description = "JSON file, relative to --base-dir")
  private String file;

  @Option(
      names = {"-i", "--inline"},
      description = "Inline JSON content, used when no file is given")
  private String inline;

  @Option(
      names = {"-H", "--header"},
      description = "Print column names as the first row")
  private boolean header;

  @Option(
      names = {"-l", "--limit"},
      description = "Maximum rows to print; 0 prints every row")
  private Integer limit;

  @Option(
      names = {"--format"},
      defaultValue = "TABLE",
      description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
  private Format format;

  @Option(
      names = {"-e", "--encoding"},
      defaultValue = "utf-8",
      description = "File encoding (default: ${DEFAULT-VALUE})")
  private String encoding;

  @Option(
      names = {"--base-dir"},
      defaultValue = ".",
      description = "Directory JSON files must stay within (default: ${DEFAULT-VALUE})")
  private Path baseDir;

  @Option(
      names = {"-c", "--config"},
      description = "Properties file with defaultCap, maxObjects, maxKeys, maxKeyLength")
  private Path configFile;

  public static void main(String[] args) {
    int exitCode = commandLine().execute(args);
    System.exit(exitCode);
  }

  /** Creates the command line used by {@link #main}. */
  public static CommandLine commandLine() {
    return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
  }

  @Override
  public Integer call() {
    if (limit != null && limit < 0) {
      throw new CommandLine.ParameterException(
          spec.commandLine(), "--limit must be 0 or a positive integer, got " + limit);
    }
    OutputWriter out = OutputWriter.to(System.out);
    OutputWriter err = OutputWriter.to(System.err);
    ConversionConfig config;
    try {
      config = configFile != null ? ConversionConfig.load(configFile) : ConversionConfig.defaults();
    } catch (IOException | IllegalArgumentException e) {
      err.println("Error: invalid configuration: " + e.getMessage());
      return 1;
    }

    try {
      Object data = new JsonDataLoader(encoding).load(file, inline, baseDir);
      TableMatrix table =
          new JsonTableConverter(config, new Slf4jDiagnosticsSink()).convert(data, header, limit);
      switch (format) {
        case CSV -> CsvRenderer.render(table, out);
        case TABLE -> TableRenderer.render(table, out);
      }
      return 0;
    } catch (JsonTableException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
