package io.framemeta.shell;

import io.framemeta.metadata.api.MetadataOptions;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "framemeta",
    description = "Inspect and convert encoded runtime metadata",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {
      VersionCommand.class,
      SummaryCommand.class,
      JsonCommand.class,
      UpgradeCommand.class
    })
public final class Main implements Callable<Integer> {

  @CommandLine.Option(
      names = {"--lenient"},
      description = "Skip the type reference check after decoding")
  private boolean lenient;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  MetadataOptions options() {
    return lenient
        ? MetadataOptions.DEFAULT.toBuilder().verifyTypeReferences(false).build()
        : MetadataOptions.DEFAULT;
  }

  @Override
  public Integer call() {
    spec.commandLine().usage(System.err);
    return 1;
  }
}
