package io.framemeta.shell;

import io.framemeta.json.MetadataJson;
import io.framemeta.metadata.api.MetadataException;
import io.framemeta.metadata.api.RuntimeMetadata;
import java.io.IOException;
import picocli.CommandLine;

@CommandLine.Command(name = "json", description = "Print the JSON projection of a metadata file")
final class JsonCommand extends MetadataCommand {

  @CommandLine.Option(
      names = {"-p", "--pretty"},
      description = "Indent the output")
  private boolean pretty;

  @Override
  void run() throws MetadataException, IOException {
    RuntimeMetadata metadata = decode();
    MetadataJson json = new MetadataJson(parent.options());
    System.out.println(pretty ? json.toPrettyJson(metadata) : json.toJson(metadata));
  }
}
