package io.framemeta.shell;

import io.framemeta.metadata.api.MetadataException;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadata;
import io.framemeta.metadata.convert.MetadataUpgrader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "upgrade",
    description = "Convert a metadata file to a newer version and write the encoded result")
final class UpgradeCommand extends MetadataCommand {
  private static final Logger log = LoggerFactory.getLogger(UpgradeCommand.class);

  @CommandLine.Option(
      names = {"-t", "--to"},
      required = true,
      converter = VersionConverter.class,
      description = "Target version tag, e.g. 15 or V15")
  private MetadataVersion target;

  @CommandLine.Option(
      names = {"-o", "--output"},
      required = true,
      description = "File to write the encoded result to")
  private Path output;

  @Override
  void run() throws MetadataException, IOException {
    RuntimeMetadata metadata = decode();
    RuntimeMetadata upgraded = MetadataUpgrader.upgrade(metadata, target);
    byte[] encoded = codec().encode(upgraded);
    Files.write(output, encoded);
    log.info("Wrote {} metadata to {} ({} bytes)", target, output, encoded.length);
    System.out.println(metadata.version() + " -> " + target + ": " + output);
  }

  /** Accepts {@code 15} or {@code V15}. */
  static final class VersionConverter implements CommandLine.ITypeConverter<MetadataVersion> {
    @Override
    public MetadataVersion convert(String text) {
      String digits = text.startsWith("V") || text.startsWith("v") ? text.substring(1) : text;
      int tag;
      try {
        tag = Integer.parseInt(digits);
      } catch (NumberFormatException e) {
        throw new CommandLine.TypeConversionException("not a version: " + text);
      }
      return MetadataVersion.fromTag(tag)
          .orElseThrow(
              () -> new CommandLine.TypeConversionException("unknown metadata version: " + text));
    }
  }
}
