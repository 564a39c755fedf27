package io.framemeta.shell;

import io.framemeta.metadata.api.MetadataException;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadataCodec;
import java.io.IOException;
import java.util.Optional;
import picocli.CommandLine;

@CommandLine.Command(
    name = "version",
    description = "Print the version tag of an encoded metadata file")
final class VersionCommand extends MetadataCommand {

  @Override
  void run() throws MetadataException, IOException {
    int tag = RuntimeMetadataCodec.versionOf(readInput());
    Optional<MetadataVersion> version = MetadataVersion.fromTag(tag);
    if (version.isPresent()) {
      System.out.println(version.get());
    } else {
      System.out.println(tag + " (unsupported)");
    }
  }
}
