package io.framemeta.shell;

import io.framemeta.metadata.api.MetadataException;
import io.framemeta.metadata.api.RuntimeMetadata;
import io.framemeta.metadata.util.MetadataSummary;
import java.io.IOException;
import picocli.CommandLine;

@CommandLine.Command(name = "summary", description = "Print version, pallets and registry size")
final class SummaryCommand extends MetadataCommand {

  @Override
  void run() throws MetadataException, IOException {
    RuntimeMetadata metadata = decode();
    System.out.println(MetadataSummary.describe(metadata));
    for (MetadataSummary.PalletInfo pallet : MetadataSummary.pallets(metadata)) {
      System.out.printf("  %3d  %s%n", pallet.index(), pallet.name());
    }
  }
}
