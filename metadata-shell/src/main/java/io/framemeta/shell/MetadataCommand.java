package io.framemeta.shell;

import io.framemeta.metadata.api.MetadataException;
import io.framemeta.metadata.api.RuntimeMetadata;
import io.framemeta.metadata.api.RuntimeMetadataCodec;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/** Base for subcommands that read one metadata file and report failures as exit code 1. */
abstract class MetadataCommand implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(MetadataCommand.class);

  @CommandLine.ParentCommand Main parent;

  @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Encoded metadata")
  Path file;

  @Override
  public final Integer call() {
    try {
      run();
      return 0;
    } catch (MetadataException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    } catch (NoSuchFileException e) {
      System.err.println("Error: File not found: " + e.getFile());
      return 1;
    } catch (IOException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    } catch (UncheckedIOException e) {
      System.err.println("Error: " + e.getCause().getMessage());
      return 1;
    }
  }

  abstract void run() throws MetadataException, IOException;

  byte[] readInput() throws IOException {
    return MetadataInput.read(file);
  }

  RuntimeMetadataCodec codec() {
    return new RuntimeMetadataCodec(parent.options());
  }

  RuntimeMetadata decode() throws MetadataException, IOException {
    byte[] data = readInput();
    RuntimeMetadata metadata = codec().decode(data);
    log.info("Decoded {} metadata from {} ({} bytes)", metadata.version(), file, data.length);
    return metadata;
  }
}
