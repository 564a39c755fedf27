package io.framemeta.metadata.internal;

import io.framemeta.codec.ScaleCodecException;
import io.framemeta.codec.ScaleReader;
import io.framemeta.codec.ScaleWriter;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadata;

/**
 * Reads and writes the payload of one metadata version, i.e. everything after the magic and the
 * version discriminant.
 *
 * @param <T> the tree type of the version
 */
public interface PayloadCodec<T extends RuntimeMetadata> {

  /** Returns the version this codec handles. */
  MetadataVersion version();

  /**
   * Decodes a payload.
   *
   * @param reader positioned at the first payload byte
   * @return the tree
   * @throws ScaleCodecException if the payload is not a valid encoding
   */
  T decode(ScaleReader reader) throws ScaleCodecException;

  /**
   * Encodes a tree's payload.
   *
   * @param writer the output
   * @param metadata the tree
   */
  void encode(ScaleWriter writer, T metadata);
}
