package io.framemeta.metadata.api;

/**
 * A runtime metadata tree of one specific version. The set of versions is closed: exactly one
 * record type exists per {@link MetadataVersion}.
 */
public sealed interface RuntimeMetadata
    permits RuntimeMetadataV8,
        RuntimeMetadataV9,
        RuntimeMetadataV10,
        RuntimeMetadataV11,
        RuntimeMetadataV12,
        RuntimeMetadataV13,
        RuntimeMetadataV14,
        RuntimeMetadataV15,
        RuntimeMetadataV16 {

  /** Returns the version of this tree. */
  MetadataVersion version();
}
