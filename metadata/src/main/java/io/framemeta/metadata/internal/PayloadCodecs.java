package io.framemeta.metadata.internal;

import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadata;
import java.util.EnumMap;
import java.util.Map;

/** The payload codec of every supported version. */
public final class PayloadCodecs {
  private static final Map<MetadataVersion, PayloadCodec<?>> CODECS =
      new EnumMap<>(MetadataVersion.class);

  static {
    register(LegacyCodec.V8);
    register(LegacyCodec.V9);
    register(LegacyCodec.V10);
    register(LegacyCodec.V11);
    register(LegacyCodec.V12);
    register(LegacyCodec.V13);
    register(V14Codec.INSTANCE);
    register(V15Codec.INSTANCE);
    register(V16Codec.INSTANCE);
  }

  private PayloadCodecs() {}

  private static void register(PayloadCodec<?> codec) {
    CODECS.put(codec.version(), codec);
  }

  /**
   * Returns the codec for a version. The cast is safe because each tree record reports the version
   * its codec is registered under.
   *
   * @param version the version
   * @return the codec
   */
  @SuppressWarnings("unchecked")
  public static PayloadCodec<RuntimeMetadata> forVersion(MetadataVersion version) {
    return (PayloadCodec<RuntimeMetadata>) CODECS.get(version);
  }
}
