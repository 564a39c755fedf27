package io.framemeta.metadata.v16;

import io.framemeta.metadata.types.TypeId;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The V16 extrinsic format.
 *
 * @param versions the supported extrinsic format versions
 * @param addressType the address type
 * @param signatureType the signature type
 * @param transactionExtensionsByVersion for each extension version, the indices into {@code
 *     transactionExtensions} in use
 * @param transactionExtensions all transaction extensions
 */
public record ExtrinsicMetadata(
    List<Integer> versions,
    TypeId addressType,
    TypeId signatureType,
    SortedMap<Integer, List<Long>> transactionExtensionsByVersion,
    List<TransactionExtensionMetadata> transactionExtensions) {
  public ExtrinsicMetadata {
    versions = List.copyOf(versions);
    for (int v : versions) {
      checkByte(v, "Extrinsic version");
    }
    Objects.requireNonNull(addressType, "addressType");
    Objects.requireNonNull(signatureType, "signatureType");
    TreeMap<Integer, List<Long>> byVersion = new TreeMap<>();
    for (Map.Entry<Integer, List<Long>> e : transactionExtensionsByVersion.entrySet()) {
      checkByte(e.getKey(), "Transaction extension version");
      for (long idx : e.getValue()) {
        if (idx < 0 || idx > 0xFFFF_FFFFL) {
          throw new IllegalArgumentException("Extension index out of u32 range: " + idx);
        }
      }
      byVersion.put(e.getKey(), List.copyOf(e.getValue()));
    }
    transactionExtensionsByVersion = Collections.unmodifiableSortedMap(byVersion);
    transactionExtensions = List.copyOf(transactionExtensions);
  }

  private static void checkByte(int v, String what) {
    if (v < 0 || v > 0xFF) {
      throw new IllegalArgumentException(what + " out of u8 range: " + v);
    }
  }
}
