package io.framemeta.metadata.legacy;

import io.framemeta.metadata.common.StorageHasher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A storage map, with the Map, DoubleMap and NMap wire variants unified into one ordered key list.
 * Hasher order is exactly the order on the wire; for a DoubleMap the first key's hasher comes
 * first even though the wire stores the second hasher last.
 *
 * @param keys the keys with their hashers, in order
 * @param valueType the value type name
 * @param shape the wire variant, retained so the entry re-encodes bit-exactly
 * @param unused the historical {@code is_linked} flag of single-key maps; false for other shapes
 */
public record MapStorage(List<StorageKey> keys, String valueType, MapShape shape, boolean unused)
    implements StorageEntryType {
  public MapStorage {
    keys = List.copyOf(keys);
    Objects.requireNonNull(valueType, "valueType");
    Objects.requireNonNull(shape, "shape");
    switch (shape) {
      case MAP -> requireKeys(keys, 1, shape);
      case DOUBLE_MAP -> requireKeys(keys, 2, shape);
      case N_MAP -> {}
    }
    if (unused && shape != MapShape.MAP) {
      throw new IllegalArgumentException("Only single-key maps carry the linked flag");
    }
  }

  private static void requireKeys(List<StorageKey> keys, int n, MapShape shape) {
    if (keys.size() != n) {
      throw new IllegalArgumentException(shape + " needs " + n + " keys, got " + keys.size());
    }
  }

  public static MapStorage map(StorageHasher hasher, String key, String value) {
    return new MapStorage(List.of(new StorageKey(hasher, key)), value, MapShape.MAP, false);
  }

  public static MapStorage doubleMap(
      StorageHasher hasher1, String key1, StorageHasher hasher2, String key2, String value) {
    return new MapStorage(
        List.of(new StorageKey(hasher1, key1), new StorageKey(hasher2, key2)),
        value,
        MapShape.DOUBLE_MAP,
        false);
  }

  public static MapStorage nMap(List<StorageKey> keys, String value) {
    return new MapStorage(keys, value, MapShape.N_MAP, false);
  }

  /** Returns the hashers in key order. */
  public List<StorageHasher> hashers() {
    List<StorageHasher> out = new ArrayList<>(keys.size());
    for (StorageKey k : keys) {
      out.add(k.hasher());
    }
    return out;
  }
}
