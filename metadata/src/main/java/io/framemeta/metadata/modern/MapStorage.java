package io.framemeta.metadata.modern;

import io.framemeta.metadata.api.DanglingTypeReferenceException;
import io.framemeta.metadata.api.MalformedPayloadException;
import io.framemeta.metadata.api.MetadataException;
import io.framemeta.metadata.common.StorageHasher;
import io.framemeta.metadata.types.TupleDef;
import io.framemeta.metadata.types.TypeDef;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A storage map. A map with one hasher is keyed by {@code keyType} directly; a map with several
 * hashers is keyed by a tuple type whose fields pair up with the hashers in order.
 *
 * @param hashers the key hashers, in order
 * @param keyType the key type, a tuple when there is more than one hasher
 * @param valueType the value type
 */
public record MapStorage(List<StorageHasher> hashers, TypeId keyType, TypeId valueType)
    implements StorageEntryType {
  public MapStorage {
    hashers = List.copyOf(hashers);
    Objects.requireNonNull(keyType, "keyType");
    Objects.requireNonNull(valueType, "valueType");
  }

  /**
   * Expands the key type into one (hasher, key type) pair per hasher.
   *
   * @param registry the registry of the tree this entry belongs to
   * @return the keys, in hasher order
   * @throws DanglingTypeReferenceException if the key type is not registered
   * @throws MalformedPayloadException if a multi-hasher key is not a tuple of matching arity
   */
  public List<StorageKey> keys(TypeRegistry registry) throws MetadataException {
    if (hashers.size() == 1) {
      return List.of(new StorageKey(hashers.get(0), keyType));
    }
    TypeDef def = registry.resolve(keyType, "storage key").typeDef();
    if (!(def instanceof TupleDef tuple) || tuple.fields().size() != hashers.size()) {
      throw new MalformedPayloadException(
          "Storage key " + keyType + " is not a tuple of " + hashers.size() + " types",
          "storage key");
    }
    List<StorageKey> out = new ArrayList<>(hashers.size());
    for (int i = 0; i < hashers.size(); i++) {
      out.add(new StorageKey(hashers.get(i), tuple.fields().get(i)));
    }
    return out;
  }
}
