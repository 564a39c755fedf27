package io.framemeta.metadata.types;

import io.framemeta.metadata.api.DanglingTypeReferenceException;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Arena of type descriptors indexed by {@link TypeId}.
 *
 * <p>Descriptors refer to each other only through ids, so recursive types are plain data and
 * lookups never expand anything. The registry keeps the declaration order of its entries, which
 * is also the encoding order.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class TypeRegistry {
  private static final TypeRegistry EMPTY = new TypeRegistry(List.of());

  /** Entries in declaration order. */
  private final List<RegisteredType> types;

  /** Map of ids to their descriptors. */
  private final Int2ObjectMap<TypeDescriptor> byId;

  private TypeRegistry(List<RegisteredType> types) {
    this.types = types;
    this.byId = new Int2ObjectOpenHashMap<>(types.size());
    for (RegisteredType t : types) {
      if (byId.put(t.id().id(), t.type()) != null) {
        throw new IllegalArgumentException("Duplicate type id " + t.id().id());
      }
    }
  }

  /** Returns the registry without any types. */
  public static TypeRegistry empty() {
    return EMPTY;
  }

  /**
   * Creates a registry from explicit entries. Ids need not be dense or sorted but must be unique.
   *
   * @param types the entries in declaration order
   * @return the registry
   * @throws IllegalArgumentException if an id occurs twice
   */
  public static TypeRegistry of(List<RegisteredType> types) {
    return types.isEmpty() ? EMPTY : new TypeRegistry(List.copyOf(types));
  }

  /** Returns a builder that assigns ids sequentially from 0. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns all entries in declaration order. */
  public List<RegisteredType> types() {
    return types;
  }

  public int size() {
    return types.size();
  }

  public boolean contains(TypeId id) {
    return byId.containsKey(id.id());
  }

  /**
   * Looks up a descriptor.
   *
   * @param id the type id
   * @return the descriptor, or empty when the id is not registered
   */
  public Optional<TypeDescriptor> find(TypeId id) {
    return Optional.ofNullable(byId.get(id.id()));
  }

  /**
   * Looks up a descriptor that must exist.
   *
   * @param id the type id
   * @return the descriptor
   * @throws DanglingTypeReferenceException if the id is not registered
   */
  public TypeDescriptor resolve(TypeId id) throws DanglingTypeReferenceException {
    return resolve(id, null);
  }

  /**
   * Looks up a descriptor that must exist, reporting {@code path} as the referring location.
   *
   * @param id the type id
   * @param path where the reference was found, may be null
   * @return the descriptor
   * @throws DanglingTypeReferenceException if the id is not registered
   */
  public TypeDescriptor resolve(TypeId id, String path) throws DanglingTypeReferenceException {
    TypeDescriptor d = byId.get(id.id());
    if (d == null) {
      throw new DanglingTypeReferenceException(id.id(), path);
    }
    return d;
  }

  /**
   * Checks that every id referenced by a descriptor (fields, elements, parameters) is itself
   * registered.
   *
   * @throws DanglingTypeReferenceException naming the first missing id
   */
  public void verifyClosure() throws DanglingTypeReferenceException {
    for (RegisteredType t : types) {
      String path = "types[" + t.id().id() + "]";
      for (TypeParameter p : t.type().typeParams()) {
        if (p.type().isPresent()) {
          resolve(p.type().get(), path + ".typeParams[" + p.name() + "]");
        }
      }
      for (TypeId ref : t.type().typeDef().references()) {
        resolve(ref, path + ".typeDef");
      }
    }
  }

  /**
   * Returns the first type whose path ends with the given segment.
   *
   * @param simpleName the last path segment
   * @return the matching id, or empty
   */
  public Optional<TypeId> findByName(String simpleName) {
    for (RegisteredType t : types) {
      if (t.type().simpleName().filter(simpleName::equals).isPresent()) {
        return Optional.of(t.id());
      }
    }
    return Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof TypeRegistry other && types.equals(other.types));
  }

  @Override
  public int hashCode() {
    return types.hashCode();
  }

  @Override
  public String toString() {
    return "TypeRegistry[" + types.size() + " types]";
  }

  /**
   * Assigns fresh sequential ids. Identical descriptors registered twice get two ids; nothing is
   * deduplicated.
   */
  public static final class Builder {
    private final List<TypeDescriptor> slots = new ArrayList<>();

    private Builder() {}

    /**
     * Registers a descriptor under the next free id.
     *
     * @param descriptor the descriptor
     * @return the new id
     */
    public TypeId register(TypeDescriptor descriptor) {
      slots.add(descriptor);
      return new TypeId(slots.size() - 1);
    }

    /** Shorthand for registering an anonymous definition. */
    public TypeId register(TypeDef def) {
      return register(TypeDescriptor.of(def));
    }

    /** Registers a primitive type. */
    public TypeId primitive(PrimitiveType primitive) {
      return register(new PrimitiveDef(primitive));
    }

    /**
     * Reserves an id whose descriptor is supplied later with {@link #define}, so that a type can
     * refer to itself.
     *
     * @return the reserved id
     */
    public TypeId reserve() {
      slots.add(null);
      return new TypeId(slots.size() - 1);
    }

    /**
     * Supplies the descriptor for a reserved id.
     *
     * @param id an id returned by {@link #reserve()}
     * @param descriptor the descriptor
     */
    public void define(TypeId id, TypeDescriptor descriptor) {
      if (id.id() >= slots.size() || slots.get(id.id()) != null) {
        throw new IllegalArgumentException("Type id " + id.id() + " was not reserved");
      }
      slots.set(id.id(), descriptor);
    }

    /**
     * Builds the registry.
     *
     * @return the registry
     * @throws IllegalStateException if a reserved id was never defined
     */
    public TypeRegistry build() {
      List<RegisteredType> out = new ArrayList<>(slots.size());
      for (int i = 0; i < slots.size(); i++) {
        TypeDescriptor d = slots.get(i);
        if (d == null) {
          throw new IllegalStateException("Reserved type id " + i + " was never defined");
        }
        out.add(new RegisteredType(new TypeId(i), d));
      }
      return of(Collections.unmodifiableList(out));
    }
  }
}
