package io.framemeta.metadata.types;

/**
 * Handle of a type inside one {@link TypeRegistry}. Meaningless outside the registry that issued
 * it.
 *
 * @param id the non-negative registry index
 */
public record TypeId(int id) implements Comparable<TypeId> {
  public TypeId {
    if (id < 0) {
      throw new IllegalArgumentException("Type id must be non-negative: " + id);
    }
  }

  public static TypeId of(int id) {
    return new TypeId(id);
  }

  @Override
  public int compareTo(TypeId o) {
    return Integer.compare(id, o.id);
  }

  @Override
  public String toString() {
    return "#" + id;
  }
}
