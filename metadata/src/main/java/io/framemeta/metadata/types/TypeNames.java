package io.framemeta.metadata.types;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/** Renders short, human-readable names for registered types. */
public final class TypeNames {
  private static final int MAX_DEPTH = 16;

  private TypeNames() {}

  /**
   * Renders the name of a type, e.g. {@code u128}, {@code Vec<u8>}, {@code [u8; 32]} or {@code
   * Option<AccountId32>}. Named types render as their last path segment with generic parameters;
   * recursive references render as the bare name once a cycle is detected. Absent ids render as
   * {@code <missing #id>}.
   *
   * @param registry the registry the id belongs to
   * @param id the type id
   * @return the display name
   */
  public static String display(TypeRegistry registry, TypeId id) {
    return display(registry, id, new HashSet<>(), 0);
  }

  private static String display(TypeRegistry registry, TypeId id, Set<TypeId> active, int depth) {
    Optional<TypeDescriptor> found = registry.find(id);
    if (found.isEmpty()) {
      return "<missing " + id + ">";
    }
    TypeDescriptor d = found.get();
    if (!active.add(id) || depth > MAX_DEPTH) {
      return d.simpleName().orElse("..." + id);
    }
    try {
      if (d.simpleName().isPresent()) {
        return withParams(registry, d, active, depth);
      }
      return structural(registry, d.typeDef(), active, depth);
    } finally {
      active.remove(id);
    }
  }

  private static String withParams(
      TypeRegistry registry, TypeDescriptor d, Set<TypeId> active, int depth) {
    String name = d.simpleName().orElseThrow();
    if (d.typeParams().isEmpty()) {
      return name;
    }
    StringJoiner params = new StringJoiner(", ", name + "<", ">");
    for (TypeParameter p : d.typeParams()) {
      params.add(
          p.type().isPresent() ? display(registry, p.type().get(), active, depth + 1) : p.name());
    }
    return params.toString();
  }

  private static String structural(
      TypeRegistry registry, TypeDef def, Set<TypeId> active, int depth) {
    if (def instanceof PrimitiveDef p) {
      return p.primitive().displayName();
    }
    if (def instanceof SequenceDef s) {
      return "Vec<" + display(registry, s.elementType(), active, depth + 1) + ">";
    }
    if (def instanceof ArrayDef a) {
      return "[" + display(registry, a.elementType(), active, depth + 1) + "; " + a.length() + "]";
    }
    if (def instanceof TupleDef t) {
      StringJoiner j = new StringJoiner(", ", "(", ")");
      for (TypeId f : t.fields()) {
        j.add(display(registry, f, active, depth + 1));
      }
      return j.toString();
    }
    if (def instanceof CompactDef c) {
      return "Compact<" + display(registry, c.wrappedType(), active, depth + 1) + ">";
    }
    if (def instanceof BitSequenceDef b) {
      return "BitVec<"
          + display(registry, b.bitOrderType(), active, depth + 1)
          + ", "
          + display(registry, b.bitStoreType(), active, depth + 1)
          + ">";
    }
    if (def instanceof CompositeDef c) {
      return "{" + c.fields().size() + " fields}";
    }
    return "enum{" + ((VariantDef) def).variants().size() + " variants}";
  }
}
