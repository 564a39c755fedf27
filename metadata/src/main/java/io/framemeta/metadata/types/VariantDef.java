package io.framemeta.metadata.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** An enum with ordered, explicitly indexed variants. */
public record VariantDef(List<Variant> variants) implements TypeDef {
  public VariantDef {
    variants = List.copyOf(variants);
  }

  public static VariantDef of(Variant... variants) {
    return new VariantDef(List.of(variants));
  }

  /** Finds a variant by its discriminant byte. */
  public Optional<Variant> byIndex(int index) {
    return variants.stream().filter(v -> v.index() == index).findFirst();
  }

  @Override
  public List<TypeId> references() {
    List<TypeId> out = new ArrayList<>();
    for (Variant v : variants) {
      for (Field f : v.fields()) {
        out.add(f.type());
      }
    }
    return out;
  }
}
