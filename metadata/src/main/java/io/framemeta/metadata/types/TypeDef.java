package io.framemeta.metadata.types;

import java.util.List;

/** The shape of a registered type. */
public sealed interface TypeDef
    permits CompositeDef,
        VariantDef,
        SequenceDef,
        ArrayDef,
        TupleDef,
        PrimitiveDef,
        CompactDef,
        BitSequenceDef {

  /** Returns every type id this definition refers to directly, in declaration order. */
  List<TypeId> references();
}
