package io.framemeta.metadata.v15;

import io.framemeta.metadata.types.TypeId;
import java.util.Objects;

/**
 * The runtime-wide enums aggregating every pallet's calls, events and errors.
 *
 * @param callEnumType the aggregate call enum
 * @param eventEnumType the aggregate event enum
 * @param errorEnumType the aggregate error enum
 */
public record OuterEnums(TypeId callEnumType, TypeId eventEnumType, TypeId errorEnumType) {
  public OuterEnums {
    Objects.requireNonNull(callEnumType, "callEnumType");
    Objects.requireNonNull(eventEnumType, "eventEnumType");
    Objects.requireNonNull(errorEnumType, "errorEnumType");
  }
}
