package io.framemeta.metadata.types;

/** Primitive types, in wire order. */
public enum PrimitiveType {
  BOOL("bool"),
  CHAR("char"),
  STR("str"),
  U8("u8"),
  U16("u16"),
  U32("u32"),
  U64("u64"),
  U128("u128"),
  U256("u256"),
  I8("i8"),
  I16("i16"),
  I32("i32"),
  I64("i64"),
  I128("i128"),
  I256("i256");

  private final String displayName;

  PrimitiveType(String displayName) {
    this.displayName = displayName;
  }

  /** Returns the name as written in source, e.g. {@code u128}. */
  public String displayName() {
    return displayName;
  }
}
