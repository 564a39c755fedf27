package io.framemeta.metadata.types;

import static org.junit.jupiter.api.Assertions.*;

import io.framemeta.metadata.fixtures.MetadataFixtures;
import org.junit.jupiter.api.Test;

public class TypeNamesTest {
  private final MetadataFixtures.Types t = MetadataFixtures.registry();

  private String name(TypeId id) {
    return TypeNames.display(t.registry(), id);
  }

  @Test
  void rendersStructuralTypes() {
    assertEquals("u128", name(t.u128()));
    assertEquals("Vec<u8>", name(t.bytes()));
    assertEquals("(AccountId32, u32)", name(t.accountAndIndex()));
    assertEquals("Compact<u128>", name(t.compactBalance()));
    assertEquals("BitVec<Lsb0, u8>", name(t.bits()));
    assertEquals("()", name(t.unit()));
  }

  @Test
  void rendersNamedTypesWithParameters() {
    assertEquals("AccountId32", name(t.accountId()));
    assertEquals(
        "UncheckedExtrinsic<AccountId32, RuntimeCall, Vec<u8>, ()>", name(t.extrinsic()));
  }

  @Test
  void stopsAtCycles() {
    assertEquals("Tree", name(t.tree()));
    TypeRegistry.Builder b = TypeRegistry.builder();
    TypeId self = b.reserve();
    b.define(self, TypeDescriptor.of(new SequenceDef(self)));
    assertEquals("Vec<...#0>", TypeNames.display(b.build(), self));
  }

  @Test
  void rendersMissingIds() {
    assertEquals("<missing #77>", name(TypeId.of(77)));
    TypeRegistry.Builder b = TypeRegistry.builder();
    TypeId arr = b.register(new ArrayDef(4, TypeId.of(9)));
    assertEquals("[<missing #9>; 4]", TypeNames.display(b.build(), arr));
  }
}
