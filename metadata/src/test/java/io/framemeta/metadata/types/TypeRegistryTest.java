package io.framemeta.metadata.types;

import static org.junit.jupiter.api.Assertions.*;

import io.framemeta.metadata.api.DanglingTypeReferenceException;
import io.framemeta.metadata.fixtures.MetadataFixtures;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class TypeRegistryTest {

  @Test
  void builderAssignsSequentialIds() throws Exception {
    TypeRegistry.Builder b = TypeRegistry.builder();
    assertEquals(TypeId.of(0), b.primitive(PrimitiveType.BOOL));
    assertEquals(TypeId.of(1), b.primitive(PrimitiveType.BOOL));
    TypeRegistry registry = b.build();
    assertEquals(2, registry.size());
    assertEquals(registry.resolve(TypeId.of(0)), registry.resolve(TypeId.of(1)));
  }

  @Test
  void reservedIdsAllowRecursion() throws Exception {
    MetadataFixtures.Types t = MetadataFixtures.registry();
    TypeDescriptor tree = t.registry().resolve(t.tree());
    CompositeDef def = assertInstanceOf(CompositeDef.class, tree.typeDef());
    TypeDescriptor children = t.registry().resolve(def.fields().get(0).type());
    assertEquals(new SequenceDef(t.tree()), children.typeDef());
    t.registry().verifyClosure();
  }

  @Test
  void undefinedReservationFailsBuild() {
    TypeRegistry.Builder b = TypeRegistry.builder();
    b.reserve();
    assertThrows(IllegalStateException.class, b::build);
  }

  @Test
  void defineRequiresReservation() {
    TypeRegistry.Builder b = TypeRegistry.builder();
    TypeId u8 = b.primitive(PrimitiveType.U8);
    assertThrows(
        IllegalArgumentException.class,
        () -> b.define(u8, TypeDescriptor.of(new PrimitiveDef(PrimitiveType.U16))));
    assertThrows(
        IllegalArgumentException.class,
        () -> b.define(TypeId.of(5), TypeDescriptor.of(new PrimitiveDef(PrimitiveType.U16))));
  }

  @Test
  void rejectsDuplicateIds() {
    RegisteredType a =
        new RegisteredType(TypeId.of(3), TypeDescriptor.of(new PrimitiveDef(PrimitiveType.U8)));
    assertThrows(IllegalArgumentException.class, () -> TypeRegistry.of(List.of(a, a)));
  }

  @Test
  void sparseIdsAreAllowed() throws Exception {
    TypeRegistry registry =
        TypeRegistry.of(
            List.of(
                new RegisteredType(TypeId.of(10), TypeDescriptor.of(new SequenceDef(TypeId.of(2)))),
                new RegisteredType(
                    TypeId.of(2), TypeDescriptor.of(new PrimitiveDef(PrimitiveType.U8)))));
    assertTrue(registry.contains(TypeId.of(10)));
    assertFalse(registry.contains(TypeId.of(0)));
    assertEquals(TypeId.of(10), registry.types().get(0).id());
    registry.verifyClosure();
  }

  @Test
  void resolveReportsPath() {
    DanglingTypeReferenceException e =
        assertThrows(
            DanglingTypeReferenceException.class,
            () -> TypeRegistry.empty().resolve(TypeId.of(4), "somewhere"));
    assertEquals(4, e.getTypeId());
    assertEquals("somewhere", e.getPath());
  }

  @Test
  void closureChecksTypeParameters() {
    TypeRegistry registry =
        TypeRegistry.of(
            List.of(
                new RegisteredType(
                    TypeId.of(0),
                    new TypeDescriptor(
                        List.of("Option"),
                        List.of(TypeParameter.of("T", TypeId.of(9))),
                        CompositeDef.of(),
                        List.of()))));
    DanglingTypeReferenceException e =
        assertThrows(DanglingTypeReferenceException.class, registry::verifyClosure);
    assertEquals("types[0].typeParams[T]", e.getPath());
  }

  @Test
  void findsTypesBySimpleName() {
    MetadataFixtures.Types t = MetadataFixtures.registry();
    assertEquals(Optional.of(t.event()), t.registry().findByName("RuntimeEvent"));
    assertEquals(Optional.of(t.accountId()), t.registry().findByName("AccountId32"));
    assertTrue(t.registry().findByName("crypto").isEmpty());
  }

  @Test
  void typeParamLookup() {
    MetadataFixtures.Types t = MetadataFixtures.registry();
    TypeDescriptor extrinsic = t.registry().find(t.extrinsic()).orElseThrow();
    assertEquals(Optional.of(t.call()), extrinsic.typeParam("Call"));
    assertTrue(extrinsic.typeParam("Missing").isEmpty());
  }

  @Test
  void variantIndicesAreLookupKeys() {
    VariantDef def =
        VariantDef.of(Variant.of("A", 0), Variant.of("B", 5), Variant.of("C", 255));
    assertEquals("B", def.byIndex(5).orElseThrow().name());
    assertTrue(def.byIndex(1).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> Variant.of("D", 256));
  }

  @Test
  void referencesFollowDefinitions() {
    assertEquals(
        List.of(TypeId.of(1), TypeId.of(2)),
        new BitSequenceDef(TypeId.of(1), TypeId.of(2)).references());
    assertEquals(List.of(), new PrimitiveDef(PrimitiveType.STR).references());
    assertEquals(
        List.of(TypeId.of(3), TypeId.of(3)),
        VariantDef.of(
                Variant.of("A", 0, Field.unnamed(TypeId.of(3))),
                Variant.of("B", 1, Field.unnamed(TypeId.of(3))))
            .references());
    assertThrows(IllegalArgumentException.class, () -> TypeId.of(-1));
  }
}
