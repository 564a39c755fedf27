package io.framemeta.json;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.framemeta.codec.Bytes;
import io.framemeta.metadata.legacy.MapStorage;
import io.framemeta.metadata.legacy.PlainStorage;
import io.framemeta.metadata.legacy.StorageEntryType;
import io.framemeta.metadata.types.ArrayDef;
import io.framemeta.metadata.types.BitSequenceDef;
import io.framemeta.metadata.types.CompactDef;
import io.framemeta.metadata.types.CompositeDef;
import io.framemeta.metadata.types.PrimitiveDef;
import io.framemeta.metadata.types.RegisteredType;
import io.framemeta.metadata.types.SequenceDef;
import io.framemeta.metadata.types.TupleDef;
import io.framemeta.metadata.types.TypeDef;
import io.framemeta.metadata.types.TypeId;
import io.framemeta.metadata.types.TypeRegistry;
import io.framemeta.metadata.types.VariantDef;
import io.framemeta.metadata.v16.DeprecationInfo;
import io.framemeta.metadata.v16.DeprecationStatus;
import java.io.IOException;
import java.util.List;

/**
 * Jackson bindings for the metadata model: hex strings for raw bytes, plain numbers for type ids,
 * an array of {@code {id, type}} entries for registries and a {@code kind} discriminator on every
 * sealed hierarchy.
 */
final class MetadataJsonModule extends SimpleModule {
  private static final long serialVersionUID = 1L;

  MetadataJsonModule() {
    super("framemeta");
    addSerializer(Bytes.class, new BytesSerializer());
    addDeserializer(Bytes.class, new BytesDeserializer());
    addSerializer(TypeId.class, new TypeIdSerializer());
    addDeserializer(TypeId.class, new TypeIdDeserializer());
    addSerializer(TypeRegistry.class, new RegistrySerializer());
    addDeserializer(TypeRegistry.class, new RegistryDeserializer());

    setMixInAnnotation(TypeDef.class, TypeDefMixin.class);
    setMixInAnnotation(StorageEntryType.class, LegacyStorageMixin.class);
    setMixInAnnotation(
        io.framemeta.metadata.modern.StorageEntryType.class, ModernStorageMixin.class);
    setMixInAnnotation(DeprecationStatus.class, DeprecationStatusMixin.class);
    setMixInAnnotation(DeprecationInfo.class, DeprecationInfoMixin.class);
  }

  // mixins

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = CompositeDef.class, name = "composite"),
    @JsonSubTypes.Type(value = VariantDef.class, name = "variant"),
    @JsonSubTypes.Type(value = SequenceDef.class, name = "sequence"),
    @JsonSubTypes.Type(value = ArrayDef.class, name = "array"),
    @JsonSubTypes.Type(value = TupleDef.class, name = "tuple"),
    @JsonSubTypes.Type(value = PrimitiveDef.class, name = "primitive"),
    @JsonSubTypes.Type(value = CompactDef.class, name = "compact"),
    @JsonSubTypes.Type(value = BitSequenceDef.class, name = "bitSequence")
  })
  interface TypeDefMixin {}

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = PlainStorage.class, name = "plain"),
    @JsonSubTypes.Type(value = MapStorage.class, name = "map")
  })
  interface LegacyStorageMixin {}

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = io.framemeta.metadata.modern.PlainStorage.class, name = "plain"),
    @JsonSubTypes.Type(value = io.framemeta.metadata.modern.MapStorage.class, name = "map")
  })
  interface ModernStorageMixin {}

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = DeprecationStatus.NotDeprecated.class, name = "notDeprecated"),
    @JsonSubTypes.Type(
        value = DeprecationStatus.DeprecatedWithoutNote.class,
        name = "deprecatedWithoutNote"),
    @JsonSubTypes.Type(value = DeprecationStatus.Deprecated.class, name = "deprecated")
  })
  interface DeprecationStatusMixin {}

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = DeprecationInfo.NotDeprecated.class, name = "notDeprecated"),
    @JsonSubTypes.Type(value = DeprecationInfo.ItemDeprecated.class, name = "itemDeprecated"),
    @JsonSubTypes.Type(
        value = DeprecationInfo.VariantsDeprecated.class,
        name = "variantsDeprecated")
  })
  interface DeprecationInfoMixin {}

  // value types

  static final class BytesSerializer extends JsonSerializer<Bytes> {
    @Override
    public void serialize(Bytes value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      gen.writeString(value.toHex());
    }
  }

  static final class BytesDeserializer extends JsonDeserializer<Bytes> {
    @Override
    public Bytes deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      if (!p.hasToken(JsonToken.VALUE_STRING)) {
        return (Bytes) ctxt.handleUnexpectedToken(Bytes.class, p);
      }
      String text = p.getText();
      if (!text.startsWith("0x")) {
        throw ctxt.weirdStringException(text, Bytes.class, "expected 0x-prefixed hex");
      }
      try {
        return Bytes.fromHex(text);
      } catch (IllegalArgumentException e) {
        throw ctxt.weirdStringException(text, Bytes.class, e.getMessage());
      }
    }
  }

  static final class TypeIdSerializer extends JsonSerializer<TypeId> {
    @Override
    public void serialize(TypeId value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      gen.writeNumber(value.id());
    }
  }

  static final class TypeIdDeserializer extends JsonDeserializer<TypeId> {
    @Override
    public TypeId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      if (!p.hasToken(JsonToken.VALUE_NUMBER_INT)
          || p.getNumberType() != JsonParser.NumberType.INT) {
        return (TypeId) ctxt.handleUnexpectedToken(TypeId.class, p);
      }
      int id = p.getIntValue();
      if (id < 0) {
        throw ctxt.weirdNumberException(id, TypeId.class, "type ids are non-negative");
      }
      return new TypeId(id);
    }
  }

  static final class RegistrySerializer extends JsonSerializer<TypeRegistry> {
    @Override
    public void serialize(TypeRegistry value, JsonGenerator gen, SerializerProvider serializers)
        throws IOException {
      serializers.defaultSerializeValue(value.types(), gen);
    }
  }

  static final class RegistryDeserializer extends JsonDeserializer<TypeRegistry> {
    @Override
    public TypeRegistry deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JavaType listType =
          ctxt.getTypeFactory().constructCollectionType(List.class, RegisteredType.class);
      List<RegisteredType> types = ctxt.readValue(p, listType);
      if (types.contains(null)) {
        throw JsonMappingException.from(p, "null entry in type registry");
      }
      try {
        return TypeRegistry.of(types);
      } catch (IllegalArgumentException e) {
        throw JsonMappingException.from(p, e.getMessage(), e);
      }
    }
  }
}
