package io.framemeta.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import io.framemeta.metadata.api.BadMagicException;
import io.framemeta.metadata.api.MalformedPayloadException;
import io.framemeta.metadata.api.MetadataException;
import io.framemeta.metadata.api.MetadataOptions;
import io.framemeta.metadata.api.MetadataVersion;
import io.framemeta.metadata.api.RuntimeMetadata;
import io.framemeta.metadata.api.RuntimeMetadataCodec;
import io.framemeta.metadata.api.RuntimeMetadataV10;
import io.framemeta.metadata.api.RuntimeMetadataV11;
import io.framemeta.metadata.api.RuntimeMetadataV12;
import io.framemeta.metadata.api.RuntimeMetadataV13;
import io.framemeta.metadata.api.RuntimeMetadataV14;
import io.framemeta.metadata.api.RuntimeMetadataV15;
import io.framemeta.metadata.api.RuntimeMetadataV16;
import io.framemeta.metadata.api.RuntimeMetadataV8;
import io.framemeta.metadata.api.RuntimeMetadataV9;
import io.framemeta.metadata.api.UnsupportedVersionException;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts metadata trees to and from a JSON document of the form {@code {"magic": "meta",
 * "version": "V14", "metadata": {...}}}.
 *
 * <p>Reading a document applies the same checks as decoding the binary form: the magic, the
 * version against the configured options, the structure of the tree and, when enabled, the type
 * reference closure of registry-backed versions.
 */
public final class MetadataJson {
  private static final Logger log = LoggerFactory.getLogger(MetadataJson.class);

  /** The value of the {@code magic} field. */
  public static final String MAGIC = "meta";

  private static final Map<MetadataVersion, Class<? extends RuntimeMetadata>> TREE_TYPES =
      new EnumMap<>(MetadataVersion.class);

  static {
    TREE_TYPES.put(MetadataVersion.V8, RuntimeMetadataV8.class);
    TREE_TYPES.put(MetadataVersion.V9, RuntimeMetadataV9.class);
    TREE_TYPES.put(MetadataVersion.V10, RuntimeMetadataV10.class);
    TREE_TYPES.put(MetadataVersion.V11, RuntimeMetadataV11.class);
    TREE_TYPES.put(MetadataVersion.V12, RuntimeMetadataV12.class);
    TREE_TYPES.put(MetadataVersion.V13, RuntimeMetadataV13.class);
    TREE_TYPES.put(MetadataVersion.V14, RuntimeMetadataV14.class);
    TREE_TYPES.put(MetadataVersion.V15, RuntimeMetadataV15.class);
    TREE_TYPES.put(MetadataVersion.V16, RuntimeMetadataV16.class);
  }

  private final MetadataOptions options;
  private final ObjectMapper mapper;

  public MetadataJson() {
    this(MetadataOptions.DEFAULT);
  }

  public MetadataJson(MetadataOptions options) {
    this.options = options;
    this.mapper =
        new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new MetadataJsonModule())
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS);
  }

  /** Returns the document tree for a metadata tree. */
  public JsonNode toTree(RuntimeMetadata metadata) {
    ObjectNode root = mapper.createObjectNode();
    root.put("magic", MAGIC);
    root.put("version", metadata.version().name());
    root.set("metadata", mapper.valueToTree(metadata));
    return root;
  }

  /** Returns the compact JSON text for a metadata tree. */
  public String toJson(RuntimeMetadata metadata) {
    return write(mapper.writer(), metadata);
  }

  /** Returns indented JSON text for a metadata tree. */
  public String toPrettyJson(RuntimeMetadata metadata) {
    return write(mapper.writerWithDefaultPrettyPrinter(), metadata);
  }

  private String write(ObjectWriter writer, RuntimeMetadata metadata) {
    try {
      return writer.writeValueAsString(toTree(metadata));
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Parses JSON text produced by {@link #toJson}.
   *
   * @param json the document text
   * @return the metadata tree
   * @throws BadMagicException if the magic field is missing or wrong
   * @throws UnsupportedVersionException if the version is unknown or disabled
   * @throws MalformedPayloadException if the text or the tree structure is invalid
   * @throws io.framemeta.metadata.api.DanglingTypeReferenceException if verification is on and a
   *     type id is missing
   */
  public RuntimeMetadata fromJson(String json) throws MetadataException {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new MalformedPayloadException(
          "Invalid JSON: " + e.getOriginalMessage(), null, -1, e);
    }
    return fromTree(root);
  }

  /**
   * Reads a document tree.
   *
   * @param root the document
   * @return the metadata tree
   * @throws MetadataException see {@link #fromJson}
   */
  public RuntimeMetadata fromTree(JsonNode root) throws MetadataException {
    if (root == null || !root.isObject()) {
      throw new MalformedPayloadException("Expected a JSON object", "document");
    }
    JsonNode magic = root.get("magic");
    if (magic == null || !magic.isTextual() || !MAGIC.equals(magic.textValue())) {
      throw BadMagicException.ofText(magic == null ? null : magic.asText());
    }
    MetadataVersion version = versionOf(root.get("version"));
    if (!options.isEnabled(version)) {
      log.warn("Metadata {} document found but disabled by options", version);
      throw UnsupportedVersionException.disabled(version);
    }
    JsonNode body = root.get("metadata");
    if (body == null || !body.isObject()) {
      throw new MalformedPayloadException("Missing metadata object", version, -1, null);
    }
    RuntimeMetadata metadata;
    try {
      metadata = mapper.treeToValue(body, TREE_TYPES.get(version));
    } catch (JsonProcessingException e) {
      throw new MalformedPayloadException(
          "Invalid " + version + " document: " + e.getOriginalMessage(), version, -1, e);
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException(
          "Invalid " + version + " document: " + e.getMessage(), version, -1, e);
    }
    log.debug("Read {} metadata document", version);
    if (options.verifyTypeReferences() && version.isRegistryBacked()) {
      RuntimeMetadataCodec.verifyTypeReferences(metadata);
    }
    return metadata;
  }

  private static MetadataVersion versionOf(JsonNode node) throws MetadataException {
    int tag;
    if (node != null && node.isInt()) {
      tag = node.intValue();
    } else if (node != null && node.isTextual() && node.textValue().matches("[Vv]\\d{1,3}")) {
      tag = Integer.parseInt(node.textValue().substring(1));
    } else {
      throw new MalformedPayloadException("Missing or invalid version field", "version");
    }
    return MetadataVersion.fromTag(tag).orElseThrow(() -> UnsupportedVersionException.unknown(tag));
  }
}
