package io.framemeta.metadata.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options controlling which versions are decoded and how strictly.
 *
 * <p>{@link #DEFAULT} takes its values from system properties when they are set:
 *
 * <ul>
 *   <li>{@code framemeta.versions}: enabled versions, e.g. {@code 8-16} or {@code 14,15,16}
 *   <li>{@code framemeta.verifyTypeReferences}: {@code true} or {@code false}
 *   <li>{@code framemeta.maxInputBytes}: the largest accepted input
 * </ul>
 *
 * @param enabledVersions versions that may be decoded and encoded
 * @param verifyTypeReferences whether decoded registry-backed trees are checked for dangling type
 *     ids
 * @param maxInputBytes the largest input accepted for decoding
 */
public record MetadataOptions(
    Set<MetadataVersion> enabledVersions, boolean verifyTypeReferences, long maxInputBytes) {
  private static final Logger log = LoggerFactory.getLogger(MetadataOptions.class);

  public static final String VERSIONS_PROPERTY = "framemeta.versions";
  public static final String VERIFY_PROPERTY = "framemeta.verifyTypeReferences";
  public static final String MAX_INPUT_PROPERTY = "framemeta.maxInputBytes";

  /** Default input limit, 64 MiB. */
  public static final long DEFAULT_MAX_INPUT_BYTES = 64L * 1024 * 1024;

  /**
   * Defaults, overridden by system properties read once at class initialization. Unparseable
   * properties are logged and ignored.
   */
  public static final MetadataOptions DEFAULT = propertiesOrDefaults();

  /** All versions, no type-reference verification. */
  public static final MetadataOptions LENIENT =
      new MetadataOptions(EnumSet.allOf(MetadataVersion.class), false, DEFAULT_MAX_INPUT_BYTES);

  /** Registry-backed versions only, with verification. */
  public static final MetadataOptions MODERN_ONLY =
      new MetadataOptions(
          EnumSet.of(MetadataVersion.V14, MetadataVersion.V15, MetadataVersion.V16),
          true,
          DEFAULT_MAX_INPUT_BYTES);

  public MetadataOptions {
    Objects.requireNonNull(enabledVersions, "enabledVersions");
    enabledVersions =
        Collections.unmodifiableSet(
            enabledVersions.isEmpty()
                ? EnumSet.noneOf(MetadataVersion.class)
                : EnumSet.copyOf(enabledVersions));
    if (maxInputBytes <= 0) {
      throw new IllegalArgumentException("maxInputBytes must be positive: " + maxInputBytes);
    }
  }

  /** Returns whether the version is enabled. */
  public boolean isEnabled(MetadataVersion version) {
    return enabledVersions.contains(version);
  }

  /**
   * Builds options from the {@code framemeta.*} system properties, using the defaults for any
   * property that is not set.
   *
   * @return the options
   * @throws IllegalArgumentException if a property value cannot be parsed
   */
  public static MetadataOptions fromProperties() {
    Builder b = builder();
    String versions = System.getProperty(VERSIONS_PROPERTY);
    if (versions != null) {
      b.enabledVersions(parseVersions(versions));
    }
    String verify = System.getProperty(VERIFY_PROPERTY);
    if (verify != null) {
      b.verifyTypeReferences(Boolean.parseBoolean(verify.trim()));
    }
    String max = System.getProperty(MAX_INPUT_PROPERTY);
    if (max != null) {
      try {
        b.maxInputBytes(Long.parseLong(max.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid " + MAX_INPUT_PROPERTY + ": " + max, e);
      }
    }
    return b.build();
  }

  static MetadataOptions propertiesOrDefaults() {
    try {
      return fromProperties();
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring framemeta.* system properties: {}", e.getMessage());
      return builder().build();
    }
  }

  /**
   * Parses a version list such as {@code 8-16}, {@code 14,15,16} or {@code V14,V16}.
   *
   * @param text the list
   * @return the versions
   * @throws IllegalArgumentException if an element is not a supported version
   */
  public static Set<MetadataVersion> parseVersions(String text) {
    Set<MetadataVersion> out = EnumSet.noneOf(MetadataVersion.class);
    for (String part : text.split(",")) {
      String p = part.trim();
      if (p.isEmpty()) {
        continue;
      }
      int dash = p.indexOf('-');
      if (dash > 0) {
        int from = parseTag(p.substring(0, dash));
        int to = parseTag(p.substring(dash + 1));
        for (int t = from; t <= to; t++) {
          out.add(toVersion(t));
        }
      } else {
        out.add(toVersion(parseTag(p)));
      }
    }
    return out;
  }

  private static int parseTag(String s) {
    String t = s.trim();
    if (t.startsWith("V") || t.startsWith("v")) {
      t = t.substring(1);
    }
    try {
      return Integer.parseInt(t);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid metadata version: " + s, e);
    }
  }

  private static MetadataVersion toVersion(int tag) {
    return MetadataVersion.fromTag(tag)
        .orElseThrow(() -> new IllegalArgumentException("Unsupported metadata version: " + tag));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized with these options. */
  public Builder toBuilder() {
    return new Builder()
        .enabledVersions(enabledVersions)
        .verifyTypeReferences(verifyTypeReferences)
        .maxInputBytes(maxInputBytes);
  }

  public static class Builder {
    private Set<MetadataVersion> enabledVersions = EnumSet.allOf(MetadataVersion.class);
    private boolean verifyTypeReferences = true;
    private long maxInputBytes = DEFAULT_MAX_INPUT_BYTES;

    public Builder enabledVersions(Set<MetadataVersion> versions) {
      this.enabledVersions = versions;
      return this;
    }

    public Builder verifyTypeReferences(boolean verify) {
      this.verifyTypeReferences = verify;
      return this;
    }

    public Builder maxInputBytes(long max) {
      this.maxInputBytes = max;
      return this;
    }

    public MetadataOptions build() {
      return new MetadataOptions(enabledVersions, verifyTypeReferences, maxInputBytes);
    }
  }
}
