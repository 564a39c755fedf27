package io.framemeta.metadata.api;

/** Thrown when a type id is referenced but absent from the accompanying type registry. */
public class DanglingTypeReferenceException extends MetadataException {
  public static final String ERROR_CODE = "DANGLING_TYPE_REFERENCE";

  private final int typeId;
  private final String path;

  public DanglingTypeReferenceException(int typeId, String path) {
    super("Type id " + typeId + " is not in the registry", path, ERROR_CODE);
    this.typeId = typeId;
    this.path = path;
  }

  /** Returns the missing type id. */
  public int getTypeId() {
    return typeId;
  }

  /** Returns the field path of the reference, or null when looked up directly. */
  public String getPath() {
    return path;
  }
}
