package io.framemeta.metadata.api;

/**
 * Base exception for all runtime metadata decoding, verification and conversion errors. Carries a
 * context string (a field path, an offset, a version) and a stable error code.
 */
public class MetadataException extends Exception {
  /** Where in the input or the tree the error was detected. */
  private final String context;

  /** Stable identifier of the error kind. */
  private final String errorCode;

  /**
   * Constructs a new MetadataException with the specified message, context, and error code.
   *
   * @param message the detail message
   * @param context the context information
   * @param errorCode the error code
   */
  public MetadataException(String message, String context, String errorCode) {
    this(message, null, context, errorCode);
  }

  /**
   * Constructs a new MetadataException with the specified message, cause, context, and error code.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   * @param context the context information
   * @param errorCode the error code
   */
  public MetadataException(String message, Throwable cause, String context, String errorCode) {
    super(formatMessage(message, context, errorCode), cause);
    this.context = context;
    this.errorCode = errorCode;
  }

  private static String formatMessage(String message, String context, String errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode).append("]");
    }
    return sb.toString();
  }

  /**
   * Gets the context information for this exception.
   *
   * @return the context information, or null if none
   */
  public String getContext() {
    return context;
  }

  /**
   * Gets the error code for this exception.
   *
   * @return the error code, or null if none
   */
  public String getErrorCode() {
    return errorCode;
  }
}
