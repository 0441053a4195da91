package com.acme.shove.resolve;

/** An order's project or command could not be mapped to an invocation. */
public class ResolutionException extends Exception {

  public enum Kind {
    UNKNOWN_PROJECT,
    MANIFEST_UNREADABLE,
    UNKNOWN_COMMAND
  }

  private final Kind kind;

  public ResolutionException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ResolutionException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
