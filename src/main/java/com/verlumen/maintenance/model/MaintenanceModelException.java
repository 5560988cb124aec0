package com.verlumen.maintenance.model;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Raised when a transition matrix, cost model, policy or run configuration is rejected at the
 * boundary of a public operation. The {@link ErrorKind} tells callers which input was at fault.
 */
public final class MaintenanceModelException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  public MaintenanceModelException(ErrorKind kind, String message) {
    super(kind.defaultMessage() + ": " + message);
    this.kind = checkNotNull(kind);
  }

  public MaintenanceModelException(ErrorKind kind, String message, Throwable cause) {
    super(kind.defaultMessage() + ": " + message, cause);
    this.kind = checkNotNull(kind);
  }

  public ErrorKind kind() {
    return kind;
  }

  /** Throws a {@link MaintenanceModelException} of {@code kind} unless {@code condition} holds. */
  public static void check(boolean condition, ErrorKind kind, String format, Object... args) {
    if (!condition) {
      throw new MaintenanceModelException(kind, String.format(format, args));
    }
  }
}
