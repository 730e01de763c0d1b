package com.voltradar.exporter.teslafi;

/**
 * Raised when a TeslaFi feed call does not yield a usable snapshot.
 *
 * <p>Never retried locally: it aborts the scrape that triggered the call.
 */
public class TeslaFiApiException extends RuntimeException {
  public enum Kind {
    /** Non-2xx status, I/O failure or interrupted call. */
    TRANSPORT,
    /** The feed answered with its own {@code {"response": {"result": ...}}} error envelope. */
    UPSTREAM_REJECTED,
    /** The body is not a JSON object. */
    INVALID_RESPONSE
  }

  private final Kind kind;
  private final String detail;

  public TeslaFiApiException(Kind kind, String detail) {
    super(kind + ": " + detail);
    this.kind = kind;
    this.detail = detail;
  }

  public TeslaFiApiException(Kind kind, String detail, Throwable cause) {
    super(kind + ": " + detail, cause);
    this.kind = kind;
    this.detail = detail;
  }

  public Kind getKind() {
    return kind;
  }

  public String getDetail() {
    return detail;
  }
}
