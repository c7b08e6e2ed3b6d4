package com.scholary.captions.error;

/**
 * Base class for every failure that aborts a captioning request.
 *
 * <p>These are runtime exceptions: a failed request cannot be repaired by the caller further down
 * the pipeline, so they travel straight up to the orchestrator, which turns them into a single
 * {@link CaptionError}.
 */
public abstract class CaptionException extends RuntimeException {

  private final ErrorKind kind;

  protected CaptionException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected CaptionException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** Structured form of this failure as reported to the caller. */
  public CaptionError toError() {
    return CaptionError.of(kind, getMessage());
  }
}
