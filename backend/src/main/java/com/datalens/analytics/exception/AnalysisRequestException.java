package com.datalens.analytics.exception;

/**
 * The analytics engine could not produce a summary. The message is the engine's response body,
 * or a generic message when the body was empty. Not retried.
 */
public class AnalysisRequestException extends RuntimeException {

  public static final String DEFAULT_MESSAGE = "Failed to generate analytics.";

  private final Integer upstreamStatus;

  public AnalysisRequestException(Integer upstreamStatus, String responseBody) {
    super(responseBody == null || responseBody.isBlank() ? DEFAULT_MESSAGE : responseBody);
    this.upstreamStatus = upstreamStatus;
  }

  public AnalysisRequestException(String message, Throwable cause) {
    super(message == null || message.isBlank() ? DEFAULT_MESSAGE : message, cause);
    this.upstreamStatus = null;
  }

  /** HTTP status returned by the engine, or {@code null} when no response was received. */
  public Integer getUpstreamStatus() {
    return upstreamStatus;
  }
}
