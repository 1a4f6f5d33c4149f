package com.gu.contentapi.tagsearch.exceptions;

import lombok.Getter;

/**
 * Base class for errors reported by the Content API itself, as opposed to transport failures
 * which surface as {@link java.io.IOException}.
 */
@Getter
public abstract class ContentApiException extends Exception {

  private final int statusCode;
  private final String statusMessage;

  protected ContentApiException(int statusCode, String statusMessage) {
    super(
        statusMessage == null
            ? "HTTP " + statusCode
            : statusMessage + " (HTTP " + statusCode + ")");
    this.statusCode = statusCode;
    this.statusMessage = statusMessage;
  }
}
