package com.gu.contentapi.tagsearch.exceptions;

/**
 * The API rejected the request because the supplied key is unknown or inactive. Callers can
 * recover by supplying a valid key; the request is never retried automatically.
 */
public class InvalidApiKeyException extends ContentApiException {

  public InvalidApiKeyException(int statusCode, String statusMessage) {
    super(statusCode, statusMessage);
  }
}
