package com.gu.contentapi.tagsearch.exceptions;

/**
 * Runtime exception signalling that a response body does not match the expected schema. Raised
 * while walking the JSON tree and converted into an empty decode result by the decoder.
 */
public class ContentApiDecodingException extends RuntimeException {

  public ContentApiDecodingException(String message) {
    super(message);
  }

  public ContentApiDecodingException(String message, Throwable cause) {
    super(message, cause);
  }
}
