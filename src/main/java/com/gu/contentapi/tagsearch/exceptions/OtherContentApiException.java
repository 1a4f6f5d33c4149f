package com.gu.contentapi.tagsearch.exceptions;

/**
 * Any non-2xx response that is not an invalid key, or a 2xx response whose body could not be
 * decoded.
 */
public class OtherContentApiException extends ContentApiException {

  /** Status code used for client-side parse failures. Never a real HTTP status. */
  public static final int PARSE_ERROR_CODE = -1;

  public static final String PARSE_ERROR_MESSAGE = "Parse Error";

  public OtherContentApiException(int statusCode, String statusMessage) {
    super(statusCode, statusMessage);
  }

  public static OtherContentApiException parseError() {
    return new OtherContentApiException(PARSE_ERROR_CODE, PARSE_ERROR_MESSAGE);
  }

  public boolean isParseError() {
    return getStatusCode() == PARSE_ERROR_CODE;
  }
}
