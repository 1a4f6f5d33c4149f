package com.gu.contentapi.tagsearch.client;

import com.gu.contentapi.tagsearch.exceptions.ContentApiException;
import com.gu.contentapi.tagsearch.exceptions.InvalidApiKeyException;
import com.gu.contentapi.tagsearch.exceptions.OtherContentApiException;
import org.apache.http.Header;
import org.apache.http.HttpResponse;
import org.apache.http.StatusLine;

/** Maps error responses from the Content API onto {@link ContentApiException}s. */
final class ContentApiErrors {

  /** Header set by the API gateway on rejected requests. */
  static final String ERROR_CODE_HEADER = "X-Mashery-Error-Code";

  /** {@link #ERROR_CODE_HEADER} value for an unknown or deactivated key. */
  static final String DEVELOPER_INACTIVE = "ERR_403_DEVELOPER_INACTIVE";

  private ContentApiErrors() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  static ContentApiException classify(HttpResponse response) {
    StatusLine statusLine = response.getStatusLine();
    Header errorCode = response.getFirstHeader(ERROR_CODE_HEADER);
    return classify(
        statusLine.getStatusCode(),
        statusLine.getReasonPhrase(),
        errorCode == null ? null : errorCode.getValue());
  }

  static ContentApiException classify(int statusCode, String statusMessage, String errorCode) {
    if (DEVELOPER_INACTIVE.equals(errorCode)) {
      return new InvalidApiKeyException(statusCode, statusMessage);
    }
    return new OtherContentApiException(statusCode, statusMessage);
  }
}
