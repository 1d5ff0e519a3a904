package com.storewatch.tracker.crawl.util;

import com.storewatch.tracker.crawl.model.HttpFetchResult;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String NOT_LISTED = "NOT_LISTED";
  public static final String EMPTY_RECORD = "EMPTY_RECORD";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodeClassifier() {}

  public static String fromResult(HttpFetchResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.errorCode() != null) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    return fromHttpStatus(result.statusCode());
  }

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    // the store answers 403 instead of 429 once an address is throttled
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.contains("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("invalid_url")) {
      return INVALID_URL;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return IO_ERROR;
    }
    return UNKNOWN;
  }

  public static boolean isRateLimit(String reasonCode) {
    return HTTP_429_RATE_LIMIT.equals(reasonCode) || HTTP_401_403.equals(reasonCode);
  }

  /** Failures that no retry or fallback locale can fix. */
  public static boolean isTerminal(String reasonCode) {
    return INTERRUPTED.equals(reasonCode) || INVALID_URL.equals(reasonCode);
  }

  public static boolean isTransient(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, DNS_FAILURE, TLS_FAILURE, IO_ERROR, HTTP_5XX, PARSING_FAILED -> true;
      default -> false;
    };
  }
}
