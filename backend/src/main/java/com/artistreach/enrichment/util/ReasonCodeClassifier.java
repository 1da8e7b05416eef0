package com.artistreach.enrichment.util;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ReasonCodeClassifier {
  public static final String NO_VIDEO_CHANNEL = "NO_VIDEO_CHANNEL";
  public static final String NO_PHOTO_HANDLE = "NO_PHOTO_HANDLE";
  public static final String NO_LINK_AGGREGATOR = "NO_LINK_AGGREGATOR";
  public static final String NO_WEBSITE = "NO_WEBSITE";
  public static final String WEBSITE_IS_AGGREGATOR = "WEBSITE_IS_AGGREGATOR";
  public static final String TICKETING_PLATFORM = "TICKETING_PLATFORM";
  public static final String NO_BIOGRAPHY = "NO_BIOGRAPHY";
  public static final String CAPABILITY_UNCONFIGURED = "CAPABILITY_UNCONFIGURED";
  public static final String CHANNEL_NOT_RESOLVED = "CHANNEL_NOT_RESOLVED";
  public static final String CONTENT_BLOCKED = "CONTENT_BLOCKED";
  public static final String CONTENT_TOO_SMALL = "CONTENT_TOO_SMALL";
  public static final String RENDERING_UNAVAILABLE = "RENDERING_UNAVAILABLE";
  public static final String RENDERING_TIMEOUT = "RENDERING_TIMEOUT";
  public static final String RENDERING_FAILED = "RENDERING_FAILED";
  public static final String NO_EMAIL_FOUND = "NO_EMAIL_FOUND";
  public static final String ALL_CANDIDATES_REJECTED = "ALL_CANDIDATES_REJECTED";
  public static final String NOT_VERBATIM_IN_SOURCE = "NOT_VERBATIM_IN_SOURCE";
  public static final String GENERATIVE_PARSE_FAILED = "GENERATIVE_PARSE_FAILED";
  public static final String DEADLINE_EXCEEDED = "DEADLINE_EXCEEDED";
  public static final String EARLY_TERMINATION = "EARLY_TERMINATION";
  public static final String DISCOVERY_ONLY = "DISCOVERY_ONLY";
  public static final String STEP_ERROR = "STEP_ERROR";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String UNKNOWN = "UNKNOWN";

  private static final Pattern STATUS_IN_CODE = Pattern.compile("http_(\\d{3})");
  private static final List<String> DNS_MARKERS =
      List.of("unknownhost", "name or service not known", "no such host");
  private static final Set<String> RETRYABLE =
      Set.of(TIMEOUT, DNS_FAILURE, TLS_FAILURE, HTTP_429_RATE_LIMIT, HTTP_5XX);

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null) {
      return UNKNOWN;
    }
    return switch (status) {
      case 401, 403 -> HTTP_401_403;
      case 404, 410 -> HTTP_404;
      case 408 -> TIMEOUT;
      case 429 -> HTTP_429_RATE_LIMIT;
      default -> status >= 500 && status < 600 ? HTTP_5XX : UNKNOWN;
    };
  }

  /**
   * Maps a transport error code from the HTTP client, such as {@code io_error} or {@code http_503},
   * to a reason code. Connection failures are told apart by the exception message.
   */
  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("deadline")) {
      return DEADLINE_EXCEEDED;
    }
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.equals("invalid_url")) {
      return INVALID_URL;
    }
    if (code.equals("io_error")) {
      return fromConnectionMessage(errorMessage);
    }
    Matcher status = STATUS_IN_CODE.matcher(code);
    return status.find() ? fromHttpStatus(Integer.valueOf(status.group(1))) : UNKNOWN;
  }

  /**
   * Reason text for a failed direct fetch, e.g. {@code HTTP_404 (http_404)}.
   */
  public static String describeFetchFailure(String errorCode, int statusCode, String errorMessage) {
    if (errorCode != null && !errorCode.isBlank()) {
      return fromErrorCode(errorCode, errorMessage) + " (" + errorCode + ")";
    }
    return fromHttpStatus(statusCode) + " (http_" + statusCode + ")";
  }

  public static boolean isRetryable(String reasonCode) {
    return reasonCode != null && RETRYABLE.contains(reasonCode);
  }

  private static String fromConnectionMessage(String message) {
    String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
    for (String marker : DNS_MARKERS) {
      if (lower.contains(marker)) {
        return DNS_FAILURE;
      }
    }
    if (lower.contains("ssl") || lower.contains("handshake")) {
      return TLS_FAILURE;
    }
    return UNKNOWN;
  }
}
