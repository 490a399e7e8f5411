package com.codeheadsystems.tether.client.callback;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Query string encoding and decoding for authorization and redirect URLs.
 * <p>
 * Redirect URLs use app-specific schemes that {@link java.net.URI} does not always accept,
 * so they are split by hand: everything after the first {@code ?} and before any {@code #}.
 */
public final class QueryParameters {

  private QueryParameters() {
  }

  /**
   * Parses the query of a URL. When a name repeats, the first value wins.
   *
   * @param url the url
   * @return decoded parameters in the order they appear
   * @throws IllegalArgumentException when a value carries a malformed percent-escape
   */
  public static Map<String, String> parse(String url) {
    Map<String, String> params = new LinkedHashMap<>();
    int q = url.indexOf('?');
    if (q < 0) {
      return params;
    }
    String query = url.substring(q + 1);
    int hash = query.indexOf('#');
    if (hash >= 0) {
      query = query.substring(0, hash);
    }
    for (String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String name = decode(eq < 0 ? pair : pair.substring(0, eq));
      String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
      params.putIfAbsent(name, value);
    }
    return params;
  }

  /**
   * The part of a URL before its query and fragment.
   *
   * @param url the url
   * @return the url without query or fragment
   */
  public static String withoutQuery(String url) {
    int end = url.length();
    int q = url.indexOf('?');
    if (q >= 0) {
      end = q;
    }
    int hash = url.indexOf('#');
    if (hash >= 0 && hash < end) {
      end = hash;
    }
    return url.substring(0, end);
  }

  /**
   * Form-encodes parameters in iteration order.
   *
   * @param params the params
   * @return {@code a=1&b=2}
   */
  public static String encode(Map<String, String> params) {
    StringJoiner joiner = new StringJoiner("&");
    params.forEach((name, value) -> joiner.add(
        URLEncoder.encode(name, StandardCharsets.UTF_8) + "="
            + URLEncoder.encode(value, StandardCharsets.UTF_8)));
    return joiner.toString();
  }

  private static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }
}
