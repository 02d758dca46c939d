package com.luanvv.listings.core;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;

public class UrlUtils {

  public static final Map<String, String> REPLACEMENTS = Map.of(
      " ", "%20",
      "\\[", "%5B",
      "]", "%5D"
  );

  public static URI toAbsolute(String baseUrl, String href) {
    if (href == null || href.isBlank()) {
      return null;
    }
    try {
      URI target = new URI(urlEncode(href.trim()));
      if (target.isAbsolute() || baseUrl == null || baseUrl.isBlank()) {
        return target;
      }
      return new URI(baseUrl).resolve(target);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URL: " + href, e);
    }
  }

  public static String urlEncode(String s) {
    for (Map.Entry<String, String> e : REPLACEMENTS.entrySet()) {
      s = s.replaceAll(e.getKey(), e.getValue());
    }
    return s;
  }

  /** Listing pages are addressed as {@code ?page=N}, appended to any query already present. */
  public static String withPage(String url, int page) {
    String separator = url.contains("?") ? "&" : "?";
    return url + separator + "page=" + page;
  }

  /**
   * Compares two URLs ignoring a trailing slash and the fragment, which the site adds
   * or drops freely without it meaning a redirect.
   */
  public static boolean sameLocation(String a, String b) {
    if (a == null || b == null) {
      return a == null && b == null;
    }
    return normalize(a).equals(normalize(b));
  }

  private static String normalize(String url) {
    String s = url.trim();
    int hash = s.indexOf('#');
    if (hash >= 0) {
      s = s.substring(0, hash);
    }
    while (s.endsWith("/")) {
      s = s.substring(0, s.length() - 1);
    }
    return s;
  }
}
