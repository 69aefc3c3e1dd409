package io.sitepull.source.server;

import io.sitepull.source.exceptions.InvalidRequestException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/** Transport independent view of an action request: form/query parameters and headers. */
@Builder
@Value
public class SourceRequest {
  @NonNull @Singular Map<String, List<String>> parameters;

  /** Header names are lower case. */
  @NonNull @Singular Map<String, String> headers;

  @Nullable
  public String getParameter(String name) {
    List<String> values = parameters.get(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  public List<String> getParameterValues(String name) {
    return parameters.getOrDefault(name, Collections.emptyList());
  }

  @Nullable
  public String getHeader(String name) {
    return headers.get(name.toLowerCase(Locale.ROOT));
  }

  /**
   * Parses {@code application/x-www-form-urlencoded} text, which is also the query string form.
   *
   * @throws InvalidRequestException on malformed percent escapes
   */
  public static Map<String, List<String>> parseForm(@Nullable String encoded) {
    Map<String, List<String>> parameters = new LinkedHashMap<>();
    if (StringUtils.isEmpty(encoded)) {
      return parameters;
    }
    for (String pair : encoded.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String name = decode(eq < 0 ? pair : pair.substring(0, eq));
      String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
      parameters.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
    }
    return parameters;
  }

  private static String decode(String value) {
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Malformed form encoding: " + e.getMessage());
    }
  }
}
