package io.sitepull.source.export.models;

import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

public enum Compression {
  NONE,
  GZIP;

  public static Compression fromParameter(String value) {
    if (StringUtils.isBlank(value)) {
      return NONE;
    }
    return "gzip".equals(value.trim().toLowerCase(Locale.ROOT)) ? GZIP : NONE;
  }
}
