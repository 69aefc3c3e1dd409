package io.sitepull.api;

import io.sitepull.exceptions.ValidationException;
import lombok.NonNull;
import lombok.Value;
import okhttp3.HttpUrl;
import org.apache.commons.lang3.StringUtils;

/** Where the site's action endpoint lives and the key it expects. */
@Value
public class SourceEndpoint {
  @NonNull HttpUrl url;
  @NonNull String accessKey;

  public static SourceEndpoint of(String url, String accessKey) {
    HttpUrl parsed = url == null ? null : HttpUrl.parse(url.trim());
    if (parsed == null) {
      throw new ValidationException("Invalid endpoint url: " + url);
    }
    if (StringUtils.isBlank(accessKey)) {
      throw new ValidationException("Access key must not be blank");
    }
    return new SourceEndpoint(parsed, accessKey.trim());
  }

  public String getHost() {
    return url.host();
  }
}
