package io.sitepull.source.server;

import io.sitepull.source.exceptions.AccessDeniedException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.apache.commons.lang3.StringUtils;

/** Checks the shared access key in constant time. */
public class AccessKeyValidator {
  private final byte[] expectedKey;

  public AccessKeyValidator(String expectedKey) {
    if (StringUtils.isBlank(expectedKey)) {
      throw new IllegalArgumentException("Access key must not be blank");
    }
    this.expectedKey = expectedKey.getBytes(StandardCharsets.UTF_8);
  }

  public void validate(String providedKey) {
    if (StringUtils.isEmpty(providedKey)
        || !MessageDigest.isEqual(expectedKey, providedKey.getBytes(StandardCharsets.UTF_8))) {
      throw new AccessDeniedException();
    }
  }
}
