package io.sitepull.source.service;

import static io.sitepull.source.constants.SourceConstants.JOB_ID_LENGTH;

import java.security.SecureRandom;
import org.apache.commons.lang3.RandomStringUtils;

/** Alphanumeric job ids; they address stored jobs, so they come from a secure generator. */
public class JobIdGenerator {
  private final SecureRandom random = new SecureRandom();

  public String nextId() {
    return RandomStringUtils.random(JOB_ID_LENGTH, 0, 0, true, true, null, random);
  }
}
