package io.sitepull.source.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

public class SourceConfigLoader {
  private final ObjectMapper mapper;

  public SourceConfigLoader() {
    this.mapper = new ObjectMapper(new YAMLFactory());
    mapper.registerModule(new Jdk8Module());
  }

  public SourceConfig loadConfigFromConfigFile(String configFilePath) {
    try (InputStream in = Files.newInputStream(Paths.get(configFilePath))) {
      return validate(mapper.readValue(in, SourceConfig.class));
    } catch (IllegalArgumentException e) {
      throw e;
    } catch (Exception e) {
      throw new RuntimeException("Failed to load source config", e);
    }
  }

  public SourceConfig loadConfigFromString(String configYaml) {
    try {
      return validate(mapper.readValue(configYaml, SourceConfig.class));
    } catch (IllegalArgumentException e) {
      throw e;
    } catch (Exception e) {
      throw new RuntimeException("Failed to load source config", e);
    }
  }

  private SourceConfig validate(SourceConfig config) {
    List<String> invalid = new ArrayList<>();
    if (StringUtils.isBlank(config.getAccessKey())) {
      invalid.add("accessKey");
    }
    if (StringUtils.isBlank(config.getRootDirectory())) {
      invalid.add("rootDirectory");
    }
    if (config.getPort() < 0 || config.getPort() > 65535) {
      invalid.add("port");
    }
    if (config.getWorkerThreads() < 1) {
      invalid.add("workerThreads");
    }
    if (config.getJobTtlMinutes() < 1) {
      invalid.add("jobTtlMinutes");
    }
    if (config.getDefaultTimeBudgetSeconds() < 1) {
      invalid.add("defaultTimeBudgetSeconds");
    }
    if (!invalid.isEmpty()) {
      throw new IllegalArgumentException(
          String.format("Invalid config params: %s", String.join(", ", invalid)));
    }
    return config;
  }
}
