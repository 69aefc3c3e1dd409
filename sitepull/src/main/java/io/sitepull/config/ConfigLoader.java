package io.sitepull.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import io.sitepull.config.models.common.HttpClientConfig;
import io.sitepull.config.models.configv1.ConfigV1;
import io.sitepull.config.models.configv1.DownloadConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

public class ConfigLoader {
  private final ObjectMapper MAPPER;

  public ConfigLoader() {
    this.MAPPER = new ObjectMapper(new YAMLFactory());
    MAPPER.registerModule(new Jdk8Module());
  }

  /** Tuning used when no file is given on the command line. */
  public Config defaultConfig() {
    return ConfigV1.builder().version(ConfigVersion.V1.name()).build();
  }

  public Config loadConfigFromConfigFile(String configFilePath) {
    try (InputStream in = Files.newInputStream(Paths.get(configFilePath))) {
      return loadConfigFromJsonNode(MAPPER.readTree(in));
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to load config from " + configFilePath, e);
    }
  }

  public Config loadConfigFromString(String configYaml) {
    try {
      return loadConfigFromJsonNode(MAPPER.readTree(configYaml));
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to load config", e);
    }
  }

  private Config loadConfigFromJsonNode(JsonNode jsonNode) throws IOException {
    if (jsonNode == null || !jsonNode.hasNonNull("version")) {
      throw new IllegalArgumentException("Missing config params: version");
    }
    ConfigVersion version = ConfigVersion.valueOf(jsonNode.get("version").asText());
    switch (version) {
      case V1:
        ConfigV1 configV1 = MAPPER.treeToValue(jsonNode, ConfigV1.class);
        validateConfig(configV1);
        return configV1;
      default:
        throw new UnsupportedOperationException("Unsupported config version: " + version);
    }
  }

  private void validateConfig(ConfigV1 configV1) {
    DownloadConfig download = configV1.getDownloadConfig();
    HttpClientConfig http = configV1.getHttpClientConfig();
    List<String> invalidFields = new ArrayList<>();
    if (download.getLargeFileThresholdBytes() < 1) {
      invalidFields.add("largeFileThresholdBytes");
    }
    if (download.getBatchMaxBytes() < 1) {
      invalidFields.add("batchMaxBytes");
    }
    if (download.getBatchMaxFiles() < 1) {
      invalidFields.add("batchMaxFiles");
    }
    if (download.getUnitAttempts() < 1) {
      invalidFields.add("unitAttempts");
    }
    if (download.getDbTimeBudgetSeconds() < 1) {
      invalidFields.add("dbTimeBudgetSeconds");
    }
    if (download.getDbMaxProcessCalls() < 1) {
      invalidFields.add("dbMaxProcessCalls");
    }
    if (download.getManifestPageSize() < 1) {
      invalidFields.add("manifestPageSize");
    }
    if (http.getMaxRetries() < 1) {
      invalidFields.add("maxRetries");
    }
    if (!invalidFields.isEmpty()) {
      throw new IllegalArgumentException(
          String.format("Invalid config params: %s", String.join(", ", invalidFields)));
    }
  }
}
