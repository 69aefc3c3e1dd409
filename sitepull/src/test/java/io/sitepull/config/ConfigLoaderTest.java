package io.sitepull.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.sitepull.config.models.configv1.ConfigV1;
import io.sitepull.config.models.configv1.DownloadConfig;
import io.sitepull.constants.DownloadConstants;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ConfigLoaderTest {
  private final ConfigLoader configLoader = new ConfigLoader();

  @Test
  void testLoadValidConfigFromFile() throws URISyntaxException {
    Config config = configLoader.loadConfigFromConfigFile(resource("validConfigV1.yaml"));

    assertEquals(ConfigVersion.V1, config.getVersion());
    assertEquals(10, config.getHttpClientConfig().getConnectTimeoutSeconds());
    assertEquals(120, config.getHttpClientConfig().getReadTimeoutSeconds());
    assertEquals(5, config.getHttpClientConfig().getMaxRetries());
    DownloadConfig download = config.getDownloadConfig();
    assertEquals(4194304, download.getLargeFileThresholdBytes());
    assertEquals(500, download.getBatchMaxFiles());
    assertEquals(4, download.getUnitAttempts());
    assertEquals(1000, download.getManifestPageSize());
    assertEquals(DownloadConstants.DEFAULT_BATCH_MAX_BYTES, download.getBatchMaxBytes());
  }

  @Test
  void testVersionOnlyFileEqualsDefaults() throws URISyntaxException {
    Config config =
        configLoader.loadConfigFromConfigFile(resource("validConfigV1VersionOnly.yaml"));

    assertEquals(configLoader.defaultConfig(), config);
  }

  @ParameterizedTest
  @CsvSource({
    "invalidConfigV1NonPositive.yaml, 'Invalid config params: batchMaxFiles, unitAttempts'",
    "invalidConfigMissingVersion.yaml, 'Missing config params: version'"
  })
  void testInvalidConfigFiles(String file, String expectedMessage) throws URISyntaxException {
    String path = resource(file);

    IllegalArgumentException exception =
        assertThrows(
            IllegalArgumentException.class, () -> configLoader.loadConfigFromConfigFile(path));

    assertEquals(expectedMessage, exception.getMessage());
  }

  @Test
  void testLoadFromString() {
    Config config =
        configLoader.loadConfigFromString(
            "version: V1\ndownloadConfig:\n  batchMaxBytes: 1024\n  unitRetryDelayMillis: 0\n");

    assertEquals(1024, config.getDownloadConfig().getBatchMaxBytes());
    assertEquals(0, config.getDownloadConfig().getUnitRetryDelayMillis());
  }

  @Test
  void testUnknownVersionAndMissingFile() {
    assertThrows(
        IllegalArgumentException.class, () -> configLoader.loadConfigFromString("version: V9\n"));
    assertThrows(
        IllegalArgumentException.class,
        () -> configLoader.loadConfigFromConfigFile("/does/not/exist.yaml"));
  }

  @Test
  void testDefaultConfig() {
    ConfigV1 config = (ConfigV1) configLoader.defaultConfig();

    assertEquals(DownloadConstants.DEFAULT_UNIT_ATTEMPTS, config.getDownloadConfig().getUnitAttempts());
    assertEquals(3, config.getHttpClientConfig().getMaxRetries());
  }

  private static String resource(String name) throws URISyntaxException {
    return Paths.get(
            ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config_test_resources/" + name)
                .toURI())
        .toString();
  }
}
