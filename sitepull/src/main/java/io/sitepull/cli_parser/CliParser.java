package io.sitepull.cli_parser;

import static io.sitepull.constants.DownloadConstants.DEFAULT_CONCURRENCY;
import static io.sitepull.constants.DownloadConstants.MAX_CONCURRENCY;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;

public class CliParser {
  private String url;
  private String key;
  private String outputDirectory;
  private int concurrency = DEFAULT_CONCURRENCY;
  private String configFilePath;
  private static final String URL_OPTION = "u";
  private static final String KEY_OPTION = "k";
  private static final String OUTPUT_OPTION = "o";
  private static final String CONCURRENCY_OPTION = "n";
  private static final String CONFIG_OPTION = "c";
  private static final String HELP_OPTION = "h";
  private boolean helpRequested = false;

  public void parse(String[] args) throws ParseException {
    Options options = new Options();
    options.addOption(
        Option.builder(URL_OPTION)
            .longOpt("url")
            .hasArg()
            .desc("Action endpoint of the site, e.g. https://example.com/sitepull")
            .build());
    options.addOption(
        Option.builder(KEY_OPTION).longOpt("key").hasArg().desc("Access key of the site").build());
    options.addOption(
        Option.builder(OUTPUT_OPTION)
            .longOpt("output")
            .hasArg()
            .desc("Directory receiving the archive")
            .build());
    options.addOption(
        Option.builder(CONCURRENCY_OPTION)
            .longOpt("concurrency")
            .hasArg()
            .desc("Parallel file transfers (default " + DEFAULT_CONCURRENCY + ")")
            .build());
    options.addOption(
        Option.builder(CONFIG_OPTION)
            .longOpt("config")
            .hasArg()
            .desc("The file path to an optional YAML tuning file")
            .build());
    options.addOption(
        Option.builder(HELP_OPTION).longOpt("help").desc("Display help information").build());

    CommandLineParser parser = new DefaultParser();
    CommandLine cmd = parser.parse(options, args);

    if (cmd.hasOption(HELP_OPTION)) {
      HelpFormatter formatter = new HelpFormatter();
      helpRequested = true;
      formatter.printHelp("sitepull", options);
      return;
    }

    url = requiredOption(cmd, URL_OPTION, "url");
    key = requiredOption(cmd, KEY_OPTION, "key");
    outputDirectory = requiredOption(cmd, OUTPUT_OPTION, "output");
    configFilePath = cmd.getOptionValue(CONFIG_OPTION);

    if (cmd.hasOption(CONCURRENCY_OPTION)) {
      String value = cmd.getOptionValue(CONCURRENCY_OPTION);
      try {
        concurrency = Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        throw new ParseException("Concurrency must be an integer: " + value);
      }
      if (concurrency < 1 || concurrency > MAX_CONCURRENCY) {
        throw new ParseException("Concurrency must be between 1 and " + MAX_CONCURRENCY);
      }
    }
  }

  private static String requiredOption(CommandLine cmd, String option, String name)
      throws ParseException {
    String value = cmd.getOptionValue(option);
    if (StringUtils.isBlank(value)) {
      throw new ParseException("Missing required option: --" + name);
    }
    return value.trim();
  }

  public boolean isHelpRequested() {
    return helpRequested;
  }

  public String getUrl() {
    return url;
  }

  public String getKey() {
    return key;
  }

  public String getOutputDirectory() {
    return outputDirectory;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public String getConfigFilePath() {
    return configFilePath;
  }
}
