package io.sitepull.source;

import com.google.common.base.Ticker;
import io.sitepull.source.config.DatabaseConfig;
import io.sitepull.source.config.SourceConfig;
import io.sitepull.source.config.SourceConfigLoader;
import io.sitepull.source.export.JdbcTableSource;
import io.sitepull.source.server.SourceHttpServer;
import java.io.IOException;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/** Runs the export endpoint for the site described by a YAML config file. */
@Slf4j
public class SourceMain {
  private static final String CONFIG_OPTION = "c";
  private static final String HELP_OPTION = "h";

  public static void main(String[] args) {
    Options options = new Options();
    options.addOption(
        Option.builder(CONFIG_OPTION)
            .longOpt("config")
            .hasArg()
            .desc("Path to the endpoint YAML configuration")
            .build());
    options.addOption(
        Option.builder(HELP_OPTION).longOpt("help").desc("Display help information").build());

    CommandLine cmd;
    try {
      cmd = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      log.error("Failed to parse command line arguments", e);
      System.exit(2);
      return;
    }
    if (cmd.hasOption(HELP_OPTION) || !cmd.hasOption(CONFIG_OPTION)) {
      new HelpFormatter().printHelp("sitepull-source", options);
      return;
    }

    SourceConfig config =
        new SourceConfigLoader().loadConfigFromConfigFile(cmd.getOptionValue(CONFIG_OPTION));
    DatabaseConfig database = config.getDatabase();
    JdbcTableSource tableSource =
        JdbcTableSource.forUrl(database.getJdbcUrl(), database.getUser(), database.getPassword());
    try {
      SourceHttpServer server =
          new SourceHttpServer(
              SourceApplication.createDispatcher(
                  config, tableSource, Clock.systemUTC(), Ticker.systemTicker()),
              config.getPort(),
              config.getWorkerThreads());
      Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
      server.start();
    } catch (IOException e) {
      log.error("Unable to start endpoint on port {}", config.getPort(), e);
      System.exit(4);
    }
  }
}
