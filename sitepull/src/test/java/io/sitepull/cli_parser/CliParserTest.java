package io.sitepull.cli_parser;

import static org.junit.jupiter.api.Assertions.*;

import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

class CliParserTest {

  @Test
  void testParseRequiredOptions() throws ParseException {
    CliParser parser = new CliParser();
    String[] args = {"-u", "https://example.com/sitepull", "-k", "abc", "-o", "out"};
    parser.parse(args);
    assertEquals("https://example.com/sitepull", parser.getUrl());
    assertEquals("abc", parser.getKey());
    assertEquals("out", parser.getOutputDirectory());
    assertEquals(4, parser.getConcurrency());
    assertNull(parser.getConfigFilePath());
    assertFalse(parser.isHelpRequested());
  }

  @Test
  void testParseLongOptions() throws ParseException {
    CliParser parser = new CliParser();
    String[] args = {
      "--url", "https://example.com/sitepull",
      "--key", "abc",
      "--output", "out",
      "--concurrency", "12",
      "--config", "tuning.yaml"
    };
    parser.parse(args);
    assertEquals(12, parser.getConcurrency());
    assertEquals("tuning.yaml", parser.getConfigFilePath());
  }

  @Test
  void testMissingKey() {
    CliParser parser = new CliParser();
    String[] args = {"-u", "https://example.com/sitepull", "-o", "out"};

    Exception exception = assertThrows(ParseException.class, () -> parser.parse(args));

    assertTrue(exception.getMessage().contains("--key"));
  }

  @Test
  void testConcurrencyOutOfRange() {
    String[] tooHigh = {"-u", "https://a/sitepull", "-k", "k", "-o", "out", "-n", "33"};
    String[] zero = {"-u", "https://a/sitepull", "-k", "k", "-o", "out", "-n", "0"};
    String[] notANumber = {"-u", "https://a/sitepull", "-k", "k", "-o", "out", "-n", "four"};

    assertThrows(ParseException.class, () -> new CliParser().parse(tooHigh));
    assertThrows(ParseException.class, () -> new CliParser().parse(zero));
    assertThrows(ParseException.class, () -> new CliParser().parse(notANumber));
  }

  @Test
  void testHelpOption() throws ParseException {
    CliParser parser = new CliParser();
    String[] args = {"-h"};
    parser.parse(args);
    assertTrue(parser.isHelpRequested());
    assertNull(parser.getUrl());
  }

  @Test
  void testUnknownOption() {
    CliParser parser = new CliParser();
    String[] args = {"-x"};
    assertThrows(ParseException.class, () -> parser.parse(args));
  }
}
