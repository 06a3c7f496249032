package astro.asp;

import astro.asp.errors.AspException;
import astro.asp.support.AspConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.LogManager;

/**
 * 命令行入口：解析 .asx 文件并把 pax3 JSON 输出到标准输出。
 */
public final class Runner {
  public static void main(String[] args) throws Exception {
    configureLogging();
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args.length == 0) {
      System.err.println("Usage: Runner <file.asx> [--header=<title>] [--assign-kw=<name>] [--strict-comments] [--compact]");
      return 2;
    }

    ParserOptions.Builder options = ParserOptions.builder();
    boolean compact = false;
    Path file = Path.of(args[0]);

    // Support --header=<title>, --assign-kw=<name>, --strict-comments, --compact
    for (int i = 1; i < args.length; i++) {
      String a = args[i];
      if (a.startsWith("--header=")) options.headerTitle(a.substring("--header=".length()));
      else if (a.startsWith("--assign-kw=")) options.assignmentKeyword(a.substring("--assign-kw=".length()));
      else if ("--strict-comments".equals(a)) options.strictBlockComments(true);
      else if ("--compact".equals(a)) compact = true;
      else {
        System.err.println("Unknown option: " + a);
        return 2;
      }
    }

    if (AspConfig.DEBUG) {
      System.err.println("DEBUG: input=" + file.toAbsolutePath());
    }

    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println(file + ": cannot read file (" + e + ")");
      return 2;
    }

    try {
      ParsedScript script = AspParser.parse(lines, options.build());
      System.out.println(compact ? script.toJson() : script.toPrettyJson());
      return 0;
    } catch (AspException e) {
      System.err.println(file.getFileName() + ": line " + e.getLine() + ": " + e.getMessage());
      return 1;
    }
  }

  private static void configureLogging() throws IOException {
    try (InputStream in = Runner.class.getResourceAsStream("/logging.properties")) {
      if (in != null) LogManager.getLogManager().readConfiguration(in);
    }
  }
}
