package com.acme.shove.manifest;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for the line-oriented {@code name: invocation} manifest format.
 *
 * <p>Blank lines and lines starting with {@code #} are ignored. Any other line that is not a valid
 * entry is skipped with a warning; a parse never fails as a whole. When a name is defined twice the
 * last definition wins.
 */
public class ProcfileParser {
  private static final Logger log = LoggerFactory.getLogger(ProcfileParser.class);

  private static final Pattern ENTRY = Pattern.compile("^([A-Za-z0-9_-]+):\\s*(.+)$");

  public Procfile parse(String content) {
    Map<String, String> commands = new LinkedHashMap<>();
    if (content == null) {
      return new Procfile(commands);
    }

    String[] lines = content.split("\\R");
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].strip();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }

      Matcher m = ENTRY.matcher(line);
      if (!m.matches()) {
        log.warn("Skipping malformed manifest line {}: `{}`", i + 1, line);
        continue;
      }

      String name = m.group(1);
      String invocation = m.group(2).strip();
      if (commands.put(name, invocation) != null) {
        log.warn("Command `{}` redefined on manifest line {}, using the later definition", name, i + 1);
      }
    }
    return new Procfile(commands);
  }
}
