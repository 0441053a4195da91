package com.acme.shove.resolve;

import com.acme.shove.config.ShoveConfig;
import com.acme.shove.manifest.Procfile;
import com.acme.shove.manifest.ProcfileParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Looks up a project's command in the manifest at {@code <project>/bin/commands.procfile}.
 *
 * <p>The manifest is read and parsed on every call, so edits apply to the very next order.
 */
public class CommandResolver {
  static final Path MANIFEST_PATH = Path.of("bin", "commands.procfile");

  private final ShoveConfig config;
  private final ProcfileParser parser;

  public CommandResolver(ShoveConfig config, ProcfileParser parser) {
    this.config = config;
    this.parser = parser;
  }

  public ResolvedCommand resolve(String projectId, String commandName) throws ResolutionException {
    Path projectPath =
        config
            .findProjectPath(projectId)
            .orElseThrow(
                () ->
                    new ResolutionException(
                        ResolutionException.Kind.UNKNOWN_PROJECT,
                        "No project `" + projectId + "` found."));

    Path manifestPath = projectPath.resolve(MANIFEST_PATH);
    Procfile procfile;
    try {
      procfile = parser.parse(Files.readString(manifestPath, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new ResolutionException(
          ResolutionException.Kind.MANIFEST_UNREADABLE,
          "Error loading procfile for project `" + projectId + "`: " + describe(e),
          e);
    }

    String invocation =
        procfile
            .command(commandName)
            .orElseThrow(
                () ->
                    new ResolutionException(
                        ResolutionException.Kind.UNKNOWN_COMMAND,
                        "No command `" + commandName + "` found in " + manifestPath));

    return new ResolvedCommand(commandName, invocation, projectPath);
  }

  private static String describe(IOException e) {
    String type = e.getClass().getSimpleName();
    return e.getMessage() == null ? type : type + ": " + e.getMessage();
  }
}
