package com.acme.shove.resolve;

import java.nio.file.Path;

/** A manifest entry located for an order, ready to be executed in its project directory. */
public record ResolvedCommand(String name, String invocation, Path workingDirectory) {
}
