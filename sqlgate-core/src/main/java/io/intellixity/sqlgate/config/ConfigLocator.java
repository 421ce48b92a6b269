package io.intellixity.sqlgate.config;

import io.intellixity.sqlgate.error.ConfigurationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Finds the configuration file. First match wins:
 * <ol>
 *   <li>{@code --config <path>} or {@code --config=<path>} program argument</li>
 *   <li>{@code SQLGATE_CONFIG} environment variable, when the file exists</li>
 *   <li>{@code ./config.yaml}</li>
 *   <li>{@code ~/.config/sqlgate/config.yaml}</li>
 *   <li>{@code ~/sqlgate.yaml}</li>
 * </ol>
 */
public final class ConfigLocator {
  public static final String ENV_VAR = "SQLGATE_CONFIG";

  private final Map<String, String> env;
  private final Path workingDir;
  private final Path homeDir;

  public ConfigLocator(Map<String, String> env, Path workingDir, Path homeDir) {
    this.env = env == null ? Map.of() : env;
    this.workingDir = workingDir;
    this.homeDir = homeDir;
  }

  public static ConfigLocator system() {
    return new ConfigLocator(System.getenv(), Paths.get("").toAbsolutePath(), Paths.get(System.getProperty("user.home")));
  }

  public Path locate(String... args) {
    String explicit = fromArgs(args);
    if (explicit != null) return Paths.get(explicit);

    String fromEnv = env.get(ENV_VAR);
    if (fromEnv != null && !fromEnv.isBlank() && Files.isRegularFile(Paths.get(fromEnv))) {
      return Paths.get(fromEnv);
    }
    if (workingDir != null) {
      Path p = workingDir.resolve("config.yaml");
      if (Files.isRegularFile(p)) return p;
    }
    if (homeDir != null) {
      Path xdg = homeDir.resolve(".config").resolve("sqlgate").resolve("config.yaml");
      if (Files.isRegularFile(xdg)) return xdg;
      Path home = homeDir.resolve("sqlgate.yaml");
      if (Files.isRegularFile(home)) return home;
    }
    throw new ConfigurationException("Config file not found");
  }

  private static String fromArgs(String[] args) {
    if (args == null) return null;
    for (int i = 0; i < args.length; i++) {
      String a = args[i];
      if (a == null) continue;
      if (a.equals("--config") && i + 1 < args.length) return args[i + 1];
      if (a.startsWith("--config=") && a.length() > "--config=".length()) return a.substring("--config=".length());
    }
    return null;
  }
}
