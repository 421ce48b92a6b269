package io.intellixity.sqlgate.config;

import io.intellixity.sqlgate.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigLocatorTest {
  @TempDir
  Path tmp;

  private Path touch(Path p) throws IOException {
    Files.createDirectories(p.getParent());
    Files.writeString(p, "databases: {}\n");
    return p;
  }

  @Test
  void explicitArgumentWins() throws IOException {
    Path cwd = tmp.resolve("cwd");
    touch(cwd.resolve("config.yaml"));
    ConfigLocator locator = new ConfigLocator(Map.of(), cwd, tmp.resolve("home"));

    assertEquals(Path.of("/etc/custom.yaml"), locator.locate("--config", "/etc/custom.yaml"));
    assertEquals(Path.of("/etc/other.yaml"), locator.locate("--verbose", "--config=/etc/other.yaml"));
  }

  @Test
  void environmentVariableNeedsExistingFile() throws IOException {
    Path env = touch(tmp.resolve("env.yaml"));
    Path cwdConfig = touch(tmp.resolve("cwd").resolve("config.yaml"));

    ConfigLocator withFile = new ConfigLocator(Map.of(ConfigLocator.ENV_VAR, env.toString()), tmp.resolve("cwd"), null);
    assertEquals(env, withFile.locate());

    ConfigLocator dangling = new ConfigLocator(
        Map.of(ConfigLocator.ENV_VAR, tmp.resolve("missing.yaml").toString()), tmp.resolve("cwd"), null);
    assertEquals(cwdConfig, dangling.locate());
  }

  @Test
  void fallsBackToHomeLocations() throws IOException {
    Path home = tmp.resolve("home");
    Path simple = touch(home.resolve("sqlgate.yaml"));
    ConfigLocator locator = new ConfigLocator(Map.of(), tmp.resolve("empty"), home);
    assertEquals(simple, locator.locate());

    Path xdg = touch(home.resolve(".config").resolve("sqlgate").resolve("config.yaml"));
    assertEquals(xdg, locator.locate());
  }

  @Test
  void nothingFound() {
    ConfigLocator locator = new ConfigLocator(Map.of(), tmp, tmp);
    ConfigurationException ex = assertThrows(ConfigurationException.class, locator::locate);
    assertEquals("Config file not found", ex.getMessage());
  }
}
