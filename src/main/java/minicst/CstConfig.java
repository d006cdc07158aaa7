package minicst;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formatting policy for text the renderer has to make up: the separator written for a defaulted
 * semicolon and the newline used when the source gave none. Instances are immutable.
 */
public final class CstConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger("CstConfig");
  private static final Pattern SEMICOLON_PATTERN = Pattern.compile("[ \f\t]*;[ \f\t]*");
  private static final ImmutableMap<String, String> NEWLINES =
      ImmutableMap.of("LF", "\n", "CRLF", "\r\n", "CR", "\r");
  private static final CstConfig DEFAULTS = new CstConfig("; ", "\n");

  private final String defaultSemicolon;
  private final String defaultNewline;

  private CstConfig(String defaultSemicolon, String defaultNewline) {
    checkArgument(
        SEMICOLON_PATTERN.matcher(checkNotNull(defaultSemicolon)).matches(),
        "Default semicolon must be a ';' surrounded by whitespace, got '%s'",
        defaultSemicolon);
    checkArgument(
        isValidNewline(checkNotNull(defaultNewline)),
        "Default newline must be one of LF, CRLF or CR");
    this.defaultSemicolon = defaultSemicolon;
    this.defaultNewline = defaultNewline;
  }

  public static CstConfig defaults() {
    return DEFAULTS;
  }

  /** Reads {@link EnvVar#CST_DEFAULT_SEMICOLON} and {@link EnvVar#CST_DEFAULT_NEWLINE}. */
  public static CstConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  static CstConfig fromEnvironment(Map<String, String> environment) {
    CstConfig config = DEFAULTS;
    if (EnvVar.CST_DEFAULT_SEMICOLON.isAvailable(environment)) {
      config = config.withDefaultSemicolon(EnvVar.CST_DEFAULT_SEMICOLON.value(environment));
    }
    if (EnvVar.CST_DEFAULT_NEWLINE.isAvailable(environment)) {
      String name = EnvVar.CST_DEFAULT_NEWLINE.value(environment);
      checkArgument(
          NEWLINES.containsKey(name),
          "%s must be one of %s, got '%s'",
          EnvVar.CST_DEFAULT_NEWLINE,
          NEWLINES.keySet(),
          name);
      config = config.withDefaultNewline(NEWLINES.get(name));
    }
    LOGGER.debug("Using {}", config);
    return config;
  }

  /** True for the newline sequences a source may use: LF, CRLF and CR. */
  public static boolean isValidNewline(String newline) {
    return NEWLINES.containsValue(newline);
  }

  public CstConfig withDefaultSemicolon(String defaultSemicolon) {
    return new CstConfig(defaultSemicolon, defaultNewline);
  }

  public CstConfig withDefaultNewline(String defaultNewline) {
    return new CstConfig(defaultSemicolon, defaultNewline);
  }

  public String defaultSemicolon() {
    return defaultSemicolon;
  }

  public String defaultNewline() {
    return defaultNewline;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    CstConfig that = (CstConfig) o;
    return defaultSemicolon.equals(that.defaultSemicolon)
        && defaultNewline.equals(that.defaultNewline);
  }

  @Override
  public int hashCode() {
    return Objects.hash(defaultSemicolon, defaultNewline);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("defaultSemicolon", "'" + defaultSemicolon + "'")
        .add("defaultNewline", defaultNewline.replace("\r", "\\r").replace("\n", "\\n"))
        .toString();
  }
}
