package minicst;

import java.util.ArrayList;
import java.util.Map;

public enum EnvVar {
  CST_DEFAULT_SEMICOLON(
      "Text rendered for a defaulted semicolon between statements on one line, e.g. \"; \"."),
  CST_DEFAULT_NEWLINE("Newline used when a source has none: \"LF\", \"CRLF\" or \"CR\".");

  public final String description;

  EnvVar(String description) {
    this.description = description;
  }

  /** Looks this variable up in {@code environment}; returns "" if it is not set. */
  String value(Map<String, String> environment) {
    String value = environment.get(this.name());
    return value == null ? "" : value;
  }

  boolean isAvailable(Map<String, String> environment) {
    return environment.containsKey(this.name());
  }

  public static String[] getAllEnvVarDescriptions() {
    ArrayList<String> descriptions = new ArrayList<String>();
    for (EnvVar envVariable : EnvVar.values()) {
      descriptions.add(envVariable.name() + ": " + envVariable.description);
    }
    return descriptions.toArray(new String[0]);
  }
}
