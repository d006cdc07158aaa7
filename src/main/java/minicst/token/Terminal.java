package minicst.token;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.EnumSet;
import java.util.Optional;

/** Enum of terminals used by the Lexer. */
public enum Terminal {

  // keywords, English spelling
  RAISE("raise"),
  RETURN("return"),
  BREAK("break"),
  CONTINUE("continue"),
  PASS("pass"),
  FROM("from"),

  // keywords, Spanish spelling
  AUMENTA("aumenta"),
  DEVUELVE("devuelve"),
  ROMPE("rompe"),
  CONTINUA("continúa"),

  // separators
  LPAREN("("),
  RPAREN(")"),
  COMMA(","),
  SEMICOLON(";"),

  // with dynamic string values
  NAME,
  INTEGER,
  STRING,
  RESERVED, // keyword of the full language, parsing fails if tokens of this type exist

  // formatting, kept so that the parser can attach it to nodes
  WS,
  COMMENT,
  NEWLINE,

  EOF;

  public static final ImmutableMap<String, Terminal> KEYWORDS =
      Maps.uniqueIndex(
          EnumSet.of(
              RAISE, RETURN, BREAK, CONTINUE, PASS, FROM, AUMENTA, DEVUELVE, ROMPE, CONTINUA),
          t -> t.string.get());

  public static final ImmutableSet<String> RESERVED_IDENTIFIERS =
      ImmutableSet.of(
          "and",
          "as",
          "assert",
          "async",
          "await",
          "class",
          "def",
          "del",
          "elif",
          "else",
          "except",
          "finally",
          "for",
          "global",
          "if",
          "import",
          "in",
          "is",
          "lambda",
          "nonlocal",
          "not",
          "or",
          "try",
          "while",
          "with",
          "yield");

  public final Optional<String> string;

  Terminal(String string) {
    this.string = Optional.of(string);
  }

  Terminal() {
    this.string = Optional.empty();
  }

  /** True if {@code word} cannot be used as a name. */
  public static boolean isKeyword(String word) {
    return KEYWORDS.containsKey(word) || RESERVED_IDENTIFIERS.contains(word);
  }
}
