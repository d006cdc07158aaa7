package minicst.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import java.util.List;
import java.util.Objects;
import org.jooq.lambda.Seq;

/**
 * The half-open extent of a token or node in source text: {@link #end} is one beyond the last
 * character. Empty ranges are legal, an empty whitespace node occupies no characters.
 */
public class SourceRange {
  public final SourcePosition begin;
  public final SourcePosition end; // exclusive!

  public SourceRange(SourcePosition begin, SourcePosition end) {
    this.begin = checkNotNull(begin);
    this.end = checkNotNull(end);
    checkArgument(begin.compareTo(end) <= 0, "SourceRange ends before it begins");
  }

  public SourceRange(SourcePosition begin, int length) {
    this(begin, begin.moveHorizontal(length));
  }

  public boolean isEmpty() {
    return begin.equals(end);
  }

  /**
   * Quotes the lines of {@code sourceLines} this range covers. A range within one line is
   * underlined with carets, a range over several lines is marked in the gutter. A range behind the
   * last line points just past its end.
   */
  public String annotateSourceFileExcerpt(List<String> sourceLines) {
    String nl = System.lineSeparator();
    if (begin.line < end.line) {
      int gutterWidth = String.valueOf(end.line).length();
      return Seq.rangeClosed(Math.max(begin.line, 1), Math.min(end.line, sourceLines.size()))
          .map(
              i ->
                  Strings.padStart(String.valueOf(i), gutterWidth, ' ')
                      + "|> "
                      + sourceLines.get(i - 1)
                      + nl)
          .toString("");
    }
    boolean pastEnd = begin.line > sourceLines.size();
    int lineNumber = Math.max(1, Math.min(begin.line, sourceLines.size()));
    String line = sourceLines.isEmpty() ? "" : sourceLines.get(lineNumber - 1);
    String gutter = lineNumber + "| ";
    int column = pastEnd ? line.length() : begin.column;
    int carets = pastEnd ? 1 : Math.max(1, end.column - begin.column);
    return gutter
        + line
        + nl
        + Strings.repeat(" ", gutter.length() + column)
        + Strings.repeat("^", carets)
        + nl;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    SourceRange that = (SourceRange) o;
    return begin.equals(that.begin) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(begin, end);
  }

  @Override
  public String toString() {
    return String.format("%s-%s", begin, end);
  }
}
