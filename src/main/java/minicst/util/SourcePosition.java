package minicst.util;

import org.jetbrains.annotations.NotNull;

/**
 * Position in a source text. Lines start at 1, columns at 0 and count UTF-16 code units. Instances
 * of this class are immutable.
 */
public class SourcePosition implements Comparable<SourcePosition> {

  public static final SourcePosition BEGIN_OF_PROGRAM = new SourcePosition(1, 0);
  public final int line;
  public final int column;

  public SourcePosition(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public SourcePosition moveHorizontal(int length) {
    return new SourcePosition(line, column + length);
  }

  @Override
  public String toString() {
    return "[" + line + ":" + column + "]";
  }

  @Override
  public int compareTo(@NotNull SourcePosition other) {
    int byLine = Integer.compare(line, other.line);
    return byLine != 0 ? byLine : Integer.compare(column, other.column);
  }

  // if we implement Comparable, we probably should also implement equals.

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    SourcePosition that = (SourcePosition) o;

    return compareTo(that) == 0;
  }

  @Override
  public int hashCode() {
    int result = line;
    result = 31 * result + column;
    return result;
  }
}
