package minicst.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * An @Iterator@ decorator which enables look ahead into iterated elements.
 *
 * <p>@lookAhead(0)@ is the element most recently returned by @next()@, if any. @lookAhead(n)@ is
 * the element that the n-th following call to @next()@ will return. Elements are pulled from the
 * decorated iterator only as far as a look ahead requires.
 */
public class LookAheadIterator<T> implements Iterator<T> {

  private final Iterator<T> it;
  // buffer.get(0) is the current element once next() was called at least once
  private final List<T> buffer = new ArrayList<>(16);
  private boolean isBeforeFirstElement = true;

  public LookAheadIterator(Iterator<T> it) {
    this.it = it;
  }

  /**
   * Returns the element which will be the return value after @n-1@ further calls to @next@, or
   * @Optional.empty()@ if the decorated iterator runs out before that.
   *
   * @param n non-negative integer, denoting the number of elements to look ahead.
   */
  public Optional<T> lookAhead(int n) {
    if (n < 0) {
      throw new IllegalArgumentException("n was negative");
    }
    int index = isBeforeFirstElement ? n - 1 : n;
    if (index < 0) {
      return Optional.empty();
    }
    while (buffer.size() <= index) {
      if (!it.hasNext()) {
        return Optional.empty();
      }
      buffer.add(it.next());
    }
    return Optional.of(buffer.get(index));
  }

  @Override
  public boolean hasNext() {
    return lookAhead(1).isPresent();
  }

  @Override
  public T next() {
    Optional<T> ret = lookAhead(1);
    if (!ret.isPresent()) {
      throw new NoSuchElementException();
    }
    if (isBeforeFirstElement) {
      isBeforeFirstElement = false;
    } else {
      buffer.remove(0);
    }
    return ret.get();
  }
}
