package minicst.ast;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * A formatting slot that is either explicitly given or left to the renderer, which then supplies a
 * context-appropriate default.
 *
 * <p>The default case is distinct from every explicit value. In particular, an explicit empty
 * whitespace and the default case render alike when nothing follows, but only the explicit one
 * promises that no separator will be inserted.
 *
 * @param <T> the type of the explicit value
 */
public final class MaybeSentinel<T> {

  private static final MaybeSentinel<?> DEFAULT = new MaybeSentinel<>(null);

  @Nullable private final T value;

  private MaybeSentinel(@Nullable T value) {
    this.value = value;
  }

  @SuppressWarnings("unchecked")
  public static <T> MaybeSentinel<T> useDefault() {
    return (MaybeSentinel<T>) DEFAULT;
  }

  public static <T> MaybeSentinel<T> explicit(T value) {
    return new MaybeSentinel<>(checkNotNull(value));
  }

  /** Maps an absent {@link Optional} to the default case. */
  public static <T> MaybeSentinel<T> fromOptional(Optional<T> value) {
    return value.isPresent() ? explicit(value.get()) : useDefault();
  }

  public boolean isDefault() {
    return value == null;
  }

  public boolean isExplicit() {
    return value != null;
  }

  /** Returns the explicit value; throws {@link IllegalStateException} in the default case. */
  public T get() {
    if (value == null) {
      throw new IllegalStateException("No explicit value given, the default is used");
    }
    return value;
  }

  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }

  public <R> MaybeSentinel<R> map(Function<? super T, ? extends R> mapper) {
    return value == null ? useDefault() : explicit(mapper.apply(value));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    MaybeSentinel<?> that = (MaybeSentinel<?>) o;
    return Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public String toString() {
    if (value == null) {
      return "MaybeSentinel.DEFAULT";
    }
    return MoreObjects.toStringHelper(this).addValue(value).toString();
  }
}
