package minicst.ast;

import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.junit.Assert.assertThat;

import java.util.Optional;
import minicst.ast.whitespace.SimpleWhitespace;
import org.junit.Test;

public class MaybeSentinelTest {

  @Test
  public void defaultCase_differsFromExplicitEmpty() {
    MaybeSentinel<SimpleWhitespace> byDefault = MaybeSentinel.useDefault();
    MaybeSentinel<SimpleWhitespace> empty = MaybeSentinel.explicit(SimpleWhitespace.EMPTY);

    assertThat(byDefault, is(not(empty)));
    assertThat(byDefault.isDefault(), is(true));
    assertThat(empty.isExplicit(), is(true));
    assertThat(empty.get().isEmpty(), is(true));
  }

  @Test
  public void explicitValues_comparedByValue() {
    assertThat(
        MaybeSentinel.explicit(new SimpleWhitespace(" ")),
        is(MaybeSentinel.explicit(SimpleWhitespace.SPACE)));
    assertThat(
        MaybeSentinel.explicit(new SimpleWhitespace(" ")).hashCode(),
        is(MaybeSentinel.explicit(SimpleWhitespace.SPACE).hashCode()));
  }

  @Test(expected = IllegalStateException.class)
  public void getOnDefault_throws() {
    MaybeSentinel.useDefault().get();
  }

  @Test(expected = NullPointerException.class)
  public void explicitNull_throws() {
    MaybeSentinel.explicit(null);
  }

  @Test
  public void conversions_keepTheCase() {
    assertThat(MaybeSentinel.fromOptional(Optional.empty()).isDefault(), is(true));
    assertThat(MaybeSentinel.fromOptional(Optional.of("x")).get(), is("x"));
    assertThat(MaybeSentinel.explicit("x").toOptional(), is(Optional.of("x")));
    assertThat(MaybeSentinel.<String>useDefault().toOptional(), is(Optional.<String>empty()));
    assertThat(MaybeSentinel.explicit("x").map(String::length).get(), is(1));
    assertThat(MaybeSentinel.<String>useDefault().map(String::length).isDefault(), is(true));
  }
}
