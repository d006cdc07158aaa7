package minicst;

import static org.hamcrest.core.Is.is;
import static org.junit.Assert.assertThat;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.Size;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import minicst.ast.Module;
import minicst.transforms.KeywordTranslator;
import org.junit.runner.RunWith;

@RunWith(JUnitQuickcheck.class)
public class RoundTripPropertiesTest {

  @Property(trials = 500)
  public void renderedModulesParseToTheSameText(
      @From(ModuleGenerator.class) @Size(max = 200) GeneratedModule generated) {
    String code = generated.module.code();
    assertThat(Cst.parseModule(code).code(), is(code));
  }

  @Property(trials = 300)
  public void parsingIsIdempotent(
      @From(ModuleGenerator.class) @Size(max = 200) GeneratedModule generated) {
    Module parsed = Cst.parseModule(generated.module.code());
    assertThat(Cst.parseModule(parsed.code()), is(parsed));
  }

  @Property(trials = 300)
  public void translatingBackAndForthKeepsTheText(
      @From(ModuleGenerator.class) @Size(max = 200) GeneratedModule generated) {
    Module english = Cst.transform(generated.module, KeywordTranslator.toEnglish());
    Module spanish = Cst.transform(english, KeywordTranslator.toSpanish());
    Module back = Cst.transform(spanish, KeywordTranslator.toEnglish());
    assertThat(back.code(), is(english.code()));
  }
}
