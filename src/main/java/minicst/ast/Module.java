package minicst.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import minicst.CstConfig;
import minicst.ast.statement.BaseStatement;
import minicst.ast.visitors.CstTransformer;
import minicst.ast.whitespace.EmptyLine;
import minicst.codegen.CodegenState;

/**
 * The root of a parsed source file. Empty lines before the first statement belong to {@link
 * #header}, those after the last statement to {@link #footer}.
 */
public final class Module extends CstNode {

  public final ImmutableList<BaseStatement> body;
  public final ImmutableList<EmptyLine> header;
  public final ImmutableList<EmptyLine> footer;

  /** The newline defaulted newlines render as. Detected from the source when parsing. */
  public final String defaultNewline;

  /** False if the source did not end with a newline; the last default newline is then dropped. */
  public final boolean hasTrailingNewline;

  public Module(List<? extends BaseStatement> body) {
    this(body, ImmutableList.of(), ImmutableList.of(), "\n", true);
  }

  public Module(
      List<? extends BaseStatement> body,
      List<EmptyLine> header,
      List<EmptyLine> footer,
      String defaultNewline,
      boolean hasTrailingNewline) {
    this.body = ImmutableList.copyOf(body);
    this.header = ImmutableList.copyOf(header);
    this.footer = ImmutableList.copyOf(footer);
    this.defaultNewline = checkNotNull(defaultNewline);
    if (!CstConfig.isValidNewline(defaultNewline)) {
      throw new CstValidationError("Invalid default newline " + escape(defaultNewline) + ".");
    }
    this.hasTrailingNewline = hasTrailingNewline;
  }

  public Module withBody(List<? extends BaseStatement> body) {
    return new Module(body, header, footer, defaultNewline, hasTrailingNewline);
  }

  @Override
  protected CstNode visitAndReplaceChildren(CstTransformer transformer) {
    ImmutableList<EmptyLine> visitedHeader =
        ChildVisits.visitSequence(this, "header", header, EmptyLine.class, transformer);
    ImmutableList<BaseStatement> visitedBody =
        ChildVisits.visitSequence(this, "body", body, BaseStatement.class, transformer);
    ImmutableList<EmptyLine> visitedFooter =
        ChildVisits.visitSequence(this, "footer", footer, EmptyLine.class, transformer);
    return new Module(
        visitedBody, visitedHeader, visitedFooter, defaultNewline, hasTrailingNewline);
  }

  /**
   * Transforms this module. A module cannot be removed or replaced by a different kind of node.
   */
  public Module visitModule(CstTransformer transformer) {
    Optional<CstNode> result = visit(transformer);
    if (!result.isPresent()) {
      throw new CstValidationError("A Module cannot be removed.");
    }
    checkArgument(
        result.get() instanceof Module,
        "Expected a Module from the transformer, but got %s",
        result.get().getClass().getSimpleName());
    return (Module) result.get();
  }

  @Override
  protected void codegenImpl(CodegenState state) {
    for (EmptyLine line : header) {
      line.codegen(state);
    }
    for (BaseStatement statement : body) {
      statement.codegen(state);
    }
    for (EmptyLine line : footer) {
      line.codegen(state);
    }
    if (!hasTrailingNewline) {
      state.removeTrailingDefaultNewline();
    }
  }

  /** Renders the whole module with its own default newline and the default configuration. */
  @Override
  public String code() {
    return code(CstConfig.defaults());
  }

  /** Renders the whole module; the module's default newline wins over the config's. */
  public String code(CstConfig config) {
    CodegenState state = createState(config);
    codegen(state);
    return state.code();
  }

  /** Renders any node with the defaults of this module. */
  public String codeFor(CstNode node) {
    CodegenState state = createState(CstConfig.defaults());
    node.codegen(state);
    return state.code();
  }

  /** Creates a codegen state that renders defaulted newlines like this module does. */
  public CodegenState createState(CstConfig config) {
    return new CodegenState(config.withDefaultNewline(defaultNewline));
  }

  private static String escape(String s) {
    return "'" + s.replace("\r", "\\r").replace("\n", "\\n") + "'";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Module that = (Module) o;
    return hasTrailingNewline == that.hasTrailingNewline
        && body.equals(that.body)
        && header.equals(that.header)
        && footer.equals(that.footer)
        && defaultNewline.equals(that.defaultNewline);
  }

  @Override
  public int hashCode() {
    return Objects.hash(body, header, footer, defaultNewline, hasTrailingNewline);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("body", body)
        .add("header", header)
        .add("footer", footer)
        .add("defaultNewline", escape(defaultNewline))
        .add("hasTrailingNewline", hasTrailingNewline)
        .toString();
  }
}
