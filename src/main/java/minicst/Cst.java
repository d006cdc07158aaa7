package minicst;

import static org.jooq.lambda.Seq.seq;

import java.util.List;
import java.util.Optional;
import minicst.ast.CstNode;
import minicst.ast.Module;
import minicst.ast.expression.BaseExpression;
import minicst.ast.statement.SimpleStatementLine;
import minicst.ast.visitors.CstTransformer;
import minicst.codegen.CodegenState;
import minicst.lexer.Lexer;
import minicst.parser.Parser;
import minicst.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry points for parsing source text into trees, transforming them and rendering them back. */
public class Cst {

  private static final Logger LOGGER = LoggerFactory.getLogger("Cst");

  private Cst() {}

  public static Lexer lex(String source) {
    return new Lexer(source);
  }

  /** All tokens of {@code source}, up to and including EOF. */
  public static List<Token> tokens(String source) {
    return seq(lex(source)).toList();
  }

  public static Module parseModule(String source) {
    return parseModule(source, CstConfig.fromEnvironment());
  }

  public static Module parseModule(String source, CstConfig config) {
    LOGGER.debug("Parsing module of {} characters", source.length());
    return new Parser(lex(source), config).parseModule();
  }

  public static SimpleStatementLine parseStatement(String source) {
    return new Parser(lex(source), CstConfig.fromEnvironment()).parseStatement();
  }

  public static BaseExpression parseExpression(String source) {
    return new Parser(lex(source), CstConfig.fromEnvironment()).parseExpression();
  }

  /** Renders {@code module} using the configuration from the environment. */
  public static String render(Module module) {
    return module.code(CstConfig.fromEnvironment());
  }

  /**
   * Renders {@code module} into a fresh {@link CodegenState}, which afterwards holds the code and
   * the positions of all rendered nodes.
   */
  public static CodegenState codegen(Module module, CstConfig config) {
    CodegenState state = module.createState(config);
    module.codegen(state);
    LOGGER.debug("Rendered module to {} characters", state.code().length());
    return state;
  }

  /** Renders a single node with the given configuration. */
  public static String render(CstNode node, CstConfig config) {
    CodegenState state = new CodegenState(config);
    node.codegen(state);
    return state.code();
  }

  public static Module transform(Module module, CstTransformer transformer) {
    LOGGER.debug("Applying {}", transformer.getClass().getSimpleName());
    return module.visitModule(transformer);
  }

  /** Transforms any node; empty if the transformer removed it. */
  public static Optional<CstNode> transform(CstNode node, CstTransformer transformer) {
    return node.visit(transformer);
  }
}
