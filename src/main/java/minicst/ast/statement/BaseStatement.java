package minicst.ast.statement;

import minicst.ast.CstNode;

/**
 * A statement that makes up one or more whole lines of a module. Only {@link SimpleStatementLine}
 * exists; compound statements with indented bodies would be further subclasses.
 */
public abstract class BaseStatement extends CstNode {}
