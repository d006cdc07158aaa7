package minicst.ast;

import minicst.CstError;

/**
 * Raised by a node constructor when the supplied children and formatting cannot be rendered back
 * into valid source. The node is never created; callers may fix their input and retry.
 */
public class CstValidationError extends CstError {

  public CstValidationError(String message) {
    super(message);
  }
}
