package minicst;

import java.util.List;

/** Basic error class in this project. */
public class CstError extends RuntimeException {

  public CstError(String message) {
    super(message);
  }

  public String getSourceReferencingMessage(List<String> sourceFile) {
    return getMessage();
  }
}
