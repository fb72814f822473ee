package exm.ksc.common.exceptions;

/**
 * Assignment to a name that was declared constant: a function,
 * a type, an enumerator or a const variable.
 */
public class InvalidWriteException extends CompileException {

  public InvalidWriteException(int line, int col, String name) {
    super(line, col, "Cannot assign to constant '" + name + "'");
  }

  private static final long serialVersionUID = 1L;
}
