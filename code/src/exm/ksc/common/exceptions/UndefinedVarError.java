package exm.ksc.common.exceptions;

public class UndefinedVarError extends CompileException {

  public UndefinedVarError(int line, int col, String name) {
    super(line, col, "Undefined identifier '" + name + "'");
  }

  private static final long serialVersionUID = 1L;
}
