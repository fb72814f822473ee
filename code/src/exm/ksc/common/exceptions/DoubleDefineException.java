package exm.ksc.common.exceptions;

public class DoubleDefineException extends CompileException {

  public DoubleDefineException(int line, int col, String name) {
    super(line, col, "Redefinition of '" + name + "'");
  }

  public DoubleDefineException(String name) {
    super("Redefinition of '" + name + "'");
  }

  private static final long serialVersionUID = 1L;
}
