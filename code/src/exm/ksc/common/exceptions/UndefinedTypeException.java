package exm.ksc.common.exceptions;

public class UndefinedTypeException
extends CompileException
{

  public UndefinedTypeException(int line, int col, String typeName)
  {
    super(line, col, "The following type was not defined in the current " +
        "scope: " + typeName);
  }

  private static final long serialVersionUID = 1L;
}
