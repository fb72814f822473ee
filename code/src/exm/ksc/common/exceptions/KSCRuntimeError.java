
package exm.ksc.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug (or missing feature).
 * */
public class KSCRuntimeError extends RuntimeException
{
  public KSCRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
