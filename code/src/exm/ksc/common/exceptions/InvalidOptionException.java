package exm.ksc.common.exceptions;

/**
 * A configuration property or command line option had a bad value
 */
public class InvalidOptionException extends Exception {

  public InvalidOptionException(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
