package core.exceptions;

public class CryptoException extends ReconcileException
{
  private static final long serialVersionUID = 2908990171511790800L;

  public CryptoException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
