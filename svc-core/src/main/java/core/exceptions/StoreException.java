package core.exceptions;

/**
 * Transient failure talking to the Kubernetes API. Retried implicitly by the
 * next maintenance run.
 */
public class StoreException extends ReconcileException
{
  private static final long serialVersionUID = 1290416675306012483L;

  public StoreException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
