package core.exceptions;

/**
 * Base class for the checked failures raised while reconciling certificates
 * or replication slots. Callers that only need to log and wait for the next
 * scheduled run catch this type.
 */
public class ReconcileException extends Exception
{
  private static final long serialVersionUID = 3187442094119260517L;

  public ReconcileException( String msg )
  {
    super( msg );
  }

  public ReconcileException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
