package core.exceptions;

/**
 * Raised when an update carried a stale resourceVersion. The caller is
 * expected to read the record again and re-apply its change.
 */
public class ConflictException extends ReconcileException
{
  private static final long serialVersionUID = 6621880937051728931L;

  public ConflictException( String msg )
  {
    super( msg );
  }

  public ConflictException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
