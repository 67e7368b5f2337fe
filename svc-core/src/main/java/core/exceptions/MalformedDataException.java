package core.exceptions;

public class MalformedDataException extends ReconcileException
{
  private static final long serialVersionUID = 8034513216970412858L;

  public MalformedDataException( String msg )
  {
    super( msg );
  }

  public MalformedDataException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
