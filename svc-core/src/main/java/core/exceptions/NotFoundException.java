package core.exceptions;

public class NotFoundException extends ReconcileException
{
  private static final long serialVersionUID = 4757120132833816243L;

  public NotFoundException( String msg )
  {
    super( msg );
  }

  public NotFoundException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
