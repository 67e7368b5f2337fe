package core.slots;

import java.util.Locale;

/**
 * What the owning process does once the slot replicator has terminated on a
 * fault.
 */
public enum RestartPolicy
{
  /** Leave it terminated. Slots stop being mirrored until the process restarts. */
  NEVER,

  /** Undeploy and deploy a fresh replicator. */
  REDEPLOY;

  public static RestartPolicy fromString( String value )
  {
    if( value == null || value.isBlank() )
    {
      return NEVER;
    }
    return RestartPolicy.valueOf( value.trim().toUpperCase( Locale.ROOT ) );
  }
}
