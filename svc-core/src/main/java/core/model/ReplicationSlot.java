package core.model;

/**
 * A physical replication slot as reported by one PostgreSQL instance.
 * Slots are compared by name only when diffing two instances.
 */
public record ReplicationSlot( String slotName, String slotType, boolean active, String restartLsn )
{
  public static final String PhysicalSlotType = "physical";

  public ReplicationSlot
  {
    if( slotName == null || slotName.isEmpty() )
    {
      throw new IllegalArgumentException( "Replication slot name is required" );
    }
    if( slotType == null )   slotType   = PhysicalSlotType;
    if( restartLsn == null ) restartLsn = "";
  }

  public static ReplicationSlot physical( String slotName, boolean active, String restartLsn )
  {
    return new ReplicationSlot( slotName, PhysicalSlotType, active, restartLsn );
  }

  public boolean hasRestartLsn()
  {
    return !restartLsn.isEmpty();
  }
}
