package core.slots;

import core.model.ReplicationSlotsConfig;

/**
 * An event for the slot replicator. Only CONFIG events carry a payload, and
 * that payload may be null when the configuration has been removed.
 */
public final class SlotReplicatorEvent
{
  public enum Type
  {
    CONFIG,
    TICK,
    CANCEL
  }

  private static final SlotReplicatorEvent TickEvent   = new SlotReplicatorEvent( Type.TICK,   null );
  private static final SlotReplicatorEvent CancelEvent = new SlotReplicatorEvent( Type.CANCEL, null );

  private final Type                   type;
  private final ReplicationSlotsConfig config;

  private SlotReplicatorEvent( Type type, ReplicationSlotsConfig config )
  {
    this.type   = type;
    this.config = config;
  }

  public static SlotReplicatorEvent config( ReplicationSlotsConfig config )
  {
    return new SlotReplicatorEvent( Type.CONFIG, config );
  }

  public static SlotReplicatorEvent tick()
  {
    return TickEvent;
  }

  public static SlotReplicatorEvent cancel()
  {
    return CancelEvent;
  }

  public Type getType()
  {
    return type;
  }

  public ReplicationSlotsConfig getConfig()
  {
    return config;
  }

  @Override
  public String toString()
  {
    return type == Type.CONFIG ? "CONFIG(" + config + ")" : type.name();
  }
}
