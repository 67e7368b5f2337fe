package core.slots;

import core.exceptions.SlotOperationException;
import core.model.ReplicationSlot;
import core.model.ReplicationSlotsConfig;
import core.model.SlotList;

/**
 * Reads and mutates the replication slots of one database instance. Two
 * instances exist at runtime, one for the primary and one for the local
 * replica; they never share a connection.
 */
public interface SlotManagerIF
{
  /**
   * Lists the slots managed under {@code config}, freshly read on every call.
   */
  SlotList list( String podName, ReplicationSlotsConfig config ) throws SlotOperationException;

  void create( ReplicationSlot slot ) throws SlotOperationException;

  void update( ReplicationSlot slot ) throws SlotOperationException;

  void delete( ReplicationSlot slot ) throws SlotOperationException;
}
