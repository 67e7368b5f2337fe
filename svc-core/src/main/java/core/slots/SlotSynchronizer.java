package core.slots;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.SlotOperationException;
import core.model.ReplicationSlot;
import core.model.ReplicationSlotsConfig;
import core.model.SlotList;

/**
 * One reconciliation pass: brings the local replication slots in line with
 * the primary's. The first failing call ends the pass; whatever was applied
 * before it stays applied.
 */
public final class SlotSynchronizer
{
  private static final Logger LOGGER = LoggerFactory.getLogger( SlotSynchronizer.class );

  private SlotSynchronizer()
  {
  }

  public static void synchronizeReplicationSlots( SlotManagerIF          primary,
                                                  SlotManagerIF          local,
                                                  String                 podName,
                                                  ReplicationSlotsConfig config )
    throws SlotOperationException
  {
    SlotList primarySlots = primary.list( podName, config );
    SlotList localSlots   = local.list( podName, config );

    int created = 0;
    int deleted = 0;

    for( ReplicationSlot slot : primarySlots.getItems() )
    {
      if( !localSlots.has( slot.slotName() ) )
      {
        local.create( slot );
        created++;
      }

      // Existing slots are updated too so their position follows the primary
      local.update( slot );
    }

    for( ReplicationSlot slot : localSlots.getItems() )
    {
      if( !primarySlots.has( slot.slotName() ) )
      {
        local.delete( slot );
        deleted++;
      }
    }

    LOGGER.debug( "Slot pass for pod {}: {} on primary, {} created, {} updated, {} deleted",
                  podName, primarySlots.size(), created, primarySlots.size(), deleted );
  }
}
