package core.slots;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.SlotOperationException;
import core.model.ReplicationSlot;
import core.model.ReplicationSlotsConfig;
import core.model.SlotList;

/**
 * Slot manager backed by one PostgreSQL instance. Every call opens its own
 * connection from the factory and closes it before returning.
 */
public class PostgresSlotManager implements SlotManagerIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( PostgresSlotManager.class );

  static final String ListSlotsSql  = "SELECT slot_name, slot_type, active, coalesce(restart_lsn::TEXT, '') AS restart_lsn " +
                                      "FROM pg_catalog.pg_replication_slots " +
                                      "WHERE NOT temporary AND slot_type = 'physical' AND slot_name ^@ ?";
  static final String CreateSlotSql  = "SELECT pg_catalog.pg_create_physical_replication_slot(?, ?)";
  static final String AdvanceSlotSql = "SELECT pg_catalog.pg_replication_slot_advance(?, ?::pg_lsn)";
  static final String DropSlotSql    = "SELECT pg_catalog.pg_drop_replication_slot(?)";

  private final String              instanceName;
  private final ConnectionFactoryIF connectionFactory;

  public PostgresSlotManager( String instanceName, ConnectionFactoryIF connectionFactory )
  {
    this.instanceName      = instanceName;
    this.connectionFactory = connectionFactory;
  }

  public String getInstanceName()
  {
    return instanceName;
  }

  @Override
  public SlotList list( String podName, ReplicationSlotsConfig config )
    throws SlotOperationException
  {
    List<ReplicationSlot> slots = new ArrayList<>();

    try( Connection conn = connectionFactory.connect();
         PreparedStatement stmt = conn.prepareStatement( ListSlotsSql ) )
    {
      stmt.setString( 1, config.getSlotPrefix() );

      try( ResultSet rs = stmt.executeQuery() )
      {
        while( rs.next() )
        {
          slots.add( new ReplicationSlot( rs.getString( "slot_name" ),
                                          rs.getString( "slot_type" ),
                                          rs.getBoolean( "active" ),
                                          rs.getString( "restart_lsn" ) ) );
        }
      }
    }
    catch( SQLException e )
    {
      throw new SlotOperationException( SlotOperation.LIST, null,
                                        "Failed to list replication slots on " + instanceName + " for pod " + podName, e );
    }

    LOGGER.debug( "Listed {} slot(s) with prefix {} on {}", slots.size(), config.getSlotPrefix(), instanceName );
    return new SlotList( slots );
  }

  @Override
  public void create( ReplicationSlot slot )
    throws SlotOperationException
  {
    try( Connection conn = connectionFactory.connect();
         PreparedStatement stmt = conn.prepareStatement( CreateSlotSql ) )
    {
      stmt.setString(  1, slot.slotName() );
      stmt.setBoolean( 2, slot.hasRestartLsn() );
      stmt.execute();
    }
    catch( SQLException e )
    {
      throw failure( SlotOperation.CREATE, slot, e );
    }

    LOGGER.info( "Created replication slot {} on {}", slot.slotName(), instanceName );
  }

  @Override
  public void update( ReplicationSlot slot )
    throws SlotOperationException
  {
    if( !slot.hasRestartLsn() )
    {
      return;
    }

    try( Connection conn = connectionFactory.connect();
         PreparedStatement stmt = conn.prepareStatement( AdvanceSlotSql ) )
    {
      stmt.setString( 1, slot.slotName() );
      stmt.setString( 2, slot.restartLsn() );
      stmt.execute();
    }
    catch( SQLException e )
    {
      throw failure( SlotOperation.UPDATE, slot, e );
    }

    LOGGER.debug( "Advanced replication slot {} on {} to {}", slot.slotName(), instanceName, slot.restartLsn() );
  }

  @Override
  public void delete( ReplicationSlot slot )
    throws SlotOperationException
  {
    if( slot.active() )
    {
      LOGGER.debug( "Replication slot {} on {} is active, not dropping it", slot.slotName(), instanceName );
      return;
    }

    try( Connection conn = connectionFactory.connect();
         PreparedStatement stmt = conn.prepareStatement( DropSlotSql ) )
    {
      stmt.setString( 1, slot.slotName() );
      stmt.execute();
    }
    catch( SQLException e )
    {
      throw failure( SlotOperation.DELETE, slot, e );
    }

    LOGGER.info( "Dropped replication slot {} on {}", slot.slotName(), instanceName );
  }

  private SlotOperationException failure( SlotOperation operation, ReplicationSlot slot, SQLException e )
  {
    return new SlotOperationException( operation, slot.slotName(),
                                       "Failed to " + operation.name().toLowerCase( Locale.ROOT ) + " replication slot " + slot.slotName() +
                                       " on " + instanceName + " (SQLState " + e.getSQLState() + ")", e );
  }

  @Override
  public String toString()
  {
    return "PostgresSlotManager{" + instanceName + "}";
  }
}
