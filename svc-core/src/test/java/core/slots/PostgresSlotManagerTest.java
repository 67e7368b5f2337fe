package core.slots;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import core.exceptions.SlotOperationException;
import core.model.ReplicationSlot;
import core.model.ReplicationSlotsConfig;
import core.model.SlotList;

@ExtendWith( MockitoExtension.class )
public class PostgresSlotManagerTest
{
  @Mock
  private ConnectionFactoryIF connections;

  @Mock
  private Connection connection;

  @Mock
  private PreparedStatement statement;

  @Mock
  private ResultSet resultSet;

  private PostgresSlotManager manager;

  @BeforeEach
  public void setUp()
  {
    manager = new PostgresSlotManager( "primary", connections );
  }

  private void expectStatement( String sql )
    throws SQLException
  {
    when( connections.connect() ).thenReturn( connection );
    when( connection.prepareStatement( sql ) ).thenReturn( statement );
  }

  @Test
  public void listMapsRowsAndFiltersByPrefix()
    throws Exception
  {
    expectStatement( PostgresSlotManager.ListSlotsSql );
    when( statement.executeQuery() ).thenReturn( resultSet );
    when( resultSet.next() ).thenReturn( true, true, false );
    when( resultSet.getString( "slot_name" ) ).thenReturn( "_cnpg_pg_1", "_cnpg_pg_3" );
    when( resultSet.getString( "slot_type" ) ).thenReturn( "physical", "physical" );
    when( resultSet.getBoolean( "active" ) ).thenReturn( true, false );
    when( resultSet.getString( "restart_lsn" ) ).thenReturn( "0/5000128", "" );

    SlotList slots = manager.list( "pg-2", ReplicationSlotsConfig.enabled( Duration.ofSeconds( 10 ) ) );

    assertThat( slots.size(), is( 2 ) );
    assertThat( slots.has( "_cnpg_pg_1" ), is( true ) );

    ReplicationSlot second = slots.getItems().get( 1 );
    assertThat( second.slotName(), is( "_cnpg_pg_3" ) );
    assertThat( second.active(), is( false ) );
    assertThat( second.hasRestartLsn(), is( false ) );

    verify( statement ).setString( 1, ReplicationSlotsConfig.DefaultSlotPrefix );
    verify( resultSet ).close();
    verify( statement ).close();
    verify( connection ).close();
  }

  @Test
  public void createReservesWalOnlyWhenThePrimaryHasAPosition()
    throws Exception
  {
    expectStatement( PostgresSlotManager.CreateSlotSql );

    manager.create( ReplicationSlot.physical( "_cnpg_pg_1", false, "0/5000128" ) );

    verify( statement ).setString( 1, "_cnpg_pg_1" );
    verify( statement ).setBoolean( 2, true );
    verify( statement ).execute();
    verify( connection ).close();
  }

  @Test
  public void createWithoutPositionDoesNotReserveWal()
    throws Exception
  {
    expectStatement( PostgresSlotManager.CreateSlotSql );

    manager.create( ReplicationSlot.physical( "_cnpg_pg_1", false, "" ) );

    verify( statement ).setBoolean( 2, false );
  }

  @Test
  public void updateAdvancesToThePrimaryPosition()
    throws Exception
  {
    expectStatement( PostgresSlotManager.AdvanceSlotSql );

    manager.update( ReplicationSlot.physical( "_cnpg_pg_1", true, "0/5000128" ) );

    verify( statement ).setString( 1, "_cnpg_pg_1" );
    verify( statement ).setString( 2, "0/5000128" );
    verify( statement ).execute();
  }

  @Test
  public void updateWithoutPositionIsSkipped()
    throws Exception
  {
    manager.update( ReplicationSlot.physical( "_cnpg_pg_1", false, "" ) );

    verifyNoInteractions( connections );
  }

  @Test
  public void activeSlotIsNotDropped()
    throws Exception
  {
    manager.delete( ReplicationSlot.physical( "_cnpg_pg_1", true, "0/5000128" ) );

    verify( connections, never() ).connect();
  }

  @Test
  public void inactiveSlotIsDropped()
    throws Exception
  {
    expectStatement( PostgresSlotManager.DropSlotSql );

    manager.delete( ReplicationSlot.physical( "_cnpg_pg_1", false, "0/5000128" ) );

    verify( statement ).setString( 1, "_cnpg_pg_1" );
    verify( statement ).execute();
  }

  @Test
  public void sqlErrorIsTaggedWithOperationAndSlot()
    throws Exception
  {
    SQLException cause = new SQLException( "replication slot \"_cnpg_pg_1\" already exists", "42710" );
    expectStatement( PostgresSlotManager.CreateSlotSql );
    when( statement.execute() ).thenThrow( cause );

    SlotOperationException e = assertThrows( SlotOperationException.class,
                                             () -> manager.create( ReplicationSlot.physical( "_cnpg_pg_1", false, "" ) ) );

    assertThat( e.getOperation(), is( SlotOperation.CREATE ) );
    assertThat( e.getSlotName(), is( "_cnpg_pg_1" ) );
    assertThat( e.getMessage(), containsString( "42710" ) );
    assertThat( e.getCause(), is( sameInstance( (Throwable)cause ) ) );
    verify( connection ).close();
  }

  @Test
  public void connectionFailureOnListIsTagged()
    throws Exception
  {
    when( connections.connect() ).thenThrow( new SQLException( "Connection refused" ) );

    SlotOperationException e = assertThrows( SlotOperationException.class,
                                             () -> manager.list( "pg-2", ReplicationSlotsConfig.enabled( Duration.ofSeconds( 10 ) ) ) );

    assertThat( e.getOperation(), is( SlotOperation.LIST ) );
    assertThat( e.getSlotName(), is( nullValue() ) );
  }
}
