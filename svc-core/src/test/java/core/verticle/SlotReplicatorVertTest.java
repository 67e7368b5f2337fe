package core.verticle;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.ThreadingModel;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.Checkpoint;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import core.model.ReplicationSlot;
import core.model.ReplicationSlotsConfig;
import core.model.ServiceCoreIF;
import core.model.SlotList;
import core.slots.RestartPolicy;
import core.slots.SlotManagerIF;

@ExtendWith( VertxExtension.class )
public class SlotReplicatorVertTest
{
  private static final String POD = "pg-2";

  /**
   * Thread-safe slot table; the replicator touches it from a worker thread.
   */
  private static class SharedSlotManager implements SlotManagerIF
  {
    final Map<String, ReplicationSlot> slots = new ConcurrentHashMap<>();

    volatile RuntimeException fault    = null;
    volatile Runnable         onCreate = () -> {};

    SharedSlotManager with( String name )
    {
      slots.put( name, ReplicationSlot.physical( name, false, "0/3000060" ) );
      return this;
    }

    @Override
    public SlotList list( String podName, ReplicationSlotsConfig config )
    {
      if( fault != null )
      {
        throw fault;
      }
      List<ReplicationSlot> matching = new ArrayList<>();
      slots.values().stream().filter( s -> s.slotName().startsWith( config.getSlotPrefix() ) ).forEach( matching::add );
      return new SlotList( matching );
    }

    @Override
    public void create( ReplicationSlot slot )
    {
      slots.put( slot.slotName(), slot );
      onCreate.run();
    }

    @Override
    public void update( ReplicationSlot slot )
    {
      slots.put( slot.slotName(), slot );
    }

    @Override
    public void delete( ReplicationSlot slot )
    {
      slots.remove( slot.slotName() );
    }
  }

  private static DeploymentOptions worker()
  {
    return new DeploymentOptions().setThreadingModel( ThreadingModel.WORKER );
  }

  private static JsonObject enabledConfig()
  {
    return ReplicationSlotsConfig.enabled( Duration.ofMillis( 50 ) ).toJson();
  }

  @Test
  public void publishedConfigurationDrivesPasses( Vertx vertx, VertxTestContext testContext )
  {
    SharedSlotManager primary = new SharedSlotManager().with( "_cnpg_pg_1" );
    SharedSlotManager local   = new SharedSlotManager();
    Checkpoint        created = testContext.laxCheckpoint();

    local.onCreate = () -> testContext.verify( () ->
    {
      assertThat( local.slots.containsKey( "_cnpg_pg_1" ), is( true ) );
      created.flag();
    });

    SlotReplicatorVert vert = new SlotReplicatorVert( POD, () -> primary, () -> local, RestartPolicy.NEVER );

    vertx.deployVerticle( vert, worker() )
      .onComplete( testContext.succeeding( id ->
      {
        // Malformed bodies are dropped without affecting the replicator
        vertx.eventBus().publish( ServiceCoreIF.SlotReplicatorConfigAddress, new JsonObject().put( "updateIntervalMs", "soon" ) );
        vertx.eventBus().publish( ServiceCoreIF.SlotReplicatorConfigAddress, enabledConfig() );
      }));
  }

  @Test
  public void faultPublishesTerminationNotice( Vertx vertx, VertxTestContext testContext )
  {
    SharedSlotManager         primary      = new SharedSlotManager().with( "_cnpg_pg_1" );
    SharedSlotManager         local        = new SharedSlotManager();
    AtomicReference<String>   deploymentId = new AtomicReference<>();
    Checkpoint                noticed      = testContext.checkpoint();

    primary.fault = new IllegalStateException( "driver failure" );

    vertx.eventBus().<JsonObject>consumer( ServiceCoreIF.SlotReplicatorTerminatedAddress, msg -> testContext.verify( () ->
    {
      JsonObject notice = msg.body();
      assertThat( notice.getString( SlotReplicatorVert.PodNameField ), is( POD ) );
      assertThat( notice.getString( SlotReplicatorVert.DeploymentIdField ), is( deploymentId.get() ) );
      assertThat( notice.getString( SlotReplicatorVert.RestartPolicyField ), is( "REDEPLOY" ) );
      assertThat( notice.getString( SlotReplicatorVert.CauseField ), containsString( "driver failure" ) );
      noticed.flag();
    }));

    SlotReplicatorVert vert = new SlotReplicatorVert( POD, () -> primary, () -> local, RestartPolicy.REDEPLOY );

    vertx.deployVerticle( vert, worker() )
      .onComplete( testContext.succeeding( id ->
      {
        deploymentId.set( id );
        vertx.eventBus().publish( ServiceCoreIF.SlotReplicatorConfigAddress, enabledConfig() );
      }));
  }

  @Test
  public void undeployCancelsTheReplicator( Vertx vertx, VertxTestContext testContext )
  {
    SharedSlotManager  primary = new SharedSlotManager();
    SharedSlotManager  local   = new SharedSlotManager();
    SlotReplicatorVert vert    = new SlotReplicatorVert( POD, () -> primary, () -> local, RestartPolicy.NEVER );

    vertx.deployVerticle( vert, worker() )
      .compose( id -> vertx.undeploy( id ) )
      .onComplete( testContext.succeeding( v -> testContext.verify( () ->
      {
        assertThat( vert.getState().name(), is( "TERMINATED" ) );
        testContext.completeNow();
      })));
  }
}
