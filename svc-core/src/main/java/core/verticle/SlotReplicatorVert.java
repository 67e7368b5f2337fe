package core.verticle;

import java.time.Duration;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.model.ReplicationSlotsConfig;
import core.model.ServiceCoreIF;
import core.slots.RestartPolicy;
import core.slots.SlotManagerIF;
import core.slots.SlotReplicator;
import core.slots.SlotReplicatorEvent;
import core.slots.SlotTickerIF;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;

/**
 * Hosts the {@link SlotReplicator}. Must be deployed with the worker
 * threading model: configuration messages, ticks and undeploy then all run
 * on this verticle's context, one at a time, and a pass may block on JDBC.
 *
 * Configurations arrive as JSON on {@link ServiceCoreIF#SlotReplicatorConfigAddress}.
 * When the replicator dies on a fault a JSON notice is published on
 * {@link ServiceCoreIF#SlotReplicatorTerminatedAddress} carrying the restart
 * policy the owner should apply.
 */
public class SlotReplicatorVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( SlotReplicatorVert.class );

  public static final String PodNameField       = "podName";
  public static final String DeploymentIdField  = "deploymentId";
  public static final String CauseField         = "cause";
  public static final String RestartPolicyField = "restartPolicy";

  private final String                  podName;
  private final Supplier<SlotManagerIF> primaryManagers;
  private final Supplier<SlotManagerIF> localManagers;
  private final RestartPolicy           restartPolicy;

  private SlotReplicator              replicator;
  private MessageConsumer<JsonObject> configConsumer;
  private boolean                     terminationReported = false;

  public SlotReplicatorVert( String                  podName,
                             Supplier<SlotManagerIF> primaryManagers,
                             Supplier<SlotManagerIF> localManagers,
                             RestartPolicy           restartPolicy )
  {
    this.podName         = podName;
    this.primaryManagers = primaryManagers;
    this.localManagers   = localManagers;
    this.restartPolicy   = restartPolicy;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    replicator     = new SlotReplicator( podName, primaryManagers, localManagers, new VertxTicker() );
    configConsumer = vertx.eventBus().consumer( ServiceCoreIF.SlotReplicatorConfigAddress, this::handleConfigMessage );

    Promise<Void> registered = Promise.promise();
    configConsumer.completionHandler( registered );

    registered.future()
      .onSuccess( v ->
      {
        LOGGER.info( "SlotReplicatorVert started for pod {}, waiting for configuration", podName );
        startPromise.complete();
      })
      .onFailure( err ->
      {
        LOGGER.error( "SlotReplicatorVert failed to register its configuration consumer", err );
        startPromise.fail( err );
      });
  }

  @Override
  public void stop( Promise<Void> stopPromise )
  {
    if( replicator != null )
    {
      dispatch( SlotReplicatorEvent.cancel() );
    }

    if( configConsumer != null )
    {
      configConsumer.unregister().onComplete( ar -> stopPromise.complete() );
    }
    else
    {
      stopPromise.complete();
    }
  }

  public SlotReplicator.State getState()
  {
    return replicator == null ? SlotReplicator.State.WAITING_FOR_CONFIG : replicator.getState();
  }

  private void handleConfigMessage( Message<JsonObject> msg )
  {
    ReplicationSlotsConfig config;
    try
    {
      config = msg.body() == null ? null : ReplicationSlotsConfig.fromJson( msg.body() );
    }
    catch( RuntimeException e )
    {
      LOGGER.warn( "Discarding malformed replication slot configuration for pod {}: {}", podName, msg.body(), e );
      return;
    }

    dispatch( SlotReplicatorEvent.config( config ) );
  }

  private void dispatch( SlotReplicatorEvent event )
  {
    SlotReplicator.State state = replicator.onEvent( event );

    if( state == SlotReplicator.State.TERMINATED && replicator.getTerminationCause() != null && !terminationReported )
    {
      terminationReported = true;
      reportTermination( replicator.getTerminationCause() );
    }
  }

  private void reportTermination( Throwable cause )
  {
    LOGGER.error( "Slot replicator for pod {} terminated, restart policy = {}", podName, restartPolicy );

    if( configConsumer != null )
    {
      configConsumer.unregister();
    }

    JsonObject notice = new JsonObject().put( PodNameField,       podName )
                                        .put( DeploymentIdField,  deploymentID() )
                                        .put( CauseField,         String.valueOf( cause ) )
                                        .put( RestartPolicyField, restartPolicy.name() );

    vertx.eventBus().publish( ServiceCoreIF.SlotReplicatorTerminatedAddress, notice );
  }

  /**
   * Periodic Vert.x timer. Its callbacks run on the verticle context.
   */
  private class VertxTicker implements SlotTickerIF
  {
    private long timerId = -1;

    @Override
    public void start( Duration period )
    {
      stop();
      timerId = vertx.setPeriodic( Math.max( 1L, period.toMillis() ), id -> dispatch( SlotReplicatorEvent.tick() ) );
    }

    @Override
    public void reset( Duration period )
    {
      start( period );
    }

    @Override
    public void stop()
    {
      if( timerId >= 0 )
      {
        vertx.cancelTimer( timerId );
        timerId = -1;
      }
    }

    @Override
    public boolean isRunning()
    {
      return timerId >= 0;
    }
  }
}
