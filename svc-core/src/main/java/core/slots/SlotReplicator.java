package core.slots;

import java.time.Duration;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.SlotOperationException;
import core.model.ReplicationSlotsConfig;

/**
 * Keeps the local replication slots in sync with the primary's.
 *
 * Events are handed in one at a time by the owner, which must never call
 * {@link #onEvent(SlotReplicatorEvent)} concurrently. A configuration is
 * therefore only ever replaced between two passes.
 *
 * <pre>
 *   WAITING_FOR_CONFIG --config--> IDLE | ACTIVE
 *   IDLE   --config (enabled)-->   ACTIVE
 *   ACTIVE --config (disabled)-->  IDLE
 *   any    --cancel | fault-->     TERMINATED
 * </pre>
 */
public class SlotReplicator
{
  private static final Logger LOGGER = LoggerFactory.getLogger( SlotReplicator.class );

  public enum State
  {
    WAITING_FOR_CONFIG,
    IDLE,
    ACTIVE,
    TERMINATED
  }

  private final String                  podName;
  private final Supplier<SlotManagerIF> primaryManagers;
  private final Supplier<SlotManagerIF> localManagers;
  private final SlotTickerIF            ticker;

  private State                  state            = State.WAITING_FOR_CONFIG;
  private ReplicationSlotsConfig config           = null;
  private Duration               tickInterval     = null;
  private Throwable              terminationCause = null;
  private long                   passCount        = 0;
  private long                   failedPassCount  = 0;

  /**
   * @param primaryManagers supplies a new manager for the primary on every pass
   * @param localManagers   supplies a new manager for the local instance on every pass
   */
  public SlotReplicator( String                  podName,
                         Supplier<SlotManagerIF> primaryManagers,
                         Supplier<SlotManagerIF> localManagers,
                         SlotTickerIF            ticker )
  {
    this.podName         = podName;
    this.primaryManagers = primaryManagers;
    this.localManagers   = localManagers;
    this.ticker          = ticker;
  }

  /**
   * Consumes one event. A runtime fault raised while handling it terminates
   * the replicator; the cause is then available from
   * {@link #getTerminationCause()}.
   *
   * @return the state after the event
   */
  public State onEvent( SlotReplicatorEvent event )
  {
    if( state == State.TERMINATED )
    {
      LOGGER.debug( "Slot replicator for pod {} is terminated, ignoring {}", podName, event );
      return state;
    }

    try
    {
      switch( event.getType() )
      {
        case CANCEL:
          LOGGER.info( "Slot replicator for pod {} cancelled", podName );
          terminate( null );
          break;

        case CONFIG:
          handleConfig( event.getConfig() );
          break;

        case TICK:
          reconcile();
          break;

        default:
          throw new IllegalStateException( "Unknown slot replicator event " + event );
      }
    }
    catch( RuntimeException e )
    {
      LOGGER.error( "Slot replicator for pod {} failed, terminating", podName, e );
      terminate( e );
    }

    return state;
  }

  private void handleConfig( ReplicationSlotsConfig newConfig )
  {
    boolean first = state == State.WAITING_FOR_CONFIG;

    LOGGER.info( "Slot replicator for pod {} received configuration {}", podName, newConfig );
    config = newConfig;

    if( first )
    {
      // The first configuration only arms the tick; the first pass runs on the first tick
      if( isEnabled() )
      {
        tickInterval = config.getUpdateInterval();
        ticker.start( tickInterval );
        state = State.ACTIVE;
      }
      else
      {
        state = State.IDLE;
      }
      return;
    }

    reconcile();
  }

  private void reconcile()
  {
    if( !isEnabled() )
    {
      if( ticker.isRunning() )
      {
        LOGGER.info( "Replication slot synchronization disabled for pod {}, stopping the tick", podName );
        ticker.stop();
      }
      state = State.IDLE;
      return;
    }

    Duration interval = config.getUpdateInterval();
    if( !ticker.isRunning() )
    {
      LOGGER.info( "Replication slot synchronization enabled for pod {}, ticking every {}", podName, interval );
      ticker.start( interval );
    }
    else if( !interval.equals( tickInterval ) )
    {
      LOGGER.info( "Slot update interval for pod {} changed from {} to {}", podName, tickInterval, interval );
      ticker.reset( interval );
    }
    tickInterval = interval;
    state        = State.ACTIVE;

    runPass( config );
  }

  private void runPass( ReplicationSlotsConfig passConfig )
  {
    passCount++;
    try
    {
      SlotSynchronizer.synchronizeReplicationSlots( primaryManagers.get(), localManagers.get(), podName, passConfig );
    }
    catch( SlotOperationException e )
    {
      failedPassCount++;
      LOGGER.error( "Error synchronizing replication slots for pod {} - operation = {}, slot = {}",
                    podName, e.getOperation(), e.getSlotName(), e );
    }
  }

  private void terminate( Throwable cause )
  {
    state            = State.TERMINATED;
    terminationCause = cause;

    if( ticker.isRunning() )
    {
      try
      {
        ticker.stop();
      }
      catch( RuntimeException e )
      {
        LOGGER.warn( "Failed to stop the slot tick for pod {}", podName, e );
      }
    }
  }

  private boolean isEnabled()
  {
    return config != null && config.isHighAvailabilityEnabled();
  }

  public State getState()
  {
    return state;
  }

  public String getPodName()
  {
    return podName;
  }

  public ReplicationSlotsConfig getConfig()
  {
    return config;
  }

  /**
   * @return the fault that terminated the replicator, or null when it is
   *         running or was cancelled
   */
  public Throwable getTerminationCause()
  {
    return terminationCause;
  }

  public long getPassCount()
  {
    return passCount;
  }

  public long getFailedPassCount()
  {
    return failedPassCount;
  }
}
