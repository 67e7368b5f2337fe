package handler;

import java.util.Map;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;

import io.vertx.core.Vertx;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.model.ReplicationSlotsConfig;
import core.model.ServiceCoreIF;

/**
 * Watches the replication slot ConfigMap and publishes every new
 * configuration to the slot replicator. A deleted ConfigMap is published as
 * an empty message, which puts the replicator to idle.
 */
public class ReplicationSlotsConfigWatcher
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ReplicationSlotsConfigWatcher.class );

  private static final long RewatchDelayMs = 5000;

  private final Vertx            vertx;
  private final KubernetesClient kubeClient;
  private final String           nameSpace;
  private final String           configMapName;

  private Watch                  watch          = null;
  private ReplicationSlotsConfig lastPublished  = null;
  private boolean                publishedEmpty = false;
  private volatile boolean       closed         = false;

  public ReplicationSlotsConfigWatcher( Vertx vertx, KubernetesClient kubeClient, String nameSpace, String configMapName )
  {
    this.vertx         = vertx;
    this.kubeClient    = kubeClient;
    this.nameSpace     = nameSpace;
    this.configMapName = configMapName;
  }

  /**
   * Publishes the current ConfigMap content, then starts watching it.
   */
  public void start()
  {
    ConfigMap current = kubeClient.configMaps().inNamespace( nameSpace ).withName( configMapName ).get();
    if( current != null )
    {
      handleEvent( Watcher.Action.ADDED, current );
    }
    else
    {
      LOGGER.warn( "Replication slot ConfigMap {}/{} not found, waiting for it", nameSpace, configMapName );
    }

    startWatch();
  }

  public void close()
  {
    closed = true;
    if( watch != null )
    {
      watch.close();
      watch = null;
    }
  }

  private void startWatch()
  {
    LOGGER.info( "Starting replication slot ConfigMap watcher: {} in namespace: {}", configMapName, nameSpace );

    watch = kubeClient.configMaps().inNamespace( nameSpace )
                                   .withName( configMapName )
                                   .watch( new Watcher<ConfigMap>()
    {
      @Override
      public void eventReceived( Action action, ConfigMap configMap )
      {
        handleEvent( action, configMap );
      }

      @Override
      public void onClose( WatcherException cause )
      {
        if( cause == null || closed )
        {
          LOGGER.info( "Replication slot ConfigMap watcher closed" );
          return;
        }

        LOGGER.error( "Replication slot ConfigMap watcher closed with error, restarting in {} ms", RewatchDelayMs, cause );
        vertx.setTimer( RewatchDelayMs, id ->
        {
          if( !closed )
          {
            vertx.executeBlocking( () ->
            {
              startWatch();
              return null;
            }).onFailure( err -> LOGGER.error( "Failed to restart replication slot ConfigMap watcher", err ) );
          }
        });
      }
    });
  }

  /**
   * Publishes the last known configuration again, for a replicator that was
   * deployed after it was first published.
   */
  public synchronized void republish()
  {
    if( lastPublished != null )
    {
      LOGGER.info( "Republishing replication slot configuration {}", lastPublished );
      vertx.eventBus().publish( ServiceCoreIF.SlotReplicatorConfigAddress, lastPublished.toJson() );
    }
  }

  synchronized void handleEvent( Watcher.Action action, ConfigMap configMap )
  {
    if( configMap == null || configMap.getMetadata() == null || !configMapName.equals( configMap.getMetadata().getName() ) )
    {
      return;
    }

    switch( action )
    {
      case ADDED:
      case MODIFIED:
        publishConfig( configMap );
        break;

      case DELETED:
        LOGGER.warn( "Replication slot ConfigMap {}/{} deleted", nameSpace, configMapName );
        lastPublished = null;
        if( !publishedEmpty )
        {
          publishedEmpty = true;
          vertx.eventBus().publish( ServiceCoreIF.SlotReplicatorConfigAddress, null );
        }
        break;

      default:
        LOGGER.debug( "Ignoring {} event for ConfigMap {}", action, configMapName );
    }
  }

  private void publishConfig( ConfigMap configMap )
  {
    Map<String, String> data = configMap.getData() == null ? Map.of() : configMap.getData();

    ReplicationSlotsConfig config;
    try
    {
      config = ReplicationSlotsConfig.fromMap( data );
    }
    catch( IllegalArgumentException e )
    {
      LOGGER.error( "Ignoring invalid replication slot ConfigMap {}/{}: {}", nameSpace, configMapName, e.getMessage() );
      return;
    }

    if( Objects.equals( config, lastPublished ) )
    {
      LOGGER.debug( "Replication slot configuration unchanged" );
      return;
    }

    lastPublished  = config;
    publishedEmpty = false;

    LOGGER.info( "Publishing replication slot configuration {}", config );
    vertx.eventBus().publish( ServiceCoreIF.SlotReplicatorConfigAddress, config.toJson() );
  }
}
