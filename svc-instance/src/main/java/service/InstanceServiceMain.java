package service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.ThreadingModel;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.eventbus.Message;
import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.model.ChildVerticle;
import core.model.InstanceIF;
import core.model.ServiceCoreIF;
import core.slots.PostgresConnectionFactory;
import core.slots.PostgresSlotManager;
import core.slots.RestartPolicy;
import core.slots.SlotManagerIF;
import core.utils.ConfigReader;
import core.verticle.SlotReplicatorVert;

import handler.ReplicationSlotsConfigWatcher;

import utils.InstanceConfig;

/**
 * Instance manager process running next to a PostgreSQL replica. Mirrors the
 * primary's physical replication slots onto the local instance.
 *
 * Environment:
 *    POD_NAME            = name of this pod (required)
 *    POD_NAMESPACE       = namespace of this pod (defaults to the client's namespace)
 *    INSTANCE_CONFIGMAP  = name of the instance ConfigMap (optional)
 *    PRIMARY_DB_PASSWORD = password for the primary connection (optional)
 *    LOCAL_DB_PASSWORD   = password for the local connection (optional)
 */
public class InstanceServiceMain
{
  private static final Logger LOGGER = LoggerFactory.getLogger( InstanceServiceMain.class );

  private static final long DeployTimeoutSecs = 60;

  private final Vertx               vertx;
  private final KubernetesClient    kubeClient;
  private final InstanceConfig      instanceConfig;
  private final String              nameSpace;
  private final String              podName;
  private final List<ChildVerticle> deployedVerticles = new ArrayList<ChildVerticle>();
  private final AtomicBoolean       cleanedUp         = new AtomicBoolean( false );

  private ReplicationSlotsConfigWatcher configWatcher = null;

  public InstanceServiceMain()
  {
    try
    {
      this.podName = System.getenv( InstanceIF.PodNameEnv );
      if( podName == null || podName.isEmpty() )
      {
        throw new IllegalArgumentException( InstanceIF.PodNameEnv + " environment variable must be set" );
      }

      this.vertx      = Vertx.vertx( new VertxOptions().setWorkerPoolSize( 4 )
                                                       .setMaxWorkerExecuteTime( 10 )
                                                       .setMaxWorkerExecuteTimeUnit( TimeUnit.MINUTES ) );
      this.kubeClient = new KubernetesClientBuilder().build();
      this.nameSpace  = ConfigReader.getEnv( InstanceIF.PodNamespaceEnv, kubeClient.getNamespace() );

      String configMapName = ConfigReader.getEnv( InstanceIF.ConfigMapEnv, InstanceIF.DefaultConfigMap );
      this.instanceConfig  = new InstanceConfig( new ConfigReader( kubeClient, nameSpace ).getConfigProperties( configMapName ) );
    }
    catch( Exception e )
    {
      String errMsg = "Error initializing InstanceServiceMain: " + e.getMessage();
      LOGGER.error( errMsg, e );
      throw new IllegalStateException( errMsg, e );
    }
  }

  public void start()
  {
    LOGGER.info( "Starting Instance Service for pod {} in namespace {}", podName, nameSpace );

    vertx.eventBus().<JsonObject>consumer( ServiceCoreIF.SlotReplicatorTerminatedAddress, this::handleReplicatorTerminated );

    try
    {
      deploySlotReplicator().toCompletionStage().toCompletableFuture().get( DeployTimeoutSecs, TimeUnit.SECONDS );

      configWatcher = new ReplicationSlotsConfigWatcher( vertx, kubeClient, nameSpace, instanceConfig.getSlotsConfigMapName() );
      configWatcher.start();
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      LOGGER.error( "Interrupted while starting the slot replicator" );
      cleanupResources();
      System.exit( 1 );
    }
    catch( Exception e )
    {
      LOGGER.error( "Fatal error starting the slot replicator: {}", e.getMessage(), e );
      cleanupResources();
      System.exit( 1 );
    }
  }

  private Future<String> deploySlotReplicator()
  {
    PostgresConnectionFactory primaryConnections = new PostgresConnectionFactory( "primary",
                                                                                  instanceConfig.getPrimaryJdbcUrl(),
                                                                                  instanceConfig.getDatabaseUser(),
                                                                                  System.getenv( InstanceIF.PrimaryPasswordEnv ),
                                                                                  instanceConfig.getApplicationName() );
    PostgresConnectionFactory localConnections   = new PostgresConnectionFactory( "local",
                                                                                  instanceConfig.getLocalJdbcUrl(),
                                                                                  instanceConfig.getDatabaseUser(),
                                                                                  System.getenv( InstanceIF.LocalPasswordEnv ),
                                                                                  instanceConfig.getApplicationName() );

    Supplier<SlotManagerIF> primaryManagers = () -> new PostgresSlotManager( "primary", primaryConnections );
    Supplier<SlotManagerIF> localManagers   = () -> new PostgresSlotManager( "local",   localConnections   );

    SlotReplicatorVert replicatorVert = new SlotReplicatorVert( podName, primaryManagers, localManagers, instanceConfig.getRestartPolicy() );

    return vertx.deployVerticle( replicatorVert, new DeploymentOptions().setThreadingModel( ThreadingModel.WORKER ) )
      .onSuccess( id ->
      {
        synchronized( deployedVerticles )
        {
          deployedVerticles.add( new ChildVerticle( replicatorVert.getClass().getName(), id ) );
        }
        LOGGER.info( "SlotReplicatorVert deployed successfully: {}", id );
      });
  }

  private void handleReplicatorTerminated( Message<JsonObject> msg )
  {
    JsonObject    notice       = msg.body();
    String        deploymentId = notice.getString( SlotReplicatorVert.DeploymentIdField );
    RestartPolicy policy       = RestartPolicy.fromString( notice.getString( SlotReplicatorVert.RestartPolicyField ) );

    LOGGER.error( "Slot replicator {} for pod {} terminated: {}", deploymentId, podName, notice.getString( SlotReplicatorVert.CauseField ) );

    if( policy != RestartPolicy.REDEPLOY || cleanedUp.get() )
    {
      LOGGER.error( "Replication slots are no longer synchronized for pod {} (restart policy = {})", podName, policy );
      return;
    }

    synchronized( deployedVerticles )
    {
      deployedVerticles.removeIf( child -> child.id().equals( deploymentId ) );
    }

    vertx.undeploy( deploymentId )
      .recover( err ->
      {
        LOGGER.warn( "Failed to undeploy terminated slot replicator {}: {}", deploymentId, err.getMessage() );
        return Future.succeededFuture();
      })
      .compose( v -> deploySlotReplicator() )
      .onSuccess( id ->
      {
        if( configWatcher != null )
        {
          configWatcher.republish();
        }
      })
      .onFailure( err -> LOGGER.error( "Failed to redeploy the slot replicator for pod {}", podName, err ) );
  }

  void cleanupResources()
  {
    if( !cleanedUp.compareAndSet( false, true ) )
    {
      return;
    }
    LOGGER.info( "Starting cleanup of resources" );

    if( configWatcher != null )
    {
      configWatcher.close();
    }

    List<ChildVerticle> verticlesToUndeploy;
    synchronized( deployedVerticles )
    {
      verticlesToUndeploy = new ArrayList<>( deployedVerticles );
      deployedVerticles.clear();
    }

    for( int i = verticlesToUndeploy.size() - 1; i >= 0; i-- )
    {
      ChildVerticle child    = verticlesToUndeploy.get( i );
      String        vertInfo = child.vertName() + " with id = " + child.id();

      try
      {
        vertx.undeploy( child.id() ).toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS );
        LOGGER.info( "Successfully undeployed verticle: {}", vertInfo );
      }
      catch( TimeoutException e )
      {
        LOGGER.warn( "Timeout while undeploying verticle {}", vertInfo );
      }
      catch( InterruptedException e )
      {
        LOGGER.warn( "Interrupted while undeploying verticle {}", vertInfo );
        Thread.currentThread().interrupt();
        break;
      }
      catch( Exception e )
      {
        LOGGER.warn( "Error while undeploying verticle {}: {}", vertInfo, e.getMessage(), e );
      }
    }

    try
    {
      kubeClient.close();
      LOGGER.info( "Kubernetes client closed" );
    }
    catch( Exception e )
    {
      LOGGER.warn( "Error while closing Kubernetes client: {}", e.getMessage(), e );
    }

    try
    {
      vertx.close().toCompletionStage().toCompletableFuture().get( 30, TimeUnit.SECONDS );
      LOGGER.info( "Vertx instance closed" );
    }
    catch( InterruptedException e )
    {
      LOGGER.warn( "Interrupted while closing Vertx instance" );
      Thread.currentThread().interrupt();
    }
    catch( Exception e )
    {
      LOGGER.warn( "Error while closing Vertx instance: {}", e.getMessage(), e );
    }
  }

  public static void main( String[] args )
  {
    LOGGER.info( "InstanceServiceMain.main - Starting InstanceService" );

    final InstanceServiceMain instanceSvc = new InstanceServiceMain();

    Runtime.getRuntime().addShutdownHook( new Thread( () ->
    {
      LOGGER.info( "Shutdown hook triggered - cleaning up resources" );
      instanceSvc.cleanupResources();
    }));

    instanceSvc.start();
  }
}
