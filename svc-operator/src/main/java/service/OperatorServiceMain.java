package service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.crypto.CertificateAuthority;
import core.handler.KubernetesAdmissionConfigStore;
import core.handler.KubernetesSecretStore;
import core.handler.WebhookCertificateManager;
import core.model.ChildVerticle;
import core.model.InstanceIF;
import core.model.OperatorIF;
import core.utils.ConfigReader;
import core.verticle.WebhookCertificateVert;

import utils.OperatorConfig;

/**
 * Operator process. Makes sure the webhook server has a valid certificate
 * before anything else starts, then keeps the CA and the certificate fresh
 * for the life of the process.
 *
 * Environment:
 *    POD_NAMESPACE      = namespace the operator runs in (defaults to the client's namespace)
 *    OPERATOR_CONFIGMAP = name of the operator ConfigMap (optional)
 */
public class OperatorServiceMain
{
  private static final Logger LOGGER = LoggerFactory.getLogger( OperatorServiceMain.class );

  private static final long DeployTimeoutSecs = 120;

  private final Vertx               vertx;
  private final KubernetesClient    kubeClient;
  private final OperatorConfig      operatorConfig;
  private final List<ChildVerticle> deployedVerticles = new ArrayList<ChildVerticle>();
  private final AtomicBoolean       cleanedUp         = new AtomicBoolean( false );

  public OperatorServiceMain()
  {
    try
    {
      this.vertx      = Vertx.vertx( new VertxOptions().setWorkerPoolSize( 4 )
                                                       .setMaxWorkerExecuteTime( 10 )
                                                       .setMaxWorkerExecuteTimeUnit( TimeUnit.MINUTES ) );
      this.kubeClient = new KubernetesClientBuilder().build();

      String nameSpace     = ConfigReader.getEnv( InstanceIF.PodNamespaceEnv, kubeClient.getNamespace() );
      String configMapName = ConfigReader.getEnv( OperatorIF.ConfigMapEnv, OperatorIF.DefaultConfigMap );

      ConfigReader reader = new ConfigReader( kubeClient, nameSpace );
      this.operatorConfig = new OperatorConfig( reader.getConfigPropertiesOrEmpty( configMapName ), nameSpace );
    }
    catch( Exception e )
    {
      String errMsg = "Error initializing OperatorServiceMain: " + e.getMessage();
      LOGGER.error( errMsg, e );
      throw new IllegalStateException( errMsg, e );
    }
  }

  public void start()
  {
    LOGGER.info( "Starting Operator Service..." );

    CertificateAuthority authority = new CertificateAuthority( Clock.systemUTC(),
                                                               CertificateAuthority.CertificateDuration,
                                                               CertificateAuthority.RenewalThresholdPercent,
                                                               operatorConfig.getCaCommonName() );

    WebhookCertificateManager certManager = new WebhookCertificateManager( new KubernetesSecretStore( kubeClient ),
                                                                           new KubernetesAdmissionConfigStore( kubeClient ),
                                                                           authority,
                                                                           operatorConfig.toWebhookEnvironment() );

    WebhookCertificateVert certVert = new WebhookCertificateVert( certManager,
                                                                  TimeUnit.MINUTES.toMillis( operatorConfig.getCertMaintenanceMinutes() ) );

    try
    {
      String deploymentId = vertx.deployVerticle( certVert, new DeploymentOptions() )
                                 .toCompletionStage()
                                 .toCompletableFuture()
                                 .get( DeployTimeoutSecs, TimeUnit.SECONDS );

      deployedVerticles.add( new ChildVerticle( certVert.getClass().getName(), deploymentId ) );
      LOGGER.info( "WebhookCertificateVert deployed successfully: {}", deploymentId );
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      LOGGER.error( "Interrupted while deploying WebhookCertificateVert" );
      cleanupResources();
      System.exit( 1 );
    }
    catch( Exception e )
    {
      LOGGER.error( "Fatal error setting up webhook certificates: {}", e.getMessage(), e );
      cleanupResources();
      System.exit( 1 );
    }
  }

  void cleanupResources()
  {
    if( !cleanedUp.compareAndSet( false, true ) )
    {
      return;
    }
    LOGGER.info( "Starting cleanup of resources" );

    for( int i = deployedVerticles.size() - 1; i >= 0; i-- )
    {
      ChildVerticle child    = deployedVerticles.get( i );
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
    deployedVerticles.clear();

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
    LOGGER.info( "OperatorServiceMain.main - Starting OperatorService" );

    final OperatorServiceMain operatorSvc = new OperatorServiceMain();

    Runtime.getRuntime().addShutdownHook( new Thread( () ->
    {
      LOGGER.info( "Shutdown hook triggered - cleaning up resources" );
      operatorSvc.cleanupResources();
    }));

    operatorSvc.start();
  }
}
