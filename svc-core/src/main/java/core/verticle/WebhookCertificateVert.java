package core.verticle;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.handler.WebhookCertificateManager;
import core.model.ServiceCoreIF;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.WorkerExecutor;

/**
 * Runs the webhook certificate setup once at deployment, failing the
 * deployment if that run fails, and then periodically for the life of the
 * verticle. A periodic run that fails is logged and the schedule goes on.
 */
public class WebhookCertificateVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( WebhookCertificateVert.class );

  private final WebhookCertificateManager certManager;
  private final long                      periodMs;
  private final AtomicBoolean             setupInProgress = new AtomicBoolean( false );

  private WorkerExecutor   workerExecutor;
  private long             timerId = -1;
  private volatile boolean stopped = false;

  public WebhookCertificateVert( WebhookCertificateManager certManager )
  {
    this( certManager, TimeUnit.MINUTES.toMillis( ServiceCoreIF.CertMaintenanceMinutes ) );
  }

  public WebhookCertificateVert( WebhookCertificateManager certManager, long periodMs )
  {
    this.certManager = certManager;
    this.periodMs    = periodMs;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    workerExecutor = vertx.createSharedWorkerExecutor( "webhook-cert-maintenance", 1 );

    runSetup()
      .onSuccess( v ->
      {
        timerId = vertx.setPeriodic( periodMs, id -> runScheduledSetup() );
        LOGGER.info( "WebhookCertificateVert started, maintenance every {} ms", periodMs );
        startPromise.complete();
      })
      .onFailure( err ->
      {
        LOGGER.error( "Initial webhook certificate setup failed", err );
        workerExecutor.close();
        startPromise.fail( err );
      });
  }

  @Override
  public void stop( Promise<Void> stopPromise )
  {
    stopped = true;
    if( timerId >= 0 )
    {
      vertx.cancelTimer( timerId );
      timerId = -1;
    }

    if( workerExecutor != null )
    {
      workerExecutor.close().onComplete( ar -> stopPromise.complete() );
    }
    else
    {
      stopPromise.complete();
    }
    LOGGER.info( "WebhookCertificateVert stopped" );
  }

  private void runScheduledSetup()
  {
    if( stopped )
    {
      return;
    }

    runSetup().onFailure( err -> LOGGER.error( "Scheduled webhook certificate maintenance failed - namespace = {}, secret = {}",
                                               certManager.getWebhookEnvironment().getOperatorNamespace(),
                                               certManager.getWebhookEnvironment().getSecretName(), err ) );
  }

  /**
   * Runs one setup on the worker executor. Completes immediately when a run
   * is already in progress.
   */
  Future<Void> runSetup()
  {
    if( !setupInProgress.compareAndSet( false, true ) )
    {
      LOGGER.warn( "Webhook certificate setup still running, skipping this run" );
      return Future.succeededFuture();
    }

    return workerExecutor.<Void>executeBlocking( () ->
    {
      certManager.setup();
      return null;
    }, false )
      .andThen( ar -> setupInProgress.set( false ) );
  }
}
