package core.verticle;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.vertx.core.Vertx;
import io.vertx.junit5.Checkpoint;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import core.exceptions.StoreException;
import core.handler.WebhookCertificateManager;
import core.handler.WebhookEnvironment;

@ExtendWith( VertxExtension.class )
public class WebhookCertificateVertTest
{
  @Test
  public void deploymentFailsWhenInitialSetupFails( Vertx vertx, VertxTestContext testContext )
    throws Exception
  {
    WebhookCertificateManager manager = mock( WebhookCertificateManager.class );
    doThrow( new StoreException( "apiserver unavailable", null ) ).when( manager ).setup();

    vertx.deployVerticle( new WebhookCertificateVert( manager, 50 ) )
      .onComplete( testContext.failing( err -> testContext.verify( () ->
      {
        assertThat( err instanceof StoreException, is( true ) );
        testContext.completeNow();
      })));
  }

  @Test
  public void setupRunsAgainOnEveryPeriod( Vertx vertx, VertxTestContext testContext )
    throws Exception
  {
    WebhookCertificateManager manager = mock( WebhookCertificateManager.class );
    Checkpoint                deployed = testContext.checkpoint();
    Checkpoint                runs     = testContext.laxCheckpoint( 3 );
    doAnswer( inv -> { runs.flag(); return null; } ).when( manager ).setup();

    vertx.deployVerticle( new WebhookCertificateVert( manager, 50 ) )
      .onComplete( testContext.succeeding( id -> deployed.flag() ) );

    assertThat( testContext.awaitCompletion( 5, TimeUnit.SECONDS ), is( true ) );
    verify( manager, atLeast( 3 ) ).setup();
  }

  @Test
  public void periodicFailureDoesNotStopTheSchedule( Vertx vertx, VertxTestContext testContext )
    throws Exception
  {
    WebhookCertificateManager manager = mock( WebhookCertificateManager.class );
    AtomicInteger             calls   = new AtomicInteger();
    CountDownLatch            latch   = new CountDownLatch( 4 );
    when( manager.getWebhookEnvironment() ).thenReturn( mock( WebhookEnvironment.class ) );

    doAnswer( inv ->
    {
      latch.countDown();
      if( calls.incrementAndGet() == 2 )
      {
        throw new StoreException( "transient", null );
      }
      return null;
    }).when( manager ).setup();

    vertx.deployVerticle( new WebhookCertificateVert( manager, 50 ) )
      .onComplete( testContext.succeeding( id -> vertx.executeBlocking( () -> latch.await( 5, TimeUnit.SECONDS ) )
                                                      .onComplete( testContext.succeeding( done -> testContext.verify( () ->
                                                      {
                                                        assertThat( done, is( true ) );
                                                        testContext.completeNow();
                                                      })))));
  }

  @Test
  public void overlappingRunIsSkipped( Vertx vertx, VertxTestContext testContext )
    throws Exception
  {
    WebhookCertificateManager manager = mock( WebhookCertificateManager.class );
    CountDownLatch            entered = new CountDownLatch( 1 );
    CountDownLatch            release = new CountDownLatch( 1 );

    doAnswer( inv ->
    {
      entered.countDown();
      release.await( 5, TimeUnit.SECONDS );
      return null;
    }).when( manager ).setup();

    WebhookCertificateVert vert = new WebhookCertificateVert( manager, 60_000 );
    vertx.deployVerticle( vert );

    assertThat( entered.await( 5, TimeUnit.SECONDS ), is( true ) );

    vertx.runOnContext( v -> vert.runSetup().onComplete( testContext.succeeding( skipped -> testContext.verify( () ->
    {
      verify( manager ).setup();
      release.countDown();
      testContext.completeNow();
    }))));
  }
}
