package core.handler;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.ConflictException;
import core.exceptions.NotFoundException;
import core.exceptions.StoreException;
import core.model.SecretRecord;

/**
 * Secret store backed by Kubernetes Secrets. The API server performs the
 * compare-and-swap on resourceVersion for every update.
 */
public class KubernetesSecretStore implements SecretStoreIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KubernetesSecretStore.class );

  private static final int HTTP_NOT_FOUND = 404;
  private static final int HTTP_CONFLICT  = 409;

  private static final Map<String, String> Labels = Map.of( "app.kubernetes.io/managed-by", "postgresql-operator",
                                                             "app.kubernetes.io/component",  "webhook-pki" );

  private final KubernetesClient kubeClient;

  public KubernetesSecretStore( KubernetesClient kubeClient )
  {
    this.kubeClient = kubeClient;
  }

  @Override
  public SecretRecord get( String namespace, String name )
    throws NotFoundException, StoreException
  {
    Secret secret;
    try
    {
      secret = kubeClient.secrets().inNamespace( namespace ).withName( name ).get();
    }
    catch( KubernetesClientException e )
    {
      if( e.getCode() == HTTP_NOT_FOUND )
      {
        throw new NotFoundException( "Secret not found: " + namespace + "/" + name, e );
      }
      throw new StoreException( "Failed to read secret " + namespace + "/" + name, e );
    }

    if( secret == null )
    {
      throw new NotFoundException( "Secret not found: " + namespace + "/" + name );
    }
    return toRecord( secret );
  }

  @Override
  public SecretRecord create( SecretRecord record )
    throws ConflictException, StoreException
  {
    Secret secret = new SecretBuilder().withNewMetadata()
                                         .withName( record.getName() )
                                         .withNamespace( record.getNamespace() )
                                         .withLabels( Labels )
                                       .endMetadata()
                                       .withType( "Opaque" )
                                       .withData( encode( record.getData() ) )
                                       .build();
    try
    {
      Secret created = kubeClient.secrets().inNamespace( record.getNamespace() ).resource( secret ).create();
      LOGGER.info( "Created secret {}/{}", record.getNamespace(), record.getName() );

      return toRecord( created );
    }
    catch( KubernetesClientException e )
    {
      if( e.getCode() == HTTP_CONFLICT )
      {
        throw new ConflictException( "Secret already exists: " + record.getNamespace() + "/" + record.getName(), e );
      }
      throw new StoreException( "Failed to create secret " + record.getNamespace() + "/" + record.getName(), e );
    }
  }

  /**
   * Replaces the data of the live Secret. Its type, labels, annotations and
   * owner references are kept; the record's resourceVersion is sent so the
   * update fails when the Secret changed since the record was read.
   */
  @Override
  public SecretRecord update( SecretRecord record )
    throws ConflictException, StoreException
  {
    String secretId = record.getNamespace() + "/" + record.getName();

    try
    {
      Secret existing = kubeClient.secrets().inNamespace( record.getNamespace() ).withName( record.getName() ).get();
      if( existing == null )
      {
        throw new ConflictException( "Secret " + secretId + " was deleted before it could be updated" );
      }

      Secret secret = new SecretBuilder( existing ).editMetadata()
                                                     .withResourceVersion( record.getResourceVersion() )
                                                     .addToLabels( Labels )
                                                   .endMetadata()
                                                   .withData( encode( record.getData() ) )
                                                   .build();

      Secret updated = kubeClient.secrets().inNamespace( record.getNamespace() ).resource( secret ).update();
      LOGGER.info( "Updated secret {} - resourceVersion {} -> {}", secretId,
                   record.getResourceVersion(), updated.getMetadata().getResourceVersion() );

      return toRecord( updated );
    }
    catch( KubernetesClientException e )
    {
      if( e.getCode() == HTTP_CONFLICT )
      {
        throw new ConflictException( "Stale resourceVersion " + record.getResourceVersion() + " updating secret " + secretId, e );
      }
      throw new StoreException( "Failed to update secret " + secretId, e );
    }
  }

  static SecretRecord toRecord( Secret secret )
  {
    Map<String, byte[]> data = new HashMap<>();
    if( secret.getData() != null )
    {
      secret.getData().forEach( ( key, value ) -> data.put( key, value == null ? new byte[0] : Base64.getDecoder().decode( value ) ) );
    }

    return new SecretRecord( secret.getMetadata().getNamespace(),
                             secret.getMetadata().getName(),
                             secret.getMetadata().getResourceVersion(),
                             data );
  }

  private static Map<String, String> encode( Map<String, byte[]> data )
  {
    Map<String, String> encoded = new HashMap<>();
    data.forEach( ( key, value ) -> encoded.put( key, Base64.getEncoder().encodeToString( value ) ) );

    return encoded;
  }
}
