package core.handler;

import java.util.ArrayList;
import java.util.List;

import io.fabric8.kubernetes.api.model.admissionregistration.v1.MutatingWebhook;
import io.fabric8.kubernetes.api.model.admissionregistration.v1.MutatingWebhookConfiguration;
import io.fabric8.kubernetes.api.model.admissionregistration.v1.ValidatingWebhook;
import io.fabric8.kubernetes.api.model.admissionregistration.v1.ValidatingWebhookConfiguration;
import io.fabric8.kubernetes.api.model.admissionregistration.v1.WebhookClientConfig;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.ConflictException;
import core.exceptions.NotFoundException;
import core.exceptions.StoreException;
import core.model.AdmissionConfiguration;
import core.model.WebhookKind;

/**
 * Reads and updates admissionregistration.k8s.io/v1 webhook configurations.
 */
public class KubernetesAdmissionConfigStore implements AdmissionConfigStoreIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KubernetesAdmissionConfigStore.class );

  private static final int HTTP_NOT_FOUND = 404;
  private static final int HTTP_CONFLICT  = 409;

  private final KubernetesClient kubeClient;

  public KubernetesAdmissionConfigStore( KubernetesClient kubeClient )
  {
    this.kubeClient = kubeClient;
  }

  @Override
  public AdmissionConfiguration get( WebhookKind kind, String name )
    throws NotFoundException, StoreException
  {
    try
    {
      switch( kind )
      {
        case MUTATING:
        {
          MutatingWebhookConfiguration config = kubeClient.admissionRegistration().v1()
                                                          .mutatingWebhookConfigurations()
                                                          .withName( name )
                                                          .get();
          if( config == null )
          {
            throw new NotFoundException( kind.getKubeKind() + " not found: " + name );
          }

          List<WebhookClientConfig> clientConfigs = new ArrayList<>();
          if( config.getWebhooks() != null )
          {
            for( MutatingWebhook webhook : config.getWebhooks() )
            {
              if( webhook.getClientConfig() == null )
              {
                webhook.setClientConfig( new WebhookClientConfig() );
              }
              clientConfigs.add( webhook.getClientConfig() );
            }
          }
          return new AdmissionConfiguration( kind, config, clientConfigs );
        }
        case VALIDATING:
        {
          ValidatingWebhookConfiguration config = kubeClient.admissionRegistration().v1()
                                                            .validatingWebhookConfigurations()
                                                            .withName( name )
                                                            .get();
          if( config == null )
          {
            throw new NotFoundException( kind.getKubeKind() + " not found: " + name );
          }

          List<WebhookClientConfig> clientConfigs = new ArrayList<>();
          if( config.getWebhooks() != null )
          {
            for( ValidatingWebhook webhook : config.getWebhooks() )
            {
              if( webhook.getClientConfig() == null )
              {
                webhook.setClientConfig( new WebhookClientConfig() );
              }
              clientConfigs.add( webhook.getClientConfig() );
            }
          }
          return new AdmissionConfiguration( kind, config, clientConfigs );
        }
        default:
          throw new IllegalArgumentException( "Unknown webhook kind: " + kind );
      }
    }
    catch( KubernetesClientException e )
    {
      if( e.getCode() == HTTP_NOT_FOUND )
      {
        throw new NotFoundException( kind.getKubeKind() + " not found: " + name, e );
      }
      throw new StoreException( "Failed to read " + kind.getKubeKind() + " " + name, e );
    }
  }

  @Override
  public void update( AdmissionConfiguration configuration )
    throws ConflictException, StoreException
  {
    WebhookKind kind = configuration.getKind();

    try
    {
      if( kind == WebhookKind.MUTATING )
      {
        kubeClient.admissionRegistration().v1()
                  .mutatingWebhookConfigurations()
                  .resource( (MutatingWebhookConfiguration)configuration.getResource() )
                  .update();
      }
      else
      {
        kubeClient.admissionRegistration().v1()
                  .validatingWebhookConfigurations()
                  .resource( (ValidatingWebhookConfiguration)configuration.getResource() )
                  .update();
      }

      LOGGER.info( "Updated {} {} with {} webhook CA bundle(s)", kind.getKubeKind(), configuration.getName(),
                   configuration.getClientConfigs().size() );
    }
    catch( KubernetesClientException e )
    {
      if( e.getCode() == HTTP_CONFLICT )
      {
        throw new ConflictException( "Conflict updating " + kind.getKubeKind() + " " + configuration.getName(), e );
      }
      throw new StoreException( "Failed to update " + kind.getKubeKind() + " " + configuration.getName(), e );
    }
  }
}
