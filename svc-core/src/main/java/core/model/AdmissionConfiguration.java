package core.model;

import java.util.List;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.admissionregistration.v1.WebhookClientConfig;

/**
 * A fetched Mutating or Validating webhook configuration. The underlying
 * resource is kept as read so that an update only changes the CA bundle of
 * each webhook entry.
 */
public class AdmissionConfiguration
{
  private final WebhookKind               kind;
  private final HasMetadata               resource;
  private final List<WebhookClientConfig> clientConfigs;

  public AdmissionConfiguration( WebhookKind kind, HasMetadata resource, List<WebhookClientConfig> clientConfigs )
  {
    this.kind          = kind;
    this.resource      = resource;
    this.clientConfigs = clientConfigs;
  }

  public WebhookKind getKind()       { return kind;     }
  public HasMetadata getResource()   { return resource; }

  public String getName()
  {
    return resource.getMetadata().getName();
  }

  /**
   * Client configs of the webhook entries, in declaration order. Mutating a
   * returned element mutates the wrapped resource.
   */
  public List<WebhookClientConfig> getClientConfigs()
  {
    return clientConfigs;
  }
}
