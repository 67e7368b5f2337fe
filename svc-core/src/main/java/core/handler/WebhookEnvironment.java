package core.handler;

import java.nio.file.Path;

import core.model.WebhookKind;

/**
 * Where the webhook server certificates live and which Kubernetes objects
 * carry them.
 */
public class WebhookEnvironment
{
  private final Path   certDir;
  private final String caSecretName;
  private final String secretName;
  private final String serviceName;
  private final String operatorNamespace;
  private final String mutatingWebhookConfigurationName;
  private final String validatingWebhookConfigurationName;

  public WebhookEnvironment( Path   certDir,
                             String caSecretName,
                             String secretName,
                             String serviceName,
                             String operatorNamespace,
                             String mutatingWebhookConfigurationName,
                             String validatingWebhookConfigurationName )
  {
    this.certDir                            = certDir;
    this.caSecretName                       = caSecretName;
    this.secretName                         = secretName;
    this.serviceName                        = serviceName;
    this.operatorNamespace                  = operatorNamespace;
    this.mutatingWebhookConfigurationName   = mutatingWebhookConfigurationName;
    this.validatingWebhookConfigurationName = validatingWebhookConfigurationName;
  }

  public Path   getCertDir()                            { return certDir;                            }
  public String getCaSecretName()                       { return caSecretName;                       }
  public String getSecretName()                         { return secretName;                         }
  public String getServiceName()                        { return serviceName;                        }
  public String getOperatorNamespace()                  { return operatorNamespace;                  }
  public String getMutatingWebhookConfigurationName()   { return mutatingWebhookConfigurationName;   }
  public String getValidatingWebhookConfigurationName() { return validatingWebhookConfigurationName; }

  /**
   * DNS name the API server uses to reach the webhook service.
   */
  public String getWebhookHostname()
  {
    return String.format( "%s.%s.svc", serviceName, operatorNamespace );
  }

  public String getWebhookConfigurationName( WebhookKind kind )
  {
    return kind == WebhookKind.MUTATING ? mutatingWebhookConfigurationName : validatingWebhookConfigurationName;
  }
}
