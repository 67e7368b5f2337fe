package utils;

import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.crypto.CertificateAuthority;
import core.handler.WebhookEnvironment;
import core.model.OperatorIF;
import core.model.ServiceCoreIF;

public class OperatorConfig
{
  private static final Logger LOGGER = LoggerFactory.getLogger( OperatorConfig.class );

  private String operatorNamespace      = null;
  private String webhookServiceName     = "postgresql-operator-webhook-service";
  private String caSecretName           = "postgresql-operator-ca-secret";
  private String webhookSecretName      = "postgresql-operator-webhook-cert";
  private String webhookCertDir         = "/run/secrets/postgresql-operator/webhook";
  private String mutatingWebhookName    = "postgresql-operator-mutating-webhook-configuration";
  private String validatingWebhookName  = "postgresql-operator-validating-webhook-configuration";
  private String caCommonName           = CertificateAuthority.DefaultCommonName;
  private long   certMaintenanceMinutes = ServiceCoreIF.CertMaintenanceMinutes;

  /**
   * @param data             ConfigMap data
   * @param defaultNamespace used when the ConfigMap does not name the operator namespace
   */
  public OperatorConfig( Map<String, String> data, String defaultNamespace )
  {
    operatorNamespace = defaultNamespace;

    if( data.get( OperatorIF.OperatorNamespace     ) != null ) operatorNamespace     = data.get( OperatorIF.OperatorNamespace     );
    if( data.get( OperatorIF.WebhookServiceName    ) != null ) webhookServiceName    = data.get( OperatorIF.WebhookServiceName    );
    if( data.get( OperatorIF.CaSecretName          ) != null ) caSecretName          = data.get( OperatorIF.CaSecretName          );
    if( data.get( OperatorIF.WebhookSecretName     ) != null ) webhookSecretName     = data.get( OperatorIF.WebhookSecretName     );
    if( data.get( OperatorIF.WebhookCertDir        ) != null ) webhookCertDir        = data.get( OperatorIF.WebhookCertDir        );
    if( data.get( OperatorIF.MutatingWebhookName   ) != null ) mutatingWebhookName   = data.get( OperatorIF.MutatingWebhookName   );
    if( data.get( OperatorIF.ValidatingWebhookName ) != null ) validatingWebhookName = data.get( OperatorIF.ValidatingWebhookName );
    if( data.get( OperatorIF.CaCommonName          ) != null ) caCommonName          = data.get( OperatorIF.CaCommonName          );

    String minutes = data.get( OperatorIF.CertMaintenanceMinutes );
    if( minutes != null )
    {
      try
      {
        certMaintenanceMinutes = Long.parseLong( minutes.trim() );
      }
      catch( NumberFormatException e )
      {
        throw new IllegalArgumentException( "Invalid " + OperatorIF.CertMaintenanceMinutes + " value: " + minutes, e );
      }
      if( certMaintenanceMinutes <= 0 )
      {
        throw new IllegalArgumentException( OperatorIF.CertMaintenanceMinutes + " must be positive: " + minutes );
      }
    }

    if( operatorNamespace == null || operatorNamespace.isBlank() )
    {
      throw new IllegalArgumentException( "Operator namespace is not configured" );
    }

    LOGGER.info( "***************** Operator Config is set for ******************" );
    LOGGER.info( "{} = {}", OperatorIF.OperatorNamespace,      operatorNamespace      );
    LOGGER.info( "{} = {}", OperatorIF.WebhookServiceName,     webhookServiceName     );
    LOGGER.info( "{} = {}", OperatorIF.CaSecretName,           caSecretName           );
    LOGGER.info( "{} = {}", OperatorIF.WebhookSecretName,      webhookSecretName      );
    LOGGER.info( "{} = {}", OperatorIF.WebhookCertDir,         webhookCertDir         );
    LOGGER.info( "{} = {}", OperatorIF.CertMaintenanceMinutes, certMaintenanceMinutes );
    LOGGER.info( "***************** End of Operator Config ******************" );
  }

  public WebhookEnvironment toWebhookEnvironment()
  {
    return new WebhookEnvironment( Path.of( webhookCertDir ),
                                   caSecretName,
                                   webhookSecretName,
                                   webhookServiceName,
                                   operatorNamespace,
                                   mutatingWebhookName,
                                   validatingWebhookName );
  }

  public String getOperatorNamespace()      { return operatorNamespace;      }
  public String getWebhookServiceName()     { return webhookServiceName;     }
  public String getCaSecretName()           { return caSecretName;           }
  public String getWebhookSecretName()      { return webhookSecretName;      }
  public String getWebhookCertDir()         { return webhookCertDir;         }
  public String getMutatingWebhookName()    { return mutatingWebhookName;    }
  public String getValidatingWebhookName()  { return validatingWebhookName;  }
  public String getCaCommonName()           { return caCommonName;           }
  public long   getCertMaintenanceMinutes() { return certMaintenanceMinutes; }
}
