package core.model;

/**
 * Operator ConfigMap keys.
 */
public interface OperatorIF
{
  public static final String OperatorNamespace      = "operatorNamespace";
  public static final String WebhookServiceName     = "webhookServiceName";
  public static final String CaSecretName           = "caSecretName";
  public static final String WebhookSecretName      = "webhookSecretName";
  public static final String WebhookCertDir         = "webhookCertDir";
  public static final String MutatingWebhookName    = "mutatingWebhookConfigurationName";
  public static final String ValidatingWebhookName  = "validatingWebhookConfigurationName";
  public static final String CaCommonName           = "caCommonName";
  public static final String CertMaintenanceMinutes = "certMaintenanceMinutes";

  // Environment
  public static final String ConfigMapEnv     = "OPERATOR_CONFIGMAP";
  public static final String DefaultConfigMap = "postgresql-operator-config";
}
