package core.model;

/**
 * The two admission webhook configuration kinds that receive the CA bundle.
 */
public enum WebhookKind
{
  MUTATING( "MutatingWebhookConfiguration" ),
  VALIDATING( "ValidatingWebhookConfiguration" );

  private final String kubeKind;

  WebhookKind( String kubeKind )
  {
    this.kubeKind = kubeKind;
  }

  public String getKubeKind()
  {
    return kubeKind;
  }
}
