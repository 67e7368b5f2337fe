package core.model;

public interface ServiceCoreIF
{
  // Well-known secret data keys
  public static final String CaCertKey  = "ca.crt";
  public static final String CaKeyKey   = "ca.key";
  public static final String TlsCertKey = "tls.crt";
  public static final String TlsKeyKey  = "tls.key";

  // Sentinel file holding the resourceVersion of the last materialized secret
  public static final String ResourceVersionFile = "resource";

  // Event bus addresses
  public static final String SlotReplicatorConfigAddress     = "slots.replicator.config";
  public static final String SlotReplicatorTerminatedAddress = "slots.replicator.terminated";

  public static final long   CertMaintenanceMinutes = 60;
}
