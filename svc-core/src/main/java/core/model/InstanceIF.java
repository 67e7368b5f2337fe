package core.model;

/**
 * Instance manager ConfigMap keys and environment variable names.
 */
public interface InstanceIF
{
  public static final String PrimaryJdbcUrl        = "primaryJdbcUrl";
  public static final String LocalJdbcUrl          = "localJdbcUrl";
  public static final String DatabaseUser          = "databaseUser";
  public static final String ApplicationName       = "applicationName";
  public static final String SlotsConfigMapName    = "replicationSlotsConfigMap";
  public static final String ReplicatorRestart     = "replicatorRestartPolicy";

  // Environment
  public static final String PodNameEnv            = "POD_NAME";
  public static final String PodNamespaceEnv       = "POD_NAMESPACE";
  public static final String ConfigMapEnv          = "INSTANCE_CONFIGMAP";
  public static final String PrimaryPasswordEnv    = "PRIMARY_DB_PASSWORD";
  public static final String LocalPasswordEnv      = "LOCAL_DB_PASSWORD";

  public static final String DefaultConfigMap      = "postgresql-instance-config";
}
