package core.utils;

import java.util.HashMap;
import java.util.Map;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.NotFoundException;
import core.exceptions.StoreException;

/**
 * Reads service settings from ConfigMaps and the process environment.
 */
public class ConfigReader
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ConfigReader.class );

  private final KubernetesClient kubeClient;
  private final String           nameSpace;

  public ConfigReader( KubernetesClient kubeClient, String nameSpace )
  {
    this.kubeClient = kubeClient;
    this.nameSpace  = nameSpace;
  }

  public static String getEnv( String envVar, String defaultValue )
  {
    String value = System.getenv( envVar );
    if( value == null || value.isBlank() )
    {
      return defaultValue;
    }
    return value.trim();
  }

  /**
   * @return the ConfigMap data, empty when the ConfigMap has no data section
   */
  public Map<String, String> getConfigProperties( String configMapName )
    throws NotFoundException, StoreException
  {
    ConfigMap configMap;
    try
    {
      configMap = kubeClient.configMaps().inNamespace( nameSpace ).withName( configMapName ).get();
    }
    catch( KubernetesClientException e )
    {
      throw new StoreException( "Failed to read ConfigMap " + nameSpace + "/" + configMapName, e );
    }

    if( configMap == null )
    {
      throw new NotFoundException( "ConfigMap not found: " + nameSpace + "/" + configMapName );
    }

    LOGGER.info( "Read ConfigMap {}/{}", nameSpace, configMapName );
    return configMap.getData() == null ? new HashMap<>() : new HashMap<>( configMap.getData() );
  }

  /**
   * Like {@link #getConfigProperties(String)} but falls back to an empty map
   * when the ConfigMap does not exist.
   */
  public Map<String, String> getConfigPropertiesOrEmpty( String configMapName )
    throws StoreException
  {
    try
    {
      return getConfigProperties( configMapName );
    }
    catch( NotFoundException e )
    {
      LOGGER.warn( "ConfigMap {}/{} not found, using defaults", nameSpace, configMapName );
      return new HashMap<>();
    }
  }

  public KubernetesClient getKubeClient() { return kubeClient; }
  public String           getNamespace()  { return nameSpace;  }
}
