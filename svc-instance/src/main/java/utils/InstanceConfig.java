package utils;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.model.InstanceIF;
import core.slots.RestartPolicy;

public class InstanceConfig
{
  private static final Logger LOGGER = LoggerFactory.getLogger( InstanceConfig.class );

  private String        primaryJdbcUrl     = null;
  private String        localJdbcUrl       = "jdbc:postgresql://localhost:5432/postgres";
  private String        databaseUser       = "postgres";
  private String        applicationName    = "instance-manager";
  private String        slotsConfigMapName = "replication-slots-config";
  private RestartPolicy restartPolicy      = RestartPolicy.NEVER;

  public InstanceConfig( Map<String, String> data )
  {
    if( data.get( InstanceIF.PrimaryJdbcUrl     ) != null ) primaryJdbcUrl     = data.get( InstanceIF.PrimaryJdbcUrl     );
    if( data.get( InstanceIF.LocalJdbcUrl       ) != null ) localJdbcUrl       = data.get( InstanceIF.LocalJdbcUrl       );
    if( data.get( InstanceIF.DatabaseUser       ) != null ) databaseUser       = data.get( InstanceIF.DatabaseUser       );
    if( data.get( InstanceIF.ApplicationName    ) != null ) applicationName    = data.get( InstanceIF.ApplicationName    );
    if( data.get( InstanceIF.SlotsConfigMapName ) != null ) slotsConfigMapName = data.get( InstanceIF.SlotsConfigMapName );
    if( data.get( InstanceIF.ReplicatorRestart  ) != null ) restartPolicy      = RestartPolicy.fromString( data.get( InstanceIF.ReplicatorRestart ) );

    if( primaryJdbcUrl == null || primaryJdbcUrl.isBlank() )
    {
      throw new IllegalArgumentException( InstanceIF.PrimaryJdbcUrl + " must be configured" );
    }

    LOGGER.info( "***************** Instance Config is set for ******************" );
    LOGGER.info( "{} = {}", InstanceIF.PrimaryJdbcUrl,     primaryJdbcUrl     );
    LOGGER.info( "{} = {}", InstanceIF.LocalJdbcUrl,       localJdbcUrl       );
    LOGGER.info( "{} = {}", InstanceIF.DatabaseUser,       databaseUser       );
    LOGGER.info( "{} = {}", InstanceIF.SlotsConfigMapName, slotsConfigMapName );
    LOGGER.info( "{} = {}", InstanceIF.ReplicatorRestart,  restartPolicy      );
    LOGGER.info( "***************** End of Instance Config ******************" );
  }

  public String        getPrimaryJdbcUrl()     { return primaryJdbcUrl;     }
  public String        getLocalJdbcUrl()       { return localJdbcUrl;       }
  public String        getDatabaseUser()       { return databaseUser;       }
  public String        getApplicationName()    { return applicationName;    }
  public String        getSlotsConfigMapName() { return slotsConfigMapName; }
  public RestartPolicy getRestartPolicy()      { return restartPolicy;      }
}
