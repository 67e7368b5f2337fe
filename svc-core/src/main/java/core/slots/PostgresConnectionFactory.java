package core.slots;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens plain JDBC connections to one PostgreSQL instance.
 */
public class PostgresConnectionFactory implements ConnectionFactoryIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( PostgresConnectionFactory.class );

  private final String     name;
  private final String     jdbcUrl;
  private final Properties properties = new Properties();

  public PostgresConnectionFactory( String name, String jdbcUrl, String user, String password, String applicationName )
  {
    this.name    = name;
    this.jdbcUrl = jdbcUrl;

    properties.setProperty( "user", user );
    if( password != null && !password.isEmpty() )
    {
      properties.setProperty( "password", password );
    }
    if( applicationName != null )
    {
      properties.setProperty( "ApplicationName", applicationName );
    }
  }

  public String getName()
  {
    return name;
  }

  public String getJdbcUrl()
  {
    return jdbcUrl;
  }

  @Override
  public Connection connect()
    throws SQLException
  {
    LOGGER.debug( "Opening {} connection to {}", name, jdbcUrl );
    return DriverManager.getConnection( jdbcUrl, properties );
  }

  @Override
  public String toString()
  {
    return "PostgresConnectionFactory{" + name + " " + jdbcUrl + "}";
  }
}
