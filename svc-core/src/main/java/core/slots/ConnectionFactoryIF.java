package core.slots;

import java.sql.Connection;
import java.sql.SQLException;

@FunctionalInterface
public interface ConnectionFactoryIF
{
  /**
   * Opens a new connection. The caller closes it.
   */
  Connection connect() throws SQLException;
}
