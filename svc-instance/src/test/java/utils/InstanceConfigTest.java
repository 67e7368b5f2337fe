package utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import core.model.InstanceIF;
import core.slots.RestartPolicy;

public class InstanceConfigTest
{
  private static final String PRIMARY = "jdbc:postgresql://pg-rw.pg.svc:5432/postgres";

  @Test
  public void onlyThePrimaryUrlIsRequired()
  {
    InstanceConfig config = new InstanceConfig( Map.of( InstanceIF.PrimaryJdbcUrl, PRIMARY ) );

    assertThat( config.getPrimaryJdbcUrl(), is( PRIMARY ) );
    assertThat( config.getLocalJdbcUrl(), is( "jdbc:postgresql://localhost:5432/postgres" ) );
    assertThat( config.getDatabaseUser(), is( "postgres" ) );
    assertThat( config.getSlotsConfigMapName(), is( "replication-slots-config" ) );
    assertThat( config.getRestartPolicy(), is( RestartPolicy.NEVER ) );
  }

  @Test
  public void restartPolicyIsCaseInsensitive()
  {
    Map<String, String> data = new HashMap<>();
    data.put( InstanceIF.PrimaryJdbcUrl,    PRIMARY );
    data.put( InstanceIF.ReplicatorRestart, "redeploy" );

    assertThat( new InstanceConfig( data ).getRestartPolicy(), is( RestartPolicy.REDEPLOY ) );
  }

  @Test
  public void invalidSettingsAreRejected()
  {
    assertThrows( IllegalArgumentException.class, () -> new InstanceConfig( new HashMap<>() ) );
    assertThrows( IllegalArgumentException.class,
                  () -> new InstanceConfig( Map.of( InstanceIF.PrimaryJdbcUrl,    PRIMARY,
                                                    InstanceIF.ReplicatorRestart, "sometimes" ) ) );
  }
}
