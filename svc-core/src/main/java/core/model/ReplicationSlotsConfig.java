package core.model;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import io.vertx.core.json.JsonObject;

/**
 * Replication slot settings pushed to the slot replicator. Instances are
 * immutable; a new configuration replaces the previous one as a whole.
 */
public class ReplicationSlotsConfig
{
  public static final Duration DefaultUpdateInterval = Duration.ofSeconds( 30 );
  public static final String   DefaultSlotPrefix     = "_cnpg_";

  // ConfigMap keys
  public static final String UpdateIntervalKey = "updateInterval";
  public static final String HaEnabledKey      = "highAvailability.enabled";
  public static final String HaSlotPrefixKey   = "highAvailability.slotPrefix";

  // Event bus JSON fields
  private static final String JsonUpdateIntervalMs = "updateIntervalMs";
  private static final String JsonHighAvailability = "highAvailability";
  private static final String JsonEnabled          = "enabled";
  private static final String JsonSlotPrefix       = "slotPrefix";

  private final Duration         updateInterval;
  private final HighAvailability highAvailability;

  public ReplicationSlotsConfig( Duration updateInterval, HighAvailability highAvailability )
  {
    this.updateInterval   = updateInterval;
    this.highAvailability = highAvailability;
  }

  public static ReplicationSlotsConfig enabled( Duration updateInterval )
  {
    return new ReplicationSlotsConfig( updateInterval, new HighAvailability( true, DefaultSlotPrefix ) );
  }

  public static ReplicationSlotsConfig disabled()
  {
    return new ReplicationSlotsConfig( null, new HighAvailability( false, DefaultSlotPrefix ) );
  }

  /**
   * @return the configured interval, or the default when unset or not positive
   */
  public Duration getUpdateInterval()
  {
    if( updateInterval == null || updateInterval.isZero() || updateInterval.isNegative() )
    {
      return DefaultUpdateInterval;
    }
    return updateInterval;
  }

  public HighAvailability getHighAvailability()
  {
    return highAvailability;
  }

  public boolean isHighAvailabilityEnabled()
  {
    return highAvailability != null && highAvailability.isEnabled();
  }

  public String getSlotPrefix()
  {
    return highAvailability == null ? DefaultSlotPrefix : highAvailability.getSlotPrefix();
  }

  /**
   * Builds a configuration from ConfigMap data. The update interval is
   * expressed in seconds.
   */
  public static ReplicationSlotsConfig fromMap( Map<String, String> data )
  {
    Duration updateInterval = null;
    String   interval       = data.get( UpdateIntervalKey );
    if( interval != null && !interval.isBlank() )
    {
      try
      {
        updateInterval = Duration.ofSeconds( Long.parseLong( interval.trim() ) );
      }
      catch( NumberFormatException e )
      {
        throw new IllegalArgumentException( "Invalid " + UpdateIntervalKey + " value: " + interval, e );
      }
    }

    boolean enabled = Boolean.parseBoolean( data.getOrDefault( HaEnabledKey, "false" ).trim() );
    String  prefix  = data.get( HaSlotPrefixKey );

    return new ReplicationSlotsConfig( updateInterval, new HighAvailability( enabled, prefix ) );
  }

  public JsonObject toJson()
  {
    JsonObject json = new JsonObject().put( JsonUpdateIntervalMs, getUpdateInterval().toMillis() );
    if( highAvailability != null )
    {
      json.put( JsonHighAvailability, new JsonObject().put( JsonEnabled,    highAvailability.isEnabled() )
                                                      .put( JsonSlotPrefix, highAvailability.getSlotPrefix() ) );
    }
    return json;
  }

  public static ReplicationSlotsConfig fromJson( JsonObject json )
  {
    Long       intervalMs = json.getLong( JsonUpdateIntervalMs );
    JsonObject ha         = json.getJsonObject( JsonHighAvailability );

    return new ReplicationSlotsConfig( intervalMs == null ? null : Duration.ofMillis( intervalMs ),
                                       ha == null ? null : new HighAvailability( ha.getBoolean( JsonEnabled, false ), ha.getString( JsonSlotPrefix ) ) );
  }

  @Override
  public boolean equals( Object o )
  {
    if( this == o ) return true;
    if( !( o instanceof ReplicationSlotsConfig ) ) return false;

    ReplicationSlotsConfig other = (ReplicationSlotsConfig)o;
    return getUpdateInterval().equals( other.getUpdateInterval() ) &&
           Objects.equals( highAvailability, other.highAvailability );
  }

  @Override
  public int hashCode()
  {
    return Objects.hash( getUpdateInterval(), highAvailability );
  }

  @Override
  public String toString()
  {
    return "ReplicationSlotsConfig[updateInterval=" + getUpdateInterval() + ", highAvailability=" + highAvailability + "]";
  }

  public static class HighAvailability
  {
    private final boolean enabled;
    private final String  slotPrefix;

    public HighAvailability( boolean enabled, String slotPrefix )
    {
      this.enabled    = enabled;
      this.slotPrefix = ( slotPrefix == null || slotPrefix.isBlank() ) ? DefaultSlotPrefix : slotPrefix.trim();
    }

    public boolean isEnabled()     { return enabled;    }
    public String  getSlotPrefix() { return slotPrefix; }

    @Override
    public boolean equals( Object o )
    {
      if( this == o ) return true;
      if( !( o instanceof HighAvailability ) ) return false;

      HighAvailability other = (HighAvailability)o;
      return enabled == other.enabled && slotPrefix.equals( other.slotPrefix );
    }

    @Override
    public int hashCode()
    {
      return Objects.hash( enabled, slotPrefix );
    }

    @Override
    public String toString()
    {
      return "{enabled=" + enabled + ", slotPrefix=" + slotPrefix + "}";
    }
  }
}
