package core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Store-neutral view of a Kubernetes Secret: a named map of byte blobs plus
 * the opaque resourceVersion used for optimistic concurrency and for the
 * filesystem materialization skip check.
 */
public class SecretRecord
{
  private final String              namespace;
  private final String              name;
  private final String              resourceVersion;
  private final Map<String, byte[]> data;

  /**
   * A record that has not been persisted yet.
   */
  public SecretRecord( String namespace, String name, Map<String, byte[]> data )
  {
    this( namespace, name, null, data );
  }

  public SecretRecord( String namespace, String name, String resourceVersion, Map<String, byte[]> data )
  {
    this.namespace       = namespace;
    this.name            = name;
    this.resourceVersion = resourceVersion;

    this.data = copyOf( data );
  }

  private static Map<String, byte[]> copyOf( Map<String, byte[]> source )
  {
    Map<String, byte[]> copy = new HashMap<>();
    if( source != null )
    {
      source.forEach( ( key, value ) -> copy.put( key, value == null ? null : value.clone() ) );
    }
    return Collections.unmodifiableMap( copy );
  }

  public String getNamespace()       { return namespace;       }
  public String getName()            { return name;            }
  public String getResourceVersion() { return resourceVersion; }

  /**
   * @return a read-only copy of the data; changing the returned arrays does
   *         not change this record
   */
  public Map<String, byte[]> getData()
  {
    return copyOf( data );
  }

  public byte[] getData( String key )
  {
    byte[] value = data.get( key );
    return value == null ? null : value.clone();
  }

  /**
   * Returns a copy of this record with one data field overwritten. The
   * resourceVersion is carried over so the store can detect a stale update.
   */
  public SecretRecord withData( String key, byte[] value )
  {
    Map<String, byte[]> updated = new HashMap<>( data );
    updated.put( key, value );

    return new SecretRecord( namespace, name, resourceVersion, updated );
  }

  public boolean sameContent( SecretRecord other )
  {
    if( other == null || !data.keySet().equals( other.data.keySet() ) )
    {
      return false;
    }

    for( Map.Entry<String, byte[]> entry : data.entrySet() )
    {
      if( !Arrays.equals( entry.getValue(), other.data.get( entry.getKey() ) ) )
      {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString()
  {
    return "SecretRecord[" + namespace + "/" + name + ", resourceVersion=" + resourceVersion + ", keys=" + data.keySet() + "]";
  }
}
