package core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The slots listed on one instance during one pass. Never cached across
 * passes.
 */
public class SlotList
{
  private final List<ReplicationSlot> items;
  private final Set<String>           names = new HashSet<>();

  public SlotList( List<ReplicationSlot> items )
  {
    this.items = Collections.unmodifiableList( new ArrayList<>( items ) );

    for( ReplicationSlot slot : this.items )
    {
      names.add( slot.slotName() );
    }
  }

  public static SlotList empty()
  {
    return new SlotList( List.of() );
  }

  public List<ReplicationSlot> getItems()
  {
    return items;
  }

  public boolean has( String slotName )
  {
    return names.contains( slotName );
  }

  public int size()
  {
    return items.size();
  }

  @Override
  public String toString()
  {
    return "SlotList" + names;
  }
}
