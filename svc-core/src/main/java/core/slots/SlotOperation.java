package core.slots;

/**
 * The slot manager operations, used to tag failures.
 */
public enum SlotOperation
{
  LIST,
  CREATE,
  UPDATE,
  DELETE
}
