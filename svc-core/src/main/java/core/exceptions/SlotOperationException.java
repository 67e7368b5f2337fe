package core.exceptions;

import core.slots.SlotOperation;

/**
 * Thrown when a replication slot operation fails against one database
 * instance. The pass that raised it is abandoned; slot state is left as is
 * for the next pass to re-evaluate.
 */
public class SlotOperationException extends ReconcileException
{
  private static final long serialVersionUID = 5527019834476601228L;

  private final SlotOperation operation;
  private final String        slotName;

  public SlotOperationException( SlotOperation operation, String slotName, String msg, Throwable cause )
  {
    super( msg, cause );
    this.operation = operation;
    this.slotName  = slotName;
  }

  public SlotOperation getOperation()
  {
    return operation;
  }

  /**
   * @return the slot being mutated, or null for a LIST failure
   */
  public String getSlotName()
  {
    return slotName;
  }
}
