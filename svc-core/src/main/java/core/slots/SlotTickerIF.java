package core.slots;

import java.time.Duration;

/**
 * The periodic tick that drives reconciliation passes.
 */
public interface SlotTickerIF
{
  void start( Duration period );

  /**
   * Restarts the tick with a new period. The next tick fires one full
   * period from now.
   */
  void reset( Duration period );

  void stop();

  boolean isRunning();
}
