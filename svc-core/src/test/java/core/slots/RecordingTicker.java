package core.slots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

class RecordingTicker implements SlotTickerIF
{
  final List<String> calls = new ArrayList<>();

  Duration period  = null;
  boolean  running = false;

  @Override
  public void start( Duration period )
  {
    calls.add( "start:" + period.getSeconds() );
    this.period  = period;
    this.running = true;
  }

  @Override
  public void reset( Duration period )
  {
    calls.add( "reset:" + period.getSeconds() );
    this.period = period;
  }

  @Override
  public void stop()
  {
    calls.add( "stop" );
    this.running = false;
  }

  @Override
  public boolean isRunning()
  {
    return running;
  }
}
