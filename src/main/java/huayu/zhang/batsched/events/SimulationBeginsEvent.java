package huayu.zhang.batsched.events;

public class SimulationBeginsEvent extends BaseEvent {
  private int numResources_;

  public SimulationBeginsEvent(double timestamp, int numResources) {
    super(timestamp);
    numResources_ = numResources;
  }

  public int getNumResources() { return numResources_; }

  @Override
  public EventType getType() { return EventType.SIMULATION_BEGINS; }

  @Override
  public String toString() {
    return "SimulationBegins(hosts: " + numResources_ + ")";
  }
}
