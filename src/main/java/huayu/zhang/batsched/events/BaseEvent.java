package huayu.zhang.batsched.events;

abstract public class BaseEvent {
  private double timestamp_;

  public BaseEvent(double timestamp) {
    timestamp_ = timestamp;
  }

  public double getTimestamp() { return timestamp_; }

  public abstract EventType getType();
}
