package huayu.zhang.batsched.events;

// any event kind this scheduler does not act on
public class UnknownEvent extends BaseEvent {
  private String typeName_;

  public UnknownEvent(double timestamp, String typeName) {
    super(timestamp);
    typeName_ = typeName;
  }

  public String getTypeName() { return typeName_; }

  @Override
  public EventType getType() { return EventType.UNKNOWN; }

  @Override
  public String toString() {
    return "Unknown(" + typeName_ + ")";
  }
}
