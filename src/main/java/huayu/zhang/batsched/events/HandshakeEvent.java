package huayu.zhang.batsched.events;

public class HandshakeEvent extends BaseEvent {
  private String peerVersion_;

  public HandshakeEvent(double timestamp, String peerVersion) {
    super(timestamp);
    peerVersion_ = peerVersion;
  }

  public String getPeerVersion() { return peerVersion_; }

  @Override
  public EventType getType() { return EventType.HANDSHAKE; }

  @Override
  public String toString() {
    return "Handshake(version: " + peerVersion_ + ")";
  }
}
