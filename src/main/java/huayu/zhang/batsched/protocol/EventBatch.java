package huayu.zhang.batsched.protocol;

import huayu.zhang.batsched.events.BaseEvent;

import java.util.*;

// one decoded inbound message: the decision instant and its events in order
public class EventBatch {
  private final double now_;
  private final List<BaseEvent> events_;

  public EventBatch(double now, List<BaseEvent> events) {
    now_ = now;
    events_ = Collections.unmodifiableList(new ArrayList<>(events));
  }

  public double getNow() { return now_; }
  public List<BaseEvent> getEvents() { return events_; }
}
