package huayu.zhang.batsched.decisions;

abstract public class Decision {
  public abstract DecisionType getType();
}
