package huayu.zhang.batsched.decisions;

import java.util.Objects;

public class AcknowledgeHandshake extends Decision {
  private final String name_;
  private final String version_;

  public AcknowledgeHandshake(String name, String version) {
    name_ = name;
    version_ = version;
  }

  public String getName() { return name_; }
  public String getVersion() { return version_; }

  @Override
  public DecisionType getType() { return DecisionType.ACKNOWLEDGE_HANDSHAKE; }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AcknowledgeHandshake)) {
      return false;
    }
    AcknowledgeHandshake that = (AcknowledgeHandshake) o;
    return name_.equals(that.name_) && version_.equals(that.version_);
  }

  @Override
  public int hashCode() { return Objects.hash(name_, version_); }

  @Override
  public String toString() {
    return "AcknowledgeHandshake(" + name_ + ", " + version_ + ")";
  }
}
