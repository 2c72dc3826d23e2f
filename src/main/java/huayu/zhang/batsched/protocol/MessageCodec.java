package huayu.zhang.batsched.protocol;

import huayu.zhang.batsched.decisions.Decision;

import java.util.List;

/**
 * Wire encoding used by the decision component: inbound event batches and
 * outbound decisions.
 */
public interface MessageCodec {

  EventBatch decodeEvents(String message);

  String encodeDecisions(double now, List<Decision> decisions);
}
