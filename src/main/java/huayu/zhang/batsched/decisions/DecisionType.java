package huayu.zhang.batsched.decisions;

public enum DecisionType { ACKNOWLEDGE_HANDSHAKE, REJECT_JOB, EXECUTE_JOB }
