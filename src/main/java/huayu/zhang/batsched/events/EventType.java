package huayu.zhang.batsched.events;

public enum EventType { HANDSHAKE, SIMULATION_BEGINS, JOB_SUBMITTED, JOB_COMPLETED, UNKNOWN }
