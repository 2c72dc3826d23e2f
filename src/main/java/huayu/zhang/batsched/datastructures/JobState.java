package huayu.zhang.batsched.datastructures;

public enum JobState { PENDING, RUNNING, COMPLETED, REJECTED }
