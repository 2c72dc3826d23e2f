package huayu.zhang.batsched.utils;

import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.Locale;
import java.util.logging.Logger;

public class Configuration {

  public static enum SchedulingPolicy { FCFS, EASY, CONSERVATIVE, BEST_CONTIGUOUS };

  private JSONParser parser_;
  private JSONObject jCfg_;

  private SchedulingPolicy schedPolicy_;
  private double timeStep_;
  private double endTime_;
  private String statsOutput_;
  private boolean traceReservations_;

  private static Logger LOG = Logger.getLogger(Configuration.class.getName());

  public Configuration() {
    parser_ = new JSONParser();
    schedPolicy_ = SchedulingPolicy.FCFS;
    timeStep_ = 1.0;
    endTime_ = 1e6;
    statsOutput_ = "logs/stats.json";
    traceReservations_ = false;
  }

  public SchedulingPolicy getSchedPolicy() { return schedPolicy_; }
  public double getTimeStep() { return timeStep_; }
  public double getEndTime() { return endTime_; }
  public String getStatsOutput() { return statsOutput_; }
  public boolean isTraceReservations() { return traceReservations_; }

  public void setSchedPolicy(SchedulingPolicy schedPolicy) { schedPolicy_ = schedPolicy; }
  public void setStatsOutput(String statsOutput) { statsOutput_ = statsOutput; }

  public void parseConfigFile(String filePath) throws ConfigurationException {
    try (FileReader fr = new FileReader(filePath)) {
      parseConfig(fr);
      LOG.info("parse configuration file " + filePath);
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read configuration file " + filePath, e);
    }
  }

  public void parseConfig(Reader reader) throws ConfigurationException, IOException {
    try {
      Object parsed = parser_.parse(reader);
      if (!(parsed instanceof JSONObject)) {
        throw new ConfigurationException("Configuration is not a JSON object");
      }
      jCfg_ = (JSONObject) parsed;
    } catch (ParseException e) {
      throw new ConfigurationException("Malformed configuration: " + e, e);
    }
    if (jCfg_.containsKey("policy")) {
      schedPolicy_ = parseSchedPolicy(jCfg_.get("policy").toString());
    }
    timeStep_ = parseDouble("time_step", timeStep_);
    endTime_ = parseDouble("end_time", endTime_);
    if (timeStep_ <= 0) {
      throw new ConfigurationException("time_step must be positive, got " + timeStep_);
    }
    if (jCfg_.containsKey("stats_output")) {
      statsOutput_ = jCfg_.get("stats_output").toString();
    }
    if (jCfg_.containsKey("trace_reservations")) {
      traceReservations_ = Boolean.parseBoolean(jCfg_.get("trace_reservations").toString());
    }
  }

  private double parseDouble(String key, double defaultValue) throws ConfigurationException {
    Object value = jCfg_.get(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.toString());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid " + key + ": " + value, e);
    }
  }

  public static SchedulingPolicy parseSchedPolicy(String spStr) throws ConfigurationException {
    String name = spStr.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    switch (name) {
    case "fcfs":
      return SchedulingPolicy.FCFS;
    case "easy":
    case "easy_backfill":
    case "easy_backfilling":
      return SchedulingPolicy.EASY;
    case "conservative":
    case "conservative_backfilling":
    case "basic":
      return SchedulingPolicy.CONSERVATIVE;
    case "best_cont":
    case "best_contiguous":
      return SchedulingPolicy.BEST_CONTIGUOUS;
    default:
      LOG.warning("UNKNOWN SCHEDULING POLICY " + spStr);
      throw new ConfigurationException("Unknown scheduling policy " + spStr);
    }
  }

  /**
   * Reads the policy from decision-component initialization data, a JSON
   * object such as {@code {"policy": "easy"}}. Empty data selects FCFS.
   */
  public static SchedulingPolicy parseInitData(String initData) throws ConfigurationException {
    if (initData == null || initData.trim().isEmpty()) {
      return SchedulingPolicy.FCFS;
    }
    Configuration config = new Configuration();
    try {
      config.parseConfig(new StringReader(initData));
    } catch (IOException e) {
      throw new ConfigurationException("Cannot read initialization data", e);
    }
    return config.getSchedPolicy();
  }
}
