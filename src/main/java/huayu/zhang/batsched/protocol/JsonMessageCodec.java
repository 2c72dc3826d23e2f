package huayu.zhang.batsched.protocol;

import huayu.zhang.batsched.decisions.AcknowledgeHandshake;
import huayu.zhang.batsched.decisions.Decision;
import huayu.zhang.batsched.decisions.ExecuteJob;
import huayu.zhang.batsched.decisions.RejectJob;
import huayu.zhang.batsched.events.*;
import huayu.zhang.batsched.utils.Utils;

import java.util.*;
import java.util.logging.Logger;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON form of the protocol. Every message is an envelope
 * <pre>{"now": 12.0, "events": [{"timestamp": 12.0, "type": "...", "data": {...}}]}</pre>
 * in both directions. The decision component only decodes events and
 * encodes decisions; the simulator uses the opposite pair.
 */
@SuppressWarnings("unchecked")
public class JsonMessageCodec implements MessageCodec {
  private static Logger LOG = Logger.getLogger(JsonMessageCodec.class.getName());

  public static final String HELLO = "BatsimHelloEvent";
  public static final String SIMULATION_BEGINS = "SimulationBeginsEvent";
  public static final String JOB_SUBMITTED = "JobSubmittedEvent";
  public static final String JOB_COMPLETED = "JobCompletedEvent";

  public static final String EDC_HELLO = "EDCHelloEvent";
  public static final String REJECT_JOB = "RejectJobEvent";
  public static final String EXECUTE_JOB = "ExecuteJobEvent";

  public static final String PROTOCOL_VERSION = "1.0.0";

  private final JSONParser parser_;

  public JsonMessageCodec() {
    parser_ = new JSONParser();
  }

  @Override
  public EventBatch decodeEvents(String message) {
    JSONObject jMsg = parse(message);
    double now = number(jMsg, "now").doubleValue();
    List<BaseEvent> events = new ArrayList<>();
    for (Object o : array(jMsg, "events")) {
      JSONObject jEvent = asObject(o);
      double timestamp = jEvent.containsKey("timestamp")
          ? number(jEvent, "timestamp").doubleValue() : now;
      String type = string(jEvent, "type");
      JSONObject jData = jEvent.containsKey("data") ? object(jEvent, "data") : new JSONObject();
      events.add(decodeEvent(timestamp, type, jData));
    }
    return new EventBatch(now, events);
  }

  private BaseEvent decodeEvent(double timestamp, String type, JSONObject jData) {
    switch (type) {
    case HELLO:
      Object version = jData.get("batsim_version");
      return new HandshakeEvent(timestamp, version == null ? null : version.toString());
    case SIMULATION_BEGINS:
      long numHosts = integer(jData, "computation_host_number");
      if (numHosts < 0 || numHosts > Integer.MAX_VALUE) {
        throw new IllegalArgumentException("Invalid computation_host_number " + numHosts);
      }
      return new SimulationBeginsEvent(timestamp, (int) numHosts);
    case JOB_SUBMITTED:
      JSONObject jJob = object(jData, "job");
      double walltime = jJob.get("walltime") == null ? 0 : number(jJob, "walltime").doubleValue();
      // out-of-range requests saturate so that the ingestor rejects them
      long request = integer(jJob, "resource_request");
      int resourceRequest = (int) Math.max(Integer.MIN_VALUE,
          Math.min(Integer.MAX_VALUE, request));
      return new JobSubmittedEvent(timestamp, string(jData, "job_id"), resourceRequest, walltime);
    case JOB_COMPLETED:
      return new JobCompletedEvent(timestamp, string(jData, "job_id"));
    default:
      LOG.fine("Unknown event type " + type);
      return new UnknownEvent(timestamp, type);
    }
  }

  @Override
  public String encodeDecisions(double now, List<Decision> decisions) {
    JSONArray jEvents = new JSONArray();
    for (Decision decision : decisions) {
      JSONObject jData = new JSONObject();
      String type;
      switch (decision.getType()) {
      case ACKNOWLEDGE_HANDSHAKE:
        AcknowledgeHandshake hello = (AcknowledgeHandshake) decision;
        type = EDC_HELLO;
        jData.put("decision_component_name", hello.getName());
        jData.put("decision_component_version", hello.getVersion());
        break;
      case REJECT_JOB:
        type = REJECT_JOB;
        jData.put("job_id", ((RejectJob) decision).getJobId());
        break;
      case EXECUTE_JOB:
        ExecuteJob execute = (ExecuteJob) decision;
        type = EXECUTE_JOB;
        jData.put("job_id", execute.getJobId());
        JSONArray jResources = new JSONArray();
        jResources.addAll(execute.getResources());
        jData.put("resources", jResources);
        jData.put("host_allocation", Utils.toHostAllocation(execute.getResources()));
        break;
      default:
        throw new IllegalArgumentException("Cannot encode decision " + decision);
      }
      jEvents.add(envelopeEntry(now, type, jData));
    }
    return envelope(now, jEvents);
  }

  /**
   * Resource-manager side: serializes events for the decision component.
   */
  public String encodeEvents(double now, List<BaseEvent> events) {
    JSONArray jEvents = new JSONArray();
    for (BaseEvent event : events) {
      JSONObject jData = new JSONObject();
      String type;
      switch (event.getType()) {
      case HANDSHAKE:
        type = HELLO;
        jData.put("batsim_version", ((HandshakeEvent) event).getPeerVersion());
        break;
      case SIMULATION_BEGINS:
        type = SIMULATION_BEGINS;
        jData.put("computation_host_number", ((SimulationBeginsEvent) event).getNumResources());
        break;
      case JOB_SUBMITTED:
        JobSubmittedEvent submitted = (JobSubmittedEvent) event;
        type = JOB_SUBMITTED;
        JSONObject jJob = new JSONObject();
        jJob.put("resource_request", submitted.getResourceRequest());
        jJob.put("walltime", submitted.getWalltime());
        jData.put("job_id", submitted.getJobId());
        jData.put("job", jJob);
        break;
      case JOB_COMPLETED:
        type = JOB_COMPLETED;
        jData.put("job_id", ((JobCompletedEvent) event).getJobId());
        break;
      case UNKNOWN:
      default:
        type = ((UnknownEvent) event).getTypeName();
      }
      jEvents.add(envelopeEntry(event.getTimestamp(), type, jData));
    }
    return envelope(now, jEvents);
  }

  /**
   * Resource-manager side: reads back the decisions of one cycle.
   */
  public List<Decision> decodeDecisions(String message) {
    JSONObject jMsg = parse(message);
    List<Decision> decisions = new ArrayList<>();
    for (Object o : array(jMsg, "events")) {
      JSONObject jEvent = asObject(o);
      String type = string(jEvent, "type");
      JSONObject jData = object(jEvent, "data");
      switch (type) {
      case EDC_HELLO:
        decisions.add(new AcknowledgeHandshake(string(jData, "decision_component_name"),
            string(jData, "decision_component_version")));
        break;
      case REJECT_JOB:
        decisions.add(new RejectJob(string(jData, "job_id")));
        break;
      case EXECUTE_JOB:
        List<Integer> resources = new ArrayList<>();
        for (Object id : array(jData, "resources")) {
          if (!(id instanceof Long)) {
            throw new IllegalArgumentException("Resource id " + id + " is not an integer");
          }
          resources.add(((Long) id).intValue());
        }
        decisions.add(new ExecuteJob(string(jData, "job_id"), resources));
        break;
      default:
        LOG.warning("Ignoring unknown decision type " + type);
      }
    }
    return decisions;
  }

  private JSONObject envelopeEntry(double timestamp, String type, JSONObject jData) {
    JSONObject jEvent = new JSONObject();
    jEvent.put("timestamp", timestamp);
    jEvent.put("type", type);
    jEvent.put("data", jData);
    return jEvent;
  }

  private String envelope(double now, JSONArray jEvents) {
    JSONObject jMsg = new JSONObject();
    jMsg.put("now", now);
    jMsg.put("events", jEvents);
    return jMsg.toJSONString();
  }

  private JSONObject parse(String message) {
    try {
      Object parsed = parser_.parse(message);
      if (!(parsed instanceof JSONObject)) {
        throw new IllegalArgumentException("Message is not a JSON object: " + message);
      }
      return (JSONObject) parsed;
    } catch (ParseException e) {
      throw new IllegalArgumentException("Malformed message: " + e, e);
    }
  }

  private static Object field(JSONObject jObj, String key) {
    Object value = jObj.get(key);
    if (value == null) {
      throw new IllegalArgumentException("Missing field '" + key + "' in " + jObj.toJSONString());
    }
    return value;
  }

  private static <T> T typed(JSONObject jObj, String key, Class<T> type) {
    Object value = field(jObj, key);
    if (!type.isInstance(value)) {
      throw new IllegalArgumentException("Field '" + key + "' is not a " + type.getSimpleName()
          + " in " + jObj.toJSONString());
    }
    return type.cast(value);
  }

  private static JSONObject asObject(Object o) {
    if (!(o instanceof JSONObject)) {
      throw new IllegalArgumentException("Event entry is not a JSON object: " + o);
    }
    return (JSONObject) o;
  }

  // json-simple reads integral numbers as Long
  private static long integer(JSONObject jObj, String key) {
    Number value = number(jObj, key);
    if (!(value instanceof Long)) {
      throw new IllegalArgumentException("Field '" + key + "' is not an integer in "
          + jObj.toJSONString());
    }
    return value.longValue();
  }

  private static Number number(JSONObject jObj, String key) { return typed(jObj, key, Number.class); }
  private static String string(JSONObject jObj, String key) { return field(jObj, key).toString(); }
  private static JSONObject object(JSONObject jObj, String key) { return typed(jObj, key, JSONObject.class); }
  private static JSONArray array(JSONObject jObj, String key) { return typed(jObj, key, JSONArray.class); }
}
