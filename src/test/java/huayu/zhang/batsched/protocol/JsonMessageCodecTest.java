package huayu.zhang.batsched.protocol;

import huayu.zhang.batsched.decisions.AcknowledgeHandshake;
import huayu.zhang.batsched.decisions.Decision;
import huayu.zhang.batsched.decisions.ExecuteJob;
import huayu.zhang.batsched.decisions.RejectJob;
import huayu.zhang.batsched.events.*;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonMessageCodecTest {

  private final JsonMessageCodec codec = new JsonMessageCodec();

  @Test
  void decodesEveryInboundEventKind() {
    EventBatch batch = codec.decodeEvents("{\"now\": 3.5, \"events\": ["
        + "{\"timestamp\": 0.0, \"type\": \"BatsimHelloEvent\", \"data\": {\"batsim_version\": \"4.1\"}},"
        + "{\"timestamp\": 0.0, \"type\": \"SimulationBeginsEvent\", \"data\": {\"computation_host_number\": 16}},"
        + "{\"timestamp\": 3.0, \"type\": \"JobSubmittedEvent\", \"data\": {\"job_id\": \"w0!7\","
        + " \"job\": {\"resource_request\": 4, \"walltime\": 120.5}}},"
        + "{\"timestamp\": 3.5, \"type\": \"JobCompletedEvent\", \"data\": {\"job_id\": \"w0!2\"}}]}");

    assertThat(batch.getNow()).isEqualTo(3.5);
    List<BaseEvent> events = batch.getEvents();
    assertThat(events).extracting("type").containsExactly(EventType.HANDSHAKE,
        EventType.SIMULATION_BEGINS, EventType.JOB_SUBMITTED, EventType.JOB_COMPLETED);
    assertThat(((HandshakeEvent) events.get(0)).getPeerVersion()).isEqualTo("4.1");
    assertThat(((SimulationBeginsEvent) events.get(1)).getNumResources()).isEqualTo(16);
    JobSubmittedEvent submitted = (JobSubmittedEvent) events.get(2);
    assertThat(submitted.getJobId()).isEqualTo("w0!7");
    assertThat(submitted.getResourceRequest()).isEqualTo(4);
    assertThat(submitted.getWalltime()).isEqualTo(120.5);
    assertThat(submitted.getTimestamp()).isEqualTo(3.0);
    assertThat(((JobCompletedEvent) events.get(3)).getJobId()).isEqualTo("w0!2");
  }

  @Test
  void unknownEventTypesArePassedThrough() {
    EventBatch batch = codec.decodeEvents("{\"now\": 1, \"events\": ["
        + "{\"timestamp\": 1, \"type\": \"JobKilledEvent\", \"data\": {}}]}");

    assertThat(batch.getEvents()).hasSize(1);
    assertThat(((UnknownEvent) batch.getEvents().get(0)).getTypeName()).isEqualTo("JobKilledEvent");
  }

  @Test
  void missingWalltimeMeansNoWalltime() {
    EventBatch batch = codec.decodeEvents("{\"now\": 0, \"events\": ["
        + "{\"type\": \"JobSubmittedEvent\", \"data\": {\"job_id\": \"x\", \"job\": {\"resource_request\": 1}}}]}");

    JobSubmittedEvent submitted = (JobSubmittedEvent) batch.getEvents().get(0);
    assertThat(submitted.getWalltime()).isZero();
    assertThat(submitted.getTimestamp()).isZero();
  }

  @Test
  void malformedMessagesAreRejected() {
    assertThatThrownBy(() -> codec.decodeEvents("{\"now\": 0, \"events\": ["))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> codec.decodeEvents("[]"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> codec.decodeEvents("{\"events\": []}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("now");
    assertThatThrownBy(() -> codec.decodeEvents("{\"now\": 0, \"events\": ["
        + "{\"type\": \"SimulationBeginsEvent\", \"data\": {\"computation_host_number\": \"many\"}}]}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("computation_host_number");
  }

  @Test
  void oversizedRequestsSaturateInsteadOfWrapping() {
    EventBatch batch = codec.decodeEvents("{\"now\": 0, \"events\": ["
        + "{\"type\": \"JobSubmittedEvent\", \"data\": {\"job_id\": \"big\","
        + " \"job\": {\"resource_request\": 4294967297, \"walltime\": 10}}},"
        + "{\"type\": \"JobSubmittedEvent\", \"data\": {\"job_id\": \"neg\","
        + " \"job\": {\"resource_request\": -4294967295, \"walltime\": 10}}}]}");

    assertThat(((JobSubmittedEvent) batch.getEvents().get(0)).getResourceRequest())
        .isEqualTo(Integer.MAX_VALUE);
    assertThat(((JobSubmittedEvent) batch.getEvents().get(1)).getResourceRequest())
        .isEqualTo(Integer.MIN_VALUE);
  }

  @Test
  void hostCountMustBeAnIntegerInRange() {
    assertThatThrownBy(() -> codec.decodeEvents("{\"now\": 0, \"events\": ["
        + "{\"type\": \"SimulationBeginsEvent\", \"data\": {\"computation_host_number\": 4294967300}}]}"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> codec.decodeEvents("{\"now\": 0, \"events\": ["
        + "{\"type\": \"SimulationBeginsEvent\", \"data\": {\"computation_host_number\": 4.5}}]}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("integer");
  }

  @Test
  void eventEntriesMustBeObjects() {
    assertThatThrownBy(() -> codec.decodeEvents("{\"now\": 0, \"events\": [42]}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("42");
    assertThatThrownBy(() -> codec.decodeDecisions("{\"now\": 0, \"events\": [\"x\"]}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void encodesDecisionsInOrder() throws Exception {
    String message = codec.encodeDecisions(7.0, Arrays.<Decision>asList(
        new AcknowledgeHandshake("best_cont", "1.0.0"),
        new RejectJob("big"),
        new ExecuteJob("j1", Arrays.asList(5, 0, 1, 2))));

    JSONObject jMsg = (JSONObject) new JSONParser().parse(message);
    assertThat(((Number) jMsg.get("now")).doubleValue()).isEqualTo(7.0);
    JSONArray jEvents = (JSONArray) jMsg.get("events");
    assertThat(jEvents).hasSize(3);

    JSONObject jHello = (JSONObject) jEvents.get(0);
    assertThat(jHello.get("type")).isEqualTo("EDCHelloEvent");
    assertThat(((JSONObject) jHello.get("data")).get("decision_component_name")).isEqualTo("best_cont");

    JSONObject jReject = (JSONObject) jEvents.get(1);
    assertThat(jReject.get("type")).isEqualTo("RejectJobEvent");
    assertThat(((JSONObject) jReject.get("data")).get("job_id")).isEqualTo("big");

    JSONObject jExecute = (JSONObject) jEvents.get(2);
    JSONObject jData = (JSONObject) jExecute.get("data");
    assertThat(jExecute.get("type")).isEqualTo("ExecuteJobEvent");
    assertThat(jExecute.get("timestamp")).isEqualTo(7.0);
    assertThat(jData.get("host_allocation")).isEqualTo("0-2 5");
    assertThat((JSONArray) jData.get("resources")).containsExactly(0L, 1L, 2L, 5L);
  }

  @Test
  void simulatorSideReadsBackWhatTheSchedulerWrites() {
    List<Decision> decisions = Arrays.<Decision>asList(new RejectJob("r"),
        new ExecuteJob("e", Arrays.asList(3, 4)));

    assertThat(codec.decodeDecisions(codec.encodeDecisions(2.0, decisions)))
        .containsExactlyElementsOf(decisions);

    List<BaseEvent> events = Arrays.<BaseEvent>asList(new SimulationBeginsEvent(0, 8),
        new JobSubmittedEvent(0, "j", 2, 30));
    EventBatch batch = codec.decodeEvents(codec.encodeEvents(0, events));
    assertThat(batch.getEvents()).extracting("type")
        .containsExactly(EventType.SIMULATION_BEGINS, EventType.JOB_SUBMITTED);
    assertThat(((JobSubmittedEvent) batch.getEvents().get(1)).getWalltime()).isEqualTo(30.0);
  }

  @Test
  void emptyDecisionListStillCarriesTheInstant() {
    EventBatch echoed = codec.decodeEvents(codec.encodeDecisions(4.25, Collections.<Decision>emptyList()));

    assertThat(echoed.getNow()).isEqualTo(4.25);
    assertThat(echoed.getEvents()).isEmpty();
  }
}
