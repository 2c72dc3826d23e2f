package huayu.zhang.batsched.utils;

import huayu.zhang.batsched.utils.Configuration.SchedulingPolicy;

import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationTest {

  @Test
  void defaultsWithoutAFile() {
    Configuration config = new Configuration();

    assertThat(config.getSchedPolicy()).isEqualTo(SchedulingPolicy.FCFS);
    assertThat(config.getTimeStep()).isEqualTo(1.0);
    assertThat(config.getStatsOutput()).isEqualTo("logs/stats.json");
    assertThat(config.isTraceReservations()).isFalse();
  }

  @Test
  void readsEveryKey() throws Exception {
    Configuration config = new Configuration();
    config.parseConfig(new StringReader("{\"policy\": \"best_cont\", \"time_step\": 0.5,"
        + " \"end_time\": 500, \"stats_output\": \"out/s.json\", \"trace_reservations\": true}"));

    assertThat(config.getSchedPolicy()).isEqualTo(SchedulingPolicy.BEST_CONTIGUOUS);
    assertThat(config.getTimeStep()).isEqualTo(0.5);
    assertThat(config.getEndTime()).isEqualTo(500.0);
    assertThat(config.getStatsOutput()).isEqualTo("out/s.json");
    assertThat(config.isTraceReservations()).isTrue();
  }

  @Test
  void readsTheBundledConfigFile() throws Exception {
    Configuration config = new Configuration();
    config.parseConfigFile(getClass().getResource("/conf/easy.json").getPath());

    assertThat(config.getSchedPolicy()).isEqualTo(SchedulingPolicy.EASY);
  }

  @Test
  void policyAliases() throws Exception {
    assertThat(Configuration.parseSchedPolicy("FCFS")).isEqualTo(SchedulingPolicy.FCFS);
    assertThat(Configuration.parseSchedPolicy("easy-backfilling")).isEqualTo(SchedulingPolicy.EASY);
    assertThat(Configuration.parseSchedPolicy("basic")).isEqualTo(SchedulingPolicy.CONSERVATIVE);
    assertThat(Configuration.parseSchedPolicy(" conservative_backfilling "))
        .isEqualTo(SchedulingPolicy.CONSERVATIVE);
    assertThat(Configuration.parseSchedPolicy("best_contiguous"))
        .isEqualTo(SchedulingPolicy.BEST_CONTIGUOUS);
  }

  @Test
  void invalidConfigurations() {
    assertThatThrownBy(() -> Configuration.parseSchedPolicy("sjf"))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> new Configuration().parseConfig(new StringReader("{\"time_step\": 0}")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("time_step");
    assertThatThrownBy(() -> new Configuration().parseConfig(new StringReader("{\"end_time\": \"soon\"}")))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> new Configuration().parseConfig(new StringReader("{policy")))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> new Configuration().parseConfigFile("/nonexistent/config.json"))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void initData() throws Exception {
    assertThat(Configuration.parseInitData(null)).isEqualTo(SchedulingPolicy.FCFS);
    assertThat(Configuration.parseInitData("  ")).isEqualTo(SchedulingPolicy.FCFS);
    assertThat(Configuration.parseInitData("{}")).isEqualTo(SchedulingPolicy.FCFS);
    assertThat(Configuration.parseInitData("{\"policy\": \"conservative\"}"))
        .isEqualTo(SchedulingPolicy.CONSERVATIVE);
  }
}
