package huayu.zhang.batsched.utils;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UtilsTest {

  @Test
  void hostAllocationCompressesRuns() {
    assertThat(Utils.toHostAllocation(Arrays.asList(0, 1, 2, 5))).isEqualTo("0-2 5");
    assertThat(Utils.toHostAllocation(Arrays.asList(7, 3, 4, 9, 10))).isEqualTo("3-4 7 9-10");
    assertThat(Utils.toHostAllocation(Collections.singletonList(4))).isEqualTo("4");
    assertThat(Utils.toHostAllocation(Collections.<Integer>emptyList())).isEmpty();
  }

  @Test
  void slotsTruncateTime() {
    assertThat(Utils.toSlot(0.0)).isZero();
    assertThat(Utils.toSlot(3.99)).isEqualTo(3);
    assertThat(Utils.toSlot(12)).isEqualTo(12);
    assertThatThrownBy(() -> Utils.toSlot(-0.5)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void roundKeepsTheRequestedPlaces() {
    assertThat(Utils.round(2.33333, 2)).isEqualTo(2.33);
    assertThat(Utils.round(0.1 + 0.2, 6)).isEqualTo(0.3);
  }
}
