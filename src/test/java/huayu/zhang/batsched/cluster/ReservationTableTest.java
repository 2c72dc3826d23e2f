package huayu.zhang.batsched.cluster;

import huayu.zhang.batsched.datastructures.Allocation;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReservationTableTest {

  @Test
  void startsWithSlotZeroAllFree() {
    ReservationTable table = new ReservationTable(4);

    assertThat(table.getHorizon()).isEqualTo(1);
    assertThat(table.getFree(0)).containsExactly(0, 1, 2, 3);
    assertThat(table.isTimeAware()).isTrue();
  }

  @Test
  void ensureHorizonCreatesAllFreeSlots() {
    ReservationTable table = new ReservationTable(3);
    table.ensureHorizon(5);

    assertThat(table.getHorizon()).isEqualTo(6);
    assertThat(table.getFree(5)).containsExactly(0, 1, 2);

    table.ensureHorizon(2);
    assertThat(table.getHorizon()).isEqualTo(6);
  }

  @Test
  void readingBeyondHorizonIsAnError() {
    ReservationTable table = new ReservationTable(2);

    assertThatThrownBy(() -> table.getFree(3)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void takeRemovesIdsOnlyInsideTheInterval() {
    ReservationTable table = new ReservationTable(4);
    table.take(new Allocation("a", Arrays.asList(0, 1), 0, 3));

    assertThat(table.getHorizon()).isEqualTo(3);
    table.ensureHorizon(3);
    assertThat(table.getFree(0)).containsExactly(2, 3);
    assertThat(table.getFree(2)).containsExactly(2, 3);
    assertThat(table.getFree(3)).containsExactly(0, 1, 2, 3);
    assertThat(table.isAvailable(3, 1)).isFalse();
    assertThat(table.isAvailable(3, 3)).isTrue();
  }

  @Test
  void conflictingTakeFailsWithoutTouchingTheTable() {
    ReservationTable table = new ReservationTable(4);
    table.take(new Allocation("a", Arrays.asList(0, 1), 0, 3));

    assertThatThrownBy(() -> table.take(new Allocation("b", Arrays.asList(1, 2), 2, 4)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Resource 1");
    assertThat(table.getFree(3)).containsExactly(0, 1, 2, 3);
    assertThat(table.getFree(2)).containsExactly(2, 3);
  }

  @Test
  void releaseFreesFromCompletionSlotThroughHorizon() {
    ReservationTable table = new ReservationTable(2);
    Allocation a = new Allocation("a", Arrays.asList(0), 0, 5);
    table.take(a);

    assertThat(table.release(a, 2)).isTrue();
    assertThat(table.getFree(0)).containsExactly(1);
    assertThat(table.getFree(1)).containsExactly(1);
    assertThat(table.getFree(2)).containsExactly(0, 1);
    assertThat(table.getFree(4)).containsExactly(0, 1);
  }

  @Test
  void releasingTwiceIsANoOp() {
    ReservationTable table = new ReservationTable(2);
    Allocation a = new Allocation("a", Arrays.asList(0), 0, 3);
    table.take(a);
    table.release(a, 1);
    Allocation b = new Allocation("b", Arrays.asList(0), 1, 3);
    table.take(b);

    assertThat(table.release(a, 1)).isFalse();
    assertThat(table.getFree(1)).containsExactly(1);
    assertThat(table.numReservations()).isEqualTo(1);
  }

  @Test
  void releaseNeverFreesIdsAnotherReservationHolds() {
    ReservationTable table = new ReservationTable(2);
    Allocation a = new Allocation("a", Arrays.asList(0), 0, 2);
    Allocation b = new Allocation("b", Arrays.asList(0), 2, 4);
    table.take(a);
    table.take(b);

    table.release(a, 0);

    assertThat(table.getFree(0)).containsExactly(0, 1);
    assertThat(table.getFree(1)).containsExactly(0, 1);
    assertThat(table.getFree(2)).containsExactly(1);
    assertThat(table.getFree(3)).containsExactly(1);
  }

  @Test
  void openEndedReservationIsPinnedInLaterSlots() {
    ReservationTable table = new ReservationTable(4);
    Allocation open = Allocation.openEnded("c", Arrays.asList(3), 0);
    table.take(open);
    table.ensureHorizon(10);

    assertThat(table.getFree(10)).containsExactly(0, 1, 2);

    table.release(open, 5);
    table.ensureHorizon(12);
    assertThat(table.getFree(4)).containsExactly(0, 1, 2);
    assertThat(table.getFree(5)).containsExactly(0, 1, 2, 3);
    assertThat(table.getFree(12)).containsExactly(0, 1, 2, 3);
  }

  @Test
  void freeThroughoutChecksEverySlotOfTheWindow() {
    ReservationTable table = new ReservationTable(3);
    table.take(new Allocation("x", Arrays.asList(0), 3, 5));

    assertThat(table.isFreeThroughout(Arrays.asList(0, 1), 0, 3)).isTrue();
    assertThat(table.isFreeThroughout(Arrays.asList(0, 1), 0, 4)).isFalse();
    assertThat(table.isFreeThroughout(Arrays.asList(1, 2), 0, 5)).isTrue();
  }

  @Test
  void describeListsEachSlot() {
    ReservationTable table = new ReservationTable(2);
    table.take(new Allocation("a", Arrays.asList(1), 0, 2));

    assertThat(table.describe(0))
        .contains("slot 0: 1/2 available [0] allocated [1]")
        .contains("slot 1: 1/2 available [0]");
  }
}
