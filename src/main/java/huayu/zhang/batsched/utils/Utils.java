package huayu.zhang.batsched.utils;

import java.util.*;

public class Utils {

  public static double round(double value, int places) {
    double scale = Math.pow(10, places);
    return Math.round(value * scale) / scale;
  }

  // reservation-table slot of a simulation time; fractions are dropped
  public static int toSlot(double time) {
    if (time < 0) {
      throw new IllegalArgumentException("Negative simulation time " + time);
    }
    return (int) time;
  }

  // compact interval form, e.g. [0, 1, 2, 5] -> "0-2 5"
  public static String toHostAllocation(Collection<Integer> ids) {
    List<Integer> sorted = new ArrayList<>(ids);
    Collections.sort(sorted);
    StringBuilder sb = new StringBuilder();
    int i = 0;
    while (i < sorted.size()) {
      int j = i;
      while (j + 1 < sorted.size() && sorted.get(j + 1) - sorted.get(j) == 1) {
        j++;
      }
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(sorted.get(i));
      if (j > i) {
        sb.append('-').append(sorted.get(j));
      }
      i = j + 1;
    }
    return sb.toString();
  }
}
