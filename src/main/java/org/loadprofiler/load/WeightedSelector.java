package org.loadprofiler.load;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.ToDoubleFunction;

/**
 * Picks items with probability proportional to their weight: draw uniformly in {@code [0, total)},
 * then subtract weights in list order until the remainder drops to zero or below.
 */
public class WeightedSelector<T> {

  private final List<T> items;
  private final double[] weights;
  private final double totalWeight;
  private final DoubleSupplier random;

  public WeightedSelector(List<T> items, ToDoubleFunction<? super T> weightOf) {
    this(items, weightOf, () -> ThreadLocalRandom.current().nextDouble());
  }

  /** @param random uniform source in {@code [0, 1)} */
  public WeightedSelector(List<T> items, ToDoubleFunction<? super T> weightOf, DoubleSupplier random) {
    Preconditions.checkArgument(!items.isEmpty(), "Nothing to select from");
    this.items = List.copyOf(items);
    this.weights = new double[this.items.size()];
    double total = 0;
    for (int i = 0; i < weights.length; i++) {
      weights[i] = weightOf.applyAsDouble(this.items.get(i));
      total += weights[i];
    }
    Preconditions.checkArgument(total > 0, "Total weight must be positive: %s", total);
    this.totalWeight = total;
    this.random = random;
  }

  public T select() {
    double remainder = random.getAsDouble() * totalWeight;
    for (int i = 0; i < weights.length; i++) {
      remainder -= weights[i];
      if (remainder <= 0) {
        return items.get(i);
      }
    }
    return items.get(0);
  }

  public double getTotalWeight() {
    return totalWeight;
  }
}
