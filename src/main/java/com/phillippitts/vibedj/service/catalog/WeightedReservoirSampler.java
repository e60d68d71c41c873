package com.phillippitts.vibedj.service.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Weighted sampling without replacement in a single pass (Efraimidis-Spirakis).
 *
 * <p>Every item with positive weight {@code w} gets the key {@code ln(u) / w} for a uniform
 * {@code u} (floored at 1e-12); the {@code k} largest keys win. When fewer than {@code k}
 * items carry positive weight, or a weight cannot be computed, the sample is drawn
 * uniformly instead.
 */
public final class WeightedReservoirSampler {

    static final double MIN_UNIFORM = 1e-12;

    private WeightedReservoirSampler() {}

    /**
     * @return exactly {@code min(k, pool.size())} distinct items; the whole pool (same order)
     *         when it is not larger than {@code k}
     */
    public static <T> List<T> sample(List<T> pool, ToDoubleFunction<T> weight, int k, Random rng) {
        if (k <= 0 || pool.isEmpty()) {
            return new ArrayList<>();
        }
        if (pool.size() <= k) {
            return new ArrayList<>(pool);
        }
        List<Keyed<T>> keyed = new ArrayList<>(pool.size());
        try {
            for (T item : pool) {
                double w = weight.applyAsDouble(item);
                if (!(w > 0.0) || Double.isInfinite(w)) {
                    continue;
                }
                double u = Math.max(MIN_UNIFORM, rng.nextDouble());
                keyed.add(new Keyed<>(Math.log(u) / w, item));
            }
        } catch (RuntimeException e) {
            return uniform(pool, k, rng);
        }
        if (keyed.size() < k) {
            return uniform(pool, k, rng);
        }
        keyed.sort(Comparator.comparingDouble(Keyed::key));
        List<T> out = new ArrayList<>(k);
        for (Keyed<T> entry : keyed.subList(keyed.size() - k, keyed.size())) {
            out.add(entry.item());
        }
        return out;
    }

    /**
     * Uniform sample of {@code k} distinct items.
     */
    public static <T> List<T> uniform(List<T> pool, int k, Random rng) {
        List<T> copy = new ArrayList<>(pool);
        if (copy.size() <= k) {
            return copy;
        }
        Collections.shuffle(copy, rng);
        return new ArrayList<>(copy.subList(0, k));
    }

    private record Keyed<T>(double key, T item) {
    }
}
