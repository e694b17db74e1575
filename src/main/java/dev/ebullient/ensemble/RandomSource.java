package dev.ebullient.ensemble;

import java.util.concurrent.ThreadLocalRandom;

/**
 * The only source of randomness used while tracking a scene.
 */
public interface RandomSource {

    /** @return a value in [0, 1) */
    double nextDouble();

    /** @return a value in [0, bound) */
    int nextInt(int bound);

    /** @return a value in [origin, bound) */
    long nextLong(long origin, long bound);

    static RandomSource system() {
        return new RandomSource() {
            @Override
            public double nextDouble() {
                return ThreadLocalRandom.current().nextDouble();
            }

            @Override
            public int nextInt(int bound) {
                return ThreadLocalRandom.current().nextInt(bound);
            }

            @Override
            public long nextLong(long origin, long bound) {
                return ThreadLocalRandom.current().nextLong(origin, bound);
            }
        };
    }
}
