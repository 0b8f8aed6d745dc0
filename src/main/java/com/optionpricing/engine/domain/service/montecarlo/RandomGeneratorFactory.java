package com.optionpricing.engine.domain.service.montecarlo;

import org.springframework.stereotype.Component;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Hands out a new generator per pricing request so no random state is shared between requests.
 */
@Component
public class RandomGeneratorFactory {

    public RandomGenerator create(Long seed) {
        return seed != null ? new SplittableRandom(seed) : new SplittableRandom();
    }
}
