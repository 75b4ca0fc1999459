package org.example.quizgen.service.llm;

import java.time.Duration;

/**
 * Blocks the calling thread between retries. Swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
