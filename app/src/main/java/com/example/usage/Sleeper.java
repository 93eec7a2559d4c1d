package com.example.usage;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
