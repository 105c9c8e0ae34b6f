package com.aetherclaw.channels.telegram;

import java.time.Duration;

/** Idle pause between poll rounds. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void pause(Duration duration) throws InterruptedException;
}
