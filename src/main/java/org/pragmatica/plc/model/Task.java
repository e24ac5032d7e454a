package org.pragmatica.plc.model;

import java.util.List;
import java.util.OptionalLong;

/**
 * A task schedules programs. Lower priority numbers run first.
 */
public record Task(String name, Trigger trigger, int priority, List<String> programs) {

    public Task {
        programs = List.copyOf(programs);
    }

    public static Task periodic(String name, long periodMs, List<String> programs) {
        return new Task(name, new Trigger.Periodic(periodMs), 10, programs);
    }

    public static Task continuous(String name, List<String> programs) {
        return new Task(name, new Trigger.Continuous(), 15, programs);
    }

    public static Task event(String name, String triggerTag, List<String> programs) {
        return new Task(name, new Trigger.Event(triggerTag), 5, programs);
    }

    /**
     * Cycle time of a periodic task.
     */
    public OptionalLong interval() {
        return trigger instanceof Trigger.Periodic periodic ? OptionalLong.of(periodic.periodMs()) : OptionalLong.empty();
    }

    public sealed interface Trigger {
        record Periodic(long periodMs) implements Trigger {}

        record Continuous() implements Trigger {}

        record Event(String triggerTag) implements Trigger {}
    }
}
