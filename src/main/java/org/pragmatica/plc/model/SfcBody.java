package org.pragmatica.plc.model;

import java.util.List;
import java.util.Optional;

/**
 * Sequential function chart: steps with their actions, and the transitions between them.
 */
public record SfcBody(List<Step> steps, List<Transition> transitions) {

    public SfcBody {
        steps = List.copyOf(steps);
        transitions = List.copyOf(transitions);
    }

    public Optional<Step> initialStep() {
        return steps.stream().filter(Step::initial).findFirst();
    }

    public record Step(String name, boolean initial, List<Action> actions) {
        public Step {
            actions = List.copyOf(actions);
        }
    }

    /**
     * @param qualifier IEC action qualifier such as {@code N}, {@code S} or {@code P}
     */
    public record Action(String name, String qualifier, Optional<Body> body) {}

    public record Transition(Optional<String> name, List<String> fromSteps, List<String> toSteps, String condition) {
        public Transition {
            fromSteps = List.copyOf(fromSteps);
            toSteps = List.copyOf(toSteps);
        }
    }
}
