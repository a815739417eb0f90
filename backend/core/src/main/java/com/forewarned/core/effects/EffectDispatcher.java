package com.forewarned.core.effects;

import com.forewarned.core.bus.EventBus;
import com.forewarned.core.model.AlertLevel;
import com.forewarned.core.model.LocalAlertState;
import com.forewarned.core.model.Transition;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Fans a committed transition out to the sensor, routines, notifications and voice calls. Each
 * effect runs as its own task; a failure is logged and reported on the bus but never touches the
 * other effects.
 *
 * <p>Sensor writes go to a separate executor. When that executor is serial, the sensor receives
 * states in the order {@link #dispatch} was called.
 */
public class EffectDispatcher {
    public static final String SENSOR_ENTITY_ID = "binary_sensor.forewarned_local_alert";

    private static final Logger LOGGER = Logger.getLogger(EffectDispatcher.class.getName());
    private static final List<String> ROUTINE_PREFIXES = List.of("scene.", "script.");

    private final HomeAutomationGateway homeAutomation;
    private final RoutinePlan routines;
    private final VoiceCallGateway voiceCalls;
    private final CallPlan callPlan;
    private final Executor executor;
    private final Executor sensorExecutor;
    private final EffectRunner runner;

    public EffectDispatcher(
            HomeAutomationGateway homeAutomation,
            RoutinePlan routines,
            VoiceCallGateway voiceCalls,
            CallPlan callPlan,
            Executor executor,
            EventBus eventBus,
            Clock clock
    ) {
        this(homeAutomation, routines, voiceCalls, callPlan, executor, executor, eventBus, clock);
    }

    /**
     * @param voiceCalls may be {@code null} when no voice integration is configured
     * @param sensorExecutor runs sensor writes; pass a single-thread executor to keep them ordered
     */
    public EffectDispatcher(
            HomeAutomationGateway homeAutomation,
            RoutinePlan routines,
            VoiceCallGateway voiceCalls,
            CallPlan callPlan,
            Executor executor,
            Executor sensorExecutor,
            EventBus eventBus,
            Clock clock
    ) {
        this.homeAutomation = Objects.requireNonNull(homeAutomation, "homeAutomation is required");
        this.routines = Objects.requireNonNull(routines, "routines is required");
        this.voiceCalls = voiceCalls;
        this.callPlan = callPlan == null ? CallPlan.empty() : callPlan;
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.sensorExecutor = Objects.requireNonNull(sensorExecutor, "sensorExecutor is required");
        this.runner = new EffectRunner(eventBus, clock);
    }

    public void dispatch(Transition transition) {
        LocalAlertState state = transition.current();
        runner.fire(sensorExecutor, "sensor update", () -> homeAutomation.setSensorState(
                SENSOR_ENTITY_ID,
                state.active() ? "on" : "off",
                sensorAttributes(state)
        ));

        if (state.active()) {
            triggerRoutines(routines.routinesFor(state.level()));
            runner.fire(executor, "alert notification", () -> homeAutomation.sendNotification(
                    "Local alert activated: " + state.reason(),
                    "Forewarned - " + state.level().label() + " Alert"
            ));
            placeCalls(state.level(), state.reason());
        } else {
            triggerRoutines(routines.clearedRoutines());
            runner.fire(executor, "all-clear notification", () -> homeAutomation.sendNotification(
                    "All alerts have been cleared",
                    "Forewarned - All Clear"
            ));
        }
    }

    private void triggerRoutines(List<String> routineIds) {
        for (String routine : routineIds) {
            if (!isRoutine(routine)) {
                LOGGER.warning("Skipping routine with unknown type: " + routine);
                continue;
            }
            runner.fire(executor, "routine " + routine, () -> homeAutomation.triggerRoutine(routine));
        }
    }

    private void placeCalls(AlertLevel level, String reason) {
        if (voiceCalls == null) {
            return;
        }
        List<String> destinations = callPlan.destinationsFor(level);
        if (destinations.isEmpty()) {
            LOGGER.fine("No voice calls configured for " + level.key() + " level");
            return;
        }
        LOGGER.info("Placing " + destinations.size() + " voice call(s) for " + level.key() + " alert via " + voiceCalls.name());
        for (String destination : destinations) {
            runner.fire(executor, "voice call to " + destination, () -> {
                if (!voiceCalls.placeAlertCall(destination, level, reason)) {
                    throw new IllegalStateException(voiceCalls.name() + " refused call to " + destination);
                }
                LOGGER.info("Voice call initiated to " + destination);
            });
        }
    }

    static boolean isRoutine(String identifier) {
        return ROUTINE_PREFIXES.stream().anyMatch(identifier::startsWith);
    }

    static Map<String, Object> sensorAttributes(LocalAlertState state) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("friendly_name", "Forewarned Local Alert");
        attributes.put("alert_level", state.level().key());
        attributes.put("reason", state.reason());
        attributes.put("triggered_by", String.join(", ", state.triggeredBy()));
        attributes.put("timestamp", state.timestamp().toString());
        return attributes;
    }
}
