package com.questrail.consolelink.api;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Complete gamepad snapshot sent over the input channel.
 *
 * <p>Triggers range over {@code [0, 1]}; thumbstick axes over {@code [-1, 1]}.</p>
 */
public record GamepadState(
        Set<GamepadButton> buttons,
        float leftTrigger,
        float rightTrigger,
        float leftThumbstickX,
        float leftThumbstickY,
        float rightThumbstickX,
        float rightThumbstickY
) {
    public GamepadState {
        Objects.requireNonNull(buttons, "buttons");
        buttons = buttons.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(buttons));

        requireRange("leftTrigger", leftTrigger, 0f, 1f);
        requireRange("rightTrigger", rightTrigger, 0f, 1f);
        requireRange("leftThumbstickX", leftThumbstickX, -1f, 1f);
        requireRange("leftThumbstickY", leftThumbstickY, -1f, 1f);
        requireRange("rightThumbstickX", rightThumbstickX, -1f, 1f);
        requireRange("rightThumbstickY", rightThumbstickY, -1f, 1f);
    }

    /**
     * A neutral gamepad: nothing pressed, sticks centered.
     */
    public static GamepadState neutral() {
        return new GamepadState(Set.of(), 0f, 0f, 0f, 0f, 0f, 0f);
    }

    /**
     * Only the given buttons pressed; analog inputs neutral.
     */
    public static GamepadState pressed(GamepadButton first, GamepadButton... rest) {
        return new GamepadState(EnumSet.of(first, rest), 0f, 0f, 0f, 0f, 0f, 0f);
    }

    /**
     * Button bits as carried on the wire.
     */
    public int buttonMask() {
        int mask = 0;
        for (GamepadButton button : buttons) {
            mask |= button.mask();
        }
        return mask;
    }

    private static void requireRange(String name, float value, float min, float max) {
        if (Float.isNaN(value) || value < min || value > max) {
            throw new IllegalArgumentException(name + " must be within [" + min + ", " + max + "]: " + value);
        }
    }
}
