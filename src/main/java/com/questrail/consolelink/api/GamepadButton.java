package com.questrail.consolelink.api;

/**
 * Gamepad buttons and their bit in the input channel's button mask.
 */
public enum GamepadButton
{
    ENROLL(1 << 1),
    NEXUS(1 << 2),
    MENU(1 << 3),
    VIEW(1 << 4),
    A(1 << 5),
    B(1 << 6),
    X(1 << 7),
    Y(1 << 8),
    DPAD_UP(1 << 9),
    DPAD_DOWN(1 << 10),
    DPAD_LEFT(1 << 11),
    DPAD_RIGHT(1 << 12),
    LEFT_SHOULDER(1 << 13),
    RIGHT_SHOULDER(1 << 14),
    LEFT_THUMBSTICK(1 << 15),
    RIGHT_THUMBSTICK(1 << 16);

    private final int mask;

    GamepadButton(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }
}
