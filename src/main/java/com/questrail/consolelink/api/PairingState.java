package com.questrail.consolelink.api;

/**
 * Pairing state reported by the console in its connect response.
 */
public enum PairingState
{
    PAIRED,
    NOT_PAIRED
}
