package com.questrail.consolelink.api;

/**
 * Screen region a title occupies (or is asked to occupy) on the console.
 */
public enum ActiveTitleLocation
{
    FULL,
    FILL,
    SNAPPED,
    START_VIEW,
    SYSTEM_UI,
    DEFAULT
}
